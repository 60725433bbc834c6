package com.github.admission;

import com.github.admission.annotation.CheckReturnValue;
import com.github.admission.internal.ToStringBuilder;

import java.time.Duration;
import java.time.Instant;

import static com.github.cowwoc.requirements.DefaultRequirements.assertThat;
import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * A counter that admits one unit of work per token, refilling one token every {@code fillInterval}.
 * <p>
 * Refills are computed lazily when tokens are requested; there is no background timer. Only whole intervals are
 * credited, and the time left over when a refill takes place is discarded. Under frequent calls the effective
 * refill rate may therefore be slightly lower than one token per {@code fillInterval}.
 * <p>
 * <b>Thread safety</b>: This class is not thread-safe. {@link CompositeLimiter} only invokes it while holding
 * its lock.
 */
public final class TokenBucket
{
	private final long capacity;
	private final Duration fillInterval;
	long tokens;
	Instant lastRefill;

	/**
	 * Creates a new bucket that starts out full.
	 *
	 * @param capacity     the maximum number of tokens that the bucket may hold
	 * @param fillInterval the amount of time it takes to add a single token
	 * @param createdAt    the time at which the bucket was created
	 * @throws NullPointerException     if {@code fillInterval} or {@code createdAt} are null
	 * @throws IllegalArgumentException if {@code capacity} or {@code fillInterval} are negative or zero
	 */
	public TokenBucket(long capacity, Duration fillInterval, Instant createdAt)
	{
		requireThat(capacity, "capacity").isPositive();
		requireThat(fillInterval, "fillInterval").isNotNull();
		requireThat(fillInterval, "fillInterval").isGreaterThan(Duration.ZERO);
		requireThat(createdAt, "createdAt").isNotNull();
		this.capacity = capacity;
		this.fillInterval = fillInterval;
		this.tokens = capacity;
		this.lastRefill = createdAt;
	}

	/**
	 * Returns the maximum number of tokens that the bucket may hold.
	 *
	 * @return the maximum number of tokens that the bucket may hold
	 */
	public long getCapacity()
	{
		return capacity;
	}

	/**
	 * Returns the amount of time it takes to add a single token.
	 *
	 * @return the amount of time it takes to add a single token
	 */
	public Duration getFillInterval()
	{
		return fillInterval;
	}

	/**
	 * Returns the number of tokens that are available, without triggering a refill.
	 *
	 * @return the number of tokens that are available
	 */
	public long getAvailableTokens()
	{
		return tokens;
	}

	/**
	 * Consumes a single token, only if one is available at {@code now}.
	 *
	 * @param now the time at which the token is requested
	 * @return true if a token was consumed
	 * @throws NullPointerException if {@code now} is null
	 */
	@CheckReturnValue
	public boolean tryConsume(Instant now)
	{
		requireThat(now, "now").isNotNull();
		refill(now);
		if (tokens <= 0)
			return false;
		--tokens;
		return true;
	}

	/**
	 * Credits the tokens accumulated since the last refill.
	 *
	 * @param now the current time
	 */
	void refill(Instant now)
	{
		// A clock that moves backwards credits nothing
		if (!now.isAfter(lastRefill))
			return;
		long tokensToAdd = Duration.between(lastRefill, now).dividedBy(fillInterval);
		if (tokensToAdd <= 0)
			return;
		// tokensToAdd may exceed capacity after a long idle period, so compare before adding
		if (tokensToAdd >= capacity - tokens)
			tokens = capacity;
		else
			tokens += tokensToAdd;
		lastRefill = now;
		assertThat(r -> r.requireThat(tokens, "tokens").isNotNegative().
			isLessThanOrEqualTo(capacity, "capacity"));
	}

	@Override
	public String toString()
	{
		return new ToStringBuilder(TokenBucket.class).
			add("tokens", tokens).
			add("capacity", capacity).
			add("fillInterval", fillInterval).
			add("lastRefill", lastRefill).
			toString();
	}
}
