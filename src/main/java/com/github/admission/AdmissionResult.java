package com.github.admission;

import com.github.admission.internal.ToStringBuilder;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

import static com.github.cowwoc.requirements.DefaultRequirements.assertionsAreEnabled;
import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * The result of an attempt to admit a request.
 * <p>
 * Callers that only care whether the request may proceed should consult {@link #isAllowed()} and, on failure,
 * relay {@link #getMessage()}. A timeout is a normal outcome, distinguishable from other denials only by its
 * message and {@link #getOutcome() outcome}.
 */
public final class AdmissionResult
{
	/**
	 * The message returned when a queued request gives up waiting.
	 */
	public static final String TIMEOUT_MESSAGE = "request timed out, try again later";

	private final String key;
	private final AdmissionOutcome outcome;
	private final Instant requestedAt;
	private final Instant resolvedAt;

	/**
	 * Creates a new result.
	 *
	 * @param key         the admission key
	 * @param outcome     the way in which the request was resolved
	 * @param requestedAt the time at which admission was requested
	 * @param resolvedAt  the time at which the request was resolved
	 * @throws NullPointerException     if any of the arguments are null
	 * @throws IllegalArgumentException if {@code requestedAt > resolvedAt}
	 */
	AdmissionResult(String key, AdmissionOutcome outcome, Instant requestedAt, Instant resolvedAt)
	{
		if (assertionsAreEnabled())
		{
			requireThat(key, "key").isNotNull();
			requireThat(outcome, "outcome").isNotNull();
			requireThat(requestedAt, "requestedAt").isNotNull();
			requireThat(resolvedAt, "resolvedAt").isGreaterThanOrEqualTo(requestedAt, "requestedAt");
		}
		this.key = key;
		this.outcome = outcome;
		this.requestedAt = requestedAt;
		this.resolvedAt = resolvedAt;
	}

	/**
	 * Returns the admission key.
	 *
	 * @return the admission key
	 */
	public String getKey()
	{
		return key;
	}

	/**
	 * Returns true if the request may proceed.
	 *
	 * @return true if the request may proceed
	 */
	public boolean isAllowed()
	{
		return outcome.isAllowed();
	}

	/**
	 * Returns a human-readable explanation of a denial.
	 *
	 * @return an empty string unless the request timed out
	 */
	public String getMessage()
	{
		if (outcome == AdmissionOutcome.TIMED_OUT)
			return TIMEOUT_MESSAGE;
		return "";
	}

	/**
	 * Returns the way in which the request was resolved.
	 *
	 * @return the way in which the request was resolved
	 */
	public AdmissionOutcome getOutcome()
	{
		return outcome;
	}

	/**
	 * Returns the time at which admission was requested.
	 *
	 * @return the time at which admission was requested
	 */
	public Instant getRequestedAt()
	{
		return requestedAt;
	}

	/**
	 * Returns the time at which the request was resolved.
	 *
	 * @return the time at which the request was resolved
	 */
	public Instant getResolvedAt()
	{
		return resolvedAt;
	}

	/**
	 * Returns the amount of time that the caller spent waiting.
	 *
	 * @return {@code Duration.ZERO} if the request was resolved immediately
	 */
	public Duration getWaitTime()
	{
		return Duration.between(requestedAt, resolvedAt);
	}

	@Override
	public boolean equals(Object o)
	{
		if (!(o instanceof AdmissionResult other))
			return false;
		return other.key.equals(key) && other.outcome == outcome && other.requestedAt.equals(requestedAt) &&
			other.resolvedAt.equals(resolvedAt);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(key, outcome, requestedAt, resolvedAt);
	}

	@Override
	public String toString()
	{
		return new ToStringBuilder(AdmissionResult.class).
			add("allowed", isAllowed()).
			add("outcome", outcome).
			add("key", key).
			add("message", getMessage()).
			add("requestedAt", requestedAt).
			add("resolvedAt", resolvedAt).
			toString();
	}
}
