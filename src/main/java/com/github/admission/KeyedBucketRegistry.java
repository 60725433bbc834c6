package com.github.admission;

import com.github.admission.annotation.CheckReturnValue;
import com.github.admission.internal.ToStringBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * One token bucket per admission key, nested inside a single global bucket.
 * <p>
 * Per-key buckets are created the first time a key is observed. Unless a maximum number of keys is configured,
 * they are retained for the lifetime of the registry, so the registry grows with the number of distinct keys.
 * <p>
 * <b>Thread safety</b>: This class is not thread-safe.
 */
final class KeyedBucketRegistry
{
	private final long perKeyCapacity;
	private final Duration fillInterval;
	private final TokenBucket globalBucket;
	private final Map<String, TokenBucket> perKeyBuckets;
	private final Logger log = LoggerFactory.getLogger(KeyedBucketRegistry.class);

	/**
	 * Creates a new registry.
	 *
	 * @param perKeyCapacity the capacity of each per-key bucket
	 * @param globalCapacity the capacity of the global bucket
	 * @param fillInterval   the amount of time it takes to add a single token to any bucket
	 * @param maximumKeys    the maximum number of per-key buckets to retain, evicting the least recently used
	 *                       key when it is exceeded; {@code 0} if keys are never evicted
	 * @param createdAt      the time at which the registry was created
	 * @throws NullPointerException     if {@code fillInterval} or {@code createdAt} are null
	 * @throws IllegalArgumentException if {@code perKeyCapacity}, {@code globalCapacity} or
	 *                                  {@code fillInterval} are negative or zero. If {@code maximumKeys} is
	 *                                  negative.
	 */
	KeyedBucketRegistry(long perKeyCapacity, long globalCapacity, Duration fillInterval, int maximumKeys,
	                    Instant createdAt)
	{
		requireThat(perKeyCapacity, "perKeyCapacity").isPositive();
		requireThat(maximumKeys, "maximumKeys").isNotNegative();
		this.perKeyCapacity = perKeyCapacity;
		this.fillInterval = fillInterval;
		this.globalBucket = new TokenBucket(globalCapacity, fillInterval, createdAt);
		if (maximumKeys == 0)
			this.perKeyBuckets = new HashMap<>();
		else
			this.perKeyBuckets = new EvictingMap(maximumKeys);
	}

	/**
	 * Returns the bucket that is shared by all keys.
	 *
	 * @return the global bucket
	 */
	TokenBucket getGlobalBucket()
	{
		return globalBucket;
	}

	/**
	 * Returns the bucket associated with a key, without creating it.
	 *
	 * @param key an admission key
	 * @return null if the key has not been observed (or was evicted)
	 */
	TokenBucket getBucket(String key)
	{
		return perKeyBuckets.get(key);
	}

	/**
	 * Returns the number of keys that have a bucket.
	 *
	 * @return the number of keys that have a bucket
	 */
	int getKeyCount()
	{
		return perKeyBuckets.size();
	}

	/**
	 * Attempts to admit a single unit of work on behalf of a key.
	 * <p>
	 * The global bucket is consulted first. If it denies the request, the per-key bucket is left untouched. If
	 * it admits the request, its token is spent even if the per-key bucket subsequently denies the request.
	 *
	 * @param key the admission key
	 * @param now the time at which admission is requested
	 * @return true if both buckets admitted the request
	 * @throws NullPointerException if any of the arguments are null
	 */
	@CheckReturnValue
	boolean admit(String key, Instant now)
	{
		requireThat(key, "key").isNotNull();
		TokenBucket perKeyBucket = perKeyBuckets.get(key);
		if (perKeyBucket == null)
		{
			perKeyBucket = new TokenBucket(perKeyCapacity, fillInterval, now);
			perKeyBuckets.put(key, perKeyBucket);
			log.debug("Created bucket for key {}", key);
		}
		return globalBucket.tryConsume(now) && perKeyBucket.tryConsume(now);
	}

	@Override
	public String toString()
	{
		return new ToStringBuilder(KeyedBucketRegistry.class).
			add("perKeyCapacity", perKeyCapacity).
			add("keys", perKeyBuckets.size()).
			add("globalBucket", globalBucket).
			toString();
	}

	/**
	 * A map that evicts its least recently accessed entry once it grows past a maximum size.
	 */
	private final class EvictingMap extends LinkedHashMap<String, TokenBucket>
	{
		private static final long serialVersionUID = 0L;
		private final int maximumSize;

		/**
		 * @param maximumSize the maximum number of entries
		 */
		EvictingMap(int maximumSize)
		{
			super(16, 0.75f, true);
			this.maximumSize = maximumSize;
		}

		@Override
		protected boolean removeEldestEntry(Map.Entry<String, TokenBucket> eldest)
		{
			if (size() <= maximumSize)
				return false;
			log.debug("Evicting bucket for key {}", eldest.getKey());
			return true;
		}
	}
}
