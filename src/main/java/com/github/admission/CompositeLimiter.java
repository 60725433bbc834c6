package com.github.admission;

import com.github.admission.annotation.CheckReturnValue;
import com.github.admission.internal.CloseableLock;
import com.github.admission.internal.Doorbell;
import com.github.admission.internal.Durations;
import com.github.admission.internal.LockAsResource;
import com.github.admission.internal.ToStringBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * Admits requests against a per-key quota nested inside a global quota.
 * <p>
 * A request that cannot be admitted immediately is queued rather than rejected. A background drainer admits
 * queued requests, in FIFO order, as global capacity frees up. A queued request that is not admitted within
 * the queue timeout gives up.
 * <p>
 * The limiter owns a daemon thread; {@link #close()} stops it.
 * <p>
 * <b>Thread safety</b>: This class is thread-safe.
 */
public final class CompositeLimiter implements AutoCloseable
{
	private static final AtomicInteger DRAINER_ID = new AtomicInteger();
	private final Clock clock;
	private final Duration queueTimeout;
	private final List<AdmissionListener> listeners;
	/**
	 * A lock over the buckets and the queue. See the {@link com.github.admission.internal locking policy} for
	 * more details.
	 */
	private final LockAsResource lock = new LockAsResource();
	private final KeyedBucketRegistry registry;
	private final AdmissionQueue queue = new AdmissionQueue();
	private final Doorbell doorbell = new Doorbell();
	private final QueueDrainer drainer;
	private final Thread drainerThread;
	private boolean closed;
	private final Logger log = LoggerFactory.getLogger(CompositeLimiter.class);

	/**
	 * Builds a new limiter.
	 *
	 * @return a CompositeLimiter builder
	 */
	public static Builder builder()
	{
		return new Builder();
	}

	/**
	 * Creates a new limiter and starts its drainer.
	 *
	 * @param builder the limiter's configuration
	 */
	private CompositeLimiter(Builder builder)
	{
		this.clock = builder.clock;
		this.queueTimeout = builder.queueTimeout;
		this.listeners = List.copyOf(builder.listeners);
		this.registry = new KeyedBucketRegistry(builder.perKeyCapacity, builder.globalCapacity,
			builder.fillInterval, builder.maximumKeys, clock.instant());
		this.drainer = new QueueDrainer(lock, queue, registry.getGlobalBucket(), clock, doorbell,
			builder.drainInterval, listeners);
		this.drainerThread = new Thread(drainer, "admission-drainer-" + DRAINER_ID.incrementAndGet());
		drainerThread.setDaemon(true);
		drainerThread.start();
	}

	/**
	 * Admits a request on behalf of a key, blocking for up to the queue timeout if the request cannot be admitted
	 * immediately.
	 *
	 * @param key the admission key (e.g. the client's address)
	 * @return the result of the operation
	 * @throws NullPointerException  if {@code key} is null
	 * @throws IllegalStateException if the limiter is closed
	 * @throws InterruptedException  if the thread is interrupted while waiting in the queue. The request is not
	 *                               admitted. If the request was resolved before the interrupt could take effect,
	 *                               its result is returned instead and the thread's interrupted status is set.
	 */
	@CheckReturnValue
	public AdmissionResult allow(String key) throws InterruptedException
	{
		requireThat(key, "key").isNotNull();
		Instant requestedAt = clock.instant();
		AdmissionTicket ticket;
		try (CloseableLock ignored = lock.lock())
		{
			ensureOpen();
			if (registry.admit(key, requestedAt))
				return new AdmissionResult(key, AdmissionOutcome.ADMITTED, requestedAt, requestedAt);

			ticket = queue.enqueue(key, requestedAt);
			int queueLength = queue.size();
			log.debug("Request from {} is denied and queued. queueLength: {}", key, queueLength);
			doorbell.ring();
			for (AdmissionListener listener : listeners)
			{
				try
				{
					listener.onQueued(key, queueLength);
				}
				catch (RuntimeException e)
				{
					log.warn("Listener failed: " + listener, e);
				}
			}
		}

		boolean resolved;
		try
		{
			resolved = ticket.await(queueTimeout);
		}
		catch (InterruptedException e)
		{
			try (CloseableLock ignored = lock.lock())
			{
				if (!ticket.abandon())
				{
					// The drainer resolved the ticket first. Report its outcome and preserve the interrupt.
					Thread.currentThread().interrupt();
					return toResult(ticket, requestedAt);
				}
				log.debug("Request from {} was interrupted while queued", key);
			}
			throw e;
		}
		if (!resolved)
		{
			try (CloseableLock ignored = lock.lock())
			{
				// The drainer may have admitted the ticket after the wait timed out
				if (ticket.abandon())
				{
					log.debug("Request from {} timed out after {}", key, queueTimeout);
					for (AdmissionListener listener : listeners)
					{
						try
						{
							listener.onTimeout(key);
						}
						catch (RuntimeException e)
						{
							log.warn("Listener failed: " + listener, e);
						}
					}
				}
			}
		}
		return toResult(ticket, requestedAt);
	}

	/**
	 * @param ticket      a resolved ticket
	 * @param requestedAt the time at which admission was requested
	 * @return the result of the admission request
	 */
	private AdmissionResult toResult(AdmissionTicket ticket, Instant requestedAt)
	{
		Instant resolvedAt = clock.instant();
		if (resolvedAt.isBefore(requestedAt))
			resolvedAt = requestedAt;
		AdmissionOutcome outcome = switch (ticket.getState())
		{
			case ADMITTED -> AdmissionOutcome.ADMITTED_FROM_QUEUE;
			case ABANDONED -> AdmissionOutcome.TIMED_OUT;
			case REJECTED -> AdmissionOutcome.REJECTED;
			case PENDING -> throw new AssertionError("Ticket was not resolved: " + ticket);
		};
		return new AdmissionResult(ticket.getKey(), outcome, requestedAt, resolvedAt);
	}

	/**
	 * Returns the number of queued requests, including requests that gave up but were not discarded by the
	 * drainer yet.
	 *
	 * @return the number of queued requests
	 */
	public int getQueueLength()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return queue.size();
		}
	}

	/**
	 * Returns the number of keys that have a bucket.
	 *
	 * @return the number of keys that have a bucket
	 */
	public int getKeyCount()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return registry.getKeyCount();
		}
	}

	/**
	 * Returns the number of tokens left in the bucket of a key, without triggering a refill.
	 *
	 * @param key an admission key
	 * @return -1 if the key does not have a bucket
	 * @throws NullPointerException if {@code key} is null
	 */
	long getAvailableTokens(String key)
	{
		requireThat(key, "key").isNotNull();
		try (CloseableLock ignored = lock.lock())
		{
			TokenBucket bucket = registry.getBucket(key);
			if (bucket == null)
				return -1;
			return bucket.getAvailableTokens();
		}
	}

	/**
	 * Returns the number of tokens left in the global bucket, without triggering a refill.
	 *
	 * @return the number of tokens left in the global bucket
	 */
	long getAvailableGlobalTokens()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return registry.getGlobalBucket().getAvailableTokens();
		}
	}

	/**
	 * Wakes the drainer as if a request had just been queued. This method is only meant to be used by tests.
	 */
	void ringDoorbell()
	{
		doorbell.ring();
	}

	/**
	 * Returns the number of drain passes that have completed.
	 *
	 * @return the number of drain passes
	 */
	long getDrainPasses()
	{
		return drainer.getPasses();
	}

	/**
	 * Indicates if the drainer thread is running.
	 *
	 * @return true if the drainer thread is running
	 */
	boolean isDrainerAlive()
	{
		return drainerThread.isAlive();
	}

	/**
	 * Returns true if the limiter is closed.
	 *
	 * @return true if the limiter is closed
	 */
	public boolean isClosed()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return closed;
		}
	}

	/**
	 * @throws IllegalStateException if the limiter is closed
	 */
	private void ensureOpen()
	{
		if (closed)
			throw new IllegalStateException("CompositeLimiter is closed");
	}

	/**
	 * Stops the drainer and rejects all queued requests. Subsequent invocations have no effect.
	 */
	@Override
	public void close()
	{
		List<AdmissionTicket> rejected;
		try (CloseableLock ignored = lock.lock())
		{
			if (closed)
				return;
			closed = true;
			rejected = queue.rejectAll();
		}
		if (!rejected.isEmpty())
			log.warn("Rejected {} queued requests because the limiter was closed", rejected.size());
		drainerThread.interrupt();
		try
		{
			drainerThread.join(TimeUnit.NANOSECONDS.toMillis(Durations.toNanos(queueTimeout)));
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
		}
	}

	@Override
	public String toString()
	{
		try (CloseableLock ignored = lock.lock())
		{
			return new ToStringBuilder(CompositeLimiter.class).
				add("registry", registry).
				add("queue", queue).
				add("queueTimeout", queueTimeout).
				add("closed", closed).
				toString();
		}
	}

	/**
	 * Builds a limiter.
	 * <p>
	 * The defaults admit 60 requests per key and 1000 requests overall, refilling one token per minute, and
	 * queue rejected requests for up to 5 seconds.
	 */
	public static final class Builder
	{
		private long perKeyCapacity = 60;
		private long globalCapacity = 1000;
		private Duration fillInterval = Duration.ofMinutes(1);
		private Duration queueTimeout = Duration.ofSeconds(5);
		private int maximumKeys;
		private Duration drainInterval;
		private Clock clock = Clock.systemUTC();
		private final List<AdmissionListener> listeners = new ArrayList<>();

		/**
		 * Use {@link CompositeLimiter#builder()}.
		 */
		private Builder()
		{
		}

		/**
		 * Sets the maximum number of tokens in each per-key bucket.
		 *
		 * @param perKeyCapacity the maximum number of tokens in each per-key bucket
		 * @return this
		 * @throws IllegalArgumentException if {@code perKeyCapacity} is negative or zero
		 */
		public Builder perKeyCapacity(long perKeyCapacity)
		{
			requireThat(perKeyCapacity, "perKeyCapacity").isPositive();
			this.perKeyCapacity = perKeyCapacity;
			return this;
		}

		/**
		 * Sets the maximum number of tokens in the global bucket.
		 *
		 * @param globalCapacity the maximum number of tokens in the global bucket
		 * @return this
		 * @throws IllegalArgumentException if {@code globalCapacity} is negative or zero
		 */
		public Builder globalCapacity(long globalCapacity)
		{
			requireThat(globalCapacity, "globalCapacity").isPositive();
			this.globalCapacity = globalCapacity;
			return this;
		}

		/**
		 * Sets the amount of time it takes to add a single token to a bucket.
		 *
		 * @param fillInterval the amount of time it takes to add a single token to a bucket
		 * @return this
		 * @throws NullPointerException     if {@code fillInterval} is null
		 * @throws IllegalArgumentException if {@code fillInterval} is negative or zero
		 */
		public Builder fillInterval(Duration fillInterval)
		{
			requireThat(fillInterval, "fillInterval").isNotNull();
			requireThat(fillInterval, "fillInterval").isGreaterThan(Duration.ZERO);
			this.fillInterval = fillInterval;
			return this;
		}

		/**
		 * Sets the maximum amount of time that a queued request waits before giving up.
		 *
		 * @param queueTimeout the maximum amount of time that a queued request waits
		 * @return this
		 * @throws NullPointerException     if {@code queueTimeout} is null
		 * @throws IllegalArgumentException if {@code queueTimeout} is negative or zero
		 */
		public Builder queueTimeout(Duration queueTimeout)
		{
			requireThat(queueTimeout, "queueTimeout").isNotNull();
			requireThat(queueTimeout, "queueTimeout").isGreaterThan(Duration.ZERO);
			this.queueTimeout = queueTimeout;
			return this;
		}

		/**
		 * Limits the number of per-key buckets. Once the limit is exceeded, the bucket of the least recently
		 * used key is discarded. A key whose bucket was discarded starts over with a full bucket.
		 * <p>
		 * By default, buckets are never discarded.
		 *
		 * @param maximumKeys the maximum number of per-key buckets
		 * @return this
		 * @throws IllegalArgumentException if {@code maximumKeys} is negative or zero
		 */
		public Builder maximumKeys(int maximumKeys)
		{
			requireThat(maximumKeys, "maximumKeys").isPositive();
			this.maximumKeys = maximumKeys;
			return this;
		}

		/**
		 * Wakes the drainer at least once every {@code drainInterval}, in addition to whenever a request is
		 * queued.
		 * <p>
		 * By default, the drainer only wakes up when a request is queued. Queued requests may then wait until
		 * they time out even though global capacity has become available in the meantime.
		 *
		 * @param drainInterval the maximum amount of time between drains
		 * @return this
		 * @throws NullPointerException     if {@code drainInterval} is null
		 * @throws IllegalArgumentException if {@code drainInterval} is negative or zero
		 */
		public Builder drainInterval(Duration drainInterval)
		{
			requireThat(drainInterval, "drainInterval").isNotNull();
			requireThat(drainInterval, "drainInterval").isGreaterThan(Duration.ZERO);
			this.drainInterval = drainInterval;
			return this;
		}

		/**
		 * Sets the clock used to refill buckets.
		 *
		 * @param clock the clock used to refill buckets
		 * @return this
		 * @throws NullPointerException if {@code clock} is null
		 */
		public Builder clock(Clock clock)
		{
			requireThat(clock, "clock").isNotNull();
			this.clock = clock;
			return this;
		}

		/**
		 * Adds an event listener to the limiter.
		 *
		 * @param listener a listener
		 * @return this
		 * @throws NullPointerException if {@code listener} is null
		 */
		public Builder addListener(AdmissionListener listener)
		{
			requireThat(listener, "listener").isNotNull();
			listeners.add(listener);
			return this;
		}

		/**
		 * Builds a new limiter and starts its drainer.
		 *
		 * @return a new CompositeLimiter
		 */
		public CompositeLimiter build()
		{
			return new CompositeLimiter(this);
		}

		@Override
		public String toString()
		{
			return new ToStringBuilder(Builder.class).
				add("perKeyCapacity", perKeyCapacity).
				add("globalCapacity", globalCapacity).
				add("fillInterval", fillInterval).
				add("queueTimeout", queueTimeout).
				add("maximumKeys", maximumKeys).
				add("drainInterval", drainInterval).
				toString();
		}
	}
}
