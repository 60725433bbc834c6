package com.github.admission;

import com.github.admission.internal.CloseableLock;
import com.github.admission.internal.Doorbell;
import com.github.admission.internal.LockAsResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static com.github.cowwoc.requirements.DefaultRequirements.assertThat;

/**
 * Releases queued callers once the global bucket has spare capacity.
 * <p>
 * The drainer sleeps until the doorbell is rung. Each wake-up admits as many callers from the head of the queue
 * as the global bucket allows, then goes back to sleep. Per-key buckets are not consulted.
 * <p>
 * Unless a drain interval is configured, the doorbell is only rung when a caller is queued. A queue that stops
 * receiving new callers is therefore not drained, even if the global bucket refills in the meantime, and its
 * callers are only released by their own timeouts.
 * <p>
 * The drainer stops when its thread is interrupted. A pass that fails is logged and does not stop the drainer.
 */
final class QueueDrainer implements Runnable
{
	private final LockAsResource lock;
	private final AdmissionQueue queue;
	private final TokenBucket globalBucket;
	private final Clock clock;
	private final Doorbell doorbell;
	private final Duration drainInterval;
	private final List<AdmissionListener> listeners;
	private final AtomicLong passes = new AtomicLong();
	private final Logger log = LoggerFactory.getLogger(QueueDrainer.class);

	/**
	 * Creates a new drainer.
	 *
	 * @param lock          the lock over the limiter's state
	 * @param queue         the queue to drain
	 * @param globalBucket  the bucket that gates release from the queue
	 * @param clock         the limiter's clock
	 * @param doorbell      wakes the drainer
	 * @param drainInterval the maximum amount of time to sleep between drains; {@code null} to only wake up
	 *                      when the doorbell is rung
	 * @param listeners     the limiter's event listeners
	 * @throws NullPointerException if any of the arguments, other than {@code drainInterval}, are null
	 */
	QueueDrainer(LockAsResource lock, AdmissionQueue queue, TokenBucket globalBucket, Clock clock,
	             Doorbell doorbell, Duration drainInterval, List<AdmissionListener> listeners)
	{
		assertThat(r ->
		{
			r.requireThat(lock, "lock").isNotNull();
			r.requireThat(queue, "queue").isNotNull();
			r.requireThat(globalBucket, "globalBucket").isNotNull();
			r.requireThat(clock, "clock").isNotNull();
			r.requireThat(doorbell, "doorbell").isNotNull();
			r.requireThat(listeners, "listeners").isNotNull();
		});
		this.lock = lock;
		this.queue = queue;
		this.globalBucket = globalBucket;
		this.clock = clock;
		this.doorbell = doorbell;
		this.drainInterval = drainInterval;
		this.listeners = listeners;
	}

	@Override
	public void run()
	{
		log.info("Started. drainInterval: {}", drainInterval);
		try
		{
			while (true)
			{
				if (drainInterval == null)
					doorbell.await();
				else
					doorbell.await(drainInterval);
				try
				{
					drain();
				}
				catch (RuntimeException e)
				{
					log.error("Drain pass failed", e);
				}
			}
		}
		catch (InterruptedException e)
		{
			log.debug("Interrupted", e);
		}
		log.info("Stopped");
	}

	/**
	 * Returns the number of drain passes that have completed.
	 *
	 * @return the number of drain passes
	 */
	long getPasses()
	{
		return passes.get();
	}

	/**
	 * Admits as many queued callers as the global bucket allows.
	 *
	 * @return the number of callers that were admitted
	 * @implNote This method acquires its own locks
	 */
	int drain()
	{
		try (CloseableLock ignored = lock.lock())
		{
			if (queue.isEmpty())
				return 0;
			Instant now = clock.instant();
			List<AdmissionTicket> admitted = queue.drain(() -> globalBucket.tryConsume(now));
			for (AdmissionTicket ticket : admitted)
			{
				log.debug("Admitted queued request from {} after {}", ticket.getKey(),
					Duration.between(ticket.getEnqueuedAt(), now));
				for (AdmissionListener listener : listeners)
				{
					try
					{
						listener.onAdmittedFromQueue(ticket.getKey());
					}
					catch (RuntimeException e)
					{
						log.warn("Listener failed: " + listener, e);
					}
				}
			}
			if (!admitted.isEmpty())
				log.debug("Admitted {} requests. {} left in queue", admitted.size(), queue.size());
			return admitted.size();
		}
		finally
		{
			passes.incrementAndGet();
		}
	}
}
