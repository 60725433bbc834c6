package com.github.admission;

import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

public final class CompositeLimiterTest
{
	private static final Duration ONE_MINUTE = Duration.ofMinutes(1);
	private ExecutorService executor;

	@BeforeMethod
	public void createExecutor()
	{
		executor = Executors.newCachedThreadPool();
	}

	@AfterMethod
	public void shutdownExecutor() throws InterruptedException
	{
		executor.shutdownNow();
		requireThat(executor.awaitTermination(10, TimeUnit.SECONDS), "executor.awaitTermination()").isTrue();
	}

	/**
	 * Blocks until a condition holds.
	 *
	 * @param condition the condition
	 * @param name      the name of the condition
	 * @throws InterruptedException if the thread is interrupted while waiting
	 * @throws AssertionError       if the condition does not hold within 5 seconds
	 */
	private static void awaitCondition(BooleanSupplier condition, String name) throws InterruptedException
	{
		long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
		while (!condition.getAsBoolean())
		{
			if (System.nanoTime() - deadline > 0)
				throw new AssertionError("Timed out waiting for " + name);
			Thread.sleep(5);
		}
	}

	@Test
	public void admitImmediatelyWithinQuota() throws InterruptedException
	{
		MutableClock clock = new MutableClock(Instant.now());
		try (CompositeLimiter limiter = CompositeLimiter.builder().
			perKeyCapacity(3).
			globalCapacity(10).
			clock(clock).
			build())
		{
			for (int i = 0; i < 3; ++i)
			{
				AdmissionResult result = limiter.allow("10.0.0.1");
				requireThat(result.isAllowed(), "result.isAllowed()").isTrue();
				requireThat(result.getMessage(), "result.getMessage()").isEmpty();
				requireThat(result.getOutcome(), "result.getOutcome()").isEqualTo(AdmissionOutcome.ADMITTED);
				requireThat(result.getKey(), "result.getKey()").isEqualTo("10.0.0.1");
				requireThat(result.getWaitTime(), "result.getWaitTime()").isEqualTo(Duration.ZERO);
			}
			requireThat(limiter.getKeyCount(), "limiter.getKeyCount()").isEqualTo(1);
			requireThat(limiter.getAvailableTokens("10.0.0.1"), "availableTokens").isEqualTo(0L);
			requireThat(limiter.getAvailableGlobalTokens(), "availableGlobalTokens").isEqualTo(7L);
		}
	}

	@Test
	public void defaultConfiguration() throws InterruptedException
	{
		try (CompositeLimiter limiter = CompositeLimiter.builder().build())
		{
			for (int i = 0; i < 60; ++i)
				requireThat(limiter.allow("client").isAllowed(), "allow(" + i + ")").isTrue();
			requireThat(limiter.getAvailableTokens("client"), "availableTokens").isEqualTo(0L);
			requireThat(limiter.getAvailableGlobalTokens(), "availableGlobalTokens").isEqualTo(940L);
		}
	}

	@Test
	public void globalDenyDoesNotConsumePerKeyToken() throws InterruptedException
	{
		MutableClock clock = new MutableClock(Instant.now());
		Duration fillInterval = Duration.ofHours(1);
		try (CompositeLimiter limiter = CompositeLimiter.builder().
			perKeyCapacity(10).
			globalCapacity(1).
			fillInterval(fillInterval).
			queueTimeout(Duration.ofMillis(100)).
			clock(clock).
			build())
		{
			requireThat(limiter.allow("other").isAllowed(), "other").isTrue();

			AdmissionResult denied = limiter.allow("key");
			requireThat(denied.isAllowed(), "denied.isAllowed()").isFalse();
			requireThat(limiter.getAvailableTokens("key"), "availableTokens").isEqualTo(10L);

			clock.advance(fillInterval);
			AdmissionResult admitted = limiter.allow("key");
			requireThat(admitted.getOutcome(), "admitted.getOutcome()").isEqualTo(AdmissionOutcome.ADMITTED);
			requireThat(limiter.getAvailableTokens("key"), "availableTokens").isEqualTo(9L);
		}
	}

	@Test
	public void queuedRequestIsReleasedByGlobalCapacityAlone() throws InterruptedException
	{
		MutableClock clock = new MutableClock(Instant.now());
		try (CompositeLimiter limiter = CompositeLimiter.builder().
			perKeyCapacity(1).
			globalCapacity(10).
			fillInterval(ONE_MINUTE).
			queueTimeout(Duration.ofSeconds(5)).
			clock(clock).
			build())
		{
			requireThat(limiter.allow("key").getOutcome(), "first").isEqualTo(AdmissionOutcome.ADMITTED);

			AdmissionResult second = limiter.allow("key");
			requireThat(second.isAllowed(), "second.isAllowed()").isTrue();
			requireThat(second.getOutcome(), "second.getOutcome()").
				isEqualTo(AdmissionOutcome.ADMITTED_FROM_QUEUE);
			requireThat(second.getMessage(), "second.getMessage()").isEmpty();
			// One token for each admission, plus one spent on the per-key denial
			requireThat(limiter.getAvailableGlobalTokens(), "availableGlobalTokens").isEqualTo(7L);
			requireThat(limiter.getAvailableTokens("key"), "availableTokens").isEqualTo(0L);
		}
	}

	@Test
	public void queueIsFirstInFirstOut() throws Exception
	{
		MutableClock clock = new MutableClock(Instant.now());
		List<String> admittedFromQueue = new CopyOnWriteArrayList<>();
		try (CompositeLimiter limiter = CompositeLimiter.builder().
			perKeyCapacity(1).
			globalCapacity(1).
			fillInterval(ONE_MINUTE).
			queueTimeout(Duration.ofSeconds(2)).
			clock(clock).
			addListener(new AdmissionListener()
			{
				@Override
				public void onAdmittedFromQueue(String key)
				{
					admittedFromQueue.add(key);
				}
			}).
			build())
		{
			requireThat(limiter.allow("x").isAllowed(), "x").isTrue();

			Future<AdmissionResult> a = executor.submit(() -> limiter.allow("a"));
			awaitCondition(() -> limiter.getQueueLength() == 1, "a to get queued");
			Future<AdmissionResult> b = executor.submit(() -> limiter.allow("b"));
			awaitCondition(() -> limiter.getQueueLength() == 2, "b to get queued");
			Future<AdmissionResult> c = executor.submit(() -> limiter.allow("c"));
			awaitCondition(() -> limiter.getQueueLength() == 3, "c to get queued");

			clock.advance(ONE_MINUTE);
			limiter.ringDoorbell();

			requireThat(a.get(5, TimeUnit.SECONDS).getOutcome(), "a").
				isEqualTo(AdmissionOutcome.ADMITTED_FROM_QUEUE);
			requireThat(b.get(5, TimeUnit.SECONDS).getOutcome(), "b").isEqualTo(AdmissionOutcome.TIMED_OUT);
			requireThat(c.get(5, TimeUnit.SECONDS).getOutcome(), "c").isEqualTo(AdmissionOutcome.TIMED_OUT);
			requireThat(admittedFromQueue, "admittedFromQueue").isEqualTo(List.of("a"));
		}
	}

	@Test
	public void timeoutBoundary() throws InterruptedException
	{
		MutableClock clock = new MutableClock(Instant.now());
		Duration queueTimeout = Duration.ofMillis(300);
		try (CompositeLimiter limiter = CompositeLimiter.builder().
			perKeyCapacity(1).
			globalCapacity(1).
			fillInterval(ONE_MINUTE).
			queueTimeout(queueTimeout).
			clock(clock).
			build())
		{
			requireThat(limiter.allow("key").isAllowed(), "first").isTrue();

			long before = System.nanoTime();
			AdmissionResult result = limiter.allow("key");
			Duration elapsed = Duration.ofNanos(System.nanoTime() - before);

			requireThat(result.isAllowed(), "result.isAllowed()").isFalse();
			requireThat(result.getOutcome(), "result.getOutcome()").isEqualTo(AdmissionOutcome.TIMED_OUT);
			requireThat(result.getMessage(), "result.getMessage()").isEqualTo(AdmissionResult.TIMEOUT_MESSAGE);
			requireThat(elapsed, "elapsed").isGreaterThanOrEqualTo(queueTimeout);
			requireThat(elapsed, "elapsed").isLessThan(queueTimeout.plusSeconds(2));
		}
	}

	@Test
	public void queueIsNotDrainedWithoutNewArrivals() throws Exception
	{
		MutableClock clock = new MutableClock(Instant.now());
		try (CompositeLimiter limiter = CompositeLimiter.builder().
			perKeyCapacity(10).
			globalCapacity(1).
			fillInterval(ONE_MINUTE).
			queueTimeout(Duration.ofMillis(500)).
			clock(clock).
			build())
		{
			requireThat(limiter.allow("a").isAllowed(), "a").isTrue();

			Future<AdmissionResult> b = executor.submit(() -> limiter.allow("b"));
			awaitCondition(() -> limiter.getQueueLength() == 1, "b to get queued");
			awaitCondition(() -> limiter.getDrainPasses() >= 1, "the drainer to inspect the queue");

			// The global bucket could admit b now, but nothing wakes the drainer
			clock.advance(ONE_MINUTE);
			requireThat(b.get(5, TimeUnit.SECONDS).getOutcome(), "b").isEqualTo(AdmissionOutcome.TIMED_OUT);
			requireThat(limiter.getAvailableGlobalTokens(), "availableGlobalTokens").isEqualTo(0L);
		}
	}

	@Test
	public void drainIntervalReleasesQueueWithoutNewArrivals() throws Exception
	{
		MutableClock clock = new MutableClock(Instant.now());
		try (CompositeLimiter limiter = CompositeLimiter.builder().
			perKeyCapacity(10).
			globalCapacity(1).
			fillInterval(ONE_MINUTE).
			queueTimeout(Duration.ofSeconds(5)).
			drainInterval(Duration.ofMillis(50)).
			clock(clock).
			build())
		{
			requireThat(limiter.allow("a").isAllowed(), "a").isTrue();

			Future<AdmissionResult> b = executor.submit(() -> limiter.allow("b"));
			awaitCondition(() -> limiter.getQueueLength() == 1, "b to get queued");

			clock.advance(ONE_MINUTE);
			requireThat(b.get(5, TimeUnit.SECONDS).getOutcome(), "b").
				isEqualTo(AdmissionOutcome.ADMITTED_FROM_QUEUE);
		}
	}

	@Test
	public void abandonedTicketDoesNotConsumeGlobalToken() throws Exception
	{
		MutableClock clock = new MutableClock(Instant.now());
		try (CompositeLimiter limiter = CompositeLimiter.builder().
			perKeyCapacity(10).
			globalCapacity(1).
			fillInterval(ONE_MINUTE).
			queueTimeout(Duration.ofMillis(100)).
			clock(clock).
			build())
		{
			requireThat(limiter.allow("a").isAllowed(), "a").isTrue();
			requireThat(limiter.allow("b").getOutcome(), "b").isEqualTo(AdmissionOutcome.TIMED_OUT);
			requireThat(limiter.getQueueLength(), "limiter.getQueueLength()").isEqualTo(1);

			long passes = limiter.getDrainPasses();
			clock.advance(ONE_MINUTE);
			limiter.ringDoorbell();
			awaitCondition(() -> limiter.getDrainPasses() > passes, "the drainer to inspect the queue");

			requireThat(limiter.getQueueLength(), "limiter.getQueueLength()").isEqualTo(0);
			// The global bucket was never consulted, so the refill is still pending
			requireThat(limiter.getAvailableGlobalTokens(), "availableGlobalTokens").isEqualTo(0L);
			requireThat(limiter.allow("c").getOutcome(), "c").isEqualTo(AdmissionOutcome.ADMITTED);
		}
	}

	@Test
	public void interruptedCallerAbandonsTicket() throws InterruptedException
	{
		MutableClock clock = new MutableClock(Instant.now());
		try (CompositeLimiter limiter = CompositeLimiter.builder().
			perKeyCapacity(10).
			globalCapacity(1).
			fillInterval(ONE_MINUTE).
			queueTimeout(Duration.ofSeconds(30)).
			clock(clock).
			build())
		{
			requireThat(limiter.allow("a").isAllowed(), "a").isTrue();

			AtomicReference<Throwable> thrown = new AtomicReference<>();
			Thread caller = new Thread(() ->
			{
				try
				{
					//noinspection ResultOfMethodCallIgnored
					limiter.allow("b");
				}
				catch (Throwable t)
				{
					thrown.set(t);
				}
			});
			caller.start();
			awaitCondition(() -> limiter.getQueueLength() == 1, "b to get queued");
			caller.interrupt();
			caller.join(TimeUnit.SECONDS.toMillis(5));
			requireThat(thrown.get(), "thrown").isInstanceOf(InterruptedException.class);

			long passes = limiter.getDrainPasses();
			limiter.ringDoorbell();
			awaitCondition(() -> limiter.getDrainPasses() > passes, "the drainer to inspect the queue");
			requireThat(limiter.getQueueLength(), "limiter.getQueueLength()").isEqualTo(0);
		}
	}

	@Test
	public void listenersAreNotified() throws InterruptedException
	{
		MutableClock clock = new MutableClock(Instant.now());
		List<String> events = new CopyOnWriteArrayList<>();
		try (CompositeLimiter limiter = CompositeLimiter.builder().
			perKeyCapacity(1).
			globalCapacity(1).
			fillInterval(ONE_MINUTE).
			queueTimeout(Duration.ofMillis(100)).
			clock(clock).
			addListener(new AdmissionListener()
			{
				@Override
				public void onQueued(String key, int queueLength)
				{
					events.add("queued:" + key + ":" + queueLength);
				}

				@Override
				public void onTimeout(String key)
				{
					events.add("timeout:" + key);
				}
			}).
			build())
		{
			requireThat(limiter.allow("a").isAllowed(), "a").isTrue();
			requireThat(limiter.allow("b").isAllowed(), "b").isFalse();
			requireThat(events, "events").isEqualTo(List.of("queued:b:1", "timeout:b"));
		}
	}

	@Test
	public void failingQueuedListenerDoesNotOrphanRequest() throws Exception
	{
		MutableClock clock = new MutableClock(Instant.now());
		try (CompositeLimiter limiter = CompositeLimiter.builder().
			perKeyCapacity(10).
			globalCapacity(1).
			fillInterval(ONE_MINUTE).
			queueTimeout(Duration.ofSeconds(5)).
			clock(clock).
			addListener(new AdmissionListener()
			{
				@Override
				public void onQueued(String key, int queueLength)
				{
					throw new IllegalStateException("onQueued");
				}

				@Override
				public void onTimeout(String key)
				{
					throw new IllegalStateException("onTimeout");
				}
			}).
			build())
		{
			requireThat(limiter.allow("a").isAllowed(), "a").isTrue();

			Future<AdmissionResult> b = executor.submit(() -> limiter.allow("b"));
			awaitCondition(() -> limiter.getQueueLength() == 1, "b to get queued");
			// Queueing rang the doorbell even though the listener failed
			awaitCondition(() -> limiter.getDrainPasses() >= 1, "the drainer to inspect the queue");

			clock.advance(ONE_MINUTE);
			limiter.ringDoorbell();
			requireThat(b.get(5, TimeUnit.SECONDS).getOutcome(), "b").
				isEqualTo(AdmissionOutcome.ADMITTED_FROM_QUEUE);

			AdmissionResult c = limiter.allow("c");
			requireThat(c.getOutcome(), "c.getOutcome()").isEqualTo(AdmissionOutcome.TIMED_OUT);
		}
	}

	@Test
	public void failingDrainListenerDoesNotStopDrainer() throws Exception
	{
		MutableClock clock = new MutableClock(Instant.now());
		List<String> admittedFromQueue = new CopyOnWriteArrayList<>();
		try (CompositeLimiter limiter = CompositeLimiter.builder().
			perKeyCapacity(10).
			globalCapacity(1).
			fillInterval(ONE_MINUTE).
			queueTimeout(Duration.ofSeconds(5)).
			clock(clock).
			addListener(new AdmissionListener()
			{
				@Override
				public void onAdmittedFromQueue(String key)
				{
					admittedFromQueue.add(key);
					throw new IllegalStateException("onAdmittedFromQueue");
				}
			}).
			build())
		{
			requireThat(limiter.allow("a").isAllowed(), "a").isTrue();

			Future<AdmissionResult> b = executor.submit(() -> limiter.allow("b"));
			awaitCondition(() -> limiter.getQueueLength() == 1, "b to get queued");
			clock.advance(ONE_MINUTE);
			limiter.ringDoorbell();
			requireThat(b.get(5, TimeUnit.SECONDS).getOutcome(), "b").
				isEqualTo(AdmissionOutcome.ADMITTED_FROM_QUEUE);
			requireThat(limiter.isDrainerAlive(), "limiter.isDrainerAlive()").isTrue();

			Future<AdmissionResult> c = executor.submit(() -> limiter.allow("c"));
			awaitCondition(() -> limiter.getQueueLength() == 1, "c to get queued");
			clock.advance(ONE_MINUTE);
			limiter.ringDoorbell();
			requireThat(c.get(5, TimeUnit.SECONDS).getOutcome(), "c").
				isEqualTo(AdmissionOutcome.ADMITTED_FROM_QUEUE);
			requireThat(admittedFromQueue, "admittedFromQueue").isEqualTo(List.of("b", "c"));
		}
	}

	@Test
	public void veryLongQueueTimeout() throws Exception
	{
		MutableClock clock = new MutableClock(Instant.now());
		try (CompositeLimiter limiter = CompositeLimiter.builder().
			perKeyCapacity(10).
			globalCapacity(1).
			fillInterval(ONE_MINUTE).
			queueTimeout(Duration.ofDays(365_000)).
			clock(clock).
			build())
		{
			requireThat(limiter.allow("a").isAllowed(), "a").isTrue();

			Future<AdmissionResult> b = executor.submit(() -> limiter.allow("b"));
			awaitCondition(() -> limiter.getQueueLength() == 1, "b to get queued");
			clock.advance(ONE_MINUTE);
			limiter.ringDoorbell();
			requireThat(b.get(5, TimeUnit.SECONDS).getOutcome(), "b").
				isEqualTo(AdmissionOutcome.ADMITTED_FROM_QUEUE);
		}
	}

	@Test
	public void interruptAfterAdmissionKeepsAdmission() throws Exception
	{
		MutableClock clock = new MutableClock(Instant.now());
		AtomicReference<Thread> caller = new AtomicReference<>();
		CountDownLatch interruptSent = new CountDownLatch(1);
		try (CompositeLimiter limiter = CompositeLimiter.builder().
			perKeyCapacity(10).
			globalCapacity(1).
			fillInterval(ONE_MINUTE).
			queueTimeout(Duration.ofSeconds(30)).
			clock(clock).
			addListener(new AdmissionListener()
			{
				@Override
				public void onAdmittedFromQueue(String key)
				{
					// The ticket is already admitted; interrupt the caller before it observes that
					caller.get().interrupt();
					interruptSent.countDown();
				}
			}).
			build())
		{
			requireThat(limiter.allow("a").isAllowed(), "a").isTrue();

			Future<Boolean> interrupted = executor.submit(() ->
			{
				caller.set(Thread.currentThread());
				AdmissionResult result = limiter.allow("b");
				requireThat(result.getOutcome(), "result.getOutcome()").
					isEqualTo(AdmissionOutcome.ADMITTED_FROM_QUEUE);
				while (interruptSent.getCount() > 0)
					Thread.onSpinWait();
				return Thread.interrupted();
			});
			awaitCondition(() -> limiter.getQueueLength() == 1, "b to get queued");
			clock.advance(ONE_MINUTE);
			limiter.ringDoorbell();
			requireThat(interrupted.get(5, TimeUnit.SECONDS), "interrupted").isTrue();
		}
	}

	@Test
	public void closeRejectsQueuedRequests() throws Exception
	{
		MutableClock clock = new MutableClock(Instant.now());
		CompositeLimiter limiter = CompositeLimiter.builder().
			perKeyCapacity(1).
			globalCapacity(1).
			fillInterval(ONE_MINUTE).
			queueTimeout(Duration.ofSeconds(30)).
			clock(clock).
			build();
		requireThat(limiter.allow("a").isAllowed(), "a").isTrue();
		Future<AdmissionResult> b = executor.submit(() -> limiter.allow("b"));
		awaitCondition(() -> limiter.getQueueLength() == 1, "b to get queued");

		limiter.close();
		AdmissionResult result = b.get(5, TimeUnit.SECONDS);
		requireThat(result.isAllowed(), "result.isAllowed()").isFalse();
		requireThat(result.getOutcome(), "result.getOutcome()").isEqualTo(AdmissionOutcome.REJECTED);
		requireThat(result.getMessage(), "result.getMessage()").isEmpty();
		requireThat(limiter.isClosed(), "limiter.isClosed()").isTrue();
		requireThat(limiter.getQueueLength(), "limiter.getQueueLength()").isEqualTo(0);
		awaitCondition(() -> !limiter.isDrainerAlive(), "the drainer to stop");

		// Closing twice has no effect
		limiter.close();
	}

	@Test(expectedExceptions = IllegalStateException.class)
	public void allowAfterClose() throws InterruptedException
	{
		CompositeLimiter limiter = CompositeLimiter.builder().build();
		limiter.close();
		//noinspection ResultOfMethodCallIgnored
		limiter.allow("key");
	}

	@Test(expectedExceptions = NullPointerException.class)
	public void rejectNullKey() throws InterruptedException
	{
		try (CompositeLimiter limiter = CompositeLimiter.builder().build())
		{
			//noinspection ResultOfMethodCallIgnored
			limiter.allow(null);
		}
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void rejectZeroPerKeyCapacity()
	{
		CompositeLimiter.builder().perKeyCapacity(0);
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void rejectZeroGlobalCapacity()
	{
		CompositeLimiter.builder().globalCapacity(0);
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void rejectNegativeFillInterval()
	{
		CompositeLimiter.builder().fillInterval(Duration.ofSeconds(-1));
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void rejectZeroQueueTimeout()
	{
		CompositeLimiter.builder().queueTimeout(Duration.ZERO);
	}

	@Test(expectedExceptions = IllegalArgumentException.class)
	public void rejectZeroMaximumKeys()
	{
		CompositeLimiter.builder().maximumKeys(0);
	}

	@Test(expectedExceptions = NullPointerException.class)
	public void rejectNullClock()
	{
		CompositeLimiter.builder().clock(null);
	}

	@Test
	public void maximumKeysBoundsRegistry() throws InterruptedException
	{
		try (CompositeLimiter limiter = CompositeLimiter.builder().
			maximumKeys(2).
			build())
		{
			for (String key : List.of("a", "b", "c", "d"))
				requireThat(limiter.allow(key).isAllowed(), key).isTrue();
			requireThat(limiter.getKeyCount(), "limiter.getKeyCount()").isEqualTo(2);
			requireThat(limiter.getAvailableTokens("a"), "availableTokens(a)").isEqualTo(-1L);
		}
	}
}
