package com.github.admission.internal;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * A single-slot wake-up signal.
 * <p>
 * Ringing never blocks. Any number of rings that take place before the next {@link #await()} are coalesced into
 * a single wake-up.
 * <p>
 * <b>Thread safety</b>: This class is thread-safe.
 */
public final class Doorbell
{
	private final ReentrantLock lock = new ReentrantLock();
	private final Condition rung = lock.newCondition();
	private boolean pending;

	/**
	 * Rings the doorbell. Has no effect if a previous ring has not been consumed yet.
	 */
	public void ring()
	{
		lock.lock();
		try
		{
			if (pending)
				return;
			pending = true;
			rung.signal();
		}
		finally
		{
			lock.unlock();
		}
	}

	/**
	 * Blocks until the doorbell is rung, consuming the ring.
	 *
	 * @throws InterruptedException if the thread is interrupted while waiting
	 */
	public void await() throws InterruptedException
	{
		lock.lock();
		try
		{
			while (!pending)
				rung.await();
			pending = false;
		}
		finally
		{
			lock.unlock();
		}
	}

	/**
	 * Blocks until the doorbell is rung or a timeout occurs, consuming the ring if there was one.
	 *
	 * @param timeout the maximum amount of time to wait
	 * @return false if the waiting time elapsed before the doorbell was rung
	 * @throws NullPointerException     if {@code timeout} is null
	 * @throws IllegalArgumentException if {@code timeout} is negative
	 * @throws InterruptedException     if the thread is interrupted while waiting
	 */
	public boolean await(Duration timeout) throws InterruptedException
	{
		requireThat(timeout, "timeout").isNotNull();
		requireThat(timeout, "timeout").isGreaterThanOrEqualTo(Duration.ZERO);
		long nanosLeft = Durations.toNanos(timeout);
		lock.lock();
		try
		{
			while (!pending)
			{
				if (nanosLeft <= 0)
					return false;
				nanosLeft = rung.awaitNanos(nanosLeft);
			}
			pending = false;
			return true;
		}
		finally
		{
			lock.unlock();
		}
	}

	/**
	 * Indicates if a ring is waiting to be consumed.
	 *
	 * @return true if the doorbell was rung since the last time it was consumed
	 */
	public boolean isPending()
	{
		lock.lock();
		try
		{
			return pending;
		}
		finally
		{
			lock.unlock();
		}
	}
}
