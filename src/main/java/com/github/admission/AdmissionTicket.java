package com.github.admission;

import com.github.admission.annotation.CheckReturnValue;
import com.github.admission.internal.Durations;
import com.github.admission.internal.ToStringBuilder;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * A one-shot handle that a queued caller waits on.
 * <p>
 * A ticket is resolved exactly once. Resolving a ticket never blocks, even if its caller stopped waiting.
 * <p>
 * <b>Thread safety</b>: This class is thread-safe.
 */
final class AdmissionTicket
{
	/**
	 * The state of a ticket.
	 */
	enum State
	{
		/**
		 * The caller is waiting.
		 */
		PENDING,
		/**
		 * The drainer admitted the caller.
		 */
		ADMITTED,
		/**
		 * The caller gave up waiting.
		 */
		ABANDONED,
		/**
		 * The limiter was closed before the caller was admitted.
		 */
		REJECTED
	}

	private final String key;
	private final Instant enqueuedAt;
	private final AtomicReference<State> state = new AtomicReference<>(State.PENDING);
	private final CountDownLatch resolved = new CountDownLatch(1);

	/**
	 * Creates a new ticket.
	 *
	 * @param key        the admission key of the caller
	 * @param enqueuedAt the time at which the caller was queued
	 * @throws NullPointerException if any of the arguments are null
	 */
	AdmissionTicket(String key, Instant enqueuedAt)
	{
		requireThat(key, "key").isNotNull();
		requireThat(enqueuedAt, "enqueuedAt").isNotNull();
		this.key = key;
		this.enqueuedAt = enqueuedAt;
	}

	/**
	 * @return the admission key of the caller
	 */
	String getKey()
	{
		return key;
	}

	/**
	 * @return the time at which the caller was queued
	 */
	Instant getEnqueuedAt()
	{
		return enqueuedAt;
	}

	/**
	 * @return the state of the ticket
	 */
	State getState()
	{
		return state.get();
	}

	/**
	 * Indicates if the caller stopped waiting for this ticket.
	 *
	 * @return true if the ticket was abandoned
	 */
	boolean isAbandoned()
	{
		return state.get() == State.ABANDONED;
	}

	/**
	 * Admits the caller.
	 *
	 * @return false if the ticket was already resolved
	 */
	@CheckReturnValue
	boolean admit()
	{
		return resolve(State.ADMITTED);
	}

	/**
	 * Marks the ticket as abandoned by its caller.
	 *
	 * @return false if the ticket was already resolved
	 */
	@CheckReturnValue
	boolean abandon()
	{
		return resolve(State.ABANDONED);
	}

	/**
	 * Rejects the caller.
	 *
	 * @return false if the ticket was already resolved
	 */
	@CheckReturnValue
	boolean reject()
	{
		return resolve(State.REJECTED);
	}

	/**
	 * @param newState the state to transition to
	 * @return false if the ticket was already resolved
	 */
	private boolean resolve(State newState)
	{
		if (!state.compareAndSet(State.PENDING, newState))
			return false;
		resolved.countDown();
		return true;
	}

	/**
	 * Blocks until the ticket is resolved or a timeout occurs.
	 *
	 * @param timeout the maximum amount of time to wait
	 * @return false if the waiting time elapsed before the ticket was resolved
	 * @throws NullPointerException if {@code timeout} is null
	 * @throws InterruptedException if the thread is interrupted while waiting
	 */
	boolean await(Duration timeout) throws InterruptedException
	{
		return resolved.await(Durations.toNanos(timeout), TimeUnit.NANOSECONDS);
	}

	@Override
	public String toString()
	{
		return new ToStringBuilder(AdmissionTicket.class).
			add("key", key).
			add("enqueuedAt", enqueuedAt).
			add("state", state.get()).
			toString();
	}
}
