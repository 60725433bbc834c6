package com.github.admission;

import com.github.admission.internal.ToStringBuilder;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.BooleanSupplier;

import static com.github.cowwoc.requirements.DefaultRequirements.requireThat;

/**
 * A FIFO of callers that failed immediate admission.
 * <p>
 * Callers never remove their own tickets. Tickets are only removed from the head of the queue, by the drainer,
 * which discards abandoned tickets without consuming capacity.
 * <p>
 * <b>Thread safety</b>: This class is not thread-safe. {@link CompositeLimiter} only invokes it while holding
 * its lock.
 */
final class AdmissionQueue
{
	private final Deque<AdmissionTicket> tickets = new ArrayDeque<>();

	/**
	 * Appends a caller to the tail of the queue.
	 *
	 * @param key        the admission key of the caller
	 * @param enqueuedAt the time at which the caller was queued
	 * @return the ticket that the caller should wait on
	 * @throws NullPointerException if any of the arguments are null
	 */
	AdmissionTicket enqueue(String key, Instant enqueuedAt)
	{
		AdmissionTicket ticket = new AdmissionTicket(key, enqueuedAt);
		tickets.addLast(ticket);
		return ticket;
	}

	/**
	 * Returns the number of tickets in the queue, including abandoned tickets that were not discarded yet.
	 *
	 * @return the number of tickets in the queue
	 */
	int size()
	{
		return tickets.size();
	}

	/**
	 * @return true if the queue is empty
	 */
	boolean isEmpty()
	{
		return tickets.isEmpty();
	}

	/**
	 * Admits tickets from the head of the queue for as long as {@code capacity} grants permission.
	 * <p>
	 * Abandoned tickets are discarded without consulting {@code capacity}. Stops at the first live ticket that
	 * {@code capacity} denies, leaving it and the rest of the queue in place.
	 *
	 * @param capacity returns true if one more ticket may be admitted, consuming the permission
	 * @return the tickets that were admitted, in queue order
	 * @throws NullPointerException if {@code capacity} is null
	 */
	List<AdmissionTicket> drain(BooleanSupplier capacity)
	{
		requireThat(capacity, "capacity").isNotNull();
		List<AdmissionTicket> admitted = new ArrayList<>();
		while (!tickets.isEmpty())
		{
			AdmissionTicket head = tickets.peekFirst();
			if (head.isAbandoned())
			{
				tickets.removeFirst();
				continue;
			}
			if (!capacity.getAsBoolean())
				break;
			tickets.removeFirst();
			if (head.admit())
				admitted.add(head);
		}
		return admitted;
	}

	/**
	 * Removes every ticket from the queue, rejecting the ones that are still pending.
	 *
	 * @return the tickets that were rejected
	 */
	List<AdmissionTicket> rejectAll()
	{
		List<AdmissionTicket> rejected = new ArrayList<>();
		for (AdmissionTicket ticket : tickets)
			if (ticket.reject())
				rejected.add(ticket);
		tickets.clear();
		return rejected;
	}

	@Override
	public String toString()
	{
		return new ToStringBuilder(AdmissionQueue.class).
			add("size", tickets.size()).
			toString();
	}
}
