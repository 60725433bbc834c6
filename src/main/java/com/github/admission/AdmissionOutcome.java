package com.github.admission;

/**
 * The way in which an admission request was resolved.
 */
public enum AdmissionOutcome
{
	/**
	 * Both the global and the per-key bucket admitted the request immediately.
	 */
	ADMITTED,
	/**
	 * The request was queued and later admitted once global capacity freed up.
	 */
	ADMITTED_FROM_QUEUE,
	/**
	 * The request was queued and gave up waiting.
	 */
	TIMED_OUT,
	/**
	 * The request was queued and the limiter was closed before it could be admitted.
	 */
	REJECTED;

	/**
	 * Indicates if the request may proceed.
	 *
	 * @return true if the request may proceed
	 */
	public boolean isAllowed()
	{
		return this == ADMITTED || this == ADMITTED_FROM_QUEUE;
	}
}
