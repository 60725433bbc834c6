package com.github.admission;

/**
 * Listens for admission events.
 * <p>
 * The listener is invoked while holding the limiter's lock, so it must return quickly and must not invoke the
 * limiter. Exceptions thrown by a listener are logged and otherwise ignored.
 */
public interface AdmissionListener
{
	/**
	 * Invoked after a request that failed immediate admission is appended to the queue.
	 *
	 * @param key         the admission key
	 * @param queueLength the length of the queue, including the new request
	 */
	default void onQueued(String key, int queueLength)
	{
	}

	/**
	 * Invoked after the drainer admits a queued request.
	 *
	 * @param key the admission key
	 */
	default void onAdmittedFromQueue(String key)
	{
	}

	/**
	 * Invoked after a queued request gives up waiting.
	 *
	 * @param key the admission key
	 */
	default void onTimeout(String key)
	{
	}
}
