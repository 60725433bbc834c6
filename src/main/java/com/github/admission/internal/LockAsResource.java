package com.github.admission.internal;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Enables the use of try-with-resources with a mutual-exclusion lock.
 */
public final class LockAsResource
{
	private final ReentrantLock lock = new ReentrantLock();

	/**
	 * Acquires the lock, blocking until it becomes available.
	 *
	 * @return the lock as a resource
	 */
	public CloseableLock lock()
	{
		Lock result = lock;
		result.lock();
		return result::unlock;
	}
}
