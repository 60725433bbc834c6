package com.github.admission.internal;

/**
 * Let the compiler know that releasing a lock does not throw any exceptions.
 */
public interface CloseableLock extends AutoCloseable
{
	@Override
	void close();
}
