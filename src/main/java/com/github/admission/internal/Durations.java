package com.github.admission.internal;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Duration helper functions.
 */
public final class Durations
{
	/**
	 * Converts a duration to nanoseconds for use with timed waits.
	 *
	 * @param duration a duration
	 * @return the duration in nanoseconds, saturated at {@code Long.MIN_VALUE} or {@code Long.MAX_VALUE}
	 * @throws NullPointerException if {@code duration} is null
	 */
	public static long toNanos(Duration duration)
	{
		try
		{
			return duration.toNanos();
		}
		catch (ArithmeticException e)
		{
			// TimeUnit conversions saturate instead of overflowing
			return TimeUnit.SECONDS.toNanos(duration.getSeconds());
		}
	}

	/**
	 * Prevent construction.
	 */
	private Durations()
	{
	}
}
