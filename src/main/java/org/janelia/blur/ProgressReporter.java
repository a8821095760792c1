package org.janelia.blur;

import java.util.function.IntConsumer;

/**
 * Turns a growing count of finished items into percent notifications.
 * Every multiple of 10 is reported exactly once and in increasing order,
 * also when a single update jumps over several of them.
 *
 * Not thread-safe, meant to be driven by the single collecting thread.
 */

public class ProgressReporter
{
	public static final int STEP_PERCENT = 10;

	private final long total;
	private final IntConsumer listener;
	private int lastReportedPercent = 0;

	public ProgressReporter( final long total, final IntConsumer listener )
	{
		if ( total <= 0 )
			throw new IllegalArgumentException( "total should be positive, got " + total );

		this.total = total;
		this.listener = listener;
	}

	public void update( final long done )
	{
		final long percent = Math.min( done, total ) * 100 / total;
		while ( lastReportedPercent + STEP_PERCENT <= percent )
		{
			lastReportedPercent += STEP_PERCENT;
			listener.accept( lastReportedPercent );
		}
	}

	public int getLastReportedPercent()
	{
		return lastReportedPercent;
	}
}
