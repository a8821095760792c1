package org.janelia.blur;

/**
 * Outcome of a single pixel job sent back to the collecting thread:
 * either the blurred ARGB value or the exception that prevented computing it.
 */

public class PixelResult
{
	private final int x, y;
	private final int value;
	private final Throwable failure;

	private PixelResult( final int x, final int y, final int value, final Throwable failure )
	{
		this.x = x;
		this.y = y;
		this.value = value;
		this.failure = failure;
	}

	public static PixelResult computed( final int x, final int y, final int value )
	{
		return new PixelResult( x, y, value, null );
	}

	public static PixelResult failed( final int x, final int y, final Throwable failure )
	{
		return new PixelResult( x, y, 0, failure );
	}

	public int getX() { return x; }
	public int getY() { return y; }
	public int getValue() { return value; }
	public Throwable getFailure() { return failure; }

	public boolean isFailed()
	{
		return failure != null;
	}

	@Override
	public String toString()
	{
		return "(" + x + "," + y + ")" + ( isFailed() ? " failed: " + failure : "" );
	}
}
