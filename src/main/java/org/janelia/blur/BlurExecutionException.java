package org.janelia.blur;

/**
 * Thrown when a blur run could not compute every pixel. No output image is produced in this case.
 */

public class BlurExecutionException extends Exception
{
	private static final long serialVersionUID = 4710522793684270158L;

	public BlurExecutionException()
	{
		super();
	}

	public BlurExecutionException( final String message )
	{
		super( message );
	}

	public BlurExecutionException( final String message, final Throwable cause )
	{
		super( message, cause );
	}

	public BlurExecutionException( final Throwable cause )
	{
		super( cause );
	}
}
