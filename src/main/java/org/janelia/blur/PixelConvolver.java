package org.janelia.blur;

import net.imglib2.Interval;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.ARGBType;

/**
 * Computes a single blurred pixel as the weighted average of its neighborhood.
 *
 * Kernel taps that fall outside of the image are skipped, and the channel sums are divided
 * by the total weight of the taps that were actually used. This keeps the border pixels
 * from getting darker than the interior.
 *
 * Every channel is truncated to an integer, except that an average within 1e-9 below the next
 * integer is rounded up to it.
 */

public class PixelConvolver
{
	// absorbs the rounding error of sum/total so that an average of equal values truncates back to that value
	private static final double TRUNCATION_EPSILON = 1e-9;

	private PixelConvolver() {}

	/**
	 * Convolves the pixel at ({@code x}, {@code y}) of a zero-min {@code source} with the {@code kernel}.
	 *
	 * @return opaque ARGB value of the blurred pixel
	 */
	public static int convolve(
			final int x,
			final int y,
			final GaussianKernel kernel,
			final RandomAccessibleInterval< ARGBType > source )
	{
		return convolve( x, y, kernel, source, source.randomAccess() );
	}

	/**
	 * Same as {@link #convolve(int, int, GaussianKernel, RandomAccessibleInterval)} but reuses
	 * the given {@code sourceRandomAccess}, which must not be shared with other threads.
	 */
	public static int convolve(
			final int x,
			final int y,
			final GaussianKernel kernel,
			final Interval source,
			final RandomAccess< ARGBType > sourceRandomAccess )
	{
		final long width = source.dimension( 0 ), height = source.dimension( 1 );
		if ( x < 0 || y < 0 || x >= width || y >= height )
			throw new IllegalArgumentException( "pixel (" + x + "," + y + ") is outside of the image of size " + width + "x" + height );

		final int radius = kernel.radius();
		double r = 0, g = 0, b = 0, total = 0;

		for ( int dy = -radius; dy <= radius; ++dy )
		{
			final int sy = y + dy;
			if ( sy < 0 || sy >= height )
				continue;

			for ( int dx = -radius; dx <= radius; ++dx )
			{
				final int sx = x + dx;
				if ( sx < 0 || sx >= width )
					continue;

				sourceRandomAccess.setPosition( sx, 0 );
				sourceRandomAccess.setPosition( sy, 1 );
				final int value = sourceRandomAccess.get().get();

				final double weight = kernel.weight( dx, dy );
				r += ARGBType.red( value ) * weight;
				g += ARGBType.green( value ) * weight;
				b += ARGBType.blue( value ) * weight;
				total += weight;
			}
		}

		// the weighted average always stays within [0, 255]
		return ARGBType.rgba( truncate( r / total ), truncate( g / total ), truncate( b / total ), 255 );
	}

	private static int truncate( final double channel )
	{
		return Math.min( ( int ) ( channel + TRUNCATION_EPSILON ), 255 );
	}
}
