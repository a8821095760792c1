package org.janelia.blur;

import java.util.function.IntConsumer;

import org.apache.log4j.Logger;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.IntArray;
import net.imglib2.type.numeric.ARGBType;
import net.imglib2.util.Intervals;

/**
 * Entry points for blurring an RGB image with a gaussian kernel.
 *
 * All parameters are validated before any work is scheduled.
 * The returned image has the same size as the source and always starts at the origin.
 */

public class Blur
{
	private static final Logger LOG = Logger.getLogger( Blur.class );

	public static final int MAX_RADIUS = 255;

	private Blur() {}

	/**
	 * Blurs the {@code source} on a pool of {@code numWorkers} threads, reporting progress to the log.
	 */
	public static ArrayImg< ARGBType, IntArray > blurParallel(
			final int radius,
			final double sigma,
			final int numWorkers,
			final RandomAccessibleInterval< ARGBType > source ) throws BlurExecutionException, InterruptedException
	{
		return blurParallel( radius, sigma, numWorkers, source, percent -> LOG.info( percent + "% done" ) );
	}

	/**
	 * Blurs the {@code source} on a pool of {@code numWorkers} threads.
	 * The {@code progressListener} receives 10, 20, ..., 100 as the pixels get collected.
	 *
	 * @throws BlurExecutionException if any pixel could not be computed
	 * @throws InterruptedException if the calling thread was interrupted while collecting the results
	 */
	public static ArrayImg< ARGBType, IntArray > blurParallel(
			final int radius,
			final double sigma,
			final int numWorkers,
			final RandomAccessibleInterval< ARGBType > source,
			final IntConsumer progressListener ) throws BlurExecutionException, InterruptedException
	{
		validate( radius, sigma, source );
		if ( numWorkers < 1 )
			throw new IllegalArgumentException( "number of workers should be positive, got " + numWorkers );
		if ( progressListener == null )
			throw new NullPointerException( "progressListener" );

		return ParallelBlurPerformer.blur( radius, sigma, numWorkers, source, progressListener );
	}

	/**
	 * Blurs the {@code source} on the calling thread.
	 */
	public static ArrayImg< ARGBType, IntArray > blurSequential(
			final int radius,
			final double sigma,
			final RandomAccessibleInterval< ARGBType > source )
	{
		validate( radius, sigma, source );
		return SequentialBlurPerformer.blur( radius, sigma, source );
	}

	private static void validate( final int radius, final double sigma, final RandomAccessibleInterval< ARGBType > source )
	{
		if ( radius < 0 || radius > MAX_RADIUS )
			throw new IllegalArgumentException( "radius should be within [0, " + MAX_RADIUS + "], got " + radius );
		if ( !( sigma > 0 ) || Double.isInfinite( sigma ) )
			throw new IllegalArgumentException( "sigma should be positive, got " + sigma );
		final double centerWeight = GaussianKernel.gaussian( 0, 0, sigma );
		if ( !( centerWeight > 0 ) || Double.isInfinite( centerWeight ) )
			throw new IllegalArgumentException( "sigma is out of the representable range, got " + sigma );
		if ( source == null )
			throw new NullPointerException( "source" );
		if ( source.numDimensions() != 2 )
			throw new IllegalArgumentException( "expected a 2D image, got " + source.numDimensions() + "D" );
		if ( Intervals.numElements( source ) == 0 )
			throw new IllegalArgumentException( "image is empty" );
		if ( Intervals.numElements( source ) > Integer.MAX_VALUE )
			throw new IllegalArgumentException( "image is too large: " + Intervals.numElements( source ) + " pixels" );
	}
}
