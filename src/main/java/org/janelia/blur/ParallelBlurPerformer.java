package org.janelia.blur;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.IntConsumer;

import org.apache.log4j.Logger;
import org.janelia.blur.concurrent.WorkerPool;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.IntArray;
import net.imglib2.type.numeric.ARGBType;
import net.imglib2.view.Views;

/**
 * Blurs an image by submitting one job per pixel to a {@link WorkerPool}.
 *
 * The jobs share the kernel and the source image (both read-only) and send their results
 * through a single queue. The calling thread is the only one writing into the output image,
 * and it stops after receiving exactly one result per pixel.
 */

public class ParallelBlurPerformer
{
	private static final Logger LOG = Logger.getLogger( ParallelBlurPerformer.class );

	/**
	 * Computes a single output pixel. Called concurrently from the worker threads.
	 */
	@FunctionalInterface
	interface PixelFunction
	{
		int compute( int x, int y );
	}

	private ParallelBlurPerformer() {}

	public static ArrayImg< ARGBType, IntArray > blur(
			final int radius,
			final double sigma,
			final int numWorkers,
			final RandomAccessibleInterval< ARGBType > source,
			final IntConsumer progressListener ) throws BlurExecutionException, InterruptedException
	{
		final RandomAccessibleInterval< ARGBType > sourceZeroMin = Views.zeroMin( source );
		final int width = ( int ) sourceZeroMin.dimension( 0 ), height = ( int ) sourceZeroMin.dimension( 1 );

		LOG.info( "Image dimensions: " + width + "x" + height );

		final GaussianKernel kernel = GaussianKernel.generate( radius, sigma );
		LOG.info( "Number of calculations: " + kernel.numCalculations( ( long ) width * height ) );

		final ArrayImg< ARGBType, IntArray > output = blur(
				width,
				height,
				numWorkers,
				( x, y ) -> PixelConvolver.convolve( x, y, kernel, sourceZeroMin ),
				progressListener );

		LOG.info( "Done!" );
		return output;
	}

	static ArrayImg< ARGBType, IntArray > blur(
			final int width,
			final int height,
			final int numWorkers,
			final PixelFunction pixelFunction,
			final IntConsumer progressListener ) throws BlurExecutionException, InterruptedException
	{
		final ArrayImg< ARGBType, IntArray > output = ArrayImgs.argbs( width, height );
		final int[] outputPixels = output.update( null ).getCurrentStorageArray();

		final long numPixels = ( long ) width * height;
		final BlockingQueue< PixelResult > results = new LinkedBlockingQueue<>();
		final ProgressReporter progress = new ProgressReporter( numPixels, progressListener );

		BlurExecutionException failure = null;

		try ( final WorkerPool pool = new WorkerPool( numWorkers ) )
		{
			for ( int y = 0; y < height; ++y )
			{
				for ( int x = 0; x < width; ++x )
				{
					final int px = x, py = y;
					pool.submit( () -> results.add( computePixel( px, py, pixelFunction ) ) );
				}
			}

			for ( long received = 1; received <= numPixels; ++received )
			{
				final PixelResult result = results.take();

				if ( result.isFailed() )
				{
					if ( failure == null )
						failure = new BlurExecutionException( "Failed to blur pixel (" + result.getX() + "," + result.getY() + ")", result.getFailure() );
					else
						failure.addSuppressed( result.getFailure() );
				}
				else
				{
					outputPixels[ result.getY() * width + result.getX() ] = result.getValue();
				}

				progress.update( received );
			}
		}

		if ( failure != null )
			throw failure;

		return output;
	}

	private static PixelResult computePixel( final int x, final int y, final PixelFunction pixelFunction )
	{
		try
		{
			return PixelResult.computed( x, y, pixelFunction.compute( x, y ) );
		}
		catch ( final Throwable e )
		{
			// every job has to send exactly one result, otherwise the collecting loop never finishes
			return PixelResult.failed( x, y, e );
		}
	}
}
