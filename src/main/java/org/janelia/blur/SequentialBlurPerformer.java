package org.janelia.blur;

import org.apache.log4j.Logger;

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.IntArray;
import net.imglib2.type.numeric.ARGBType;
import net.imglib2.view.Views;

/**
 * Single-threaded blur visiting the pixels in order. Produces exactly the same output as {@link ParallelBlurPerformer}.
 */

public class SequentialBlurPerformer
{
	private static final Logger LOG = Logger.getLogger( SequentialBlurPerformer.class );

	private SequentialBlurPerformer() {}

	public static ArrayImg< ARGBType, IntArray > blur(
			final int radius,
			final double sigma,
			final RandomAccessibleInterval< ARGBType > source )
	{
		final RandomAccessibleInterval< ARGBType > sourceZeroMin = Views.zeroMin( source );
		final int width = ( int ) sourceZeroMin.dimension( 0 ), height = ( int ) sourceZeroMin.dimension( 1 );

		LOG.info( "Image dimensions: " + width + "x" + height );

		final GaussianKernel kernel = GaussianKernel.generate( radius, sigma );

		final ArrayImg< ARGBType, IntArray > output = ArrayImgs.argbs( width, height );
		final RandomAccess< ARGBType > sourceRandomAccess = sourceZeroMin.randomAccess();
		final RandomAccess< ARGBType > outputRandomAccess = output.randomAccess();

		for ( int y = 0; y < height; ++y )
		{
			outputRandomAccess.setPosition( y, 1 );
			for ( int x = 0; x < width; ++x )
			{
				outputRandomAccess.setPosition( x, 0 );
				outputRandomAccess.get().set( PixelConvolver.convolve( x, y, kernel, sourceZeroMin, sourceRandomAccess ) );
			}
		}

		LOG.info( "Done!" );
		return output;
	}
}
