package org.janelia.blur;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import net.imglib2.FinalInterval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.IntArray;
import net.imglib2.type.numeric.ARGBType;
import net.imglib2.view.Views;

public class BlurTest
{
	private Random rnd;

	@Before
	public void setUp()
	{
		rnd = new Random( 2718 );
	}

	@Test
	public void testDimensionsPreserved() throws Exception
	{
		for ( int t = 0; t < 5; t++ )
		{
			final int width = rnd.nextInt( 30 ) + 1, height = rnd.nextInt( 30 ) + 1;
			final ArrayImg< ARGBType, IntArray > img = TestImages.random( rnd, width, height );

			final ArrayImg< ARGBType, IntArray > sequential = Blur.blurSequential( 2, 1.5, img );
			Assert.assertEquals( width, sequential.dimension( 0 ) );
			Assert.assertEquals( height, sequential.dimension( 1 ) );

			final ArrayImg< ARGBType, IntArray > parallel = Blur.blurParallel( 2, 1.5, 3, img );
			Assert.assertEquals( width, parallel.dimension( 0 ) );
			Assert.assertEquals( height, parallel.dimension( 1 ) );
		}
	}

	@Test
	public void testSequentialEqualsParallel() throws Exception
	{
		for ( int t = 0; t < 5; t++ )
		{
			final ArrayImg< ARGBType, IntArray > img = TestImages.random( rnd, rnd.nextInt( 40 ) + 1, rnd.nextInt( 40 ) + 1 );
			final int radius = rnd.nextInt( 6 );
			final double sigma = rnd.nextDouble() * 5 + 0.1;
			final int numWorkers = rnd.nextInt( 16 ) + 1;

			TestImages.assertRgbEquals( Blur.blurSequential( radius, sigma, img ), Blur.blurParallel( radius, sigma, numWorkers, img ) );
		}
	}

	@Test
	public void testWorkerCountInvariance() throws Exception
	{
		final ArrayImg< ARGBType, IntArray > img = TestImages.random( rnd, 33, 21 );
		final ArrayImg< ARGBType, IntArray > expected = Blur.blurParallel( 3, 2.0, 1, img );

		for ( final int numWorkers : new int[] { 2, 8, 64 } )
			TestImages.assertRgbEquals( expected, Blur.blurParallel( 3, 2.0, numWorkers, img ) );
	}

	@Test
	public void testZeroRadiusKeepsImage() throws Exception
	{
		final ArrayImg< ARGBType, IntArray > img = TestImages.random( rnd, 17, 9 );
		TestImages.assertRgbEquals( img, Blur.blurSequential( 0, 3.0, img ) );
		TestImages.assertRgbEquals( img, Blur.blurParallel( 0, 3.0, 4, img ) );
	}

	@Test
	public void testSinglePixelImage() throws Exception
	{
		final ArrayImg< ARGBType, IntArray > img = TestImages.filled( 1, 1, 13, 200, 255 );
		for ( final int radius : new int[] { 1, 5, 255 } )
		{
			TestImages.assertRgbEquals( img, Blur.blurSequential( radius, 1.0, img ) );
			TestImages.assertRgbEquals( img, Blur.blurParallel( radius, 1.0, 2, img ) );
		}
	}

	@Test
	public void testBlackImage() throws Exception
	{
		final ArrayImg< ARGBType, IntArray > black = TestImages.filled( 4, 4, 0, 0, 0 );

		TestImages.assertRgbEquals( black, Blur.blurSequential( 1, 1.0, black ) );
		TestImages.assertRgbEquals( black, Blur.blurParallel( 1, 1.0, 4, black ) );
	}

	@Test
	public void testUniformImageStaysUniform() throws Exception
	{
		final ArrayImg< ARGBType, IntArray > img = TestImages.filled( 12, 7, 255, 128, 1 );
		TestImages.assertRgbEquals( img, Blur.blurParallel( 4, 2.5, 5, img ) );
	}

	@Test
	public void testOutputIsOpaque() throws Exception
	{
		final ArrayImg< ARGBType, IntArray > img = ArrayImgs.argbs( 5, 5 );
		for ( final ARGBType pixel : Blur.blurParallel( 1, 1.0, 2, img ) )
			Assert.assertEquals( 255, ARGBType.alpha( pixel.get() ) );
	}

	@Test
	public void testSourceWithOffset() throws Exception
	{
		final ArrayImg< ARGBType, IntArray > img = TestImages.random( rnd, 20, 20 );
		final RandomAccessibleInterval< ARGBType > crop = Views.interval( img, new FinalInterval( new long[] { 5, 3 }, new long[] { 14, 17 } ) );

		final ArrayImg< ARGBType, IntArray > expected = Blur.blurSequential( 2, 1.0, ArrayImgs.argbs( copy( crop ), 10, 15 ) );
		TestImages.assertRgbEquals( expected, Blur.blurSequential( 2, 1.0, crop ) );
		TestImages.assertRgbEquals( expected, Blur.blurParallel( 2, 1.0, 3, crop ) );
	}

	@Test
	public void testProgressNotifications() throws Exception
	{
		final List< Integer > reported = new ArrayList<>();
		Blur.blurParallel( 1, 1.0, 4, TestImages.random( rnd, 23, 11 ), reported::add );

		Assert.assertArrayEquals( new Integer[] { 10, 20, 30, 40, 50, 60, 70, 80, 90, 100 }, reported.toArray( new Integer[ 0 ] ) );
	}

	@Test
	public void testInvalidParameters() throws Exception
	{
		final ArrayImg< ARGBType, IntArray > img = TestImages.random( rnd, 4, 4 );

		assertIllegalArgument( () -> Blur.blurSequential( 1, 0, img ) );
		assertIllegalArgument( () -> Blur.blurSequential( 1, -2.0, img ) );
		assertIllegalArgument( () -> Blur.blurSequential( 1, Double.NaN, img ) );
		assertIllegalArgument( () -> Blur.blurSequential( -1, 1.0, img ) );
		assertIllegalArgument( () -> Blur.blurSequential( 256, 1.0, img ) );
		assertIllegalArgument( () -> Blur.blurParallel( 1, 1.0, 0, img ) );
		assertIllegalArgument( () -> Blur.blurParallel( 1, 0, 4, img ) );
		assertIllegalArgument( () -> Blur.blurSequential( 1, 1.0, ArrayImgs.argbs( 4, 4, 4 ) ) );

		// the kernel weights overflow or underflow for these
		assertIllegalArgument( () -> Blur.blurSequential( 1, 1e200, img ) );
		assertIllegalArgument( () -> Blur.blurSequential( 1, 1e-170, img ) );
		assertIllegalArgument( () -> Blur.blurParallel( 1, 1e200, 2, img ) );
	}

	private interface BlurCall
	{
		void run() throws Exception;
	}

	private static void assertIllegalArgument( final BlurCall call ) throws Exception
	{
		try
		{
			call.run();
			Assert.fail( "expected IllegalArgumentException" );
		}
		catch ( final IllegalArgumentException e )
		{
			// expected
		}
	}

	private static int[] copy( final RandomAccessibleInterval< ARGBType > img )
	{
		final List< Integer > values = new ArrayList<>();
		for ( final ARGBType pixel : Views.flatIterable( img ) )
			values.add( pixel.get() );
		return values.stream().mapToInt( Integer::intValue ).toArray();
	}
}
