package org.janelia.blur;

/**
 * Square 2D gaussian kernel of side {@code 2*radius+1} addressed by signed offsets from its center.
 * The weights are the plain isotropic gaussian density and are not normalized to sum up to 1,
 * the normalization is done for every pixel separately by {@link PixelConvolver}.
 */

public class GaussianKernel
{
	private final int radius;
	private final int size;
	private final double sigma;
	private final double[] weights;

	private GaussianKernel( final int radius, final double sigma, final double[] weights )
	{
		this.radius = radius;
		this.size = 2 * radius + 1;
		this.sigma = sigma;
		this.weights = weights;
	}

	/**
	 * Builds the kernel for the given {@code radius} and standard deviation {@code sigma}.
	 */
	public static GaussianKernel generate( final int radius, final double sigma )
	{
		if ( radius < 0 )
			throw new IllegalArgumentException( "radius should be non-negative, got " + radius );
		if ( !( sigma > 0 ) || Double.isInfinite( sigma ) )
			throw new IllegalArgumentException( "sigma should be positive, got " + sigma );

		final int size = 2 * radius + 1;
		final double[] weights = new double[ size * size ];
		for ( int dy = -radius; dy <= radius; ++dy )
			for ( int dx = -radius; dx <= radius; ++dx )
				weights[ ( dy + radius ) * size + ( dx + radius ) ] = gaussian( dx, dy, sigma );

		return new GaussianKernel( radius, sigma, weights );
	}

	/**
	 * Isotropic 2D gaussian density at the offset ({@code dx}, {@code dy}).
	 */
	public static double gaussian( final int dx, final int dy, final double sigma )
	{
		final double variance = sigma * sigma;
		return Math.exp( -( dx * dx + dy * dy ) / ( 2 * variance ) ) / ( 2 * Math.PI * variance );
	}

	public double weight( final int dx, final int dy )
	{
		if ( Math.abs( dx ) > radius || Math.abs( dy ) > radius )
			throw new IndexOutOfBoundsException( "offset (" + dx + "," + dy + ") is outside of the kernel with radius " + radius );

		return weights[ ( dy + radius ) * size + ( dx + radius ) ];
	}

	public int radius()
	{
		return radius;
	}

	public int size()
	{
		return size;
	}

	public double sigma()
	{
		return sigma;
	}

	/**
	 * Number of multiply-add operations needed to blur an image of the given size with this kernel.
	 */
	public long numCalculations( final long numPixels )
	{
		return numPixels * size * size;
	}
}
