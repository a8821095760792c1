package org.janelia.blur;

import java.util.ArrayList;
import java.util.List;

import org.janelia.blur.util.RgbImages;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

/**
 * Command line arguments parser for blurring an image.
 */

public class BlurArguments
{
	@Option(name = "-r", aliases = { "--radius" }, required = false,
			usage = "Blur radius in pixels (0-255).")
	private int radius = 10;

	@Option(name = "-s", aliases = { "--sigma" }, required = false,
			usage = "Standard deviation of the gaussian kernel.")
	private double sigma = 10.0;

	@Option(name = "-t", aliases = { "--threads" }, required = false,
			usage = "Number of worker threads.")
	private int numThreads = 10;

	@Option(name = "--sequential", required = false,
			usage = "Blur on a single thread without the worker pool.")
	private boolean sequential = false;

	@Option(name = "-h", aliases = { "--help" }, required = false, help = true,
			usage = "Prints this help.")
	private boolean help = false;

	@Argument(metaVar = "<source> [<destination>]", multiValued = true,
			usage = "Path to the original image, optionally followed by the path of the blurred image (<source>_blurred_<radius>x<sigma> by default).")
	private List< String > paths = new ArrayList<>();

	private final CmdLineParser parser;
	private boolean parsedSuccessfully = false;

	public BlurArguments( final String... args )
	{
		parser = new CmdLineParser( this );
		try
		{
			parser.parseArgument( args );
			if ( !help )
				validate();
			parsedSuccessfully = true;
		}
		catch ( final CmdLineException e )
		{
			System.err.println( e.getMessage() );
			parser.printUsage( System.err );
		}
	}

	private void validate() throws CmdLineException
	{
		if ( paths.isEmpty() )
			throw new CmdLineException( parser, "Expected a source image", null );
		if ( paths.size() > 2 )
			throw new CmdLineException( parser, "Too many arguments: expected <source> [<destination>]", null );
		if ( radius < 0 || radius > Blur.MAX_RADIUS )
			throw new CmdLineException( parser, "Radius should be within [0, " + Blur.MAX_RADIUS + "], got " + radius, null );
		if ( !( sigma > 0 ) || Double.isInfinite( sigma ) )
			throw new CmdLineException( parser, "Sigma should be positive, got " + sigma, null );
		if ( numThreads < 1 )
			throw new CmdLineException( parser, "Number of threads should be positive, got " + numThreads, null );
		if ( paths.size() == 1 )
		{
			try
			{
				RgbImages.getBlurredImagePath( paths.get( 0 ), radius, sigma );
			}
			catch ( final IllegalArgumentException e )
			{
				throw new CmdLineException( parser, e.getMessage(), e );
			}
		}
	}

	public void printUsage()
	{
		System.err.println( "Usage: blur [options] <source> [<destination>]" );
		parser.printUsage( System.err );
	}

	public boolean parsedSuccessfully() { return parsedSuccessfully; }
	public boolean help() { return help; }

	public int radius() { return radius; }
	public double sigma() { return sigma; }
	public int numThreads() { return numThreads; }
	public boolean sequential() { return sequential; }

	public String sourcePath() { return paths.get( 0 ); }

	public String destinationPath()
	{
		return paths.size() > 1 ? paths.get( 1 ) : RgbImages.getBlurredImagePath( sourcePath(), radius, sigma );
	}
}
