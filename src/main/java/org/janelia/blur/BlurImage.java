package org.janelia.blur;

import java.io.IOException;

import org.apache.log4j.Logger;
import org.janelia.blur.util.RgbImages;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.IntArray;
import net.imglib2.type.numeric.ARGBType;

/**
 * Command line tool: loads an image, blurs it and saves the result.
 */

public class BlurImage
{
	private static final Logger LOG = Logger.getLogger( BlurImage.class );

	public static void main( final String... args ) throws IOException, BlurExecutionException, InterruptedException
	{
		final BlurArguments parsedArgs = new BlurArguments( args );
		if ( parsedArgs.help() )
		{
			parsedArgs.printUsage();
			System.exit( 1 );
		}
		if ( !parsedArgs.parsedSuccessfully() )
			System.exit( 1 );

		run( parsedArgs );
	}

	public static void run( final BlurArguments parsedArgs ) throws IOException, BlurExecutionException, InterruptedException
	{
		final String destinationPath = parsedArgs.destinationPath();

		LOG.info( "Opening " + parsedArgs.sourcePath() );
		final ArrayImg< ARGBType, IntArray > original = RgbImages.open( parsedArgs.sourcePath() );

		final ArrayImg< ARGBType, IntArray > blurred;
		if ( parsedArgs.sequential() )
			blurred = Blur.blurSequential( parsedArgs.radius(), parsedArgs.sigma(), original );
		else
			blurred = Blur.blurParallel( parsedArgs.radius(), parsedArgs.sigma(), parsedArgs.numThreads(), original );

		LOG.info( "Saving blurred image to " + destinationPath );
		RgbImages.save( blurred, destinationPath );
	}
}
