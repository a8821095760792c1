package org.janelia.blur.util;

import java.io.File;
import java.io.IOException;
import java.util.Locale;

import ij.IJ;
import ij.ImagePlus;
import ij.io.FileSaver;
import ij.process.ColorProcessor;
import ij.process.ImageProcessor;
import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.IntArray;
import net.imglib2.type.numeric.ARGBType;
import net.imglib2.view.Views;

/**
 * Loading and saving RGB images through ImageJ, and conversions between {@link ImagePlus} and imglib2 ARGB images.
 */

public class RgbImages
{
	private RgbImages() {}

	/**
	 * Opens the image at {@code path} and converts it to 8-bit RGB if needed.
	 */
	public static ArrayImg< ARGBType, IntArray > open( final String path ) throws IOException
	{
		if ( !new File( path ).isFile() )
			throw new IOException( "File does not exist: " + path );

		final ImagePlus imp = IJ.openImage( path );
		if ( imp == null )
			throw new IOException( "Cannot open image: " + path );

		return fromImagePlus( imp );
	}

	/**
	 * Saves the {@code img} to {@code path}, the file format is determined by the extension.
	 */
	public static void save( final RandomAccessibleInterval< ARGBType > img, final String path ) throws IOException
	{
		final FileSaver saver = new FileSaver( toImagePlus( img, new File( path ).getName() ) );
		final String extension = getExtension( path );

		final boolean saved;
		switch ( extension )
		{
		case "tif":
		case "tiff":
			saved = saver.saveAsTiff( path );
			break;
		case "png":
			saved = saver.saveAsPng( path );
			break;
		case "jpg":
		case "jpeg":
			saved = saver.saveAsJpeg( path );
			break;
		case "bmp":
			saved = saver.saveAsBmp( path );
			break;
		case "gif":
			saved = saver.saveAsGif( path );
			break;
		default:
			throw new IllegalArgumentException( "Unsupported image format '" + extension + "': " + path );
		}

		if ( !saved )
			throw new IOException( "Cannot save image: " + path );
	}

	/**
	 * Copies the pixels of the {@code imp} into a new ARGB image. Non-RGB images are converted first.
	 */
	public static ArrayImg< ARGBType, IntArray > fromImagePlus( final ImagePlus imp )
	{
		final ImageProcessor processor = imp.getProcessor();
		final ColorProcessor colorProcessor = processor instanceof ColorProcessor ? ( ColorProcessor ) processor : ( ColorProcessor ) processor.convertToRGB();

		final int[] pixels = ( ( int[] ) colorProcessor.getPixels() ).clone();
		return ArrayImgs.argbs( pixels, colorProcessor.getWidth(), colorProcessor.getHeight() );
	}

	/**
	 * Copies the {@code img} into a new RGB {@link ImagePlus}.
	 */
	public static ImagePlus toImagePlus( final RandomAccessibleInterval< ARGBType > img, final String title )
	{
		final int width = ( int ) img.dimension( 0 ), height = ( int ) img.dimension( 1 );
		final int[] pixels = new int[ width * height ];

		final Cursor< ARGBType > cursor = Views.flatIterable( img ).cursor();
		for ( int i = 0; i < pixels.length; ++i )
			pixels[ i ] = cursor.next().get();

		return new ImagePlus( title, new ColorProcessor( width, height, pixels ) );
	}

	/**
	 * Default destination for the blurred image: {@code <name>_blurred_<radius>x<sigma>.<extension>} next to the source.
	 */
	public static String getBlurredImagePath( final String sourcePath, final int radius, final double sigma )
	{
		final File source = new File( sourcePath );
		final String filename = source.getName();
		final int dot = filename.lastIndexOf( '.' );
		if ( dot <= 0 || dot == filename.length() - 1 )
			throw new IllegalArgumentException( "Cannot derive the output filename, source has no extension: " + sourcePath );

		final String blurredFilename = String.format( "%s_blurred_%dx%s%s",
				filename.substring( 0, dot ),
				radius,
				formatSigma( sigma ),
				filename.substring( dot ) );

		return new File( source.getParentFile(), blurredFilename ).getPath();
	}

	static String formatSigma( final double sigma )
	{
		if ( sigma == Math.rint( sigma ) && !Double.isInfinite( sigma ) )
			return Long.toString( ( long ) sigma );
		return Double.toString( sigma );
	}

	private static String getExtension( final String path )
	{
		final String filename = new File( path ).getName();
		final int dot = filename.lastIndexOf( '.' );
		return dot == -1 ? "" : filename.substring( dot + 1 ).toLowerCase( Locale.ROOT );
	}
}
