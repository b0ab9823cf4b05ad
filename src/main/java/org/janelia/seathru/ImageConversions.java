package org.janelia.seathru;

import java.io.File;
import java.io.IOException;

import ij.IJ;
import ij.ImagePlus;
import ij.io.FileSaver;
import ij.process.ColorProcessor;
import ij.process.FloatProcessor;
import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.ByteArray;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;

/**
 * Conversions between ImageJ images and the imglib2 arrays used by the restoration,
 * and loading/saving images on disk.
 */
public class ImageConversions
{
	/**
	 * Converts any ImageJ image to an 8-bit RGB array of size {@code [ width, height, 3 ]}.
	 */
	public static ArrayImg< UnsignedByteType, ByteArray > toColorImage( final ImagePlus imp )
	{
		final ColorProcessor cp = imp.getProcessor().convertToColorProcessor();
		final int numPixels = cp.getWidth() * cp.getHeight();
		final byte[] r = new byte[ numPixels ], g = new byte[ numPixels ], b = new byte[ numPixels ];
		cp.getRGB( r, g, b );

		// channel planes are contiguous in the array image
		final byte[] data = new byte[ numPixels * ImageOperations.NUM_CHANNELS ];
		System.arraycopy( r, 0, data, 0, numPixels );
		System.arraycopy( g, 0, data, numPixels, numPixels );
		System.arraycopy( b, 0, data, 2 * numPixels, numPixels );
		return ArrayImgs.unsignedBytes( data, cp.getWidth(), cp.getHeight(), ImageOperations.NUM_CHANNELS );
	}

	/**
	 * Reads the depth values of a single-channel ImageJ image (typically a 32-bit TIFF) into a {@code [ width, height ]} array.
	 */
	public static ArrayImg< DoubleType, DoubleArray > toDepthMap( final ImagePlus imp )
	{
		final FloatProcessor fp = imp.getProcessor().convertToFloatProcessor();
		final ArrayImg< DoubleType, DoubleArray > depth = ArrayImgs.doubles( fp.getWidth(), fp.getHeight() );
		final Cursor< DoubleType > cursor = Views.flatIterable( depth ).cursor();
		for ( int i = 0; cursor.hasNext(); ++i )
			cursor.next().set( fp.getf( i ) );
		return depth;
	}

	/**
	 * @return the image scaled to [0,1]
	 */
	public static ArrayImg< DoubleType, DoubleArray > normalize( final RandomAccessibleInterval< UnsignedByteType > image )
	{
		final ArrayImg< DoubleType, DoubleArray > normalized = ArrayImgs.doubles( Intervals.dimensionsAsLongArray( image ) );
		final Cursor< UnsignedByteType > srcCursor = Views.flatIterable( image ).cursor();
		final Cursor< DoubleType > dstCursor = Views.flatIterable( normalized ).cursor();
		while ( dstCursor.hasNext() )
			dstCursor.next().set( srcCursor.next().get() / 255.0 );
		return normalized;
	}

	public static ImagePlus toImagePlus( final RandomAccessibleInterval< UnsignedByteType > image, final String title )
	{
		final int width = ( int ) image.dimension( 0 ), height = ( int ) image.dimension( 1 );
		final byte[][] channels = new byte[ ImageOperations.NUM_CHANNELS ][ width * height ];
		for ( int c = 0; c < channels.length; ++c )
		{
			final Cursor< UnsignedByteType > cursor = Views.flatIterable( Views.hyperSlice( image, ImageOperations.CHANNEL_DIMENSION, image.min( ImageOperations.CHANNEL_DIMENSION ) + c ) ).cursor();
			for ( int i = 0; cursor.hasNext(); ++i )
				channels[ c ][ i ] = ( byte ) cursor.next().get();
		}

		final ColorProcessor cp = new ColorProcessor( width, height );
		cp.setRGB( channels[ 0 ], channels[ 1 ], channels[ 2 ] );
		return new ImagePlus( title, cp );
	}

	public static ImagePlus openImage( final String path ) throws IOException
	{
		if ( !new File( path ).isFile() )
			throw new IOException( "file does not exist: " + path );

		final ImagePlus imp = IJ.openImage( path );
		if ( imp == null )
			throw new IOException( "cannot open image " + path );
		return imp;
	}

	/**
	 * Saves the image in the format given by the file extension: PNG, JPEG, or TIFF otherwise.
	 */
	public static void saveImage( final ImagePlus imp, final String path ) throws IOException
	{
		final File parent = new File( path ).getAbsoluteFile().getParentFile();
		if ( parent != null && !parent.exists() && !parent.mkdirs() )
			throw new IOException( "cannot create directory " + parent );

		final String lowerCasePath = path.toLowerCase();
		final FileSaver saver = new FileSaver( imp );
		final boolean saved;
		if ( lowerCasePath.endsWith( ".png" ) )
			saved = saver.saveAsPng( path );
		else if ( lowerCasePath.endsWith( ".jpg" ) || lowerCasePath.endsWith( ".jpeg" ) )
			saved = saver.saveAsJpeg( path );
		else
			saved = saver.saveAsTiff( path );

		if ( !saved )
			throw new IOException( "cannot save image to " + path );
	}
}
