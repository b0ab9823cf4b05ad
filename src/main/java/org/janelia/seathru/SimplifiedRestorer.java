package org.janelia.seathru;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.ByteArray;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;

/**
 * Quick color correction that compensates the attenuation at the average scene depth only:
 * every channel is multiplied by {@code exp( beta_c * averageDepth )} and clipped to [0,255].
 */
public class SimplifiedRestorer
{
	/**
	 * Coefficients of the red, green and blue channels.
	 */
	public static final double[] DEFAULT_COEFFICIENTS = new double[] { 0.01, 0.02, 0.03 };

	private final double[] coefficients;

	public SimplifiedRestorer()
	{
		this( DEFAULT_COEFFICIENTS );
	}

	public SimplifiedRestorer( final double[] coefficients )
	{
		if ( coefficients.length != ImageOperations.NUM_CHANNELS )
			throw new IllegalArgumentException( "expected " + ImageOperations.NUM_CHANNELS + " coefficients, got " + coefficients.length );
		this.coefficients = coefficients.clone();
	}

	public double[] getGains( final double averageDepth )
	{
		final double[] gains = new double[ coefficients.length ];
		for ( int c = 0; c < gains.length; ++c )
			gains[ c ] = Math.exp( coefficients[ c ] * averageDepth );
		return gains;
	}

	/**
	 * @param image 8-bit image of size {@code [ width, height, 3 ]}
	 */
	public ArrayImg< UnsignedByteType, ByteArray > restore(
			final RandomAccessibleInterval< UnsignedByteType > image,
			final double averageDepth ) throws DegenerateInputException
	{
		if ( image.numDimensions() != 3 || image.dimension( ImageOperations.CHANNEL_DIMENSION ) != ImageOperations.NUM_CHANNELS )
			throw new DegenerateInputException( "expected an image of size [width, height, 3]" );

		final double[] gains = getGains( Double.isFinite( averageDepth ) ? averageDepth : 0 );
		final ArrayImg< UnsignedByteType, ByteArray > corrected = ArrayImgs.unsignedBytes( Intervals.dimensionsAsLongArray( image ) );
		for ( int c = 0; c < gains.length; ++c )
		{
			final Cursor< UnsignedByteType > srcCursor = Views.flatIterable( Views.hyperSlice( image, ImageOperations.CHANNEL_DIMENSION, image.min( ImageOperations.CHANNEL_DIMENSION ) + c ) ).cursor();
			final Cursor< UnsignedByteType > dstCursor = Views.flatIterable( Views.hyperSlice( corrected, ImageOperations.CHANNEL_DIMENSION, c ) ).cursor();
			while ( dstCursor.hasNext() )
				dstCursor.next().set( ( int ) Math.min( Math.round( srcCursor.next().get() * gains[ c ] ), 255 ) );
		}
		return corrected;
	}
}
