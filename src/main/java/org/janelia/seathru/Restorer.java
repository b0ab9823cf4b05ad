package org.janelia.seathru;

import org.janelia.util.concurrent.MultithreadedExecutor;

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
 * Inverts the image formation model:
 * {@code J = ( I - B ) * exp( beta * z ) / max( L, eps )}, clipped to [0,1].
 */
public class Restorer
{
	private final double epsilon;
	private final MultithreadedExecutor executor;

	public Restorer( final RestorationParameters parameters, final MultithreadedExecutor executor )
	{
		this( parameters.getEpsilon(), executor );
	}

	public Restorer( final double epsilon, final MultithreadedExecutor executor )
	{
		this.epsilon = epsilon;
		this.executor = executor;
	}

	/**
	 * @return restored image with values in [0,1]
	 */
	public ArrayImg< DoubleType, DoubleArray > restore(
			final RandomAccessibleInterval< DoubleType > image,
			final RandomAccessibleInterval< DoubleType > depth,
			final RandomAccessibleInterval< DoubleType > backscatter,
			final RandomAccessibleInterval< DoubleType > illumination,
			final RandomAccessibleInterval< DoubleType > beta ) throws RestorationException
	{
		final int numRows = ImageOperations.numRows( depth );
		final ArrayImg< DoubleType, DoubleArray > restored = ImageOperations.createColorImage( image.dimension( 0 ), image.dimension( 1 ) );

		ImageOperations.run( executor, task ->
			{
				final int c = task / numRows, y = task % numRows;
				final Cursor< DoubleType > imageCursor = rowCursor( image, c, y );
				final Cursor< DoubleType > backscatterCursor = rowCursor( backscatter, c, y );
				final Cursor< DoubleType > illuminationCursor = rowCursor( illumination, c, y );
				final Cursor< DoubleType > betaCursor = rowCursor( beta, c, y );
				final Cursor< DoubleType > depthCursor = Views.flatIterable( ImageOperations.row( depth, y ) ).cursor();
				final Cursor< DoubleType > restoredCursor = rowCursor( restored, c, y );

				while ( restoredCursor.hasNext() )
				{
					final double light = illuminationCursor.next().get();
					final double value =
							( imageCursor.next().get() - backscatterCursor.next().get() )
							* Math.exp( betaCursor.next().get() * depthCursor.next().get() )
							/ ( light > epsilon ? light : epsilon );
					restoredCursor.next().set( clip( value ) );
				}
			},
			ImageOperations.NUM_CHANNELS * numRows );

		return restored;
	}

	/**
	 * Converts a [0,1] image to 8 bits, rounding to the nearest level.
	 */
	public static ArrayImg< UnsignedByteType, ByteArray > toUnsignedBytes( final RandomAccessibleInterval< DoubleType > normalized )
	{
		final ArrayImg< UnsignedByteType, ByteArray > bytes = ArrayImgs.unsignedBytes( Intervals.dimensionsAsLongArray( normalized ) );
		final Cursor< DoubleType > srcCursor = Views.flatIterable( normalized ).cursor();
		final Cursor< UnsignedByteType > dstCursor = Views.flatIterable( bytes ).cursor();
		while ( dstCursor.hasNext() )
			dstCursor.next().set( ( int ) Math.round( clip( srcCursor.next().get() ) * 255 ) );
		return bytes;
	}

	/**
	 * Clips to [0,1], mapping NaN to 0 and positive infinity to 1.
	 */
	static double clip( final double value )
	{
		if ( value > 1 )
			return 1;
		return value > 0 ? value : 0;
	}

	private static Cursor< DoubleType > rowCursor( final RandomAccessibleInterval< DoubleType > image, final int channel, final int y )
	{
		return Views.flatIterable( ImageOperations.row( ImageOperations.channel( image, channel ), y ) ).cursor();
	}
}
