package org.janelia.seathru;

import java.util.function.DoubleUnaryOperator;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;

class TestImages
{
	static ArrayImg< DoubleType, DoubleArray > constantColor( final int width, final int height, final double... rgb )
	{
		final ArrayImg< DoubleType, DoubleArray > img = ArrayImgs.doubles( width, height, 3 );
		for ( int c = 0; c < 3; ++c )
			for ( final DoubleType t : Views.iterable( Views.hyperSlice( img, 2, c ) ) )
				t.set( rgb[ c ] );
		return img;
	}

	static ArrayImg< DoubleType, DoubleArray > constantDepth( final int width, final int height, final double depth )
	{
		final ArrayImg< DoubleType, DoubleArray > img = ArrayImgs.doubles( width, height );
		for ( final DoubleType t : img )
			t.set( depth );
		return img;
	}

	/**
	 * Depth increasing linearly along x from {@code min} to {@code max}.
	 */
	static ArrayImg< DoubleType, DoubleArray > depthRamp( final int width, final int height, final double min, final double max )
	{
		final ArrayImg< DoubleType, DoubleArray > img = ArrayImgs.doubles( width, height );
		final Cursor< DoubleType > cursor = img.localizingCursor();
		while ( cursor.hasNext() )
		{
			cursor.fwd();
			cursor.get().set( depthAt( cursor.getIntPosition( 0 ), width, min, max ) );
		}
		return img;
	}

	static double depthAt( final int x, final int width, final double min, final double max )
	{
		return min + ( max - min ) * x / ( width - 1 );
	}

	/**
	 * Fills one channel with {@code f( depth )}.
	 */
	static void fill( final RandomAccessibleInterval< DoubleType > channel, final RandomAccessibleInterval< DoubleType > depth, final DoubleUnaryOperator f )
	{
		final Cursor< DoubleType > depthCursor = Views.flatIterable( depth ).cursor();
		final Cursor< DoubleType > cursor = Views.flatIterable( channel ).cursor();
		while ( cursor.hasNext() )
			cursor.next().set( f.applyAsDouble( depthCursor.next().get() ) );
	}

	static double get( final RandomAccessibleInterval< DoubleType > img, final long... position )
	{
		final RandomAccess< DoubleType > ra = img.randomAccess();
		ra.setPosition( position );
		return ra.get().get();
	}

	static void assertAllFinite( final RandomAccessibleInterval< DoubleType > img )
	{
		for ( final DoubleType t : Views.iterable( img ) )
			if ( !Double.isFinite( t.get() ) )
				throw new AssertionError( "non-finite value " + t.get() );
	}
}
