package org.janelia.seathru;

import org.junit.Assert;
import org.junit.Test;

import net.imglib2.RandomAccess;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.ByteArray;
import net.imglib2.type.numeric.integer.UnsignedByteType;

public class SimplifiedRestorerTest
{
	@Test
	public void testGains()
	{
		final double[] gains = new SimplifiedRestorer().getGains( 10 );
		Assert.assertEquals( Math.exp( 0.1 ), gains[ 0 ], 1e-12 );
		Assert.assertEquals( Math.exp( 0.2 ), gains[ 1 ], 1e-12 );
		Assert.assertEquals( Math.exp( 0.3 ), gains[ 2 ], 1e-12 );
	}

	@Test
	public void testBlueIsBoostedMost() throws Exception
	{
		final ArrayImg< UnsignedByteType, ByteArray > image = ArrayImgs.unsignedBytes( 2, 1, 3 );
		for ( final UnsignedByteType t : image )
			t.set( 100 );
		set( image, 1, 0, 2, 250 );

		final ArrayImg< UnsignedByteType, ByteArray > corrected = new SimplifiedRestorer().restore( image, 10 );
		Assert.assertEquals( 111, get( corrected, 0, 0, 0 ) );
		Assert.assertEquals( 122, get( corrected, 0, 0, 1 ) );
		Assert.assertEquals( 135, get( corrected, 0, 0, 2 ) );

		// clipped at the top of the range
		Assert.assertEquals( 255, get( corrected, 1, 0, 2 ) );

		// the input is left untouched
		Assert.assertEquals( 100, get( image, 0, 0, 0 ) );
	}

	@Test
	public void testZeroDepthKeepsImage() throws Exception
	{
		final ArrayImg< UnsignedByteType, ByteArray > image = ArrayImgs.unsignedBytes( new byte[] { 1, 2, 3, ( byte ) 200, ( byte ) 255, 0 }, 2, 1, 3 );
		final ArrayImg< UnsignedByteType, ByteArray > corrected = new SimplifiedRestorer().restore( image, 0 );
		Assert.assertArrayEquals( image.update( null ).getCurrentStorageArray(), corrected.update( null ).getCurrentStorageArray() );
	}

	@Test( expected = DegenerateInputException.class )
	public void testWrongNumberOfChannels() throws Exception
	{
		new SimplifiedRestorer().restore( ArrayImgs.unsignedBytes( 2, 2, 1 ), 3 );
	}

	private static int get( final ArrayImg< UnsignedByteType, ByteArray > img, final int... position )
	{
		final RandomAccess< UnsignedByteType > ra = img.randomAccess();
		ra.setPosition( position );
		return ra.get().get();
	}

	private static void set( final ArrayImg< UnsignedByteType, ByteArray > img, final int x, final int y, final int c, final int value )
	{
		final RandomAccess< UnsignedByteType > ra = img.randomAccess();
		ra.setPosition( new int[] { x, y, c } );
		ra.get().set( value );
	}
}
