package org.janelia.seathru;

import org.janelia.util.concurrent.MultithreadedExecutor;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;

public class IlluminationEstimatorTest
{
	private MultithreadedExecutor executor;

	@Before
	public void setUp()
	{
		executor = new MultithreadedExecutor( 3 );
	}

	@After
	public void tearDown()
	{
		executor.close();
	}

	@Test
	public void testMirroredBorders() throws Exception
	{
		final ArrayImg< DoubleType, DoubleArray > image = ImageOperations.createColorImage( 3, 1 );
		final Cursor< DoubleType > cursor = image.localizingCursor();
		while ( cursor.hasNext() )
		{
			cursor.fwd();
			cursor.get().set( cursor.getIntPosition( 0 ) + 1 );
		}

		final ArrayImg< DoubleType, DoubleArray > illumination = new IlluminationEstimator( 3, executor ).estimate( image, ImageOperations.createColorImage( 3, 1 ) );
		for ( int c = 0; c < 3; ++c )
		{
			Assert.assertEquals( 4.0 / 3, TestImages.get( illumination, 0, 0, c ), 1e-12 );
			Assert.assertEquals( 2.0, TestImages.get( illumination, 1, 0, c ), 1e-12 );
			Assert.assertEquals( 8.0 / 3, TestImages.get( illumination, 2, 0, c ), 1e-12 );
		}
	}

	@Test
	public void testEvenWindowPlacesExtraSampleBefore() throws Exception
	{
		final ArrayImg< DoubleType, DoubleArray > image = ImageOperations.createColorImage( 4, 1 );
		final double[] values = new double[] { 1, 2, 4, 8 };
		for ( int x = 0; x < 4; ++x )
			for ( int c = 0; c < 3; ++c )
				set( image, x, 0, c, values[ x ] );

		final ArrayImg< DoubleType, DoubleArray > illumination = new IlluminationEstimator( 2, executor ).estimate( image, ImageOperations.createColorImage( 4, 1 ) );

		// window covers [x-1, x], the left border repeats the first pixel
		Assert.assertEquals( 1.0, TestImages.get( illumination, 0, 0, 0 ), 1e-12 );
		Assert.assertEquals( 1.5, TestImages.get( illumination, 1, 0, 0 ), 1e-12 );
		Assert.assertEquals( 3.0, TestImages.get( illumination, 2, 0, 0 ), 1e-12 );
		Assert.assertEquals( 6.0, TestImages.get( illumination, 3, 0, 0 ), 1e-12 );
	}

	@Test
	public void testSeparableBoxAverage() throws Exception
	{
		// a single bright pixel spreads evenly over its 3x3 neighborhood
		final ArrayImg< DoubleType, DoubleArray > image = ImageOperations.createColorImage( 7, 7 );
		set( image, 3, 3, 1, 9 );

		final ArrayImg< DoubleType, DoubleArray > illumination = new IlluminationEstimator( 3, executor ).estimate( image, ImageOperations.createColorImage( 7, 7 ) );
		for ( int y = 0; y < 7; ++y )
		{
			for ( int x = 0; x < 7; ++x )
			{
				final double expected = ( Math.abs( x - 3 ) <= 1 && Math.abs( y - 3 ) <= 1 ) ? 1 : 0;
				Assert.assertEquals( expected, TestImages.get( illumination, x, y, 1 ), 1e-12 );
				Assert.assertEquals( 0, TestImages.get( illumination, x, y, 0 ), 0 );
			}
		}
	}

	@Test
	public void testResidualIsClippedAtZero() throws Exception
	{
		final ArrayImg< DoubleType, DoubleArray > image = TestImages.constantColor( 5, 4, 0.2, 0.5, Double.NaN );
		final ArrayImg< DoubleType, DoubleArray > backscatter = TestImages.constantColor( 5, 4, 0.3, 0.1, 0.1 );

		final ArrayImg< DoubleType, DoubleArray > illumination = new IlluminationEstimator( RestorationParameters.defaults(), executor ).estimate( image, backscatter );
		Assert.assertArrayEquals( new long[] { 5, 4, 3 }, new long[] { illumination.dimension( 0 ), illumination.dimension( 1 ), illumination.dimension( 2 ) } );
		for ( int y = 0; y < 4; ++y )
		{
			for ( int x = 0; x < 5; ++x )
			{
				Assert.assertEquals( 0, TestImages.get( illumination, x, y, 0 ), 0 );
				Assert.assertEquals( 0.4, TestImages.get( illumination, x, y, 1 ), 1e-12 );
				Assert.assertEquals( 0, TestImages.get( illumination, x, y, 2 ), 0 );
			}
		}
	}

	@Test( expected = IllegalArgumentException.class )
	public void testInvalidWindow()
	{
		new IlluminationEstimator( 0, executor );
	}

	private static void set( final ArrayImg< DoubleType, DoubleArray > img, final int x, final int y, final int c, final double value )
	{
		final RandomAccess< DoubleType > ra = img.randomAccess();
		ra.setPosition( new int[] { x, y, c } );
		ra.get().set( value );
	}
}
