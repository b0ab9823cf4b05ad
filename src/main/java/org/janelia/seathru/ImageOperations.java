package org.janelia.seathru;

import java.util.concurrent.ExecutionException;
import java.util.function.IntConsumer;

import org.janelia.seathru.fit.CurveModel;
import org.janelia.util.concurrent.MultithreadedExecutor;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;

/**
 * Helpers shared by the restoration stages.
 * Color images are {@code [ width, height, 3 ]} with the channel axis last, depth maps are {@code [ width, height ]}.
 */
public class ImageOperations
{
	public static final int NUM_CHANNELS = 3;
	public static final int CHANNEL_DIMENSION = 2;

	private static final int ROW_DIMENSION = 1;

	public static ArrayImg< DoubleType, DoubleArray > createColorImage( final long width, final long height )
	{
		return ArrayImgs.doubles( width, height, NUM_CHANNELS );
	}

	public static RandomAccessibleInterval< DoubleType > channel( final RandomAccessibleInterval< DoubleType > image, final int channel )
	{
		return Views.hyperSlice( image, CHANNEL_DIMENSION, channel );
	}

	/**
	 * @return row {@code y} of a 2D image as a 1D interval
	 */
	public static RandomAccessibleInterval< DoubleType > row( final RandomAccessibleInterval< DoubleType > plane, final long y )
	{
		return Views.hyperSlice( plane, ROW_DIMENSION, y );
	}

	public static int numRows( final RandomAccessibleInterval< ? > image )
	{
		return ( int ) image.dimension( ROW_DIMENSION );
	}

	/**
	 * Runs {@code task} for every index in [0, size) on the executor and converts the failures of the worker threads.
	 */
	public static void run( final MultithreadedExecutor executor, final IntConsumer task, final int size ) throws RestorationException
	{
		try
		{
			executor.run( task, size );
		}
		catch ( final InterruptedException e )
		{
			Thread.currentThread().interrupt();
			throw new RestorationException( "restoration was interrupted", e );
		}
		catch ( final ExecutionException e )
		{
			throw new RestorationException( "restoration worker failed: " + e.getCause(), e.getCause() != null ? e.getCause() : e );
		}
	}

	/**
	 * Fills {@code target} with {@code model( depth )}, processing the rows in parallel.
	 */
	public static void evaluateModel(
			final MultithreadedExecutor executor,
			final CurveModel model,
			final double[] parameters,
			final RandomAccessibleInterval< DoubleType > depth,
			final RandomAccessibleInterval< DoubleType > target ) throws RestorationException
	{
		run( executor, y ->
			{
				final Cursor< DoubleType > depthCursor = Views.flatIterable( row( depth, y ) ).cursor();
				final Cursor< DoubleType > targetCursor = Views.flatIterable( row( target, y ) ).cursor();
				while ( targetCursor.hasNext() )
					targetCursor.next().set( model.value( depthCursor.next().get(), parameters ) );
			},
			numRows( depth ) );
	}

	/**
	 * Copies the values into a flat array in row-major order.
	 */
	public static double[] toArray( final RandomAccessibleInterval< DoubleType > plane )
	{
		final double[] values = new double[ ( int ) Views.flatIterable( plane ).size() ];
		final Cursor< DoubleType > cursor = Views.flatIterable( plane ).cursor();
		for ( int i = 0; cursor.hasNext(); ++i )
			values[ i ] = cursor.next().get();
		return values;
	}
}
