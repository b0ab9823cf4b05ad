package org.janelia.seathru;

import org.janelia.util.concurrent.MultithreadedExecutor;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;

/**
 * Estimates the illuminant field as the local average of the backscatter-free signal.
 * <p>
 * The residual {@code max( image - backscatter, 0 )} is smoothed per channel with a square box filter.
 * Borders are handled by mirroring with the edge pixel repeated ({@code d c b a | a b c d}).
 * For even window sizes the extra sample lies before the center.
 */
public class IlluminationEstimator
{
	private final int window;
	private final MultithreadedExecutor executor;

	public IlluminationEstimator( final RestorationParameters parameters, final MultithreadedExecutor executor )
	{
		this( parameters.getIlluminationWindow(), executor );
	}

	public IlluminationEstimator( final int window, final MultithreadedExecutor executor )
	{
		if ( window < 1 )
			throw new IllegalArgumentException( "window should be positive, got " + window );

		this.window = window;
		this.executor = executor;
	}

	public ArrayImg< DoubleType, DoubleArray > estimate(
			final RandomAccessibleInterval< DoubleType > image,
			final RandomAccessibleInterval< DoubleType > backscatter ) throws RestorationException
	{
		final long width = image.dimension( 0 ), height = image.dimension( 1 );
		final ArrayImg< DoubleType, DoubleArray > residual = ImageOperations.createColorImage( width, height );
		final int numRows = ( int ) height;

		ImageOperations.run( executor, task ->
			{
				final int c = task / numRows, y = task % numRows;
				final Cursor< DoubleType > imageCursor = Views.flatIterable( ImageOperations.row( ImageOperations.channel( image, c ), y ) ).cursor();
				final Cursor< DoubleType > backscatterCursor = Views.flatIterable( ImageOperations.row( ImageOperations.channel( backscatter, c ), y ) ).cursor();
				final Cursor< DoubleType > residualCursor = Views.flatIterable( ImageOperations.row( ImageOperations.channel( residual, c ), y ) ).cursor();
				while ( residualCursor.hasNext() )
				{
					final double value = imageCursor.next().get() - backscatterCursor.next().get();
					// NaN fails the comparison and becomes zero as well
					residualCursor.next().set( value > 0 ? value : 0 );
				}
			},
			ImageOperations.NUM_CHANNELS * numRows );

		// separable filter: average along x, then along y
		final ArrayImg< DoubleType, DoubleArray > horizontal = ImageOperations.createColorImage( width, height );
		average( residual, horizontal, 0 );

		final ArrayImg< DoubleType, DoubleArray > illumination = ImageOperations.createColorImage( width, height );
		average( horizontal, illumination, 1 );

		return illumination;
	}

	/**
	 * Applies the 1D box average along {@code dimension} to every line of every channel.
	 */
	private void average(
			final RandomAccessibleInterval< DoubleType > source,
			final RandomAccessibleInterval< DoubleType > target,
			final int dimension ) throws RestorationException
	{
		final int lineDimension = 1 - dimension;
		final int numLines = ( int ) source.dimension( lineDimension );
		final long length = source.dimension( dimension );
		final int before = window / 2, after = window - 1 - before;

		ImageOperations.run( executor, task ->
			{
				final int c = task / numLines, line = task % numLines;
				final RandomAccess< DoubleType > in = Views.extendMirrorDouble( ImageOperations.channel( source, c ) ).randomAccess();
				final RandomAccess< DoubleType > out = ImageOperations.channel( target, c ).randomAccess();
				in.setPosition( line, lineDimension );
				out.setPosition( line, lineDimension );

				for ( long i = 0; i < length; ++i )
				{
					double sum = 0;
					for ( long k = i - before; k <= i + after; ++k )
					{
						in.setPosition( k, dimension );
						sum += in.get().get();
					}
					out.setPosition( i, dimension );
					out.get().set( sum / window );
				}
			},
			ImageOperations.NUM_CHANNELS * numLines );
	}
}
