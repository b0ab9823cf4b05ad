package org.janelia.seathru;

import java.util.Arrays;

import org.apache.log4j.Logger;
import org.janelia.seathru.fit.BackscatterModel;
import org.janelia.seathru.fit.BoundedLevenbergMarquardt;
import org.janelia.util.concurrent.MultithreadedExecutor;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * Estimates the backscatter (veiling light) of every pixel.
 * <p>
 * The depth range is split into equal-width bins, and in each bin the darkest pixels are taken as
 * observations of pure backscatter. A {@link BackscatterModel} curve is then fitted per channel to these
 * samples and evaluated over the whole depth map.
 */
public class BackscatterEstimator
{
	private static final Logger LOG = Logger.getLogger( BackscatterEstimator.class );

	public static class BackscatterEstimate
	{
		private final ArrayImg< DoubleType, DoubleArray > map;
		private final ChannelFit[] channelFits;

		public BackscatterEstimate( final ArrayImg< DoubleType, DoubleArray > map, final ChannelFit[] channelFits )
		{
			this.map = map;
			this.channelFits = channelFits;
		}

		public ArrayImg< DoubleType, DoubleArray > getMap()
		{
			return map;
		}

		public ChannelFit[] getChannelFits()
		{
			return channelFits.clone();
		}

		public ChannelFit getChannelFit( final int channel )
		{
			return channelFits[ channel ];
		}
	}

	private final int depthBins;
	private final double darkPixelFraction;
	private final BoundedLevenbergMarquardt fitter;
	private final MultithreadedExecutor executor;

	public BackscatterEstimator(
			final RestorationParameters parameters,
			final BoundedLevenbergMarquardt fitter,
			final MultithreadedExecutor executor )
	{
		this( parameters.getDepthBins(), parameters.getDarkPixelFraction(), fitter, executor );
	}

	public BackscatterEstimator(
			final int depthBins,
			final double darkPixelFraction,
			final BoundedLevenbergMarquardt fitter,
			final MultithreadedExecutor executor )
	{
		this.depthBins = depthBins;
		this.darkPixelFraction = darkPixelFraction;
		this.fitter = fitter;
		this.executor = executor;
	}

	public BackscatterEstimate estimate(
			final RandomAccessibleInterval< DoubleType > image,
			final RandomAccessibleInterval< DoubleType > depth ) throws RestorationException
	{
		final double[] depths = ImageOperations.toArray( depth );
		final double[][] channels = new double[ ImageOperations.NUM_CHANNELS ][];
		for ( int c = 0; c < channels.length; ++c )
			channels[ c ] = ImageOperations.toArray( ImageOperations.channel( image, c ) );

		final int[] darkPixels = selectDarkPixels( depths, channels );
		final double[] sampleDepths = new double[ darkPixels.length ];
		final double[][] sampleValues = new double[ channels.length ][ darkPixels.length ];
		for ( int i = 0; i < darkPixels.length; ++i )
		{
			final int pixel = darkPixels[ i ];
			sampleDepths[ i ] = depths[ pixel ];
			for ( int c = 0; c < channels.length; ++c )
				sampleValues[ c ][ i ] = channels[ c ][ pixel ];
		}

		final ChannelFit[] channelFits = new ChannelFit[ channels.length ];
		ImageOperations.run( executor, c -> channelFits[ c ] = fitChannel( sampleDepths, sampleValues[ c ] ), channels.length );

		final ArrayImg< DoubleType, DoubleArray > map = ImageOperations.createColorImage( image.dimension( 0 ), image.dimension( 1 ) );
		for ( int c = 0; c < channels.length; ++c )
		{
			final ChannelFit channelFit = channelFits[ c ];
			if ( !channelFit.isFitted() )
				LOG.warn( "channel " + c + ": no dark pixels were sampled, backscatter is set to zero" );
			else if ( !channelFit.getStatus().isConverged() )
				LOG.warn( "channel " + c + ": backscatter fit did not converge (" + channelFit.getStatus() + "), using the initial guess" );
			else
				LOG.info( "channel " + c + ": backscatter " + channelFit );

			// the zero model keeps the freshly allocated map at zero
			if ( channelFit.isFitted() )
				ImageOperations.evaluateModel(
						executor,
						BackscatterModel.INSTANCE,
						channelFit.getCoefficients(),
						depth,
						ImageOperations.channel( map, c ) );
		}

		return new BackscatterEstimate( map, channelFits );
	}

	/**
	 * Fits the backscatter curve to the dark-pixel samples of one channel.
	 */
	public ChannelFit fitChannel( final double[] sampleDepths, final double[] sampleValues )
	{
		if ( sampleDepths.length == 0 )
			return ChannelFit.skipped( BackscatterModel.NUM_PARAMETERS, 0 );

		double maxValue = Double.NEGATIVE_INFINITY;
		for ( final double value : sampleValues )
			maxValue = Math.max( value, maxValue );

		return ChannelFit.fitted(
				fitter.fit(
						BackscatterModel.INSTANCE,
						sampleDepths,
						sampleValues,
						BackscatterModel.initialGuess( maxValue ),
						BackscatterModel.BOUNDS ),
				sampleDepths.length );
	}

	/**
	 * Splits the depth range into bins and keeps the darkest pixels of each bin, ranked by their mean intensity.
	 * Every pixel with a finite depth belongs to exactly one bin: bins are half-open except for the last one,
	 * and all pixels fall into the first bin when the depth range is empty.
	 * Pixels of equal intensity are ranked in scan order.
	 *
	 * @return flat indices of the selected pixels, bin by bin, darkest first
	 */
	public int[] selectDarkPixels( final double[] depths, final double[][] channels )
	{
		double minDepth = Double.POSITIVE_INFINITY, maxDepth = Double.NEGATIVE_INFINITY;
		for ( final double d : depths )
		{
			if ( Double.isFinite( d ) )
			{
				minDepth = Math.min( d, minDepth );
				maxDepth = Math.max( d, maxDepth );
			}
		}

		if ( minDepth > maxDepth )
			return new int[ 0 ];

		// counting sort of the pixel indices by bin, scan order is kept within a bin
		final double binWidth = ( maxDepth - minDepth ) / depthBins;
		final int[] binOf = new int[ depths.length ];
		final int[] binStart = new int[ depthBins + 1 ];
		for ( int i = 0; i < depths.length; ++i )
		{
			if ( Double.isFinite( depths[ i ] ) )
			{
				binOf[ i ] = binWidth > 0 ? Math.min( ( int ) ( ( depths[ i ] - minDepth ) / binWidth ), depthBins - 1 ) : 0;
				++binStart[ binOf[ i ] + 1 ];
			}
			else
			{
				binOf[ i ] = -1;
			}
		}
		for ( int b = 0; b < depthBins; ++b )
			binStart[ b + 1 ] += binStart[ b ];

		final int[] pixelIndexes = new int[ binStart[ depthBins ] ];
		final int[] fill = binStart.clone();
		for ( int i = 0; i < depths.length; ++i )
			if ( binOf[ i ] >= 0 )
				pixelIndexes[ fill[ binOf[ i ] ]++ ] = i;

		final double[] pixelsMean = new double[ pixelIndexes.length ];
		for ( int k = 0; k < pixelIndexes.length; ++k )
		{
			double sum = 0;
			for ( final double[] channel : channels )
				sum += channel[ pixelIndexes[ k ] ];
			final double mean = sum / channels.length;
			pixelsMean[ k ] = Double.isNaN( mean ) ? Double.POSITIVE_INFINITY : mean;
		}

		int numSelected = 0;
		final int[] selected = new int[ pixelIndexes.length ];
		for ( int b = 0; b < depthBins; ++b )
		{
			final int from = binStart[ b ], to = binStart[ b + 1 ];
			if ( from == to )
				continue;

			quicksort( pixelsMean, pixelIndexes, from, to - 1 );
			final int take = Math.max( 1, ( int ) ( ( to - from ) * darkPixelFraction ) );
			System.arraycopy( pixelIndexes, from, selected, numSelected, take );
			numSelected += take;
		}

		return Arrays.copyOf( selected, numSelected );
	}

	/**
	 * Sorts {@code values[left..right]} ascending and permutes {@code index} along with it.
	 * Equal values are ordered by index.
	 */
	private static void quicksort( final double[] values, final int[] index, int left, int right )
	{
		while ( left < right )
		{
			exch( values, index, ( left + right ) >>> 1, right );
			final int p = partition( values, index, left, right );

			// recurse into the smaller part to bound the stack depth
			if ( p - left < right - p )
			{
				quicksort( values, index, left, p - 1 );
				left = p + 1;
			}
			else
			{
				quicksort( values, index, p + 1, right );
				right = p - 1;
			}
		}
	}

	// partition around values[right], assumes left < right
	private static int partition( final double[] values, final int[] index, final int left, final int right )
	{
		int i = left - 1;
		int j = right;
		while ( true )
		{
			while ( less( values, index, ++i, right ) );
			while ( less( values, index, right, --j ) )
				if ( j == left )
					break;
			if ( i >= j )
				break;
			exch( values, index, i, j );
		}
		exch( values, index, i, right );
		return i;
	}

	private static boolean less( final double[] values, final int[] index, final int i, final int j )
	{
		return values[ i ] < values[ j ] || ( values[ i ] == values[ j ] && index[ i ] < index[ j ] );
	}

	private static void exch( final double[] values, final int[] index, final int i, final int j )
	{
		final double value = values[ i ];
		values[ i ] = values[ j ];
		values[ j ] = value;
		final int ind = index[ i ];
		index[ i ] = index[ j ];
		index[ j ] = ind;
	}
}
