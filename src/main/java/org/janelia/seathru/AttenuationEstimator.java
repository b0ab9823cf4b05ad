package org.janelia.seathru;

import java.util.Arrays;

import org.apache.log4j.Logger;
import org.janelia.seathru.fit.AttenuationModel;
import org.janelia.seathru.fit.BoundedLevenbergMarquardt;
import org.janelia.util.concurrent.MultithreadedExecutor;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * Estimates the depth-dependent attenuation coefficient of every channel.
 * <p>
 * The raw coefficient {@code -ln( illumination / ( image - backscatter ) ) / depth} is computed for every pixel,
 * and an {@link AttenuationModel} curve is fitted to the pixels with a positive finite depth.
 */
public class AttenuationEstimator
{
	private static final Logger LOG = Logger.getLogger( AttenuationEstimator.class );

	/**
	 * Channels with fewer valid samples get a zero attenuation model.
	 */
	public static final int MIN_SAMPLES = 4;

	public static class AttenuationEstimate
	{
		private final ArrayImg< DoubleType, DoubleArray > map;
		private final ChannelFit[] channelFits;

		public AttenuationEstimate( final ArrayImg< DoubleType, DoubleArray > map, final ChannelFit[] channelFits )
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

	private final double epsilon;
	private final BoundedLevenbergMarquardt fitter;
	private final MultithreadedExecutor executor;

	public AttenuationEstimator(
			final RestorationParameters parameters,
			final BoundedLevenbergMarquardt fitter,
			final MultithreadedExecutor executor )
	{
		this( parameters.getEpsilon(), fitter, executor );
	}

	public AttenuationEstimator(
			final double epsilon,
			final BoundedLevenbergMarquardt fitter,
			final MultithreadedExecutor executor )
	{
		this.epsilon = epsilon;
		this.fitter = fitter;
		this.executor = executor;
	}

	public AttenuationEstimate estimate(
			final RandomAccessibleInterval< DoubleType > depth,
			final RandomAccessibleInterval< DoubleType > illumination,
			final RandomAccessibleInterval< DoubleType > image,
			final RandomAccessibleInterval< DoubleType > backscatter ) throws RestorationException
	{
		final double[] depths = ImageOperations.toArray( depth );
		final ChannelFit[] channelFits = new ChannelFit[ ImageOperations.NUM_CHANNELS ];

		ImageOperations.run( executor, c ->
			{
				final double[] rawCoefficients = rawCoefficients(
						depths,
						ImageOperations.toArray( ImageOperations.channel( illumination, c ) ),
						ImageOperations.toArray( ImageOperations.channel( image, c ) ),
						ImageOperations.toArray( ImageOperations.channel( backscatter, c ) ) );

				final double[] sampleDepths = new double[ depths.length ];
				final double[] sampleValues = new double[ depths.length ];
				int numSamples = 0;
				for ( int i = 0; i < depths.length; ++i )
				{
					if ( depths[ i ] > 0 && Double.isFinite( depths[ i ] ) && Double.isFinite( rawCoefficients[ i ] ) )
					{
						sampleDepths[ numSamples ] = depths[ i ];
						sampleValues[ numSamples ] = rawCoefficients[ i ];
						++numSamples;
					}
				}

				channelFits[ c ] = fitChannel( Arrays.copyOf( sampleDepths, numSamples ), Arrays.copyOf( sampleValues, numSamples ) );
			},
			channelFits.length );

		final ArrayImg< DoubleType, DoubleArray > map = ImageOperations.createColorImage( depth.dimension( 0 ), depth.dimension( 1 ) );
		for ( int c = 0; c < channelFits.length; ++c )
		{
			final ChannelFit channelFit = channelFits[ c ];
			if ( !channelFit.isFitted() )
				LOG.warn( "channel " + c + ": only " + channelFit.getSamples() + " valid samples, attenuation is set to zero" );
			else if ( !channelFit.getStatus().isConverged() )
				LOG.warn( "channel " + c + ": attenuation fit did not converge (" + channelFit.getStatus() + "), using the initial guess" );
			else
				LOG.info( "channel " + c + ": attenuation " + channelFit );

			if ( channelFit.isFitted() )
				ImageOperations.evaluateModel(
						executor,
						AttenuationModel.INSTANCE,
						channelFit.getCoefficients(),
						depth,
						ImageOperations.channel( map, c ) );
		}

		return new AttenuationEstimate( map, channelFits );
	}

	/**
	 * Fits the attenuation curve to the valid raw coefficients of one channel.
	 */
	public ChannelFit fitChannel( final double[] sampleDepths, final double[] sampleValues )
	{
		if ( sampleDepths.length < MIN_SAMPLES )
			return ChannelFit.skipped( AttenuationModel.NUM_PARAMETERS, sampleDepths.length );

		return ChannelFit.fitted(
				fitter.fit(
						AttenuationModel.INSTANCE,
						sampleDepths,
						sampleValues,
						AttenuationModel.initialGuess(),
						AttenuationModel.BOUNDS ),
				sampleDepths.length );
	}

	/**
	 * @return per-pixel {@code -ln( max( illumination, eps ) / max( image - backscatter, eps ) ) / max( depth, eps )}
	 */
	public double[] rawCoefficients(
			final double[] depths,
			final double[] illumination,
			final double[] image,
			final double[] backscatter )
	{
		final double[] raw = new double[ depths.length ];
		for ( int i = 0; i < depths.length; ++i )
		{
			final double residual = clampBelow( image[ i ] - backscatter[ i ] );
			final double light = clampBelow( illumination[ i ] );
			raw[ i ] = -Math.log( light / residual ) / Math.max( depths[ i ], epsilon );
		}
		return raw;
	}

	private double clampBelow( final double value )
	{
		// NaN is replaced by epsilon too
		return value > epsilon ? value : epsilon;
	}
}
