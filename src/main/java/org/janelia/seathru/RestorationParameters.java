package org.janelia.seathru;

import java.io.Serializable;

/**
 * Tunable constants of the restoration pipeline. Immutable, created through {@link Builder}.
 */
public class RestorationParameters implements Serializable
{
	private static final long serialVersionUID = -5436028462611928273L;

	public static final int DEFAULT_DEPTH_BINS = 10;
	public static final double DEFAULT_DARK_PIXEL_FRACTION = 0.01;
	public static final int DEFAULT_ILLUMINATION_WINDOW = 5;
	public static final double DEFAULT_EPSILON = 1e-8;
	public static final int DEFAULT_MAX_EVALUATIONS = 4000;

	private final int depthBins;
	private final double darkPixelFraction;
	private final int illuminationWindow;
	private final double epsilon;
	private final int maxEvaluations;
	private final int numThreads;

	private RestorationParameters( final Builder builder )
	{
		this.depthBins = builder.depthBins;
		this.darkPixelFraction = builder.darkPixelFraction;
		this.illuminationWindow = builder.illuminationWindow;
		this.epsilon = builder.epsilon;
		this.maxEvaluations = builder.maxEvaluations;
		this.numThreads = builder.numThreads;
	}

	public static RestorationParameters defaults()
	{
		return new Builder().build();
	}

	public static Builder builder()
	{
		return new Builder();
	}

	public int getDepthBins() { return depthBins; }
	public double getDarkPixelFraction() { return darkPixelFraction; }
	public int getIlluminationWindow() { return illuminationWindow; }
	public double getEpsilon() { return epsilon; }
	public int getMaxEvaluations() { return maxEvaluations; }
	public int getNumThreads() { return numThreads; }

	@Override
	public String toString()
	{
		return String.format(
				"bins=%d, fraction=%s, window=%d, epsilon=%s, maxEvaluations=%d, threads=%d",
				depthBins, darkPixelFraction, illuminationWindow, epsilon, maxEvaluations, numThreads );
	}

	public static class Builder
	{
		private int depthBins = DEFAULT_DEPTH_BINS;
		private double darkPixelFraction = DEFAULT_DARK_PIXEL_FRACTION;
		private int illuminationWindow = DEFAULT_ILLUMINATION_WINDOW;
		private double epsilon = DEFAULT_EPSILON;
		private int maxEvaluations = DEFAULT_MAX_EVALUATIONS;
		private int numThreads = Runtime.getRuntime().availableProcessors();

		public Builder depthBins( final int depthBins )
		{
			if ( depthBins < 1 )
				throw new IllegalArgumentException( "number of depth bins should be positive, got " + depthBins );
			this.depthBins = depthBins;
			return this;
		}

		public Builder darkPixelFraction( final double darkPixelFraction )
		{
			if ( !( darkPixelFraction > 0 && darkPixelFraction <= 1 ) )
				throw new IllegalArgumentException( "dark pixel fraction should be in (0,1], got " + darkPixelFraction );
			this.darkPixelFraction = darkPixelFraction;
			return this;
		}

		public Builder illuminationWindow( final int illuminationWindow )
		{
			if ( illuminationWindow < 1 )
				throw new IllegalArgumentException( "illumination window should be positive, got " + illuminationWindow );
			this.illuminationWindow = illuminationWindow;
			return this;
		}

		public Builder epsilon( final double epsilon )
		{
			if ( !( epsilon > 0 ) || Double.isInfinite( epsilon ) )
				throw new IllegalArgumentException( "epsilon should be a positive finite value, got " + epsilon );
			this.epsilon = epsilon;
			return this;
		}

		public Builder maxEvaluations( final int maxEvaluations )
		{
			if ( maxEvaluations < 1 )
				throw new IllegalArgumentException( "evaluation budget should be positive, got " + maxEvaluations );
			this.maxEvaluations = maxEvaluations;
			return this;
		}

		public Builder numThreads( final int numThreads )
		{
			if ( numThreads < 1 )
				throw new IllegalArgumentException( "number of threads should be positive, got " + numThreads );
			this.numThreads = numThreads;
			return this;
		}

		public RestorationParameters build()
		{
			return new RestorationParameters( this );
		}
	}
}
