package org.janelia.seathru;

import java.io.Serializable;
import java.util.Arrays;

import org.janelia.seathru.fit.FitResult;
import org.janelia.seathru.fit.FitStatus;

/**
 * Model coefficients estimated for a single color channel, along with the diagnostics of the fit.
 */
public class ChannelFit implements Serializable
{
	private static final long serialVersionUID = 2194657329165180441L;

	private final double[] coefficients;
	private final FitStatus status;
	private final int samples;
	private final double cost;

	/**
	 * {@code true} if the coefficients come from the solver, {@code false} if the fit was skipped and a zero model is used.
	 */
	private final boolean fitted;

	private ChannelFit( final double[] coefficients, final FitStatus status, final int samples, final double cost, final boolean fitted )
	{
		this.coefficients = coefficients.clone();
		this.status = status;
		this.samples = samples;
		this.cost = cost;
		this.fitted = fitted;
	}

	public static ChannelFit fitted( final FitResult result, final int samples )
	{
		return new ChannelFit( result.getParameters(), result.getStatus(), samples, result.getCost(), true );
	}

	public static ChannelFit skipped( final int numParameters, final int samples )
	{
		return new ChannelFit( new double[ numParameters ], FitStatus.INSUFFICIENT_SAMPLES, samples, Double.NaN, false );
	}

	public double[] getCoefficients()
	{
		return coefficients.clone();
	}

	public FitStatus getStatus()
	{
		return status;
	}

	public int getSamples()
	{
		return samples;
	}

	public double getCost()
	{
		return cost;
	}

	public boolean isFitted()
	{
		return fitted;
	}

	@Override
	public String toString()
	{
		return ( fitted ? status.toString() : "SKIPPED" ) + " (" + samples + " samples): " + Arrays.toString( coefficients );
	}
}
