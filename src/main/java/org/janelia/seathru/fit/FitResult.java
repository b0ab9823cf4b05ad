package org.janelia.seathru.fit;

import java.util.Arrays;

/**
 * Outcome of a curve fit. When the fit did not converge, {@link #getParameters()} holds the
 * initial guess unchanged.
 */
public class FitResult
{
	private final double[] parameters;
	private final FitStatus status;
	private final int evaluations;
	private final double cost;

	public FitResult( final double[] parameters, final FitStatus status, final int evaluations, final double cost )
	{
		this.parameters = parameters.clone();
		this.status = status;
		this.evaluations = evaluations;
		this.cost = cost;
	}

	public static FitResult fallback( final double[] initialGuess, final FitStatus status, final int evaluations )
	{
		return new FitResult( initialGuess, status, evaluations, Double.NaN );
	}

	public double[] getParameters()
	{
		return parameters.clone();
	}

	public FitStatus getStatus()
	{
		return status;
	}

	public boolean isConverged()
	{
		return status.isConverged();
	}

	/**
	 * @return number of residual evaluations spent by the solver
	 */
	public int getEvaluations()
	{
		return evaluations;
	}

	/**
	 * @return sum of squared residuals at the solution, or NaN if the fit fell back to the initial guess
	 */
	public double getCost()
	{
		return cost;
	}

	@Override
	public String toString()
	{
		return status + " after " + evaluations + " evaluations, cost=" + cost + ", parameters=" + Arrays.toString( parameters );
	}
}
