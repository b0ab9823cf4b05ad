package org.janelia.seathru.fit;

public enum FitStatus
{
	CONVERGED,
	MAX_EVALUATIONS_REACHED,
	INSUFFICIENT_SAMPLES,
	INFEASIBLE_INITIAL_GUESS,
	NON_FINITE;

	public boolean isConverged()
	{
		return this == CONVERGED;
	}
}
