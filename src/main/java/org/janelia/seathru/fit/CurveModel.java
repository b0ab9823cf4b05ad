package org.janelia.seathru.fit;

/**
 * Scalar parametric model {@code y = f( x; p )} with analytic partial derivatives
 * with respect to the parameters.
 * Implementations are stateless and can be shared between threads.
 */
public interface CurveModel
{
	int numParameters();

	double value( double x, double[] parameters );

	/**
	 * Writes the partial derivatives {@code df/dp_i} at {@code x} into {@code gradient}.
	 */
	void gradient( double x, double[] parameters, double[] gradient );
}
