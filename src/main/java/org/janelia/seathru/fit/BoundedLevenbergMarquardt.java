package org.janelia.seathru.fit;

import java.io.Serializable;

import org.ojalgo.matrix.decomposition.Cholesky;
import org.ojalgo.matrix.store.MatrixStore;
import org.ojalgo.matrix.store.PrimitiveDenseStore;

/**
 * Bounded nonlinear least-squares solver.
 * <p>
 * Minimizes {@code sum( ( f( x_i; p ) - y_i )^2 )} over {@code p} inside a box using damped
 * Levenberg-Marquardt steps {@code ( JtJ + lambda * diag( JtJ ) ) * delta = -Jt * r}.
 * Every trial point is projected onto the box. Parameters sitting on a bound with the
 * gradient pointing outwards are held fixed for the step.
 * The damping factor is decreased after an accepted step and increased after a rejected one.
 * <p>
 * The solver never throws on numerical trouble: when the sample set is too small, the initial guess
 * is infeasible, the residuals become non-finite, or the evaluation budget is exhausted without
 * convergence, the initial guess is returned unchanged together with the corresponding {@link FitStatus}.
 */
public class BoundedLevenbergMarquardt implements Serializable
{
	private static final long serialVersionUID = -2880913364924768591L;

	public static final int DEFAULT_MAX_EVALUATIONS = 4000;

	private static final double DEFAULT_TOLERANCE = 1e-8;

	private static final double INITIAL_LAMBDA = 1e-3;
	private static final double LAMBDA_SCALE_GOOD = 0.5;
	private static final double LAMBDA_SCALE_BAD = 8.0;
	private static final double MAX_LAMBDA = 1e16;

	// parameters with a relative curvature below this value do not affect the model and are not moved
	private static final double NEGLIGIBLE_CURVATURE = 1e-12;

	private final int maxEvaluations;
	private final double costTolerance, stepTolerance, gradientTolerance;

	public BoundedLevenbergMarquardt()
	{
		this( DEFAULT_MAX_EVALUATIONS );
	}

	public BoundedLevenbergMarquardt( final int maxEvaluations )
	{
		this( maxEvaluations, DEFAULT_TOLERANCE, DEFAULT_TOLERANCE, DEFAULT_TOLERANCE );
	}

	public BoundedLevenbergMarquardt(
			final int maxEvaluations,
			final double costTolerance,
			final double stepTolerance,
			final double gradientTolerance )
	{
		if ( maxEvaluations < 1 )
			throw new IllegalArgumentException( "evaluation budget should be positive, got " + maxEvaluations );

		this.maxEvaluations = maxEvaluations;
		this.costTolerance = costTolerance;
		this.stepTolerance = stepTolerance;
		this.gradientTolerance = gradientTolerance;
	}

	public int getMaxEvaluations()
	{
		return maxEvaluations;
	}

	public FitResult fit(
			final CurveModel model,
			final double[] x,
			final double[] y,
			final double[] initialGuess,
			final ParameterBounds bounds )
	{
		final int numParameters = model.numParameters();
		if ( x.length != y.length )
			throw new IllegalArgumentException( "sample arrays have different lengths: " + x.length + " vs " + y.length );
		if ( initialGuess.length != numParameters || bounds.numParameters() != numParameters )
			throw new IllegalArgumentException( "model has " + numParameters + " parameters, got initial guess of length " + initialGuess.length + " and bounds for " + bounds.numParameters() );

		if ( x.length < numParameters )
			return FitResult.fallback( initialGuess, FitStatus.INSUFFICIENT_SAMPLES, 0 );

		if ( !bounds.contains( initialGuess ) )
			return FitResult.fallback( initialGuess, FitStatus.INFEASIBLE_INITIAL_GUESS, 0 );

		double[] parameters = initialGuess.clone();
		double cost = cost( model, x, y, parameters );
		int evaluations = 1;
		if ( !Double.isFinite( cost ) )
			return FitResult.fallback( initialGuess, FitStatus.NON_FINITE, evaluations );

		final double[][] normal = new double[ numParameters ][ numParameters ];
		final double[] gradient = new double[ numParameters ];
		final boolean[] active = new boolean[ numParameters ];
		double lambda = INITIAL_LAMBDA;
		boolean linearize = true;

		while ( evaluations < maxEvaluations )
		{
			if ( linearize )
			{
				if ( !linearize( model, x, y, parameters, normal, gradient ) )
					return FitResult.fallback( initialGuess, FitStatus.NON_FINITE, evaluations );

				if ( updateActiveSet( parameters, gradient, bounds, active ) <= gradientTolerance )
					return new FitResult( parameters, FitStatus.CONVERGED, evaluations, cost );

				linearize = false;
			}

			final double[] step = solveDampedSystem( normal, gradient, active, lambda );
			if ( step == null )
			{
				lambda *= LAMBDA_SCALE_BAD;
				if ( lambda > MAX_LAMBDA )
					return new FitResult( parameters, FitStatus.CONVERGED, evaluations, cost );
				continue;
			}

			final double[] candidate = new double[ numParameters ];
			for ( int i = 0; i < numParameters; ++i )
				candidate[ i ] = parameters[ i ] + step[ i ];
			bounds.project( candidate );

			if ( distance( candidate, parameters ) <= stepTolerance * ( stepTolerance + norm( parameters ) ) )
				return new FitResult( parameters, FitStatus.CONVERGED, evaluations, cost );

			final double candidateCost = cost( model, x, y, candidate );
			++evaluations;

			if ( Double.isFinite( candidateCost ) && candidateCost < cost )
			{
				final double decrease = cost - candidateCost;
				final double previousCost = cost;
				parameters = candidate;
				cost = candidateCost;

				if ( decrease <= costTolerance * previousCost )
					return new FitResult( parameters, FitStatus.CONVERGED, evaluations, cost );

				lambda *= LAMBDA_SCALE_GOOD;
				linearize = true;
			}
			else
			{
				// no descent even for tiny steps means that we are at a minimum within numerical precision
				lambda *= LAMBDA_SCALE_BAD;
				if ( lambda > MAX_LAMBDA )
					return new FitResult( parameters, FitStatus.CONVERGED, evaluations, cost );
			}
		}

		return FitResult.fallback( initialGuess, FitStatus.MAX_EVALUATIONS_REACHED, evaluations );
	}

	private static double cost( final CurveModel model, final double[] x, final double[] y, final double[] parameters )
	{
		double sum = 0;
		for ( int i = 0; i < x.length; ++i )
		{
			final double residual = model.value( x[ i ], parameters ) - y[ i ];
			sum += residual * residual;
		}
		return sum;
	}

	/**
	 * Accumulates {@code JtJ} and {@code Jt * r} without storing the Jacobian.
	 *
	 * @return false if any of the accumulated values is not finite
	 */
	private static boolean linearize(
			final CurveModel model,
			final double[] x,
			final double[] y,
			final double[] parameters,
			final double[][] normal,
			final double[] gradient )
	{
		final int n = parameters.length;
		for ( int k = 0; k < n; ++k )
		{
			gradient[ k ] = 0;
			for ( int l = 0; l < n; ++l )
				normal[ k ][ l ] = 0;
		}

		final double[] partials = new double[ n ];
		for ( int i = 0; i < x.length; ++i )
		{
			final double residual = model.value( x[ i ], parameters ) - y[ i ];
			model.gradient( x[ i ], parameters, partials );
			for ( int k = 0; k < n; ++k )
			{
				gradient[ k ] += partials[ k ] * residual;
				for ( int l = k; l < n; ++l )
					normal[ k ][ l ] += partials[ k ] * partials[ l ];
			}
		}

		for ( int k = 0; k < n; ++k )
		{
			if ( !Double.isFinite( gradient[ k ] ) )
				return false;
			for ( int l = k; l < n; ++l )
			{
				if ( !Double.isFinite( normal[ k ][ l ] ) )
					return false;
				normal[ l ][ k ] = normal[ k ][ l ];
			}
		}
		return true;
	}

	/**
	 * Marks the parameters that sit on a bound while the descent direction points out of the box.
	 *
	 * @return infinity norm of the gradient restricted to the free parameters
	 */
	private static double updateActiveSet(
			final double[] parameters,
			final double[] gradient,
			final ParameterBounds bounds,
			final boolean[] active )
	{
		double norm = 0;
		for ( int i = 0; i < parameters.length; ++i )
		{
			active[ i ] =
					( parameters[ i ] <= bounds.lower( i ) && gradient[ i ] > 0 ) ||
					( parameters[ i ] >= bounds.upper( i ) && gradient[ i ] < 0 );
			if ( !active[ i ] )
				norm = Math.max( Math.abs( gradient[ i ] ), norm );
		}
		return norm;
	}

	/**
	 * Solves the damped normal equations for the free parameters with a Cholesky decomposition.
	 * Parameters fixed on a bound and parameters that the samples do not constrain are excluded from the system.
	 *
	 * @return full-length step with zeros for the excluded parameters, or null if the system could not be solved
	 */
	private static double[] solveDampedSystem(
			final double[][] normal,
			final double[] gradient,
			final boolean[] active,
			final double lambda )
	{
		double maxCurvature = 0;
		for ( int i = 0; i < gradient.length; ++i )
			if ( !active[ i ] )
				maxCurvature = Math.max( normal[ i ][ i ], maxCurvature );

		final int[] free = new int[ gradient.length ];
		int numFree = 0;
		for ( int i = 0; i < gradient.length; ++i )
			if ( !active[ i ] && normal[ i ][ i ] > NEGLIGIBLE_CURVATURE * maxCurvature )
				free[ numFree++ ] = i;

		final double[] step = new double[ gradient.length ];
		if ( numFree == 0 )
			return step;

		final PrimitiveDenseStore lhs = PrimitiveDenseStore.FACTORY.makeZero( numFree, numFree );
		final PrimitiveDenseStore rhs = PrimitiveDenseStore.FACTORY.makeZero( numFree, 1 );
		for ( int row = 0; row < numFree; ++row )
		{
			for ( int col = 0; col < numFree; ++col )
				lhs.set( row, col, normal[ free[ row ] ][ free[ col ] ] );
			lhs.set( row, row, normal[ free[ row ] ][ free[ row ] ] * ( 1 + lambda ) );
			rhs.set( row, 0, -gradient[ free[ row ] ] );
		}

		final Cholesky< Double > cholesky = Cholesky.PRIMITIVE.make();
		if ( !cholesky.decompose( lhs ) || !cholesky.isSolvable() )
			return null;

		final MatrixStore< Double > solution = cholesky.getSolution( rhs );
		for ( int row = 0; row < numFree; ++row )
		{
			final double value = solution.doubleValue( row, 0 );
			if ( !Double.isFinite( value ) )
				return null;
			step[ free[ row ] ] = value;
		}
		return step;
	}

	private static double norm( final double[] v )
	{
		double sumSq = 0;
		for ( final double value : v )
			sumSq += value * value;
		return Math.sqrt( sumSq );
	}

	private static double distance( final double[] a, final double[] b )
	{
		double sumSq = 0;
		for ( int i = 0; i < a.length; ++i )
			sumSq += ( a[ i ] - b[ i ] ) * ( a[ i ] - b[ i ] );
		return Math.sqrt( sumSq );
	}
}
