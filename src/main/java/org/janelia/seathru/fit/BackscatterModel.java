package org.janelia.seathru.fit;

/**
 * Backscatter as a function of depth:
 * {@code B( z ) = Binf * ( 1 - exp( -betaB * z ) ) + J' * exp( -betaD' * z )}.
 * Parameters are ordered as {@code [ Binf, betaB, J', betaD' ]}.
 */
public class BackscatterModel implements CurveModel
{
	public static final BackscatterModel INSTANCE = new BackscatterModel();

	public static final int NUM_PARAMETERS = 4;

	public static final ParameterBounds BOUNDS = new ParameterBounds(
			new double[] { 0, 0, 0, 0 },
			new double[] { 1.5, 5, 1.5, 5 } );

	private BackscatterModel() {}

	/**
	 * @param maxSampleValue brightest sampled intensity, used as the starting veiling light
	 */
	public static double[] initialGuess( final double maxSampleValue )
	{
		return new double[] { maxSampleValue, 0.5, 0.1, 0.5 };
	}

	@Override
	public int numParameters()
	{
		return NUM_PARAMETERS;
	}

	@Override
	public double value( final double z, final double[] p )
	{
		return p[ 0 ] * ( 1 - Math.exp( -p[ 1 ] * z ) ) + p[ 2 ] * Math.exp( -p[ 3 ] * z );
	}

	@Override
	public void gradient( final double z, final double[] p, final double[] gradient )
	{
		final double veiling = Math.exp( -p[ 1 ] * z );
		final double direct = Math.exp( -p[ 3 ] * z );
		gradient[ 0 ] = 1 - veiling;
		gradient[ 1 ] = p[ 0 ] * z * veiling;
		gradient[ 2 ] = direct;
		gradient[ 3 ] = -p[ 2 ] * z * direct;
	}
}
