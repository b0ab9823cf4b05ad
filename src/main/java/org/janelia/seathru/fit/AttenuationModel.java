package org.janelia.seathru.fit;

/**
 * Wideband attenuation coefficient as a function of depth, a sum of two independent exponentials:
 * {@code beta( z ) = a * exp( b * z ) + c * exp( d * z )}.
 * Parameters are ordered as {@code [ a, b, c, d ]}.
 */
public class AttenuationModel implements CurveModel
{
	public static final AttenuationModel INSTANCE = new AttenuationModel();

	public static final int NUM_PARAMETERS = 4;

	public static final ParameterBounds BOUNDS = new ParameterBounds(
			new double[] { 0, -5, 0, -5 },
			new double[] { 10, 0, 10, 0 } );

	private AttenuationModel() {}

	public static double[] initialGuess()
	{
		return new double[] { 0.5, -0.8, 0.5, -0.2 };
	}

	@Override
	public int numParameters()
	{
		return NUM_PARAMETERS;
	}

	@Override
	public double value( final double z, final double[] p )
	{
		return p[ 0 ] * Math.exp( p[ 1 ] * z ) + p[ 2 ] * Math.exp( p[ 3 ] * z );
	}

	@Override
	public void gradient( final double z, final double[] p, final double[] gradient )
	{
		final double first = Math.exp( p[ 1 ] * z );
		final double second = Math.exp( p[ 3 ] * z );
		gradient[ 0 ] = first;
		gradient[ 1 ] = p[ 0 ] * z * first;
		gradient[ 2 ] = second;
		gradient[ 3 ] = p[ 2 ] * z * second;
	}
}
