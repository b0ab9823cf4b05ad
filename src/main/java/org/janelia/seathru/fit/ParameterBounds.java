package org.janelia.seathru.fit;

import java.io.Serializable;
import java.util.Arrays;

/**
 * Box constraints {@code lower[i] <= p[i] <= upper[i]} on a parameter vector.
 */
public class ParameterBounds implements Serializable
{
	private static final long serialVersionUID = 6520958151216738473L;

	private final double[] lower, upper;

	public ParameterBounds( final double[] lower, final double[] upper )
	{
		if ( lower.length != upper.length )
			throw new IllegalArgumentException( "lower and upper bounds have different lengths: " + lower.length + " vs " + upper.length );

		for ( int i = 0; i < lower.length; ++i )
			if ( !( lower[ i ] <= upper[ i ] ) )
				throw new IllegalArgumentException( "empty range for parameter " + i + ": [" + lower[ i ] + ", " + upper[ i ] + "]" );

		this.lower = lower.clone();
		this.upper = upper.clone();
	}

	public int numParameters()
	{
		return lower.length;
	}

	public double lower( final int i )
	{
		return lower[ i ];
	}

	public double upper( final int i )
	{
		return upper[ i ];
	}

	public boolean contains( final double[] parameters )
	{
		for ( int i = 0; i < lower.length; ++i )
			if ( !( parameters[ i ] >= lower[ i ] && parameters[ i ] <= upper[ i ] ) )
				return false;
		return true;
	}

	/**
	 * Clamps the parameters onto the box in place.
	 */
	public void project( final double[] parameters )
	{
		for ( int i = 0; i < lower.length; ++i )
			parameters[ i ] = Math.min( Math.max( parameters[ i ], lower[ i ] ), upper[ i ] );
	}

	@Override
	public String toString()
	{
		return "lower=" + Arrays.toString( lower ) + ", upper=" + Arrays.toString( upper );
	}
}
