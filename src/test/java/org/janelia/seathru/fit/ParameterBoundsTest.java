package org.janelia.seathru.fit;

import org.junit.Assert;
import org.junit.Test;

public class ParameterBoundsTest
{
	private final ParameterBounds bounds = new ParameterBounds( new double[] { 0, -5 }, new double[] { 1.5, 0 } );

	@Test
	public void testContains()
	{
		Assert.assertTrue( bounds.contains( new double[] { 0, 0 } ) );
		Assert.assertTrue( bounds.contains( new double[] { 1.5, -5 } ) );
		Assert.assertTrue( bounds.contains( new double[] { 0.7, -2 } ) );
		Assert.assertFalse( bounds.contains( new double[] { 1.6, -2 } ) );
		Assert.assertFalse( bounds.contains( new double[] { 0.7, 0.1 } ) );
		Assert.assertFalse( bounds.contains( new double[] { Double.NaN, -2 } ) );
	}

	@Test
	public void testProject()
	{
		final double[] p = new double[] { 3, -7 };
		bounds.project( p );
		Assert.assertArrayEquals( new double[] { 1.5, -5 }, p, 0 );

		final double[] q = new double[] { -1, 2 };
		bounds.project( q );
		Assert.assertArrayEquals( new double[] { 0, 0 }, q, 0 );

		final double[] inside = new double[] { 0.25, -1.25 };
		bounds.project( inside );
		Assert.assertArrayEquals( new double[] { 0.25, -1.25 }, inside, 0 );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testEmptyRange()
	{
		new ParameterBounds( new double[] { 1 }, new double[] { 0 } );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testMismatchedLengths()
	{
		new ParameterBounds( new double[] { 0, 0 }, new double[] { 1 } );
	}
}
