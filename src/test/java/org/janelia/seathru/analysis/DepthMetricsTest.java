package org.janelia.seathru.analysis;

import org.junit.Assert;
import org.junit.Test;

import net.imglib2.img.array.ArrayImgs;

public class DepthMetricsTest
{
	@Test
	public void testMetricsIgnoreMissingValues()
	{
		final DepthMetrics metrics = DepthMetrics.compute( ArrayImgs.doubles( new double[] { 1, 2, Double.NaN, 3 }, 2, 2 ) );
		Assert.assertEquals( 2, metrics.getAverageDepth(), 1e-12 );
		Assert.assertEquals( 1, metrics.getMinDepth(), 0 );
		Assert.assertEquals( 3, metrics.getMaxDepth(), 0 );
	}

	@Test
	public void testFloatDepthMap()
	{
		final DepthMetrics metrics = DepthMetrics.compute( ArrayImgs.floats( new float[] { 0.5f, 1.5f, 4f }, 3, 1 ) );
		Assert.assertEquals( 2, metrics.getAverageDepth(), 1e-6 );
		Assert.assertEquals( 0.5, metrics.getMinDepth(), 0 );
		Assert.assertEquals( 4, metrics.getMaxDepth(), 0 );
	}

	@Test
	public void testNoValidDepth()
	{
		final DepthMetrics metrics = DepthMetrics.compute( ArrayImgs.doubles( new double[] { Double.NaN, Double.POSITIVE_INFINITY }, 2, 1 ) );
		Assert.assertTrue( Double.isNaN( metrics.getAverageDepth() ) );
		Assert.assertTrue( Double.isNaN( metrics.getMinDepth() ) );
		Assert.assertTrue( Double.isNaN( metrics.getMaxDepth() ) );
	}
}
