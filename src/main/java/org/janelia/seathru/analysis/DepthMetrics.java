package org.janelia.seathru.analysis;

import java.io.Serializable;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;
import net.imglib2.view.Views;

/**
 * Summary of a depth map over its finite values. All metrics are NaN if there are none.
 */
public class DepthMetrics implements Serializable
{
	private static final long serialVersionUID = -3322390167315651274L;

	private final double averageDepth;
	private final double minDepth;
	private final double maxDepth;

	public DepthMetrics( final double averageDepth, final double minDepth, final double maxDepth )
	{
		this.averageDepth = averageDepth;
		this.minDepth = minDepth;
		this.maxDepth = maxDepth;
	}

	public double getAverageDepth() { return averageDepth; }
	public double getMinDepth() { return minDepth; }
	public double getMaxDepth() { return maxDepth; }

	public static < T extends RealType< T > > DepthMetrics compute( final RandomAccessibleInterval< T > depth )
	{
		double sum = 0, min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
		long count = 0;
		for ( final T type : Views.iterable( depth ) )
		{
			final double value = type.getRealDouble();
			if ( Double.isFinite( value ) )
			{
				sum += value;
				min = Math.min( value, min );
				max = Math.max( value, max );
				++count;
			}
		}

		if ( count == 0 )
			return new DepthMetrics( Double.NaN, Double.NaN, Double.NaN );

		return new DepthMetrics( sum / count, min, max );
	}

	@Override
	public String toString()
	{
		return String.format( "average=%.3f, min=%.3f, max=%.3f", averageDepth, minDepth, maxDepth );
	}
}
