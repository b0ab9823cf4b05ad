package org.janelia.seathru.analysis;

import java.io.Serializable;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.view.Views;

/**
 * Global statistics of an 8-bit RGB image of size {@code [ width, height, 3 ]}, used to compare
 * an image before and after correction.
 */
public class ImageAnalysis implements Serializable
{
	private static final long serialVersionUID = 8012731649125418127L;

	private final double brightness;
	private final double contrast;
	private final double averageRed;

	public ImageAnalysis( final double brightness, final double contrast, final double averageRed )
	{
		this.brightness = brightness;
		this.contrast = contrast;
		this.averageRed = averageRed;
	}

	/**
	 * Mean of the HSV value channel, i.e. {@code max( R, G, B )} averaged over the pixels.
	 */
	public double getBrightness() { return brightness; }

	/**
	 * Population standard deviation of all channel values.
	 */
	public double getContrast() { return contrast; }

	public double getAverageRed() { return averageRed; }

	public static ImageAnalysis analyze( final RandomAccessibleInterval< UnsignedByteType > image )
	{
		if ( image.numDimensions() != 3 || image.dimension( 2 ) != 3 )
			throw new IllegalArgumentException( "expected an image of size [width, height, 3]" );

		final long numPixels = image.dimension( 0 ) * image.dimension( 1 );
		if ( numPixels == 0 )
			throw new IllegalArgumentException( "image is empty" );

		final long minChannel = image.min( 2 );
		final Cursor< UnsignedByteType > red = Views.flatIterable( Views.hyperSlice( image, 2, minChannel ) ).cursor();
		final Cursor< UnsignedByteType > green = Views.flatIterable( Views.hyperSlice( image, 2, minChannel + 1 ) ).cursor();
		final Cursor< UnsignedByteType > blue = Views.flatIterable( Views.hyperSlice( image, 2, minChannel + 2 ) ).cursor();

		double valueSum = 0, redSum = 0, sum = 0, sumSq = 0;
		while ( red.hasNext() )
		{
			final int r = red.next().get(), g = green.next().get(), b = blue.next().get();
			valueSum += Math.max( r, Math.max( g, b ) );
			redSum += r;
			sum += r + g + b;
			sumSq += ( double ) r * r + ( double ) g * g + ( double ) b * b;
		}

		final double numValues = 3.0 * numPixels;
		final double mean = sum / numValues;
		final double variance = Math.max( sumSq / numValues - mean * mean, 0 );
		return new ImageAnalysis( valueSum / numPixels, Math.sqrt( variance ), redSum / numPixels );
	}

	@Override
	public String toString()
	{
		return String.format( "brightness=%.2f, contrast=%.2f, averageRed=%.2f", brightness, contrast, averageRed );
	}
}
