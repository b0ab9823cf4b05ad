package org.janelia.seathru;

import org.apache.log4j.Logger;
import org.janelia.seathru.AttenuationEstimator.AttenuationEstimate;
import org.janelia.seathru.BackscatterEstimator.BackscatterEstimate;
import org.janelia.seathru.fit.BoundedLevenbergMarquardt;
import org.janelia.util.concurrent.MultithreadedExecutor;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.ByteArray;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;

/**
 * Depth-aware color restoration of an underwater image.
 * <p>
 * Runs the stages once in order: backscatter estimation, illumination estimation, attenuation estimation,
 * and the inversion of the image formation model. Nothing is kept between calls.
 * <p>
 * The image is expected as {@code [ width, height, 3 ]} with values in [0,1] and the depth map as {@code [ width, height ]}.
 * Negative or non-finite depth values are treated as zero depth.
 */
public class SeaThruRestoration
{
	private static final Logger LOG = Logger.getLogger( SeaThruRestoration.class );

	public static class RestorationResult
	{
		private final BackscatterEstimate backscatter;
		private final ArrayImg< DoubleType, DoubleArray > illumination;
		private final AttenuationEstimate attenuation;
		private final ArrayImg< DoubleType, DoubleArray > restored;
		private final ArrayImg< UnsignedByteType, ByteArray > corrected;

		public RestorationResult(
				final BackscatterEstimate backscatter,
				final ArrayImg< DoubleType, DoubleArray > illumination,
				final AttenuationEstimate attenuation,
				final ArrayImg< DoubleType, DoubleArray > restored,
				final ArrayImg< UnsignedByteType, ByteArray > corrected )
		{
			this.backscatter = backscatter;
			this.illumination = illumination;
			this.attenuation = attenuation;
			this.restored = restored;
			this.corrected = corrected;
		}

		public BackscatterEstimate getBackscatter() { return backscatter; }
		public ArrayImg< DoubleType, DoubleArray > getIllumination() { return illumination; }
		public AttenuationEstimate getAttenuation() { return attenuation; }

		/**
		 * @return restored image in [0,1]
		 */
		public ArrayImg< DoubleType, DoubleArray > getRestored() { return restored; }

		/**
		 * @return restored image scaled to [0,255]
		 */
		public ArrayImg< UnsignedByteType, ByteArray > getCorrected() { return corrected; }
	}

	private final RestorationParameters parameters;
	private final BoundedLevenbergMarquardt fitter;
	private final MultithreadedExecutor executor;

	public SeaThruRestoration(
			final RestorationParameters parameters,
			final BoundedLevenbergMarquardt fitter,
			final MultithreadedExecutor executor )
	{
		this.parameters = parameters;
		this.fitter = fitter;
		this.executor = executor;
	}

	public RestorationParameters getParameters()
	{
		return parameters;
	}

	public RestorationResult restore(
			final RandomAccessibleInterval< DoubleType > image,
			final RandomAccessibleInterval< DoubleType > depth ) throws RestorationException
	{
		validate( image, depth );

		final RandomAccessibleInterval< DoubleType > zeroBasedImage = Views.zeroMin( image );
		final ArrayImg< DoubleType, DoubleArray > depthMap = sanitizeDepth( Views.zeroMin( depth ) );

		LOG.debug( "restoring " + image.dimension( 0 ) + "x" + image.dimension( 1 ) + " image, " + parameters );

		final BackscatterEstimate backscatter = new BackscatterEstimator( parameters, fitter, executor ).estimate( zeroBasedImage, depthMap );
		final ArrayImg< DoubleType, DoubleArray > illumination = new IlluminationEstimator( parameters, executor ).estimate( zeroBasedImage, backscatter.getMap() );
		final AttenuationEstimate attenuation = new AttenuationEstimator( parameters, fitter, executor ).estimate( depthMap, illumination, zeroBasedImage, backscatter.getMap() );
		final ArrayImg< DoubleType, DoubleArray > restored = new Restorer( parameters, executor ).restore(
				zeroBasedImage,
				depthMap,
				backscatter.getMap(),
				illumination,
				attenuation.getMap() );

		return new RestorationResult( backscatter, illumination, attenuation, restored, Restorer.toUnsignedBytes( restored ) );
	}

	/**
	 * @throws DegenerateInputException if the image is not a 3-channel 2D image, the depth map is not 2D,
	 * their sizes do not match, or there are no pixels
	 */
	public static void validate(
			final RandomAccessibleInterval< ? > image,
			final RandomAccessibleInterval< ? > depth ) throws DegenerateInputException
	{
		if ( image.numDimensions() != 3 || image.dimension( ImageOperations.CHANNEL_DIMENSION ) != ImageOperations.NUM_CHANNELS )
			throw new DegenerateInputException( "expected an image of size [width, height, 3], got " + dimensionsToString( image ) );

		if ( depth.numDimensions() != 2 )
			throw new DegenerateInputException( "expected a depth map of size [width, height], got " + dimensionsToString( depth ) );

		if ( image.dimension( 0 ) != depth.dimension( 0 ) || image.dimension( 1 ) != depth.dimension( 1 ) )
			throw new DegenerateInputException( "image " + dimensionsToString( image ) + " and depth map " + dimensionsToString( depth ) + " are not co-registered" );

		if ( depth.dimension( 0 ) == 0 || depth.dimension( 1 ) == 0 )
			throw new DegenerateInputException( "depth map is empty" );
	}

	private static ArrayImg< DoubleType, DoubleArray > sanitizeDepth( final RandomAccessibleInterval< DoubleType > depth )
	{
		final ArrayImg< DoubleType, DoubleArray > depthMap = ArrayImgs.doubles( depth.dimension( 0 ), depth.dimension( 1 ) );
		final Cursor< DoubleType > srcCursor = Views.flatIterable( depth ).cursor();
		final Cursor< DoubleType > dstCursor = Views.flatIterable( depthMap ).cursor();
		while ( dstCursor.hasNext() )
		{
			final double value = srcCursor.next().get();
			dstCursor.next().set( value > 0 && !Double.isInfinite( value ) ? value : 0 );
		}
		return depthMap;
	}

	private static String dimensionsToString( final RandomAccessibleInterval< ? > interval )
	{
		final StringBuilder sb = new StringBuilder( "[" );
		for ( int d = 0; d < interval.numDimensions(); ++d )
			sb.append( d == 0 ? "" : ", " ).append( interval.dimension( d ) );
		return sb.append( "]" ).toString();
	}
}
