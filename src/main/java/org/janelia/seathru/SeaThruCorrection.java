package org.janelia.seathru;

import java.io.FileWriter;
import java.io.IOException;

import org.janelia.seathru.SeaThruRestoration.RestorationResult;
import org.janelia.seathru.analysis.DepthMetrics;
import org.janelia.seathru.analysis.ImageAnalysis;
import org.janelia.seathru.fit.BoundedLevenbergMarquardt;
import org.janelia.util.concurrent.MultithreadedExecutor;

import ij.ImagePlus;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.ByteArray;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * Corrects a single underwater image given its depth map, and optionally writes a report of the applied adjustments.
 */
public class SeaThruCorrection
{
	public static void main( final String[] args ) throws IOException, RestorationException
	{
		final SeaThruCorrectionArguments argsParsed = new SeaThruCorrectionArguments( args );
		if ( !argsParsed.parsedSuccessfully() )
			throw new IllegalArgumentException( "argument format mismatch" );

		final RestorationReport report = correct( argsParsed.task(), argsParsed.mode(), argsParsed.restorationParameters() );

		if ( argsParsed.reportPath() != null )
		{
			SeaThruJSONProvider.saveReport( report, new FileWriter( argsParsed.reportPath() ) );
			System.out.println( "Saved report to " + argsParsed.reportPath() );
		}

		System.out.println( "Done" );
	}

	/**
	 * Loads the image and the depth map of the task, corrects the image, and saves it to the output path of the task.
	 */
	public static RestorationReport correct(
			final CorrectionTask task,
			final CorrectionMode mode,
			final RestorationParameters parameters ) throws IOException, RestorationException
	{
		final long startTime = System.currentTimeMillis();
		System.out.println( "Correcting " + task.getImage() + " in " + mode.toString().toLowerCase() + " mode" );

		final ImagePlus imp = ImageConversions.openImage( task.getImage() );
		final ImagePlus depthImp = ImageConversions.openImage( task.getDepth() );

		final RestorationReport report = new RestorationReport( task, mode );
		final ArrayImg< UnsignedByteType, ByteArray > corrected = correct(
				ImageConversions.toColorImage( imp ),
				ImageConversions.toDepthMap( depthImp ),
				mode,
				parameters,
				report );

		ImageConversions.saveImage( ImageConversions.toImagePlus( corrected, imp.getTitle() ), task.getOutput() );

		report.setElapsedMillis( System.currentTimeMillis() - startTime );
		System.out.println( "Saved corrected image to " + task.getOutput() + " (" + report.getElapsedMillis() + " ms)" );
		return report;
	}

	/**
	 * Corrects an 8-bit image of size {@code [ width, height, 3 ]} and fills the report.
	 */
	public static ArrayImg< UnsignedByteType, ByteArray > correct(
			final RandomAccessibleInterval< UnsignedByteType > image,
			final RandomAccessibleInterval< DoubleType > depth,
			final CorrectionMode mode,
			final RestorationParameters parameters,
			final RestorationReport report ) throws RestorationException
	{
		final DepthMetrics depthMetrics = DepthMetrics.compute( depth );
		final ImageAnalysis before = ImageAnalysis.analyze( image );
		report.setDepthMetrics( depthMetrics );
		report.setBefore( before );
		System.out.println( "  depth: " + depthMetrics );
		System.out.println( "  before: " + before );

		final ArrayImg< UnsignedByteType, ByteArray > corrected;
		if ( mode == CorrectionMode.SIMPLIFIED )
		{
			final double averageDepth = Double.isFinite( depthMetrics.getAverageDepth() ) ? depthMetrics.getAverageDepth() : 0;
			final SimplifiedRestorer restorer = new SimplifiedRestorer();
			report.setGains( restorer.getGains( averageDepth ) );
			corrected = restorer.restore( image, averageDepth );
		}
		else
		{
			try ( final MultithreadedExecutor executor = new MultithreadedExecutor( parameters.getNumThreads() ) )
			{
				final SeaThruRestoration restoration = new SeaThruRestoration(
						parameters,
						new BoundedLevenbergMarquardt( parameters.getMaxEvaluations() ),
						executor );
				final RestorationResult result = restoration.restore( ImageConversions.normalize( image ), depth );
				report.setBackscatter( result.getBackscatter().getChannelFits() );
				report.setAttenuation( result.getAttenuation().getChannelFits() );
				corrected = result.getCorrected();
			}
		}

		final ImageAnalysis after = ImageAnalysis.analyze( corrected );
		report.setAfter( after );
		System.out.println( "  after: " + after );
		return corrected;
	}
}
