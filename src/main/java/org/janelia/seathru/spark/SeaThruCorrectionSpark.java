package org.janelia.seathru.spark;

import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.spark.SparkConf;
import org.apache.spark.api.java.JavaSparkContext;
import org.janelia.seathru.CorrectionMode;
import org.janelia.seathru.CorrectionTask;
import org.janelia.seathru.RestorationException;
import org.janelia.seathru.RestorationParameters;
import org.janelia.seathru.RestorationReport;
import org.janelia.seathru.SeaThruCorrection;
import org.janelia.seathru.SeaThruJSONProvider;

/**
 * Corrects a batch of images listed in a JSON manifest. Every entry is processed independently by a Spark task.
 */
public class SeaThruCorrectionSpark
{
	private static final int MAX_PARTITIONS = 15000;

	public static void main( final String[] args ) throws IOException
	{
		final SeaThruCorrectionSparkArguments argsParsed = new SeaThruCorrectionSparkArguments( args );
		if ( !argsParsed.parsedSuccessfully() )
			throw new IllegalArgumentException( "argument format mismatch" );

		final CorrectionTask[] tasks = SeaThruJSONProvider.loadTasks( new FileReader( argsParsed.manifestPath() ) );
		System.out.println( "Correcting " + tasks.length + " images in " + argsParsed.mode().toString().toLowerCase() + " mode..." );

		final List< RestorationReport > reports;
		try ( final JavaSparkContext sparkContext = new JavaSparkContext( new SparkConf()
				.setAppName( "SeaThruCorrectionSpark" )
				.set( "spark.serializer", "org.apache.spark.serializer.KryoSerializer" )
			) )
		{
			reports = run( sparkContext, Arrays.asList( tasks ), argsParsed.mode(), argsParsed.restorationParameters() );
		}

		SeaThruJSONProvider.saveReports( reports, new FileWriter( argsParsed.reportsPath() ) );
		System.out.println( "Corrected " + reports.size() + " images, saved reports to " + argsParsed.reportsPath() );
		System.out.println( "Done" );
	}

	public static List< RestorationReport > run(
			final JavaSparkContext sparkContext,
			final List< CorrectionTask > tasks,
			final CorrectionMode mode,
			final RestorationParameters parameters )
	{
		if ( tasks.isEmpty() )
			return new ArrayList<>();

		return sparkContext
				.parallelize( tasks, Math.min( tasks.size(), MAX_PARTITIONS ) )
				.map( task -> correct( task, mode, parameters ) )
				.collect();
	}

	/**
	 * Corrects one manifest entry. Failures are rethrown with the entry attached so that the job reports which image failed.
	 */
	public static RestorationReport correct(
			final CorrectionTask task,
			final CorrectionMode mode,
			final RestorationParameters parameters ) throws IOException
	{
		try
		{
			return SeaThruCorrection.correct( task, mode, parameters );
		}
		catch ( final RestorationException e )
		{
			throw new IOException( "failed to correct " + task + ": " + e.getMessage(), e );
		}
	}
}
