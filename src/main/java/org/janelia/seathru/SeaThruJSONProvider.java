package org.janelia.seathru;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Loads batch manifests and stores restoration reports in JSON format.
 */
public class SeaThruJSONProvider
{
	public static CorrectionTask[] loadTasks( final Reader reader ) throws IOException
	{
		final CorrectionTask[] tasks;
		try ( final Reader closeableReader = reader )
		{
			tasks = createGson().fromJson( closeableReader, CorrectionTask[].class );
		}

		if ( tasks == null )
			return new CorrectionTask[ 0 ];

		for ( final CorrectionTask task : tasks )
			if ( task == null || task.isNull() )
				throw new IOException( "every manifest entry should specify image, depth and output paths" );

		return tasks;
	}

	public static void saveTasks( final CorrectionTask[] tasks, final Writer writer ) throws IOException
	{
		try ( final Writer closeableWriter = writer )
		{
			closeableWriter.write( createGson().toJson( tasks ) );
		}
	}

	public static RestorationReport loadReport( final Reader reader ) throws IOException
	{
		try ( final Reader closeableReader = reader )
		{
			return createGson().fromJson( closeableReader, RestorationReport.class );
		}
	}

	public static void saveReport( final RestorationReport report, final Writer writer ) throws IOException
	{
		try ( final Writer closeableWriter = writer )
		{
			closeableWriter.write( createGson().toJson( report ) );
		}
	}

	public static List< RestorationReport > loadReports( final Reader reader ) throws IOException
	{
		try ( final Reader closeableReader = reader )
		{
			return new ArrayList<>( Arrays.asList( createGson().fromJson( closeableReader, RestorationReport[].class ) ) );
		}
	}

	public static void saveReports( final List< RestorationReport > reports, final Writer writer ) throws IOException
	{
		try ( final Writer closeableWriter = writer )
		{
			closeableWriter.write( createGson().toJson( reports ) );
		}
	}

	private static Gson createGson()
	{
		// failed fits report NaN costs
		return new GsonBuilder()
				.serializeSpecialFloatingPointValues()
				.setPrettyPrinting()
				.create();
	}
}
