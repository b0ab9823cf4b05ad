package org.janelia.seathru.spark;

import java.nio.file.Paths;

import org.janelia.seathru.RestorationArguments;
import org.kohsuke.args4j.Option;

/**
 * Command line arguments parser for batch correction.
 */
public class SeaThruCorrectionSparkArguments extends RestorationArguments
{
	private static final long serialVersionUID = 5318806532542096172L;

	@Option(name = "-m", aliases = { "--manifest" }, required = true,
			usage = "Path to a JSON file listing the images to correct as { image, depth, output } entries")
	private String manifestPath;

	@Option(name = "--reports", required = false,
			usage = "Path to the JSON file with the reports of all entries (next to the manifest by default)")
	private String reportsPath = null;

	public SeaThruCorrectionSparkArguments( final String[] args )
	{
		parse( args );

		if ( parsedSuccessfully() )
		{
			manifestPath = Paths.get( manifestPath ).toAbsolutePath().toString();
			if ( reportsPath == null )
				reportsPath = defaultReportsPath( manifestPath );
			else
				reportsPath = Paths.get( reportsPath ).toAbsolutePath().toString();
		}
	}

	/**
	 * Spark runs several tasks per executor at once, so every image gets a single thread unless requested otherwise.
	 */
	@Override
	protected int defaultNumThreads()
	{
		return 1;
	}

	public String manifestPath() { return manifestPath; }
	public String reportsPath() { return reportsPath; }

	static String defaultReportsPath( final String manifestPath )
	{
		final int extensionIndex = manifestPath.toLowerCase().endsWith( ".json" ) ? manifestPath.length() - ".json".length() : manifestPath.length();
		return manifestPath.substring( 0, extensionIndex ) + "-reports.json";
	}
}
