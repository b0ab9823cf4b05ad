package org.janelia.seathru;

import java.nio.file.Paths;

import org.kohsuke.args4j.Option;

/**
 * Command line arguments parser for correcting a single image.
 */
public class SeaThruCorrectionArguments extends RestorationArguments
{
	private static final long serialVersionUID = -1480587370567095394L;

	@Option(name = "-i", aliases = { "--input" }, required = true,
			usage = "Path to the underwater image")
	private String inputPath;

	@Option(name = "-d", aliases = { "--depth" }, required = true,
			usage = "Path to the depth map of the image (single-channel, typically a 32-bit TIFF)")
	private String depthPath;

	@Option(name = "-o", aliases = { "--output" }, required = true,
			usage = "Path to the corrected image. The format is chosen by the extension (png, jpg, tif).")
	private String outputPath;

	@Option(name = "--report", required = false,
			usage = "Path to a JSON file where the applied adjustments are written")
	private String reportPath = null;

	public SeaThruCorrectionArguments( final String[] args )
	{
		parse( args );

		if ( parsedSuccessfully() )
		{
			inputPath = Paths.get( inputPath ).toAbsolutePath().toString();
			depthPath = Paths.get( depthPath ).toAbsolutePath().toString();
			outputPath = Paths.get( outputPath ).toAbsolutePath().toString();
			if ( reportPath != null )
				reportPath = Paths.get( reportPath ).toAbsolutePath().toString();
		}
	}

	public CorrectionTask task() { return new CorrectionTask( inputPath, depthPath, outputPath ); }
	public String reportPath() { return reportPath; }
}
