package org.janelia.seathru;

import java.io.Serializable;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

/**
 * Command line options shared by the local and the Spark correction drivers.
 * Subclasses declare their own options and call {@link #parse(String[])} at the end of their constructor.
 */
public abstract class RestorationArguments implements Serializable
{
	private static final long serialVersionUID = 2848264183493785105L;

	@Option(name = "--advanced", required = false,
			usage = "Estimate backscatter, illumination and attenuation from the depth map and invert the full model. Otherwise a fixed per-channel gain based on the average depth is applied.")
	private boolean advanced = false;

	@Option(name = "--bins", required = false,
			usage = "Number of depth bins used to sample dark pixels for the backscatter estimation")
	private int depthBins = RestorationParameters.DEFAULT_DEPTH_BINS;

	@Option(name = "--fraction", required = false,
			usage = "Fraction of the darkest pixels per depth bin used as backscatter samples")
	private double darkPixelFraction = RestorationParameters.DEFAULT_DARK_PIXEL_FRACTION;

	@Option(name = "--window", required = false,
			usage = "Size of the box filter (in pixels) used to estimate the illuminant field")
	private int illuminationWindow = RestorationParameters.DEFAULT_ILLUMINATION_WINDOW;

	@Option(name = "--maxEvaluations", required = false,
			usage = "Maximum number of residual evaluations per curve fit")
	private int maxEvaluations = RestorationParameters.DEFAULT_MAX_EVALUATIONS;

	@Option(name = "--threads", required = false,
			usage = "Number of worker threads per image (all available processors by default, 1 for Spark tasks)")
	private Integer numThreads = null;

	private RestorationParameters restorationParameters;
	private boolean parsedSuccessfully = false;

	protected void parse( final String[] args )
	{
		final CmdLineParser parser = new CmdLineParser( this );
		try
		{
			parser.parseArgument( args );
			parsedSuccessfully = true;
		}
		catch ( final CmdLineException e )
		{
			System.err.println( e.getMessage() );
			parser.printUsage( System.err );
		}

		if ( parsedSuccessfully )
		{
			final RestorationParameters.Builder builder = RestorationParameters.builder()
					.depthBins( depthBins )
					.darkPixelFraction( darkPixelFraction )
					.illuminationWindow( illuminationWindow )
					.maxEvaluations( maxEvaluations );
			builder.numThreads( numThreads != null ? numThreads : defaultNumThreads() );
			restorationParameters = builder.build();
		}
	}

	/**
	 * Number of worker threads used when {@code --threads} is not given.
	 */
	protected int defaultNumThreads()
	{
		return Runtime.getRuntime().availableProcessors();
	}

	public boolean parsedSuccessfully() { return parsedSuccessfully; }

	public CorrectionMode mode() { return advanced ? CorrectionMode.ADVANCED : CorrectionMode.SIMPLIFIED; }
	public RestorationParameters restorationParameters() { return restorationParameters; }
}
