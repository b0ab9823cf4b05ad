package org.janelia.seathru;

import java.nio.file.Paths;

import org.junit.Assert;
import org.junit.Test;

public class SeaThruCorrectionArgumentsTest
{
	@Test
	public void testDefaults()
	{
		final SeaThruCorrectionArguments args = new SeaThruCorrectionArguments( new String[] { "-i", "in.png", "-d", "depth.tif", "-o", "out.png" } );
		Assert.assertTrue( args.parsedSuccessfully() );
		Assert.assertEquals( CorrectionMode.SIMPLIFIED, args.mode() );
		Assert.assertNull( args.reportPath() );
		Assert.assertEquals( Paths.get( "in.png" ).toAbsolutePath().toString(), args.task().getImage() );
		Assert.assertEquals( Paths.get( "depth.tif" ).toAbsolutePath().toString(), args.task().getDepth() );

		final RestorationParameters parameters = args.restorationParameters();
		Assert.assertEquals( RestorationParameters.DEFAULT_DEPTH_BINS, parameters.getDepthBins() );
		Assert.assertEquals( RestorationParameters.DEFAULT_ILLUMINATION_WINDOW, parameters.getIlluminationWindow() );
		Assert.assertEquals( Runtime.getRuntime().availableProcessors(), parameters.getNumThreads() );
	}

	@Test
	public void testAdvancedOptions()
	{
		final SeaThruCorrectionArguments args = new SeaThruCorrectionArguments( new String[] {
				"--input", "in.png", "--depth", "depth.tif", "--output", "out.png",
				"--advanced", "--bins", "20", "--fraction", "0.05", "--window", "7", "--maxEvaluations", "500", "--threads", "3",
				"--report", "report.json" } );

		Assert.assertTrue( args.parsedSuccessfully() );
		Assert.assertEquals( CorrectionMode.ADVANCED, args.mode() );
		Assert.assertEquals( Paths.get( "report.json" ).toAbsolutePath().toString(), args.reportPath() );

		final RestorationParameters parameters = args.restorationParameters();
		Assert.assertEquals( 20, parameters.getDepthBins() );
		Assert.assertEquals( 0.05, parameters.getDarkPixelFraction(), 0 );
		Assert.assertEquals( 7, parameters.getIlluminationWindow() );
		Assert.assertEquals( 500, parameters.getMaxEvaluations() );
		Assert.assertEquals( 3, parameters.getNumThreads() );
	}

	@Test
	public void testMissingRequiredOption()
	{
		final SeaThruCorrectionArguments args = new SeaThruCorrectionArguments( new String[] { "-i", "in.png", "-o", "out.png" } );
		Assert.assertFalse( args.parsedSuccessfully() );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testInvalidWindow()
	{
		new SeaThruCorrectionArguments( new String[] { "-i", "in.png", "-d", "depth.tif", "-o", "out.png", "--window", "0" } );
	}
}
