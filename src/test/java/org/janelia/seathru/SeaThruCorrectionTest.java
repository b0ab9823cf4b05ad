package org.janelia.seathru;

import java.io.File;
import java.io.FileReader;
import java.io.IOException;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import ij.ImagePlus;
import ij.process.ColorProcessor;
import ij.process.FloatProcessor;

public class SeaThruCorrectionTest
{
	private static final int WIDTH = 24, HEIGHT = 16;

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private String imagePath, depthPath;

	@Before
	public void setUp() throws IOException
	{
		// blue-green cast that fades with depth, brighter texture in every other row
		final ColorProcessor cp = new ColorProcessor( WIDTH, HEIGHT );
		final FloatProcessor fp = new FloatProcessor( WIDTH, HEIGHT );
		for ( int y = 0; y < HEIGHT; ++y )
		{
			for ( int x = 0; x < WIDTH; ++x )
			{
				final double depth = 1 + 7.0 * x / ( WIDTH - 1 );
				final int texture = ( y % 2 == 0 ) ? 60 : 0;
				final int r = ( int ) ( 20 + texture * Math.exp( -0.4 * depth ) );
				final int g = ( int ) ( 60 + 10 * depth + texture * Math.exp( -0.1 * depth ) );
				final int b = ( int ) ( 80 + 12 * depth + texture * Math.exp( -0.05 * depth ) );
				cp.set( x, y, ImageConversionsTest.rgb( r, g, b ) );
				fp.setf( x, y, ( float ) depth );
			}
		}

		imagePath = new File( folder.getRoot(), "dive.tif" ).getAbsolutePath();
		depthPath = new File( folder.getRoot(), "dive-depth.tif" ).getAbsolutePath();
		ImageConversions.saveImage( new ImagePlus( "dive", cp ), imagePath );
		ImageConversions.saveImage( new ImagePlus( "dive-depth", fp ), depthPath );
	}

	@Test
	public void testSimplifiedCorrection() throws Exception
	{
		final String outputPath = new File( folder.getRoot(), "simplified.png" ).getAbsolutePath();
		final RestorationReport report = SeaThruCorrection.correct(
				new CorrectionTask( imagePath, depthPath, outputPath ),
				CorrectionMode.SIMPLIFIED,
				RestorationParameters.defaults() );

		Assert.assertEquals( CorrectionMode.SIMPLIFIED, report.getMode() );
		Assert.assertEquals( 4.5, report.getDepthMetrics().getAverageDepth(), 1e-5 );
		Assert.assertEquals( 3, report.getGains().length );
		Assert.assertNull( report.getBackscatter() );
		Assert.assertTrue( report.getAfter().getBrightness() >= report.getBefore().getBrightness() );
		Assert.assertTrue( report.getAfter().getAverageRed() >= report.getBefore().getAverageRed() );

		assertImage( outputPath );
	}

	@Test
	public void testAdvancedCorrection() throws Exception
	{
		final String outputPath = new File( new File( folder.getRoot(), "out" ), "advanced.tif" ).getAbsolutePath();
		final RestorationReport report = SeaThruCorrection.correct(
				new CorrectionTask( imagePath, depthPath, outputPath ),
				CorrectionMode.ADVANCED,
				RestorationParameters.builder().numThreads( 2 ).build() );

		Assert.assertEquals( CorrectionMode.ADVANCED, report.getMode() );
		Assert.assertNull( report.getGains() );
		Assert.assertEquals( 3, report.getBackscatter().length );
		Assert.assertEquals( 3, report.getAttenuation().length );
		for ( final ChannelFit fit : report.getBackscatter() )
			Assert.assertTrue( fit.getSamples() > 0 );
		Assert.assertNotNull( report.getAfter() );

		assertImage( outputPath );
	}

	@Test
	public void testMainWritesReport() throws Exception
	{
		final String outputPath = new File( folder.getRoot(), "main.tif" ).getAbsolutePath();
		final String reportPath = new File( folder.getRoot(), "report.json" ).getAbsolutePath();
		SeaThruCorrection.main( new String[] {
				"-i", imagePath,
				"-d", depthPath,
				"-o", outputPath,
				"--advanced",
				"--threads", "2",
				"--report", reportPath } );

		assertImage( outputPath );
		final RestorationReport report = SeaThruJSONProvider.loadReport( new FileReader( reportPath ) );
		Assert.assertEquals( CorrectionMode.ADVANCED, report.getMode() );
		Assert.assertEquals( outputPath, report.getTask().getOutput() );
		Assert.assertEquals( 3, report.getAttenuation().length );
	}

	@Test( expected = IOException.class )
	public void testMissingDepthMap() throws Exception
	{
		SeaThruCorrection.correct(
				new CorrectionTask( imagePath, new File( folder.getRoot(), "none.tif" ).getAbsolutePath(), new File( folder.getRoot(), "x.tif" ).getAbsolutePath() ),
				CorrectionMode.ADVANCED,
				RestorationParameters.defaults() );
	}

	@Test( expected = DegenerateInputException.class )
	public void testMismatchedDepthMap() throws Exception
	{
		final String smallDepthPath = new File( folder.getRoot(), "small-depth.tif" ).getAbsolutePath();
		ImageConversions.saveImage( new ImagePlus( "small", new FloatProcessor( 4, 4 ) ), smallDepthPath );

		SeaThruCorrection.correct(
				new CorrectionTask( imagePath, smallDepthPath, new File( folder.getRoot(), "x.tif" ).getAbsolutePath() ),
				CorrectionMode.ADVANCED,
				RestorationParameters.defaults() );
	}

	private static void assertImage( final String path ) throws IOException
	{
		Assert.assertTrue( new File( path ).isFile() );
		final ImagePlus imp = ImageConversions.openImage( path );
		Assert.assertEquals( WIDTH, imp.getWidth() );
		Assert.assertEquals( HEIGHT, imp.getHeight() );
		Assert.assertEquals( ImagePlus.COLOR_RGB, imp.getType() );
	}
}
