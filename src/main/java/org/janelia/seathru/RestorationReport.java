package org.janelia.seathru;

import java.io.Serializable;

import org.janelia.seathru.analysis.DepthMetrics;
import org.janelia.seathru.analysis.ImageAnalysis;

/**
 * Adjustments applied to an image: depth metrics, image statistics before and after correction,
 * and either the per-channel gains (simplified mode) or the fitted model coefficients (advanced mode).
 */
public class RestorationReport implements Serializable
{
	private static final long serialVersionUID = -7935806312858170233L;

	private CorrectionTask task;
	private CorrectionMode mode;
	private DepthMetrics depthMetrics;
	private ImageAnalysis before;
	private ImageAnalysis after;

	private double[] gains;
	private ChannelFit[] backscatter;
	private ChannelFit[] attenuation;

	private long elapsedMillis;

	public RestorationReport( final CorrectionTask task, final CorrectionMode mode )
	{
		this.task = task;
		this.mode = mode;
	}

	protected RestorationReport() { }

	public CorrectionTask getTask() { return task; }
	public CorrectionMode getMode() { return mode; }
	public DepthMetrics getDepthMetrics() { return depthMetrics; }
	public ImageAnalysis getBefore() { return before; }
	public ImageAnalysis getAfter() { return after; }
	public double[] getGains() { return gains; }
	public ChannelFit[] getBackscatter() { return backscatter; }
	public ChannelFit[] getAttenuation() { return attenuation; }
	public long getElapsedMillis() { return elapsedMillis; }

	public void setDepthMetrics( final DepthMetrics depthMetrics ) { this.depthMetrics = depthMetrics; }
	public void setBefore( final ImageAnalysis before ) { this.before = before; }
	public void setAfter( final ImageAnalysis after ) { this.after = after; }
	public void setGains( final double[] gains ) { this.gains = gains; }
	public void setBackscatter( final ChannelFit[] backscatter ) { this.backscatter = backscatter; }
	public void setAttenuation( final ChannelFit[] attenuation ) { this.attenuation = attenuation; }
	public void setElapsedMillis( final long elapsedMillis ) { this.elapsedMillis = elapsedMillis; }
}
