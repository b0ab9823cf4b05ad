package org.janelia.seathru;

import java.io.Serializable;

/**
 * Paths of one image to correct, its depth map, and the corrected output.
 */
public class CorrectionTask implements Serializable
{
	private static final long serialVersionUID = 6283574402716359038L;

	private String image;
	private String depth;
	private String output;

	public CorrectionTask( final String image, final String depth, final String output )
	{
		this.image = image;
		this.depth = depth;
		this.output = output;
	}

	protected CorrectionTask() { }

	public String getImage() { return image; }
	public String getDepth() { return depth; }
	public String getOutput() { return output; }

	public boolean isNull()
	{
		return image == null || depth == null || output == null;
	}

	@Override
	public String toString()
	{
		return image + " (depth " + depth + ") -> " + output;
	}
}
