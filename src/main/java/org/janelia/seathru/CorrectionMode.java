package org.janelia.seathru;

public enum CorrectionMode
{
	/**
	 * Fixed per-channel gain driven by the average scene depth.
	 */
	SIMPLIFIED,

	/**
	 * Full model inversion with backscatter, illumination and attenuation estimation.
	 */
	ADVANCED
}
