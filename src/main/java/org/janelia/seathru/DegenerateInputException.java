package org.janelia.seathru;

/**
 * Thrown when the image and the depth map cannot be processed together:
 * wrong dimensionality, mismatched width/height, or no pixels at all.
 */
public class DegenerateInputException extends RestorationException
{
	private static final long serialVersionUID = -1672401335517384810L;

	public DegenerateInputException( final String message )
	{
		super( message );
	}
}
