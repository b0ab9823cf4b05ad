package org.janelia.seathru;

public class RestorationException extends Exception
{
	private static final long serialVersionUID = 4409152306213941367L;

	public RestorationException()
	{
		super();
	}

	public RestorationException( final String message )
	{
		super( message );
	}

	public RestorationException( final String message, final Throwable cause )
	{
		super( message, cause );
	}

	public RestorationException( final Throwable cause )
	{
		super( cause );
	}
}
