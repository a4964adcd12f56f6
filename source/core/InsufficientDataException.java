package core;

/**
 *	Thrown by the numeric primitives when a region does not carry enough valid data to be fitted
 */
public class InsufficientDataException extends Exception
{
	private static final long serialVersionUID = 1L;
	
	public InsufficientDataException(String message)
	{
		super(message);
	}
}
