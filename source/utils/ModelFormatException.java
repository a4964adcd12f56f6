package utils;

import java.io.IOException;

/**
 *	Thrown when a model file is valid JSON but matches none of the known model layouts
 */
public class ModelFormatException extends IOException
{
	private static final long serialVersionUID = 1L;
	
	public ModelFormatException(String message)
	{
		super(message);
	}
	
	public ModelFormatException(String message, Throwable cause)
	{
		super(message, cause);
	}
}
