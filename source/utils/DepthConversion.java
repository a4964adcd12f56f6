package utils;

import java.util.OptionalDouble;

/**
 *	Fixed-point mapping between 16-bit gray values and physical distance in millimetres:
 *	<pre>
 *	distance = (gray - offset) * scale / 1000
 *	gray     = clamp(round(distance * 1000 / scale + offset), 0, 65535)
 *	</pre>
 *	The scalar gray-to-distance conversion treats the invalid value as "no distance". The bulk conversions
 *	do not look at the invalid value at all; callers mask invalid pixels themselves.
 */
public class DepthConversion
{
	/**
	 *	Constants
	 */
	public static final double DEFAULT_OFFSET = 32768.0;
	public static final double DEFAULT_SCALE_FACTOR = 1.6;
	public static final int DEFAULT_INVALID_VALUE = 65535;
	
	public static final int GRAY_MIN = 0;
	public static final int GRAY_MAX = 65535;
	
	/**
	 *	Members
	 */
	public final double offset;
	public final double scale_factor;
	public final int invalid_value;
	
	// ////////////////////////////////////////////////////////////////////////
	
	public DepthConversion()
	{
		this(DEFAULT_OFFSET, DEFAULT_SCALE_FACTOR, DEFAULT_INVALID_VALUE);
	}
	
	public DepthConversion(double offset, double scale_factor, int invalid_value)
	{
		if(!(scale_factor > 0.0) || Double.isInfinite(scale_factor))
		{
			throw new IllegalArgumentException("Scale factor must be a positive finite number: " + scale_factor);
		}
		if(invalid_value < GRAY_MIN || invalid_value > GRAY_MAX)
		{
			throw new IllegalArgumentException("Invalid value must be a 16-bit gray value: " + invalid_value);
		}
		this.offset = offset;
		this.scale_factor = scale_factor;
		this.invalid_value = invalid_value;
	}
	
	/**
	 *	Same conversion with another marker for missing pixels
	 */
	public DepthConversion withInvalidValue(int invalid_value)
	{
		return new DepthConversion(offset, scale_factor, invalid_value);
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	/**
	 *	Distance of a single pixel value; empty for the invalid value
	 */
	public OptionalDouble grayToDistance(int gray)
	{
		if(gray == invalid_value)
		{
			return OptionalDouble.empty();
		}
		return OptionalDouble.of(grayToDistance((double)gray));
	}
	
	public double grayToDistance(double gray)
	{
		return (gray - offset) * scale_factor / 1000.0;
	}
	
	public double[] grayToDistance(float[] grays)
	{
		double[] distances = new double[grays.length];
		for(int i = 0; i < grays.length; ++i)
		{
			distances[i] = (grays[i] - offset) * scale_factor / 1000.0;
		}
		return distances;
	}
	
	public int distanceToGray(double distance)
	{
		double gray = Math.round(distance * 1000.0 / scale_factor + offset);
		return (int)Math.max(GRAY_MIN, Math.min(GRAY_MAX, gray));
	}
	
	/**
	 *	Gray value of a measured distance that never equals the invalid value. A distance landing on the
	 *	invalid value is moved one gray level towards its exact position, or inwards at the ends of the range.
	 */
	public int distanceToValidGray(double distance)
	{
		int gray = distanceToGray(distance);
		if(gray != invalid_value)
		{
			return gray;
		}
		double exact = distance * 1000.0 / scale_factor + offset;
		if(gray == GRAY_MAX || (gray > GRAY_MIN && exact < gray))
		{
			return gray - 1;
		}
		return gray + 1;
	}
	
	public int[] distanceToGray(double[] distances)
	{
		int[] grays = new int[distances.length];
		for(int i = 0; i < distances.length; ++i)
		{
			grays[i] = distanceToGray(distances[i]);
		}
		return grays;
	}
	
	/**
	 *	Distance represented by one gray level
	 */
	public double quantizationStep()
	{
		return scale_factor / 1000.0;
	}
	
	@Override
	public String toString()
	{
		return String.format("DepthConversion{offset=%.1f, scale=%.4f, invalid=%d}", offset, scale_factor, invalid_value);
	}
}
