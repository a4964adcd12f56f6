package core;

/**
 *	Linear extension of the inverse model outside its fitted domain, and final output clamping.
 *	Distances are in millimetres.
 */
public class ExtrapolationConfig
{
	/**
	 *	Constants
	 */
	public static final boolean DEFAULT_ENABLED = true;
	public static final double DEFAULT_MAX_LOW = 2.0;
	public static final double DEFAULT_MAX_HIGH = 2.0;
	public static final double DEFAULT_OUTPUT_MIN = 0.0;
	public static final double DEFAULT_OUTPUT_MAX = 43.0;
	public static final boolean DEFAULT_CLAMP_OUTPUT = true;
	
	/**
	 *	Members
	 */
	public final boolean enabled;
	public final double max_low;
	public final double max_high;
	public final double output_min;
	public final double output_max;
	public final boolean clamp_output;
	
	// ////////////////////////////////////////////////////////////////////////
	
	public ExtrapolationConfig()
	{
		this(DEFAULT_ENABLED, DEFAULT_MAX_LOW, DEFAULT_MAX_HIGH, DEFAULT_OUTPUT_MIN, DEFAULT_OUTPUT_MAX, DEFAULT_CLAMP_OUTPUT);
	}
	
	public ExtrapolationConfig(boolean enabled, double max_low, double max_high)
	{
		this(enabled, max_low, max_high, DEFAULT_OUTPUT_MIN, DEFAULT_OUTPUT_MAX, DEFAULT_CLAMP_OUTPUT);
	}
	
	public ExtrapolationConfig(boolean enabled, double max_low, double max_high, double output_min, double output_max, boolean clamp_output)
	{
		if(max_low < 0.0 || max_high < 0.0)
		{
			throw new IllegalArgumentException("Extrapolation distances must not be negative: low=" + max_low + ", high=" + max_high);
		}
		if(clamp_output && output_min > output_max)
		{
			throw new IllegalArgumentException("Output clamp range is empty: [" + output_min + ", " + output_max + "]");
		}
		this.enabled = enabled;
		this.max_low = max_low;
		this.max_high = max_high;
		this.output_min = output_min;
		this.output_max = output_max;
		this.clamp_output = clamp_output;
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public static ExtrapolationConfig disabled()
	{
		return new ExtrapolationConfig(false, DEFAULT_MAX_LOW, DEFAULT_MAX_HIGH, DEFAULT_OUTPUT_MIN, DEFAULT_OUTPUT_MAX, false);
	}
	
	@Override
	public String toString()
	{
		return String.format("ExtrapolationConfig{enabled=%s, low=%.3f, high=%.3f, clamp=%s[%.3f,%.3f]}",
		                     enabled, max_low, max_high, clamp_output, output_min, output_max);
	}
}
