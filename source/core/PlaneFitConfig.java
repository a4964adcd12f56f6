package core;

/**
 *	Minimum amount of valid data required before a plane is fitted to a region
 */
public class PlaneFitConfig
{
	public static final int DEFAULT_MIN_VALID_PIXELS = 100;
	public static final double DEFAULT_MIN_VALID_RATIO = 0.10;
	
	public final int min_valid_pixels;
	public final double min_valid_ratio;
	
	public PlaneFitConfig()
	{
		this(DEFAULT_MIN_VALID_PIXELS, DEFAULT_MIN_VALID_RATIO);
	}
	
	public PlaneFitConfig(int min_valid_pixels, double min_valid_ratio)
	{
		// at least three points are needed to span a plane
		if(min_valid_pixels < 3)
		{
			throw new IllegalArgumentException("Minimum valid pixel count must be at least 3: " + min_valid_pixels);
		}
		if(min_valid_ratio < 0.0 || min_valid_ratio > 1.0)
		{
			throw new IllegalArgumentException("Minimum valid ratio must lie in [0,1]: " + min_valid_ratio);
		}
		this.min_valid_pixels = min_valid_pixels;
		this.min_valid_ratio = min_valid_ratio;
	}
	
	@Override
	public String toString()
	{
		return String.format("PlaneFitConfig{min_pixels=%d, min_ratio=%.1f%%}", min_valid_pixels, 100.0 * min_valid_ratio);
	}
}
