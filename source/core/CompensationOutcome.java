package core;

// import ImageJ classes
import ij.process.ImageProcessor;

/**
 *	Compensated depth image together with its pixel classification counts
 */
public class CompensationOutcome
{
	public final ImageProcessor compensated;
	public final int total_pixels;
	public final int valid_pixels;
	public final int invalid_pixels;
	public final int in_range_pixels;
	public final int extrapolated_pixels;
	public final int compensated_pixels;
	public final int out_of_range_pixels;
	public final boolean extrapolation_enabled;
	public final double normalize_offset;
	
	public CompensationOutcome(ImageProcessor compensated, int total_pixels, int valid_pixels, int in_range_pixels, int extrapolated_pixels, int compensated_pixels, boolean extrapolation_enabled, double normalize_offset)
	{
		this.compensated = compensated;
		this.total_pixels = total_pixels;
		this.valid_pixels = valid_pixels;
		this.invalid_pixels = total_pixels - valid_pixels;
		this.in_range_pixels = in_range_pixels;
		this.extrapolated_pixels = extrapolated_pixels;
		this.compensated_pixels = compensated_pixels;
		this.out_of_range_pixels = valid_pixels - compensated_pixels;
		this.extrapolation_enabled = extrapolation_enabled;
		this.normalize_offset = normalize_offset;
	}
	
	/**
	 *	Percentage of all pixels that were adjusted
	 */
	public double compensationRate()
	{
		return total_pixels > 0 ? 100.0 * compensated_pixels / total_pixels : 0.0;
	}
	
	@Override
	public String toString()
	{
		return String.format("CompensationOutcome{total=%d, valid=%d, invalid=%d, in_range=%d, extrapolated=%d, compensated=%d, out_of_range=%d, rate=%.2f%%}",
		                     total_pixels, valid_pixels, invalid_pixels, in_range_pixels, extrapolated_pixels, compensated_pixels, out_of_range_pixels, compensationRate());
	}
}
