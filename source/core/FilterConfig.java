package core;

/**
 *	Immutable settings of the denoising filter chain (outlier rejection, median, gaussian)
 */
public class FilterConfig
{
	/**
	 *	Constants
	 */
	public static final boolean DEFAULT_ENABLED = true;
	public static final double DEFAULT_OUTLIER_STD_FACTOR = 3.0;
	public static final int DEFAULT_MEDIAN_SIZE = 3;
	public static final double DEFAULT_GAUSSIAN_SIGMA = 1.0;
	
	/**
	 *	Members
	 */
	public final boolean enabled;
	public final boolean outlier_rejection;
	public final boolean median;
	public final boolean gaussian;
	public final double outlier_std_factor;
	public final int median_size;
	public final double gaussian_sigma;
	
	// ////////////////////////////////////////////////////////////////////////
	
	public FilterConfig()
	{
		this(DEFAULT_ENABLED, DEFAULT_OUTLIER_STD_FACTOR, DEFAULT_MEDIAN_SIZE, DEFAULT_GAUSSIAN_SIGMA);
	}
	
	public FilterConfig(boolean enabled, double outlier_std_factor, int median_size, double gaussian_sigma)
	{
		this(enabled, true, true, true, outlier_std_factor, median_size, gaussian_sigma);
	}
	
	public FilterConfig(boolean enabled, boolean outlier_rejection, boolean median, boolean gaussian, double outlier_std_factor, int median_size, double gaussian_sigma)
	{
		if(outlier_std_factor <= 0.0)
		{
			throw new IllegalArgumentException("Outlier std factor must be positive: " + outlier_std_factor);
		}
		if(median_size < 1)
		{
			throw new IllegalArgumentException("Median window size must be at least 1: " + median_size);
		}
		if(gaussian_sigma <= 0.0)
		{
			throw new IllegalArgumentException("Gaussian sigma must be positive: " + gaussian_sigma);
		}
		this.enabled = enabled;
		this.outlier_rejection = outlier_rejection;
		this.median = median;
		this.gaussian = gaussian;
		this.outlier_std_factor = outlier_std_factor;
		this.median_size = median_size;
		this.gaussian_sigma = gaussian_sigma;
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public static FilterConfig disabled()
	{
		return new FilterConfig(false, DEFAULT_OUTLIER_STD_FACTOR, DEFAULT_MEDIAN_SIZE, DEFAULT_GAUSSIAN_SIGMA);
	}
	
	@Override
	public String toString()
	{
		return String.format("FilterConfig{enabled=%s, outlier=%s(k=%.2f), median=%s(%d), gaussian=%s(sigma=%.2f)}",
		                     enabled, outlier_rejection, outlier_std_factor, median, median_size, gaussian, gaussian_sigma);
	}
}
