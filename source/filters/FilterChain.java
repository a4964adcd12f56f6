package filters;

// import ImageJ classes
import ij.process.ImageProcessor;

// import own classes
import core.FilterConfig;

/**
 *	Fixed-order denoising chain: outlier rejection, median, gaussian. Each stage can be switched off;
 *	with the chain disabled an unmodified copy of the input is returned.
 */
public class FilterChain
{
	/**
	 *	Constructor
	 */
	public FilterChain()
	{
		/* do nothing */
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public static ImageProcessor run(ImageProcessor ip, int invalid_value)
	{
		return run(ip, new FilterConfig(), invalid_value);
	}
	
	public static ImageProcessor run(ImageProcessor ip, FilterConfig config, int invalid_value)
	{
		if(!config.enabled)
		{
			return ip.duplicate();
		}
		
		ImageProcessor filtered = ip.duplicate();
		if(config.outlier_rejection)
		{
			filtered = OutlierRejection.run(filtered, config.outlier_std_factor, invalid_value);
		}
		if(config.median)
		{
			filtered = Median.run(filtered, config.median_size, invalid_value);
		}
		if(config.gaussian)
		{
			filtered = Gaussian.run(filtered, config.gaussian_sigma, invalid_value);
		}
		return filtered;
	}
}
