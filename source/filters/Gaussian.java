package filters;

// import ImageJ classes
import ij.process.ImageProcessor;
import ij.process.FloatProcessor;

// import Apache Commons Math classes
import org.apache.commons.math3.stat.StatUtils;

/**
 *	Separable gaussian smoothing that ignores the invalid-pixel marker, using the same fill/restore
 *	strategy as {@link Median}. Output values are rounded to the nearest integer.
 */
public class Gaussian
{
	/**
	 *	Constants
	 */
	public static final double DEFAULT_SIGMA = 1.0;
	public static final double KERNEL_TRUNCATE = 4.0; // kernel radius in units of sigma
	
	/**
	 *	Constructor
	 */
	public Gaussian()
	{
		/* do nothing */
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public static ImageProcessor run(ImageProcessor ip, int invalid_value)
	{
		return run(ip, DEFAULT_SIGMA, invalid_value);
	}
	
	public static ImageProcessor run(ImageProcessor ip, double sigma, int invalid_value)
	{
		boolean[] mask = MaskFilter.validMask(ip, invalid_value);
		double[] values = MaskFilter.validValues(ip, invalid_value);
		if(values.length == 0)
		{
			return ip.duplicate();
		}
		
		FloatProcessor filled = MaskFilter.fillInvalid(ip, mask, StatUtils.mean(values));
		FloatProcessor smoothed = smooth(filled, sigma);
		
		ImageProcessor ip_out = ip.createProcessor(ip.getWidth(), ip.getHeight());
		for(int py = 0; py < ip_out.getHeight(); ++py)
		{
			for(int px = 0; px < ip_out.getWidth(); ++px)
			{
				// round half to even
				ip_out.setf(px, py, MaskFilter.toGray(Math.rint(smoothed.getf(px, py))));
			}
		}
		MaskFilter.restoreInvalid(ip_out, mask, invalid_value);
		return ip_out;
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	/**
	 *	Convolve rows, then columns, with a normalized 1D gaussian kernel; borders are mirrored
	 */
	public static FloatProcessor smooth(ImageProcessor ip, double sigma)
	{
		double[] kernel = computeKernelGaussian1D(sigma);
		int kernel_radius = kernel.length / 2;
		int image_width = ip.getWidth();
		int image_height = ip.getHeight();
		
		FloatProcessor ip_rows = new FloatProcessor(image_width, image_height);
		for(int py = 0; py < image_height; ++py)
		{
			for(int px = 0; px < image_width; ++px)
			{
				double kernel_product = 0.0;
				for(int k = 0; k < kernel.length; ++k)
				{
					int x = MaskFilter.reflect(px + k - kernel_radius, image_width);
					kernel_product += ip.getf(x, py) * kernel[k];
				}
				ip_rows.setf(px, py, (float)kernel_product);
			}
		}
		
		FloatProcessor ip_res = new FloatProcessor(image_width, image_height);
		for(int py = 0; py < image_height; ++py)
		{
			for(int px = 0; px < image_width; ++px)
			{
				double kernel_product = 0.0;
				for(int k = 0; k < kernel.length; ++k)
				{
					int y = MaskFilter.reflect(py + k - kernel_radius, image_height);
					kernel_product += ip_rows.getf(px, y) * kernel[k];
				}
				ip_res.setf(px, py, (float)kernel_product);
			}
		}
		return ip_res;
	}
	
	public static double[] computeKernelGaussian1D(double sigma)
	{
		// kernel size covers +/- 4 sigma
		int kernel_radius = (int)(KERNEL_TRUNCATE * sigma + 0.5);
		int kernel_size = 1 + 2 * kernel_radius;
		
		double[] kernel = new double[kernel_size];
		double sum = 0.0;
		for(int k = 0; k < kernel_size; ++k)
		{
			int x = k - kernel_radius;
			kernel[k] = Math.exp(-0.5 * x * x / (sigma * sigma));
			sum += kernel[k];
		}
		
		// normalize kernel
		for(int k = 0; k < kernel_size; ++k)
		{
			kernel[k] /= sum;
		}
		return kernel;
	}
}
