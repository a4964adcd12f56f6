package filters;

import java.util.Arrays;

// import ImageJ classes
import ij.process.ImageProcessor;
import ij.process.FloatProcessor;

// import Apache Commons Math classes
import org.apache.commons.math3.stat.StatUtils;

/**
 *	Windowed median that ignores the invalid-pixel marker. Invalid pixels are filled with the mean of the
 *	valid pixels before filtering so that they do not drag the median of their neighbours, and are set
 *	back to the invalid value afterwards.
 */
public class Median
{
	/**
	 *	Constants
	 */
	public static final int DEFAULT_KERNEL_SIZE = 3;
	
	/**
	 *	Constructor
	 */
	public Median()
	{
		/* do nothing */
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public static ImageProcessor run(ImageProcessor ip, int invalid_value)
	{
		return run(ip, DEFAULT_KERNEL_SIZE, invalid_value);
	}
	
	public static ImageProcessor run(ImageProcessor ip, int size, int invalid_value)
	{
		boolean[] mask = MaskFilter.validMask(ip, invalid_value);
		double[] values = MaskFilter.validValues(ip, invalid_value);
		if(values.length == 0)
		{
			return ip.duplicate();
		}
		
		FloatProcessor filled = MaskFilter.fillInvalid(ip, mask, StatUtils.mean(values));
		FloatProcessor filtered = median(filled, size);
		
		// back to the integer type of the input, truncating
		ImageProcessor ip_out = ip.createProcessor(ip.getWidth(), ip.getHeight());
		for(int py = 0; py < ip_out.getHeight(); ++py)
		{
			for(int px = 0; px < ip_out.getWidth(); ++px)
			{
				ip_out.setf(px, py, (float)Math.floor(MaskFilter.toGray(filtered.getf(px, py))));
			}
		}
		MaskFilter.restoreInvalid(ip_out, mask, invalid_value);
		return ip_out;
	}
	
	/**
	 *	Plain median over a size x size window with mirrored borders
	 */
	public static FloatProcessor median(ImageProcessor ip, int size)
	{
		int image_width = ip.getWidth();
		int image_height = ip.getHeight();
		int k_min = -(size / 2);
		int k_max = k_min + size - 1;
		float[] window = new float[size * size];
		FloatProcessor ip_out = new FloatProcessor(image_width, image_height);
		for(int py = 0; py < image_height; ++py)
		{
			for(int px = 0; px < image_width; ++px)
			{
				int n = 0;
				for(int ky = k_min; ky <= k_max; ++ky)
				{
					int y = MaskFilter.reflect(py + ky, image_height);
					for(int kx = k_min; kx <= k_max; ++kx)
					{
						int x = MaskFilter.reflect(px + kx, image_width);
						window[n++] = ip.getf(x, y);
					}
				}
				Arrays.sort(window);
				ip_out.setf(px, py, window[window.length / 2]);
			}
		}
		return ip_out;
	}
}
