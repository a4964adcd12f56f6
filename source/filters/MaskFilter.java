package filters;

// import ImageJ classes
import ij.process.ImageProcessor;
import ij.process.FloatProcessor;

/**
 *	Validity handling for depth images, where one reserved gray value marks pixels without a measurement
 */
public class MaskFilter
{
	/**
	 *	Constructor
	 */
	public MaskFilter()
	{
		/* do nothing */
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	/**
	 *	Row-major mask, true where the pixel carries a measurement
	 */
	public static boolean[] validMask(ImageProcessor ip, int invalid_value)
	{
		int width = ip.getWidth();
		boolean[] mask = new boolean[width * ip.getHeight()];
		for(int py = 0; py < ip.getHeight(); ++py)
		{
			for(int px = 0; px < width; ++px)
			{
				mask[py * width + px] = (ip.getf(px, py) != invalid_value);
			}
		}
		return mask;
	}
	
	/**
	 *	Flattened (row-major) values of the valid pixels
	 */
	public static double[] validValues(ImageProcessor ip, int invalid_value)
	{
		double[] values = new double[validCount(ip, invalid_value)];
		int i = 0;
		for(int py = 0; py < ip.getHeight(); ++py)
		{
			for(int px = 0; px < ip.getWidth(); ++px)
			{
				float pv = ip.getf(px, py);
				if(pv != invalid_value)
				{
					values[i++] = pv;
				}
			}
		}
		return values;
	}
	
	public static int validCount(ImageProcessor ip, int invalid_value)
	{
		int count = 0;
		for(int py = 0; py < ip.getHeight(); ++py)
		{
			for(int px = 0; px < ip.getWidth(); ++px)
			{
				if(ip.getf(px, py) != invalid_value)
				{
					++count;
				}
			}
		}
		return count;
	}
	
	/**
	 *	Float work copy in which every invalid pixel is replaced by the fill value
	 */
	public static FloatProcessor fillInvalid(ImageProcessor ip, boolean[] mask, double fill_value)
	{
		int width = ip.getWidth();
		FloatProcessor filled = new FloatProcessor(width, ip.getHeight());
		for(int py = 0; py < ip.getHeight(); ++py)
		{
			for(int px = 0; px < width; ++px)
			{
				filled.setf(px, py, mask[py * width + px] ? ip.getf(px, py) : (float)fill_value);
			}
		}
		return filled;
	}
	
	/**
	 *	Write the invalid value back into every position the mask marks as invalid
	 */
	public static void restoreInvalid(ImageProcessor ip, boolean[] mask, int invalid_value)
	{
		int width = ip.getWidth();
		for(int py = 0; py < ip.getHeight(); ++py)
		{
			for(int px = 0; px < width; ++px)
			{
				if(!mask[py * width + px])
				{
					ip.setf(px, py, invalid_value);
				}
			}
		}
	}
	
	/**
	 *	Index into [0, n) for a position outside the image, mirroring about the pixel edges (d c b a | a b c d | d c b a)
	 */
	public static int reflect(int i, int n)
	{
		if(n == 1) return 0;
		int period = 2 * n;
		i %= period;
		if(i < 0) i += period;
		return (i < n) ? i : period - 1 - i;
	}
	
	/**
	 *	Clamp to the 16-bit gray range
	 */
	static float toGray(double value)
	{
		return (float)Math.max(0.0, Math.min(65535.0, value));
	}
}
