package filters;

// import ImageJ classes
import ij.process.ImageProcessor;

// import Apache Commons Math classes
import org.apache.commons.math3.stat.StatUtils;

/**
 *	Reclassifies valid pixels further than k standard deviations from the mean as invalid
 */
public class OutlierRejection
{
	/**
	 *	Constants
	 */
	public static final double DEFAULT_STD_FACTOR = 3.0;
	
	/**
	 *	Constructor
	 */
	public OutlierRejection()
	{
		/* do nothing */
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public static ImageProcessor run(ImageProcessor ip, int invalid_value)
	{
		return run(ip, DEFAULT_STD_FACTOR, invalid_value);
	}
	
	public static ImageProcessor run(ImageProcessor ip, double std_factor, int invalid_value)
	{
		ImageProcessor ip_out = ip.duplicate();
		double[] values = MaskFilter.validValues(ip, invalid_value);
		if(values.length == 0)
		{
			return ip_out;
		}
		
		// population statistics over valid pixels only
		double mean = StatUtils.mean(values);
		double std = Math.sqrt(StatUtils.populationVariance(values, mean));
		double lower = mean - std_factor * std;
		double upper = mean + std_factor * std;
		
		for(int py = 0; py < ip_out.getHeight(); ++py)
		{
			for(int px = 0; px < ip_out.getWidth(); ++px)
			{
				float pv = ip_out.getf(px, py);
				if(pv != invalid_value && (pv < lower || pv > upper))
				{
					ip_out.setf(px, py, invalid_value);
				}
			}
		}
		return ip_out;
	}
}
