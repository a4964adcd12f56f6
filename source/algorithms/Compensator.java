package algorithms;

// import ImageJ classes
import ij.process.ImageProcessor;

// import own classes
import core.CompensationModel;
import core.CompensationOutcome;
import core.ExtrapolationConfig;
import core.NormalizationConfig;
import utils.DepthConversion;

/**
 *	Applies a compensation model to single distances, distance arrays and depth images
 */
public class Compensator
{
	/**
	 *	Constructor
	 */
	public Compensator()
	{
		/* do nothing */
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	/**
	 *	Compensated distance of one measured distance. Without an enabled extrapolation configuration
	 *	the inverse spline is evaluated directly, which extends the boundary polynomials outside the domain.
	 */
	public static double compensate(double measured, CompensationModel model, ExtrapolationConfig config)
	{
		if(config != null && config.enabled)
		{
			return Extrapolator.apply(measured, model, config);
		}
		return model.getInverse().evaluate(measured);
	}
	
	public static double[] compensate(double[] measured, CompensationModel model, ExtrapolationConfig config)
	{
		if(config != null && config.enabled)
		{
			return Extrapolator.apply(measured, model, config);
		}
		return model.getInverse().evaluate(measured);
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public static CompensationOutcome compensateImage(ImageProcessor ip, CompensationModel model)
	{
		return compensateImage(ip, model, new DepthConversion(), new ExtrapolationConfig(), 0.0);
	}
	
	/**
	 *	Per-pixel compensation of a 16-bit depth image. Valid pixels whose measured distance lies inside
	 *	the model range, or inside the extended range when extrapolation is enabled, are replaced by the
	 *	compensated distance plus the normalization offset; every other pixel keeps its value. Compensated
	 *	pixels never take the invalid value, even where the gray range saturates.
	 *
	 *	@param ip 16-bit depth image, left untouched
	 *	@param model compensation model
	 *	@param conversion gray/distance conversion including the invalid value
	 *	@param config extrapolation configuration, null for the default (enabled)
	 *	@param normalize_offset offset in mm added to every compensated distance
	 *	@return the compensated copy with pixel classification counts
	 */
	public static CompensationOutcome compensateImage(ImageProcessor ip, CompensationModel model, DepthConversion conversion, ExtrapolationConfig config, double normalize_offset)
	{
		if(config == null)
		{
			config = new ExtrapolationConfig();
		}
		
		int width = ip.getWidth();
		int height = ip.getHeight();
		int total = width * height;
		ImageProcessor result = ip.duplicate();
		
		double x_min = model.getXMin();
		double x_max = model.getXMax();
		double lower = x_min;
		double upper = x_max;
		if(config.enabled)
		{
			double[] extended = Extrapolator.extendedRange(model, config);
			lower = extended[0];
			upper = extended[1];
		}
		
		// classify valid pixels
		int valid = 0;
		int in_range = 0;
		int[] selected = new int[total];
		double[] measured = new double[total];
		int count = 0;
		for(int py = 0; py < height; ++py)
		{
			for(int px = 0; px < width; ++px)
			{
				int gray = ip.get(px, py);
				if(gray == conversion.invalid_value)
				{
					continue;
				}
				++valid;
				double d = conversion.grayToDistance((double)gray);
				if(d >= x_min && d <= x_max)
				{
					++in_range;
				}
				if(d >= lower && d <= upper)
				{
					selected[count] = py * width + px;
					measured[count] = d;
					++count;
				}
			}
		}
		
		if(count > 0)
		{
			double[] to_compensate = new double[count];
			System.arraycopy(measured, 0, to_compensate, 0, count);
			double[] compensated = compensate(to_compensate, model, config);
			for(int i = 0; i < count; ++i)
			{
				int gray = conversion.distanceToValidGray(compensated[i] + normalize_offset);
				result.set(selected[i] % width, selected[i] / width, gray);
			}
		}
		
		int extrapolated = config.enabled ? count - in_range : 0;
		return new CompensationOutcome(result, total, valid, in_range, extrapolated, count, config.enabled, normalize_offset);
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	/**
	 *	Offset that moves the center of the model's actual range to the target center
	 */
	public static double normalizationOffset(CompensationModel model, double target_center)
	{
		return target_center - (model.getYMin() + model.getYMax()) / 2.0;
	}
	
	public static double normalizationOffset(CompensationModel model, NormalizationConfig config)
	{
		if(config == null || !config.enabled)
		{
			return 0.0;
		}
		if(config.auto_offset)
		{
			return normalizationOffset(model, config.target_center);
		}
		return config.manual_offset;
	}
}
