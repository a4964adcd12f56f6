package algorithms;

// import own classes
import core.BSpline;
import core.CompensationModel;
import core.ExtrapolationConfig;

/**
 *	Evaluates the inverse spline of a compensation model with bounded linear extrapolation beyond the
 *	knot domain [t[k], t[n-k-1]]. Below the domain the value is continued along the tangent at the lower
 *	boundary, above it along the tangent at the upper boundary; the extrapolation distance is capped by
 *	the configured maximum on each side.
 */
public class Extrapolator
{
	/**
	 *	Extrapolation statistics for a set of measured distances
	 */
	public static class Statistics
	{
		public final int total_count;
		public final int in_range_count;
		public final int below_range_count;
		public final int above_range_count;
		public final double below_range_max_distance;
		public final double above_range_max_distance;
		
		public Statistics(int total_count, int in_range_count, int below_range_count, int above_range_count, double below_range_max_distance, double above_range_max_distance)
		{
			this.total_count = total_count;
			this.in_range_count = in_range_count;
			this.below_range_count = below_range_count;
			this.above_range_count = above_range_count;
			this.below_range_max_distance = below_range_max_distance;
			this.above_range_max_distance = above_range_max_distance;
		}
		
		@Override
		public String toString()
		{
			return "Statistics[total=" + total_count + ", in_range=" + in_range_count + ", below=" + below_range_count + " (max " + below_range_max_distance + " mm), above=" + above_range_count + " (max " + above_range_max_distance + " mm)]";
		}
	}
	
	/**
	 *	Constructor
	 */
	public Extrapolator()
	{
		/* do nothing */
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public static double apply(double measured, CompensationModel model, ExtrapolationConfig config)
	{
		return apply(new double[]{measured}, model, config)[0];
	}
	
	public static double[] apply(double[] measured, CompensationModel model, ExtrapolationConfig config)
	{
		if(config == null)
		{
			config = new ExtrapolationConfig();
		}
		
		BSpline spline = model.getInverse();
		double x_min = spline.domainMin();
		double x_max = spline.domainMax();
		
		// boundary values and slopes
		BSpline slope_spline = spline.derivative();
		double y_low = spline.evaluate(x_min);
		double y_high = spline.evaluate(x_max);
		double slope_low = slope_spline.evaluate(x_min);
		double slope_high = slope_spline.evaluate(x_max);
		
		double[] result = new double[measured.length];
		for(int i = 0; i < measured.length; ++i)
		{
			double v = measured[i];
			double y;
			if(v < x_min)
			{
				y = y_low - slope_low * Math.min(x_min - v, config.max_low);
			}
			else if(v > x_max)
			{
				y = y_high + slope_high * Math.min(v - x_max, config.max_high);
			}
			else
			{
				y = spline.evaluate(v);
			}
			
			if(config.clamp_output)
			{
				y = clamp(y, config.output_min, config.output_max);
			}
			result[i] = y;
		}
		return result;
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	/**
	 *	Measured distance range that is compensated when extrapolation is enabled
	 */
	public static double[] extendedRange(CompensationModel model, ExtrapolationConfig config)
	{
		return new double[]{model.getXMin() - config.max_low, model.getXMax() + config.max_high};
	}
	
	public static Statistics statistics(double[] measured, CompensationModel model)
	{
		double x_min = model.getXMin();
		double x_max = model.getXMax();
		
		int in_range = 0;
		int below = 0;
		int above = 0;
		double below_max = 0.0;
		double above_max = 0.0;
		for(double v : measured)
		{
			if(v < x_min)
			{
				++below;
				below_max = Math.max(below_max, x_min - v);
			}
			else if(v > x_max)
			{
				++above;
				above_max = Math.max(above_max, v - x_max);
			}
			else if(v >= x_min && v <= x_max)
			{
				++in_range;
			}
		}
		return new Statistics(measured.length, in_range, below, above, below_max, above_max);
	}
	
	static double clamp(double v, double min, double max)
	{
		return Math.max(min, Math.min(max, v));
	}
}
