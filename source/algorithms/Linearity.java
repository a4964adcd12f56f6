package algorithms;

// import Apache Commons Math classes
import org.apache.commons.math3.stat.regression.SimpleRegression;

// import own classes
import core.CompensationEffect;
import core.LinearityResult;

/**
 *	Best fit straight line (BFSL) linearity of measured against actual distances.
 *	Both sequences are made relative to their first element before the line is fitted.
 */
public class Linearity
{
	/**
	 *	Constants
	 */
	public static final double DEFAULT_FULL_SCALE = 41.0; // mm
	
	/**
	 *	Constructor
	 */
	public Linearity()
	{
		/* do nothing */
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public static LinearityResult calculate(double[] actual, double[] measured)
	{
		return calculate(actual, measured, DEFAULT_FULL_SCALE);
	}
	
	/**
	 *	@param full_scale full scale in mm, a non-positive value selects the default
	 *	@throws IllegalArgumentException for fewer than two points, a length mismatch, NaN/Inf values or constant actual values
	 */
	public static LinearityResult calculate(double[] actual, double[] measured, double full_scale)
	{
		validate(actual, measured);
		if(!(full_scale > 0.0))
		{
			full_scale = DEFAULT_FULL_SCALE;
		}
		
		int n = actual.length;
		double[] x = toRelative(actual);
		double[] y = toRelative(measured);
		
		SimpleRegression regression = new SimpleRegression(true);
		for(int i = 0; i < n; ++i)
		{
			regression.addData(x[i], y[i]);
		}
		double slope = regression.getSlope();
		double intercept = regression.getIntercept();
		
		// residuals
		double max_deviation = Double.NEGATIVE_INFINITY;
		double min_deviation = Double.POSITIVE_INFINITY;
		double ss_res = 0.0;
		double abs_sum = 0.0;
		double y_mean = 0.0;
		for(int i = 0; i < n; ++i)
		{
			double r = y[i] - (slope * x[i] + intercept);
			max_deviation = Math.max(max_deviation, r);
			min_deviation = Math.min(min_deviation, r);
			ss_res += r * r;
			abs_sum += Math.abs(r);
			y_mean += y[i];
		}
		y_mean /= n;
		double ss_tot = 0.0;
		for(int i = 0; i < n; ++i)
		{
			ss_tot += (y[i] - y_mean) * (y[i] - y_mean);
		}
		
		double abs_max_deviation = Math.max(Math.abs(max_deviation), Math.abs(min_deviation));
		double linearity = 100.0 * abs_max_deviation / full_scale;
		double rms_error = Math.sqrt(ss_res / n);
		double mae = abs_sum / n;
		double r_squared = (ss_tot != 0.0) ? 1.0 - ss_res / ss_tot : 0.0;
		
		return new LinearityResult(linearity, slope, intercept, max_deviation, min_deviation, abs_max_deviation, rms_error, mae, r_squared);
	}
	
	/**
	 *	Linearity before and after compensation over the same actual distances
	 */
	public static CompensationEffect compare(double[] actual, double[] measured, double[] compensated, double full_scale)
	{
		LinearityResult before = calculate(actual, measured, full_scale);
		LinearityResult after = calculate(actual, compensated, full_scale);
		return new CompensationEffect(before, after);
	}
	
	public static CompensationEffect compare(double[] actual, double[] measured, double[] compensated)
	{
		return compare(actual, measured, compensated, DEFAULT_FULL_SCALE);
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	/**
	 *	Values relative to the first element
	 */
	public static double[] toRelative(double[] values)
	{
		double[] relative = new double[values.length];
		for(int i = 0; i < values.length; ++i)
		{
			relative[i] = values[i] - values[0];
		}
		return relative;
	}
	
	private static void validate(double[] actual, double[] measured)
	{
		if(actual.length < 2)
		{
			throw new IllegalArgumentException("Insufficient data points: linear regression needs at least 2, got " + actual.length);
		}
		if(actual.length != measured.length)
		{
			throw new IllegalArgumentException("Length mismatch: " + actual.length + " actual values, " + measured.length + " measured values");
		}
		for(double v : actual)
		{
			if(Double.isNaN(v) || Double.isInfinite(v))
			{
				throw new IllegalArgumentException("Actual values contain NaN or Inf");
			}
		}
		for(double v : measured)
		{
			if(Double.isNaN(v) || Double.isInfinite(v))
			{
				throw new IllegalArgumentException("Measured values contain NaN or Inf");
			}
		}
		boolean constant = true;
		for(double v : actual)
		{
			if(v != actual[0])
			{
				constant = false;
				break;
			}
		}
		if(constant)
		{
			throw new IllegalArgumentException("All actual values are identical, linear regression is undefined");
		}
	}
}
