package algorithms;

import java.util.Arrays;
import java.util.Comparator;

// import own classes
import core.BSpline;
import core.CompensationModel;
import core.ModelBuildResult;

/**
 *	Builds a compensation model from (actual, measured) calibration pairs.
 *	<p>
 *	The spline degree is min(3, n - 1), so a small calibration set yields a lower order curve instead of
 *	an error; the degree is recorded in the model. Two curves are fitted: a forward curve over the pairs
 *	sorted by actual distance, and the inverse curve (measured to actual, used for compensation) over the
 *	pairs sorted by measured distance.
 */
public class CompensationModelBuilder
{
	/**
	 *	Constants
	 */
	public static final int DEFAULT_SPLINE_ORDER = 3;
	public static final int MIN_POINTS = 2;
	
	/**
	 *	Constructor
	 */
	public CompensationModelBuilder()
	{
		/* do nothing */
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public static int degreeFor(int point_count)
	{
		return degreeFor(point_count, DEFAULT_SPLINE_ORDER);
	}
	
	public static int degreeFor(int point_count, int spline_order)
	{
		return Math.min(spline_order, point_count - 1);
	}
	
	public static ModelBuildResult build(double[] actual, double[] measured)
	{
		return build(actual, measured, DEFAULT_SPLINE_ORDER);
	}
	
	public static ModelBuildResult build(double[] actual, double[] measured, int spline_order)
	{
		int k = degreeFor(actual.length, spline_order);
		String problem = validate(actual, measured, k);
		if(problem != null)
		{
			return ModelBuildResult.failure(problem);
		}
		
		int n = actual.length;
		Integer[] by_actual = sortedOrder(actual);
		Integer[] by_measured = sortedOrder(measured);
		
		double[] forward_x = new double[n];
		double[] forward_y = new double[n];
		double[] inverse_x = new double[n];
		double[] inverse_y = new double[n];
		for(int i = 0; i < n; ++i)
		{
			forward_x[i] = actual[by_actual[i]];
			forward_y[i] = measured[by_actual[i]];
			inverse_x[i] = measured[by_measured[i]];
			inverse_y[i] = actual[by_measured[i]];
		}
		
		BSpline forward;
		BSpline inverse;
		try
		{
			forward = SplineFitter.interpolate(forward_x, forward_y, k);
			inverse = SplineFitter.interpolate(inverse_x, inverse_y, k);
		}
		catch(IllegalArgumentException e)
		{
			return ModelBuildResult.failure("Spline fit failed: " + e.getMessage() + ". Check that the calibration data is monotonic and free of duplicates");
		}
		
		CompensationModel model = new CompensationModel(inverse, forward,
		                                                inverse_x[0], inverse_x[n-1],
		                                                forward_x[0], forward_x[n-1],
		                                                n, CompensationModel.CURRENT_VERSION,
		                                                actual, measured);
		return ModelBuildResult.success(model);
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	/**
	 *	First problem found in the calibration pairs, or null if they can be fitted
	 */
	static String validate(double[] actual, double[] measured, int k)
	{
		int min_points = Math.max(MIN_POINTS, k + 1);
		if(actual.length < min_points)
		{
			return "Insufficient calibration points: need at least " + min_points + ", got " + actual.length;
		}
		if(actual.length != measured.length)
		{
			return "Length mismatch: " + actual.length + " actual values, " + measured.length + " measured values";
		}
		if(!allFinite(actual))
		{
			return "Actual values contain NaN or Inf";
		}
		if(!allFinite(measured))
		{
			return "Measured values contain NaN or Inf";
		}
		if(hasDuplicates(actual))
		{
			return "Actual values contain duplicates, spline sites must be unique";
		}
		if(hasDuplicates(measured))
		{
			return "Measured values contain duplicates, spline sites must be unique";
		}
		return null;
	}
	
	private static boolean allFinite(double[] values)
	{
		for(double v : values)
		{
			if(Double.isNaN(v) || Double.isInfinite(v)) return false;
		}
		return true;
	}
	
	private static boolean hasDuplicates(double[] values)
	{
		double[] sorted = values.clone();
		Arrays.sort(sorted);
		for(int i = 1; i < sorted.length; ++i)
		{
			if(sorted[i] == sorted[i-1]) return true;
		}
		return false;
	}
	
	private static Integer[] sortedOrder(final double[] values)
	{
		Integer[] order = new Integer[values.length];
		for(int i = 0; i < order.length; ++i)
		{
			order[i] = i;
		}
		Arrays.sort(order, new Comparator<Integer>()
		{
			@Override
			public int compare(Integer a, Integer b)
			{
				return Double.compare(values[a], values[b]);
			}
		});
		return order;
	}
}
