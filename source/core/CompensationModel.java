package core;

/**
 *	Durable artifact of a calibration run. The inverse spline maps measured distance to actual distance and is
 *	the only part needed to compensate images; the forward spline and the raw calibration pairs are kept for
 *	analysis when available. Instances are immutable and may be shared between threads.
 */
public class CompensationModel
{
	/**
	 *	Constants
	 */
	public static final String MODEL_TYPE = "cubic_spline";
	public static final String CURRENT_VERSION = "2.2";
	
	/**
	 *	Members
	 */
	private final BSpline inverse;
	private final BSpline forward; // may be null
	private final double[] x_range; // measured distance, {min, max}
	private final double[] y_range; // actual distance, {min, max}
	private final int calibration_points;
	private final String version;
	private final double[] actual_values; // may be null
	private final double[] measured_values; // may be null
	
	// ////////////////////////////////////////////////////////////////////////
	
	public CompensationModel(BSpline inverse, double x_min, double x_max, double y_min, double y_max, int calibration_points)
	{
		this(inverse, null, x_min, x_max, y_min, y_max, calibration_points, CURRENT_VERSION, null, null);
	}
	
	public CompensationModel(BSpline inverse, BSpline forward, double x_min, double x_max, double y_min, double y_max, int calibration_points, String version, double[] actual_values, double[] measured_values)
	{
		if(inverse == null)
		{
			throw new IllegalArgumentException("Inverse spline is required");
		}
		if((actual_values == null) != (measured_values == null))
		{
			throw new IllegalArgumentException("Calibration values must be given as complete (actual, measured) pairs");
		}
		if(actual_values != null && actual_values.length != measured_values.length)
		{
			throw new IllegalArgumentException("Calibration value count mismatch: " + actual_values.length + " actual, " + measured_values.length + " measured");
		}
		this.inverse = inverse;
		this.forward = forward;
		this.x_range = new double[]{x_min, x_max};
		this.y_range = new double[]{y_min, y_max};
		this.calibration_points = calibration_points;
		this.version = (version != null) ? version : CURRENT_VERSION;
		this.actual_values = (actual_values != null) ? actual_values.clone() : null;
		this.measured_values = (measured_values != null) ? measured_values.clone() : null;
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public BSpline getInverse()
	{
		return inverse;
	}
	
	public BSpline getForward()
	{
		return forward;
	}
	
	public boolean hasForward()
	{
		return forward != null;
	}
	
	public int getDegree()
	{
		return inverse.getDegree();
	}
	
	public double getXMin()
	{
		return x_range[0];
	}
	
	public double getXMax()
	{
		return x_range[1];
	}
	
	public double getYMin()
	{
		return y_range[0];
	}
	
	public double getYMax()
	{
		return y_range[1];
	}
	
	public int getCalibrationPoints()
	{
		return calibration_points;
	}
	
	public String getVersion()
	{
		return version;
	}
	
	public boolean hasCalibrationData()
	{
		return actual_values != null;
	}
	
	public double[] getActualValues()
	{
		return actual_values != null ? actual_values.clone() : null;
	}
	
	public double[] getMeasuredValues()
	{
		return measured_values != null ? measured_values.clone() : null;
	}
	
	public boolean inMeasuredRange(double value)
	{
		return value >= x_range[0] && value <= x_range[1];
	}
	
	@Override
	public String toString()
	{
		return String.format("CompensationModel{v%s, k=%d, points=%d, measured=[%.4f, %.4f], actual=[%.4f, %.4f], forward=%s}",
		                     version, getDegree(), calibration_points, x_range[0], x_range[1], y_range[0], y_range[1], hasForward());
	}
}
