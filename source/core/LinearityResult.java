package core;

/**
 *	Best-fit-straight-line linearity figures. Deviations are in the unit of the input values (mm).
 */
public class LinearityResult
{
	public final double linearity; // percent of full scale
	public final double slope;
	public final double intercept;
	public final double max_deviation;
	public final double min_deviation;
	public final double abs_max_deviation;
	public final double rms_error;
	public final double mae;
	public final double r_squared;
	
	public LinearityResult(double linearity, double slope, double intercept, double max_deviation, double min_deviation, double abs_max_deviation, double rms_error, double mae, double r_squared)
	{
		this.linearity = linearity;
		this.slope = slope;
		this.intercept = intercept;
		this.max_deviation = max_deviation;
		this.min_deviation = min_deviation;
		this.abs_max_deviation = abs_max_deviation;
		this.rms_error = rms_error;
		this.mae = mae;
		this.r_squared = r_squared;
	}
	
	@Override
	public String toString()
	{
		return String.format("Linearity{%.4f%%, slope=%.6f, intercept=%.6f, max_dev=%.6f, rms=%.6f, R2=%.8f}",
		                     linearity, slope, intercept, abs_max_deviation, rms_error, r_squared);
	}
}
