package core;

// import ImageJ classes
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

/**
 *	Outcome of one plane calibration pass: either a {@link Success} carrying the fitted plane and
 *	the tilt-free region, or a {@link Failure} carrying a human readable reason.
 */
public abstract class CalibrationResult
{
	private CalibrationResult()
	{
		/* closed hierarchy */
	}
	
	public abstract boolean isSuccess();
	
	public Success asSuccess()
	{
		throw new IllegalStateException("Calibration failed: " + ((Failure)this).reason);
	}
	
	public static Success success(PlaneParameters plane, FloatProcessor calibrated, double flatness, FloatProcessor deviation, ImageProcessor filtered)
	{
		return new Success(plane, calibrated, flatness, deviation, filtered);
	}
	
	public static Failure failure(String reason)
	{
		return new Failure(reason);
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public static final class Success extends CalibrationResult
	{
		public final PlaneParameters plane;
		public final FloatProcessor calibrated;
		public final double flatness; // NaN when undefined
		public final FloatProcessor deviation;
		public final ImageProcessor filtered; // null when the filter chain was not applied
		
		private Success(PlaneParameters plane, FloatProcessor calibrated, double flatness, FloatProcessor deviation, ImageProcessor filtered)
		{
			this.plane = plane;
			this.calibrated = calibrated;
			this.flatness = flatness;
			this.deviation = deviation;
			this.filtered = filtered;
		}
		
		@Override
		public boolean isSuccess()
		{
			return true;
		}
		
		@Override
		public Success asSuccess()
		{
			return this;
		}
		
		/**
		 *	Mean gray value of the valid pixels of the calibrated region, NaN if there are none
		 */
		public double meanValidValue(int invalid_value)
		{
			double sum = 0.0;
			long count = 0;
			float[] pixels = (float[])calibrated.getPixels();
			for(int i = 0; i < pixels.length; ++i)
			{
				if(pixels[i] != invalid_value)
				{
					sum += pixels[i];
					++count;
				}
			}
			return count > 0 ? sum / count : Double.NaN;
		}
		
		@Override
		public String toString()
		{
			return "CalibrationResult.Success{" + plane + ", flatness=" + flatness + "}";
		}
	}
	
	public static final class Failure extends CalibrationResult
	{
		public final String reason;
		
		private Failure(String reason)
		{
			this.reason = reason;
		}
		
		@Override
		public boolean isSuccess()
		{
			return false;
		}
		
		@Override
		public String toString()
		{
			return "CalibrationResult.Failure{" + reason + "}";
		}
	}
}
