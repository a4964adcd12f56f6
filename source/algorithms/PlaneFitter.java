package algorithms;

// import ImageJ classes
import ij.process.ImageProcessor;
import ij.process.FloatProcessor;

// import Jama classes
import Jama.LUDecomposition;
import Jama.Matrix;

// import own classes
import core.CalibrationResult;
import core.FilterConfig;
import core.InsufficientDataException;
import core.PlaneFitConfig;
import core.PlaneParameters;
import filters.FilterChain;
import filters.MaskFilter;

/**
 *	Least-squares plane fitting and tilt removal for depth regions
 */
public class PlaneFitter
{
	/**
	 *	Constructor
	 */
	public PlaneFitter()
	{
		/* do nothing */
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	/**
	 *	Fit z = a*x + b*y + c to the valid pixels of the region, with x and y the column and row index.
	 *	Coordinates are centred before building the normal equations to keep them well conditioned.
	 */
	public static PlaneParameters fitPlane(ImageProcessor roi, int invalid_value, int min_valid_pixels) throws InsufficientDataException
	{
		// first pass: count and centroid of valid pixels
		long count = 0;
		double sum_x = 0.0;
		double sum_y = 0.0;
		for(int py = 0; py < roi.getHeight(); ++py)
		{
			for(int px = 0; px < roi.getWidth(); ++px)
			{
				if(roi.getf(px, py) != invalid_value)
				{
					++count;
					sum_x += px;
					sum_y += py;
				}
			}
		}
		if(count < min_valid_pixels)
		{
			throw new InsufficientDataException("Insufficient valid pixels: " + count + " < " + min_valid_pixels);
		}
		double mean_x = sum_x / count;
		double mean_y = sum_y / count;
		
		// second pass: normal equations of [x, y, 1] * [a, b, c]' = z in centred coordinates
		double sxx = 0.0, sxy = 0.0, syy = 0.0, sx = 0.0, sy = 0.0;
		double sxz = 0.0, syz = 0.0, sz = 0.0;
		for(int py = 0; py < roi.getHeight(); ++py)
		{
			for(int px = 0; px < roi.getWidth(); ++px)
			{
				float pv = roi.getf(px, py);
				if(pv != invalid_value)
				{
					double x = px - mean_x;
					double y = py - mean_y;
					sxx += x * x;
					sxy += x * y;
					syy += y * y;
					sx += x;
					sy += y;
					sxz += x * pv;
					syz += y * pv;
					sz += pv;
				}
			}
		}
		Matrix ata = new Matrix(new double[][]{
			{sxx, sxy, sx},
			{sxy, syy, sy},
			{sx,  sy,  count}
		});
		Matrix atz = new Matrix(new double[][]{{sxz}, {syz}, {sz}});
		
		LUDecomposition lu = ata.lu();
		if(!lu.isNonsingular())
		{
			throw new InsufficientDataException("Valid pixels are collinear, plane is undetermined (" + count + " pixels)");
		}
		Matrix solution = lu.solve(atz);
		double a = solution.get(0, 0);
		double b = solution.get(1, 0);
		double c = solution.get(2, 0) - a * mean_x - b * mean_y;
		return new PlaneParameters(a, b, c);
	}
	
	/**
	 *	Per-pixel z - (a*x + b*y + c) over the whole grid, invalid pixels included
	 */
	public static FloatProcessor deviation(ImageProcessor roi, PlaneParameters plane)
	{
		FloatProcessor deviation = new FloatProcessor(roi.getWidth(), roi.getHeight());
		for(int py = 0; py < roi.getHeight(); ++py)
		{
			for(int px = 0; px < roi.getWidth(); ++px)
			{
				deviation.setf(px, py, (float)(roi.getf(px, py) - plane.valueAt(px, py)));
			}
		}
		return deviation;
	}
	
	/**
	 *	Peak-to-peak deviation over the valid pixels, NaN if there are none
	 */
	public static double flatness(ImageProcessor roi, PlaneParameters plane, int invalid_value)
	{
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for(int py = 0; py < roi.getHeight(); ++py)
		{
			for(int px = 0; px < roi.getWidth(); ++px)
			{
				float pv = roi.getf(px, py);
				if(pv != invalid_value)
				{
					// same float precision as the deviation map
					float d = (float)(pv - plane.valueAt(px, py));
					min = Math.min(min, d);
					max = Math.max(max, d);
				}
			}
		}
		return (min <= max) ? max - min : Double.NaN;
	}
	
	/**
	 *	Remove the tilt: deviation from the plane plus the plane's constant term. Invalid pixels keep the invalid value.
	 */
	public static FloatProcessor calibratePlane(ImageProcessor roi, PlaneParameters plane, int invalid_value)
	{
		FloatProcessor calibrated = deviation(roi, plane);
		for(int py = 0; py < roi.getHeight(); ++py)
		{
			for(int px = 0; px < roi.getWidth(); ++px)
			{
				if(roi.getf(px, py) == invalid_value)
				{
					calibrated.setf(px, py, invalid_value);
				}
				else
				{
					calibrated.setf(px, py, (float)(calibrated.getf(px, py) + plane.c));
				}
			}
		}
		return calibrated;
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public static CalibrationResult calibrateImage(ImageProcessor roi, FilterConfig filter_config, int invalid_value)
	{
		return calibrateImage(roi, filter_config.enabled, filter_config, invalid_value, new PlaneFitConfig());
	}
	
	public static CalibrationResult calibrateImage(ImageProcessor roi, FilterConfig filter_config, int invalid_value, PlaneFitConfig plane_config)
	{
		return calibrateImage(roi, filter_config.enabled, filter_config, invalid_value, plane_config);
	}
	
	/**
	 *	Full calibration pass: optional filter chain, valid pixel check (absolute count and ratio), plane fit,
	 *	flatness and tilt removal. Lack of data is reported as a failure result, never thrown.
	 */
	public static CalibrationResult calibrateImage(ImageProcessor roi, boolean filter_enabled, FilterConfig filter_config, int invalid_value, PlaneFitConfig plane_config)
	{
		int area = roi.getWidth() * roi.getHeight();
		if(area == 0)
		{
			return CalibrationResult.failure("Empty ROI: region lies outside the image");
		}
		
		// 1. filter
		ImageProcessor processed = filter_enabled ? FilterChain.run(roi, filter_config, invalid_value) : roi.duplicate();
		
		// 2. valid pixel check
		int valid_count = MaskFilter.validCount(processed, invalid_value);
		double valid_ratio = (double)valid_count / area;
		if(valid_count < plane_config.min_valid_pixels || valid_ratio < plane_config.min_valid_ratio)
		{
			return CalibrationResult.failure(String.format("Insufficient valid pixels: %d (%.2f%%), need %d and %.2f%%",
			                                 valid_count, 100.0 * valid_ratio, plane_config.min_valid_pixels, 100.0 * plane_config.min_valid_ratio));
		}
		
		// 3. plane fit
		PlaneParameters plane;
		try
		{
			plane = fitPlane(processed, invalid_value, plane_config.min_valid_pixels);
		}
		catch(InsufficientDataException e)
		{
			return CalibrationResult.failure(e.getMessage());
		}
		
		// 4. flatness and tilt removal
		double flatness = flatness(processed, plane, invalid_value);
		FloatProcessor calibrated = calibratePlane(processed, plane, invalid_value);
		FloatProcessor deviation = deviation(processed, plane);
		return CalibrationResult.success(plane, calibrated, flatness, deviation, filter_enabled ? processed : null);
	}
}
