package plugins;

// import ImageJ classes
import ij.IJ;
import ij.ImagePlus;
import ij.measure.ResultsTable;

import ij.plugin.PlugIn;
import ij.gui.GenericDialog;

// import own classes
import algorithms.CalibrationPipeline;
import core.CalibrationResult;
import core.FilterConfig;
import core.PlaneFitConfig;
import core.RegionOfInterest;
import utils.DepthConversion;

/**
 *	Plane calibration of the active 16-bit depth image: filters the ROI, fits and removes the plane,
 *	shows the calibrated ROI and reports plane, flatness and mean distance
 */
public class Plane_Calibration implements PlugIn
{
	public void run(String arg)
	{
		// get active image
		ImagePlus imp = IJ.getImage();
		if(null == imp) return;
		if(imp.getBitDepth() != 16)
		{
			IJ.error("Plane calibration", "A 16-bit depth image is required");
			return;
		}
		
		// ask for parameters
		GenericDialog gd = new GenericDialog("Plane calibration");
		DialogSettings.addRegionFields(gd);
		DialogSettings.addFilterFields(gd);
		DialogSettings.addPlaneFitFields(gd);
		DialogSettings.addConversionFields(gd);
		
		gd.showDialog();
		if(gd.wasCanceled()) return;
		
		// retrieve parameters and save preferences
		RegionOfInterest roi;
		FilterConfig filter_config;
		PlaneFitConfig plane_fit_config;
		DepthConversion conversion;
		try
		{
			roi = DialogSettings.readRegion(gd);
			filter_config = DialogSettings.readFilter(gd);
			plane_fit_config = DialogSettings.readPlaneFit(gd);
			conversion = DialogSettings.readConversion(gd);
		}
		catch(IllegalArgumentException e)
		{
			IJ.error("Plane calibration", e.getMessage());
			return;
		}
		
		// execute calibration
		CalibrationPipeline pipeline = new CalibrationPipeline(roi, filter_config, plane_fit_config, conversion);
		CalibrationResult result = exec(imp, pipeline);
		if(!result.isSuccess())
		{
			IJ.error("Plane calibration", ((CalibrationResult.Failure)result).reason);
			return;
		}
		CalibrationResult.Success success = result.asSuccess();
		
		// show results
		double mean_gray = success.meanValidValue(conversion.invalid_value);
		ResultsTable rt = ResultsTable.getResultsTable();
		rt.incrementCounter();
		rt.addValue("Image", imp.getTitle());
		rt.addValue("a", success.plane.a);
		rt.addValue("b", success.plane.b);
		rt.addValue("c", success.plane.c);
		rt.addValue("Flatness (gray)", success.flatness);
		rt.addValue("Flatness (mm)", success.flatness * conversion.quantizationStep());
		rt.addValue("Mean (gray)", mean_gray);
		rt.addValue("Mean (mm)", conversion.grayToDistance(mean_gray));
		rt.show("Results");
		
		new ImagePlus("Calibrated_" + imp.getTitle(), success.calibrated).show();
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public CalibrationResult exec(ImagePlus imp, CalibrationPipeline pipeline)
	{
		return pipeline.calibrate(imp.getProcessor());
	}
}
