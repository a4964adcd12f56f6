package plugins;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

// import ImageJ classes
import ij.IJ;
import ij.measure.ResultsTable;

import ij.plugin.PlugIn;
import ij.gui.GenericDialog;

import ij.Prefs;

// import own classes
import algorithms.CalibrationPipeline;
import core.BatchResult;
import core.CompensationModel;
import core.FilterConfig;
import core.ModelBuildResult;
import core.PlaneFitConfig;
import core.RegionOfInterest;
import utils.DepthConversion;
import utils.ModelIO;

/**
 *	Builds a compensation model from a calibration directory and saves it as JSON
 */
public class Build_Compensation_Model implements PlugIn
{
	/**
	 *	Constants
	 */
	public static final boolean DEFAULT_MINIMAL_FORMAT = true;
	
	// ////////////////////////////////////////////////////////////////////////
	
	public void run(String arg)
	{
		// ask for parameters
		GenericDialog gd = new GenericDialog("Build compensation model");
		gd.addDirectoryField("Calibration_directory", Prefs.get(DialogSettings.PREFS_PREFIX + "calibration_directory", ""));
		gd.addFileField("Model_file", Prefs.get(DialogSettings.PREFS_PREFIX + "model_file", "compensation_model.json"));
		gd.addCheckbox("Minimal_format", Prefs.get(DialogSettings.PREFS_PREFIX + "minimal_format", DEFAULT_MINIMAL_FORMAT));
		DialogSettings.addRegionFields(gd);
		DialogSettings.addFilterFields(gd);
		DialogSettings.addPlaneFitFields(gd);
		DialogSettings.addConversionFields(gd);
		
		gd.showDialog();
		if(gd.wasCanceled()) return;
		
		// retrieve parameters and save preferences
		String directory = gd.getNextString();
		String model_file = gd.getNextString();
		boolean minimal = gd.getNextBoolean();
		Prefs.set(DialogSettings.PREFS_PREFIX + "calibration_directory", directory);
		Prefs.set(DialogSettings.PREFS_PREFIX + "model_file", model_file);
		Prefs.set(DialogSettings.PREFS_PREFIX + "minimal_format", minimal);
		
		CalibrationPipeline.Calibration calibration;
		Path saved;
		try
		{
			RegionOfInterest roi = DialogSettings.readRegion(gd);
			FilterConfig filter_config = DialogSettings.readFilter(gd);
			PlaneFitConfig plane_fit_config = DialogSettings.readPlaneFit(gd);
			DepthConversion conversion = DialogSettings.readConversion(gd);
			CalibrationPipeline pipeline = new CalibrationPipeline(roi, filter_config, plane_fit_config, conversion);
			
			// execute calibration
			calibration = exec(pipeline, Paths.get(directory));
			if(!calibration.model.isSuccess())
			{
				IJ.error("Build compensation model", ((ModelBuildResult.Failure)calibration.model).reason);
				return;
			}
			saved = save(calibration, Paths.get(model_file), minimal);
		}
		catch(IOException e)
		{
			IJ.error("Build compensation model", e.getMessage());
			return;
		}
		catch(IllegalArgumentException e)
		{
			IJ.error("Build compensation model", e.getMessage());
			return;
		}
		
		// show results
		ResultsTable rt = new ResultsTable();
		for(CalibrationPipeline.Sample sample : calibration.samples.getResults())
		{
			rt.incrementCounter();
			rt.addValue("Image", sample.name);
			rt.addValue("Actual (mm)", sample.actual);
			rt.addValue("Measured (mm)", sample.measured);
		}
		rt.show("Calibration samples");
		
		CompensationModel model = calibration.model.getModel();
		IJ.log("Compensation model saved to " + saved);
		IJ.log("  " + model);
		IJ.log("  images used: " + calibration.samples.getProcessed() + "/" + calibration.samples.getTotal());
		for(BatchResult.ItemError error : calibration.samples.getErrors())
		{
			IJ.log("  skipped " + error);
		}
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public CalibrationPipeline.Calibration exec(CalibrationPipeline pipeline, Path directory) throws IOException
	{
		return pipeline.run(directory);
	}
	
	public Path save(CalibrationPipeline.Calibration calibration, Path model_file) throws IOException
	{
		return save(calibration, model_file, DEFAULT_MINIMAL_FORMAT);
	}
	
	/**
	 *	Write the model of a successful calibration; the minimal layout drops the forward curve and the raw pairs
	 */
	public Path save(CalibrationPipeline.Calibration calibration, Path model_file, boolean minimal) throws IOException
	{
		return ModelIO.save(calibration.model.getModel(), model_file, minimal);
	}
}
