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
import algorithms.Linearity;
import algorithms.LinearityEvaluation;
import core.InsufficientDataException;
import core.LinearityResult;
import utils.ModelIO;

/**
 *	Linearity of a test directory before and, with a model file, after compensation
 */
public class Depth_Linearity implements PlugIn
{
	public void run(String arg)
	{
		// ask for parameters
		GenericDialog gd = new GenericDialog("Depth linearity");
		gd.addDirectoryField("Test_directory", Prefs.get(DialogSettings.PREFS_PREFIX + "test_directory", ""));
		gd.addFileField("Model_file (optional)", Prefs.get(DialogSettings.PREFS_PREFIX + "linearity_model_file", ""));
		gd.addNumericField("Full_scale (mm)", Prefs.get(DialogSettings.PREFS_PREFIX + "full_scale", Linearity.DEFAULT_FULL_SCALE), 2);
		DialogSettings.addRegionFields(gd);
		DialogSettings.addFilterFields(gd);
		DialogSettings.addPlaneFitFields(gd);
		DialogSettings.addConversionFields(gd);
		
		gd.showDialog();
		if(gd.wasCanceled()) return;
		
		// retrieve parameters and save preferences
		String test_directory = gd.getNextString();
		String model_file = gd.getNextString().trim();
		double full_scale = gd.getNextNumber();
		Prefs.set(DialogSettings.PREFS_PREFIX + "test_directory", test_directory);
		Prefs.set(DialogSettings.PREFS_PREFIX + "linearity_model_file", model_file);
		Prefs.set(DialogSettings.PREFS_PREFIX + "full_scale", full_scale);
		
		LinearityEvaluation.Evaluation evaluation;
		try
		{
			CalibrationPipeline measurement = new CalibrationPipeline(DialogSettings.readRegion(gd), DialogSettings.readFilter(gd), DialogSettings.readPlaneFit(gd), DialogSettings.readConversion(gd));
			Path model_path = model_file.isEmpty() ? null : Paths.get(model_file);
			evaluation = exec(measurement, Paths.get(test_directory), model_path, full_scale);
		}
		catch(IOException e)
		{
			IJ.error("Depth linearity", e.getMessage());
			return;
		}
		catch(InsufficientDataException e)
		{
			IJ.error("Depth linearity", e.getMessage());
			return;
		}
		catch(IllegalArgumentException e)
		{
			IJ.error("Depth linearity", e.getMessage());
			return;
		}
		
		// show results
		ResultsTable rt = new ResultsTable();
		for(LinearityEvaluation.Row row : evaluation.rows.getResults())
		{
			rt.incrementCounter();
			rt.addValue("Image", row.name);
			rt.addValue("Actual (mm)", row.actual);
			rt.addValue("Measured (mm)", row.measured);
			if(evaluation.hasCompensation())
			{
				rt.addValue("Compensated (mm)", row.compensated);
			}
		}
		rt.show("Linearity samples");
		
		log("Before compensation", evaluation.before);
		if(evaluation.hasCompensation())
		{
			log("After compensation", evaluation.after);
			IJ.log(String.format("Improvement: %.2f%%", evaluation.improvement()));
		}
	}
	
	private static void log(String title, LinearityResult result)
	{
		IJ.log(title);
		IJ.log(String.format("  linearity: %.4f%%", result.linearity));
		IJ.log(String.format("  max deviation: %.6f mm", result.abs_max_deviation));
		IJ.log(String.format("  RMS error: %.6f mm", result.rms_error));
		IJ.log(String.format("  R squared: %.8f", result.r_squared));
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public LinearityEvaluation.Evaluation exec(CalibrationPipeline measurement, Path test_directory, Path model_file, double full_scale) throws IOException, InsufficientDataException
	{
		LinearityEvaluation evaluation = new LinearityEvaluation(measurement, full_scale, (model_file != null) ? ModelIO.load(model_file) : null);
		return evaluation.run(test_directory);
	}
}
