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
import algorithms.Repeatability;
import core.InsufficientDataException;
import utils.ModelIO;

/**
 *	Depth repeatability over a directory of repeated exposures of the same target
 */
public class Depth_Repeatability implements PlugIn
{
	public void run(String arg)
	{
		// ask for parameters
		GenericDialog gd = new GenericDialog("Depth repeatability");
		gd.addDirectoryField("Image_directory", Prefs.get(DialogSettings.PREFS_PREFIX + "repeatability_directory", ""));
		gd.addFileField("Model_file (optional)", Prefs.get(DialogSettings.PREFS_PREFIX + "repeatability_model_file", ""));
		DialogSettings.addRegionFields(gd);
		DialogSettings.addFilterFields(gd);
		DialogSettings.addPlaneFitFields(gd);
		DialogSettings.addConversionFields(gd);
		DialogSettings.addExtrapolationFields(gd);
		
		gd.showDialog();
		if(gd.wasCanceled()) return;
		
		// retrieve parameters and save preferences
		String image_directory = gd.getNextString();
		String model_file = gd.getNextString().trim();
		Prefs.set(DialogSettings.PREFS_PREFIX + "repeatability_directory", image_directory);
		Prefs.set(DialogSettings.PREFS_PREFIX + "repeatability_model_file", model_file);
		
		Repeatability.Result result;
		try
		{
			Repeatability repeatability = new Repeatability(DialogSettings.readRegion(gd),
			                                                DialogSettings.readFilter(gd),
			                                                DialogSettings.readPlaneFit(gd),
			                                                DialogSettings.readConversion(gd),
			                                                model_file.isEmpty() ? null : ModelIO.load(Paths.get(model_file)),
			                                                DialogSettings.readExtrapolation(gd));
			result = exec(repeatability, Paths.get(image_directory));
		}
		catch(IOException e)
		{
			IJ.error("Depth repeatability", e.getMessage());
			return;
		}
		catch(InsufficientDataException e)
		{
			IJ.error("Depth repeatability", e.getMessage());
			return;
		}
		catch(IllegalArgumentException e)
		{
			IJ.error("Depth repeatability", e.getMessage());
			return;
		}
		
		// show results
		ResultsTable rt = new ResultsTable();
		for(Repeatability.ImageStatistics stats : result.images.getResults())
		{
			rt.incrementCounter();
			rt.addValue("Image", stats.name);
			rt.addValue("Mean (mm)", stats.mean);
			rt.addValue("Std (mm)", stats.std);
			rt.addValue("Min (mm)", stats.min);
			rt.addValue("Max (mm)", stats.max);
			rt.addValue("Valid", stats.valid_count);
			rt.addValue("Valid (%)", stats.valid_ratio);
		}
		rt.show("Repeatability samples");
		
		IJ.log(String.format("Mean depth: %.6f mm", result.mean_depth));
		IJ.log(String.format("Std (1 sigma): %.6f mm", result.std_1sigma));
		IJ.log(String.format("Repeatability (+/-3 sigma): %.6f mm", result.repeatability_3sigma));
		IJ.log(String.format("Repeatability (6 sigma): %.6f mm", result.repeatability_6sigma));
		IJ.log(String.format("Peak to peak: %.6f mm", result.peak_to_peak));
		IJ.log(String.format("Mean intra-image std: %.6f mm", result.avg_intra_image_std));
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public Repeatability.Result exec(Repeatability repeatability, Path image_directory) throws IOException, InsufficientDataException
	{
		return repeatability.run(image_directory);
	}
}
