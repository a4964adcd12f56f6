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
import algorithms.CompensationBatch;
import core.BatchResult;
import core.CompensationOutcome;
import core.ExtrapolationConfig;
import core.NormalizationConfig;
import utils.DepthConversion;
import utils.ModelIO;

/**
 *	Compensates every depth image of a directory with a saved model
 */
public class Compensate_Depth_Images implements PlugIn
{
	public void run(String arg)
	{
		// ask for parameters
		GenericDialog gd = new GenericDialog("Compensate depth images");
		gd.addFileField("Model_file", Prefs.get(DialogSettings.PREFS_PREFIX + "model_file", "compensation_model.json"));
		gd.addDirectoryField("Input_directory", Prefs.get(DialogSettings.PREFS_PREFIX + "input_directory", ""));
		gd.addDirectoryField("Output_directory", Prefs.get(DialogSettings.PREFS_PREFIX + "output_directory", ""));
		DialogSettings.addExtrapolationFields(gd);
		DialogSettings.addNormalizationFields(gd);
		DialogSettings.addConversionFields(gd);
		
		gd.showDialog();
		if(gd.wasCanceled()) return;
		
		// retrieve parameters and save preferences
		String model_file = gd.getNextString();
		String input_directory = gd.getNextString();
		String output_directory = gd.getNextString();
		Prefs.set(DialogSettings.PREFS_PREFIX + "model_file", model_file);
		Prefs.set(DialogSettings.PREFS_PREFIX + "input_directory", input_directory);
		Prefs.set(DialogSettings.PREFS_PREFIX + "output_directory", output_directory);
		
		CompensationBatch.Summary summary;
		try
		{
			ExtrapolationConfig extrapolation_config = DialogSettings.readExtrapolation(gd);
			NormalizationConfig normalization_config = DialogSettings.readNormalization(gd);
			DepthConversion conversion = DialogSettings.readConversion(gd);
			summary = exec(Paths.get(model_file), Paths.get(input_directory), Paths.get(output_directory), extrapolation_config, normalization_config, conversion);
		}
		catch(IOException e)
		{
			IJ.error("Compensate depth images", e.getMessage());
			return;
		}
		catch(IllegalArgumentException e)
		{
			IJ.error("Compensate depth images", e.getMessage());
			return;
		}
		
		// show results
		ResultsTable rt = new ResultsTable();
		for(CompensationBatch.CompensatedImage image : summary.images.getResults())
		{
			CompensationOutcome outcome = image.outcome;
			rt.incrementCounter();
			rt.addValue("Image", image.name);
			rt.addValue("Valid", outcome.valid_pixels);
			rt.addValue("In range", outcome.in_range_pixels);
			rt.addValue("Extrapolated", outcome.extrapolated_pixels);
			rt.addValue("Out of range", outcome.out_of_range_pixels);
			rt.addValue("Rate (%)", outcome.compensationRate());
		}
		rt.show("Compensation");
		
		IJ.log(String.format("Compensated %d/%d images, average compensation rate %.2f%%", summary.images.getProcessed(), summary.images.getTotal(), summary.averageCompensationRate()));
		for(BatchResult.ItemError error : summary.images.getErrors())
		{
			IJ.log("  failed " + error);
		}
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public CompensationBatch.Summary exec(Path model_file, Path input_directory, Path output_directory, ExtrapolationConfig extrapolation_config, NormalizationConfig normalization_config, DepthConversion conversion) throws IOException
	{
		CompensationBatch batch = new CompensationBatch(ModelIO.load(model_file), extrapolation_config, normalization_config, conversion);
		if(batch.getNormalizeOffset() != 0.0)
		{
			IJ.log(String.format("Normalization offset %.4f mm", batch.getNormalizeOffset()));
		}
		return batch.run(input_directory, output_directory);
	}
}
