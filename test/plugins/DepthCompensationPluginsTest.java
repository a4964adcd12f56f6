package plugins;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

// import ImageJ classes
import ij.ImagePlus;
import ij.process.ShortProcessor;

// import own classes
import algorithms.CalibrationPipeline;
import algorithms.CompensationBatch;
import algorithms.LinearityEvaluation;
import core.CalibrationResult;
import core.CompensationModel;
import core.ExtrapolationConfig;
import core.FilterConfig;
import core.InsufficientDataException;
import core.NormalizationConfig;
import utils.DepthConversion;
import utils.DepthImageIO;
import utils.ModelIO;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 *	Calibrate, save, compensate and evaluate through the plugin entry points
 */
class DepthCompensationPluginsTest
{
	private static final double[] ACTUAL = {0, 5, 10, 15, 20, 25, 30, 35, 40};
	private static final double[] MEASURED = {0.3, 5.1, 9.8, 14.7, 19.9, 25.2, 30.4, 35.1, 39.8};
	private static final DepthConversion CONVERSION = new DepthConversion();
	
	@TempDir
	Path dir;
	
	private static ShortProcessor flat(double distance)
	{
		ShortProcessor ip = new ShortProcessor(16, 16);
		ip.set(CONVERSION.distanceToGray(distance));
		return ip;
	}
	
	private Path writeCalibrationSet() throws IOException
	{
		Path calibration = dir.resolve("calibration");
		StringBuilder csv = new StringBuilder("displacement\n");
		for(int i = 0; i < ACTUAL.length; ++i)
		{
			csv.append(ACTUAL[i]).append('\n');
			DepthImageIO.write(flat(MEASURED[i]), calibration.resolve("frame_" + (i + 1) + ".tif"));
		}
		Files.write(calibration.resolve("displacement.csv"), csv.toString().getBytes(StandardCharsets.UTF_8));
		return calibration;
	}
	
	@Test
	void planeCalibration_onActiveImage()
	{
		CalibrationResult result = new Plane_Calibration().exec(new ImagePlus("flat", flat(20.0)), new CalibrationPipeline());
		assertTrue(result.isSuccess());
		assertEquals(0.0, result.asSuccess().flatness, 1e-3);
	}
	
	@Test
	void buildModel_savesMinimalLayoutByDefault() throws IOException
	{
		Path calibration_directory = writeCalibrationSet();
		Build_Compensation_Model builder = new Build_Compensation_Model();
		CalibrationPipeline.Calibration calibration = builder.exec(new CalibrationPipeline(null, FilterConfig.disabled(), null, null), calibration_directory);
		
		Path model_file = builder.save(calibration, dir.resolve("default_model.json"));
		CompensationModel loaded = ModelIO.load(model_file);
		assertFalse(loaded.hasForward());
		assertFalse(loaded.hasCalibrationData());
		assertEquals(9, loaded.getCalibrationPoints());
	}
	
	@Test
	void calibrateCompensateEvaluate() throws IOException, InsufficientDataException
	{
		Path calibration_directory = writeCalibrationSet();
		CalibrationPipeline pipeline = new CalibrationPipeline(null, FilterConfig.disabled(), null, null);
		
		CalibrationPipeline.Calibration calibration = new Build_Compensation_Model().exec(pipeline, calibration_directory);
		assertTrue(calibration.model.isSuccess());
		Build_Compensation_Model builder = new Build_Compensation_Model();
		Path model_file = builder.save(calibration, dir.resolve("models/depth_model"), false);
		assertTrue(ModelIO.load(model_file).hasForward());
		
		Path input = dir.resolve("scans");
		DepthImageIO.write(flat(19.9), input.resolve("scan_1.tif"));
		CompensationBatch.Summary summary = new Compensate_Depth_Images().exec(model_file, input, dir.resolve("compensated"),
		                                                                       new ExtrapolationConfig(), new NormalizationConfig(), CONVERSION);
		assertEquals(1, summary.images.getProcessed());
		assertEquals(100.0, summary.averageCompensationRate(), 1e-9);
		double compensated = CONVERSION.grayToDistance((double)DepthImageIO.read(dir.resolve("compensated/scan_1.tif")).get(0, 0));
		assertEquals(20.0, compensated, 0.01);
		
		LinearityEvaluation.Evaluation evaluation = new Depth_Linearity().exec(pipeline, calibration_directory, model_file, 41.0);
		assertTrue(evaluation.hasCompensation());
		assertTrue(evaluation.after.linearity < evaluation.before.linearity);
	}
}
