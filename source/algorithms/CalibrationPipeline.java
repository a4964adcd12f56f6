package algorithms;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

// import ImageJ classes
import ij.IJ;
import ij.process.ImageProcessor;

// import own classes
import core.BatchResult;
import core.CalibrationResult;
import core.FilterConfig;
import core.InsufficientDataException;
import core.ModelBuildResult;
import core.PlaneFitConfig;
import core.RegionOfInterest;
import utils.CalibrationDataset;
import utils.DepthConversion;
import utils.DepthImageIO;
import utils.Profiling;

/**
 *	Builds a compensation model from a calibration directory. Every image is reduced to one measured
 *	distance: the ROI is filtered, its tilt removed by a plane fit, and the mean of the valid calibrated
 *	pixels converted to mm. Images that fail are skipped and reported.
 */
public class CalibrationPipeline
{
	/**
	 *	Constants
	 */
	public static final int MIN_USABLE_IMAGES = 4;
	
	/**
	 *	One calibration exposure reduced to an (actual, measured) pair
	 */
	public static class Sample
	{
		public final String name;
		public final double actual;
		public final double measured;
		
		public Sample(String name, double actual, double measured)
		{
			this.name = name;
			this.actual = actual;
			this.measured = measured;
		}
		
		@Override
		public String toString()
		{
			return name + ": actual=" + actual + " mm, measured=" + measured + " mm";
		}
	}
	
	/**
	 *	Samples of a calibration run together with the model built from them
	 */
	public static class Calibration
	{
		public final BatchResult<Sample> samples;
		public final ModelBuildResult model;
		
		public Calibration(BatchResult<Sample> samples, ModelBuildResult model)
		{
			this.samples = samples;
			this.model = model;
		}
		
		public double[] actualValues()
		{
			List<Sample> list = samples.getResults();
			double[] values = new double[list.size()];
			for(int i = 0; i < values.length; ++i)
			{
				values[i] = list.get(i).actual;
			}
			return values;
		}
		
		public double[] measuredValues()
		{
			List<Sample> list = samples.getResults();
			double[] values = new double[list.size()];
			for(int i = 0; i < values.length; ++i)
			{
				values[i] = list.get(i).measured;
			}
			return values;
		}
	}
	
	/**
	 *	Members
	 */
	public final RegionOfInterest roi;
	public final FilterConfig filter_config;
	public final PlaneFitConfig plane_fit_config;
	public final DepthConversion conversion;
	
	// ////////////////////////////////////////////////////////////////////////
	
	public CalibrationPipeline()
	{
		this(RegionOfInterest.FULL_IMAGE, new FilterConfig(), new PlaneFitConfig(), new DepthConversion());
	}
	
	public CalibrationPipeline(RegionOfInterest roi, FilterConfig filter_config, PlaneFitConfig plane_fit_config, DepthConversion conversion)
	{
		this.roi = (roi != null) ? roi : RegionOfInterest.FULL_IMAGE;
		this.filter_config = (filter_config != null) ? filter_config : new FilterConfig();
		this.plane_fit_config = (plane_fit_config != null) ? plane_fit_config : new PlaneFitConfig();
		this.conversion = (conversion != null) ? conversion : new DepthConversion();
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	/**
	 *	Plane calibration of the configured ROI of one depth image
	 */
	public CalibrationResult calibrate(ImageProcessor ip)
	{
		if(roi.isEmpty(ip))
		{
			return CalibrationResult.failure("Empty ROI: " + roi + " lies outside the " + ip.getWidth() + "x" + ip.getHeight() + " image");
		}
		ImageProcessor region = roi.extract(ip);
		return PlaneFitter.calibrateImage(region, filter_config.enabled, filter_config, conversion.invalid_value, plane_fit_config);
	}
	
	/**
	 *	Mean measured distance in mm of one depth image
	 *
	 *	@throws InsufficientDataException with the failure reason when the image cannot be calibrated
	 */
	public double measure(ImageProcessor ip) throws InsufficientDataException
	{
		CalibrationResult result = calibrate(ip);
		if(!result.isSuccess())
		{
			throw new InsufficientDataException(((CalibrationResult.Failure)result).reason);
		}
		double mean_gray = result.asSuccess().meanValidValue(conversion.invalid_value);
		if(Double.isNaN(mean_gray))
		{
			throw new InsufficientDataException("No valid pixels after plane calibration");
		}
		return conversion.grayToDistance(mean_gray);
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public Calibration run(Path directory) throws IOException
	{
		return run(CalibrationDataset.open(directory));
	}
	
	/**
	 *	Measure every paired image of the dataset and build the model. Fewer than four usable images
	 *	yields a failed model build.
	 */
	public Calibration run(CalibrationDataset dataset)
	{
		Profiling timer = Profiling.tic("Calibration of " + dataset.directory);
		int total = dataset.size();
		List<Sample> samples = new ArrayList<Sample>();
		List<BatchResult.ItemError> errors = new ArrayList<BatchResult.ItemError>();
		
		for(int i = 0; i < total; ++i)
		{
			Path path = dataset.image(i);
			String name = path.getFileName().toString();
			IJ.showStatus("Calibrating " + name + " (" + (i + 1) + "/" + total + ")");
			IJ.showProgress(i, total);
			try
			{
				double measured = measure(DepthImageIO.read(path));
				samples.add(new Sample(name, dataset.displacement(i), measured));
			}
			catch(IOException e)
			{
				errors.add(new BatchResult.ItemError(name, e.getMessage()));
			}
			catch(InsufficientDataException e)
			{
				errors.add(new BatchResult.ItemError(name, e.getMessage()));
			}
		}
		IJ.showProgress(1.0);
		
		BatchResult<Sample> batch = new BatchResult<Sample>(total, samples, errors);
		for(BatchResult.ItemError error : errors)
		{
			IJ.log("Skipped " + error);
		}
		
		ModelBuildResult model;
		if(samples.size() < MIN_USABLE_IMAGES)
		{
			model = ModelBuildResult.failure("Insufficient usable calibration images: " + samples.size() + " < " + MIN_USABLE_IMAGES);
		}
		else
		{
			Calibration partial = new Calibration(batch, null);
			model = CompensationModelBuilder.build(partial.actualValues(), partial.measuredValues());
		}
		timer.toc();
		IJ.showStatus("Calibration done: " + samples.size() + "/" + total + " images usable");
		return new Calibration(batch, model);
	}
}
