package algorithms;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

// import ImageJ classes
import ij.IJ;
import ij.process.ImageProcessor;

// import Apache Commons Math classes
import org.apache.commons.math3.stat.StatUtils;

// import own classes
import core.BatchResult;
import core.CalibrationResult;
import core.CompensationModel;
import core.ExtrapolationConfig;
import core.FilterConfig;
import core.InsufficientDataException;
import core.PlaneFitConfig;
import core.RegionOfInterest;
import filters.MaskFilter;
import utils.CalibrationDataset;
import utils.DepthConversion;
import utils.DepthImageIO;

/**
 *	Depth repeatability over repeated exposures of the same target. Each image is reduced to the mean
 *	distance of its (filtered, plane calibrated) ROI; the spread of these means is the repeatability.
 *	With a model set, every valid pixel is compensated before the statistics are taken.
 */
public class Repeatability
{
	/**
	 *	Statistics of one image in mm
	 */
	public static class ImageStatistics
	{
		public final String name;
		public final double mean;
		public final double std; // population
		public final double min;
		public final double max;
		public final int valid_count;
		public final double valid_ratio; // percent of the ROI
		
		public ImageStatistics(String name, double mean, double std, double min, double max, int valid_count, double valid_ratio)
		{
			this.name = name;
			this.mean = mean;
			this.std = std;
			this.min = min;
			this.max = max;
			this.valid_count = valid_count;
			this.valid_ratio = valid_ratio;
		}
	}
	
	public static class Result
	{
		public final BatchResult<ImageStatistics> images;
		public final double mean_depth;
		public final double std_1sigma;
		public final double repeatability_3sigma;
		public final double repeatability_6sigma;
		public final double peak_to_peak;
		public final double avg_intra_image_std;
		
		public Result(BatchResult<ImageStatistics> images)
		{
			this.images = images;
			double[] means = new double[images.getProcessed()];
			double[] stds = new double[means.length];
			for(int i = 0; i < means.length; ++i)
			{
				means[i] = images.getResults().get(i).mean;
				stds[i] = images.getResults().get(i).std;
			}
			this.mean_depth = StatUtils.mean(means);
			this.std_1sigma = Math.sqrt(StatUtils.variance(means));
			this.repeatability_3sigma = 3.0 * std_1sigma;
			this.repeatability_6sigma = 6.0 * std_1sigma;
			this.peak_to_peak = StatUtils.max(means) - StatUtils.min(means);
			this.avg_intra_image_std = StatUtils.mean(stds);
		}
		
		public int imageCount()
		{
			return images.getProcessed();
		}
		
		@Override
		public String toString()
		{
			return String.format("Repeatability{images=%d, mean=%.6f mm, 1sigma=%.6f mm, 3sigma=%.6f mm, 6sigma=%.6f mm, p-p=%.6f mm}",
			                     imageCount(), mean_depth, std_1sigma, repeatability_3sigma, repeatability_6sigma, peak_to_peak);
		}
	}
	
	/**
	 *	Members
	 */
	public final RegionOfInterest roi;
	public final FilterConfig filter_config;
	public final PlaneFitConfig plane_fit_config;
	public final DepthConversion conversion;
	public final CompensationModel model; // may be null
	public final ExtrapolationConfig extrapolation_config;
	
	// ////////////////////////////////////////////////////////////////////////
	
	public Repeatability()
	{
		this(RegionOfInterest.FULL_IMAGE, new FilterConfig(), new PlaneFitConfig(), new DepthConversion(), null, null);
	}
	
	public Repeatability(RegionOfInterest roi, FilterConfig filter_config, PlaneFitConfig plane_fit_config, DepthConversion conversion, CompensationModel model, ExtrapolationConfig extrapolation_config)
	{
		this.roi = (roi != null) ? roi : RegionOfInterest.FULL_IMAGE;
		this.filter_config = (filter_config != null) ? filter_config : new FilterConfig();
		this.plane_fit_config = (plane_fit_config != null) ? plane_fit_config : new PlaneFitConfig();
		this.conversion = (conversion != null) ? conversion : new DepthConversion();
		this.model = model;
		this.extrapolation_config = (extrapolation_config != null) ? extrapolation_config : new ExtrapolationConfig();
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	/**
	 *	Statistics of one depth image. When filtering is enabled the plane calibrated ROI is used if the
	 *	calibration succeeds, the raw ROI otherwise.
	 *
	 *	@throws InsufficientDataException if the ROI lies outside the image or has no valid pixels
	 */
	public ImageStatistics measure(String name, ImageProcessor ip) throws InsufficientDataException
	{
		if(roi.isEmpty(ip))
		{
			throw new InsufficientDataException("Empty ROI: " + roi + " lies outside the " + ip.getWidth() + "x" + ip.getHeight() + " image");
		}
		ImageProcessor region = roi.extract(ip);
		ImageProcessor values = region;
		if(filter_config.enabled)
		{
			CalibrationResult result = PlaneFitter.calibrateImage(region, true, filter_config, conversion.invalid_value, plane_fit_config);
			if(result.isSuccess())
			{
				values = result.asSuccess().calibrated;
			}
		}
		
		double[] grays = MaskFilter.validValues(values, conversion.invalid_value);
		if(grays.length == 0)
		{
			throw new InsufficientDataException("No valid pixels in ROI");
		}
		double[] distances = new double[grays.length];
		for(int i = 0; i < grays.length; ++i)
		{
			distances[i] = conversion.grayToDistance(grays[i]);
		}
		if(model != null)
		{
			distances = Compensator.compensate(distances, model, extrapolation_config);
		}
		
		int area = region.getWidth() * region.getHeight();
		return new ImageStatistics(name,
		                           StatUtils.mean(distances),
		                           Math.sqrt(StatUtils.populationVariance(distances)),
		                           StatUtils.min(distances),
		                           StatUtils.max(distances),
		                           distances.length,
		                           100.0 * distances.length / area);
	}
	
	/**
	 *	@throws FileNotFoundException if the directory holds no depth images
	 *	@throws InsufficientDataException if fewer than two images are present or usable
	 */
	public Result run(Path directory) throws IOException, InsufficientDataException
	{
		List<Path> images = CalibrationDataset.listImages(directory);
		if(images.isEmpty())
		{
			throw new FileNotFoundException("No depth images found in " + directory);
		}
		if(images.size() < 2)
		{
			throw new InsufficientDataException("At least 2 images are needed for repeatability, found " + images.size());
		}
		
		List<ImageStatistics> stats = new ArrayList<ImageStatistics>();
		List<BatchResult.ItemError> errors = new ArrayList<BatchResult.ItemError>();
		for(int i = 0; i < images.size(); ++i)
		{
			Path path = images.get(i);
			String name = path.getFileName().toString();
			IJ.showStatus("Measuring " + name + " (" + (i + 1) + "/" + images.size() + ")");
			IJ.showProgress(i, images.size());
			try
			{
				stats.add(measure(name, DepthImageIO.read(path)));
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
		
		if(stats.size() < 2)
		{
			throw new InsufficientDataException("Insufficient usable images for repeatability: " + stats.size() + " < 2");
		}
		return new Result(new BatchResult<ImageStatistics>(images.size(), stats, errors));
	}
}
