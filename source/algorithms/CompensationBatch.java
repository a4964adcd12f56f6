package algorithms;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

// import ImageJ classes
import ij.IJ;
import ij.process.ImageProcessor;

// import own classes
import core.BatchResult;
import core.CompensationModel;
import core.CompensationOutcome;
import core.ExtrapolationConfig;
import core.NormalizationConfig;
import utils.CalibrationDataset;
import utils.DepthConversion;
import utils.DepthImageIO;
import utils.ModelIO;
import utils.Profiling;

/**
 *	Compensates single depth images and whole directories with one model
 */
public class CompensationBatch
{
	/**
	 *	Compensation outcome of one file
	 */
	public static class CompensatedImage
	{
		public final String name;
		public final CompensationOutcome outcome;
		
		public CompensatedImage(String name, CompensationOutcome outcome)
		{
			this.name = name;
			this.outcome = outcome;
		}
	}
	
	/**
	 *	Per-file outcomes with pixel totals over all processed files
	 */
	public static class Summary
	{
		public final BatchResult<CompensatedImage> images;
		public final long total_pixels;
		public final long compensated_pixels;
		
		public Summary(BatchResult<CompensatedImage> images)
		{
			this.images = images;
			long total = 0;
			long compensated = 0;
			for(CompensatedImage image : images.getResults())
			{
				total += image.outcome.total_pixels;
				compensated += image.outcome.compensated_pixels;
			}
			this.total_pixels = total;
			this.compensated_pixels = compensated;
		}
		
		public double averageCompensationRate()
		{
			return total_pixels > 0 ? 100.0 * compensated_pixels / total_pixels : 0.0;
		}
	}
	
	/**
	 *	Members
	 */
	private CompensationModel model;
	public final ExtrapolationConfig extrapolation_config;
	public final NormalizationConfig normalization_config;
	public final DepthConversion conversion;
	private double normalize_offset;
	
	// ////////////////////////////////////////////////////////////////////////
	
	public CompensationBatch(CompensationModel model)
	{
		this(model, new ExtrapolationConfig(), new NormalizationConfig(), new DepthConversion());
	}
	
	public CompensationBatch(CompensationModel model, ExtrapolationConfig extrapolation_config, NormalizationConfig normalization_config, DepthConversion conversion)
	{
		this.extrapolation_config = (extrapolation_config != null) ? extrapolation_config : new ExtrapolationConfig();
		this.normalization_config = (normalization_config != null) ? normalization_config : new NormalizationConfig();
		this.conversion = (conversion != null) ? conversion : new DepthConversion();
		setModel(model);
	}
	
	public CompensationModel getModel()
	{
		return model;
	}
	
	public void setModel(CompensationModel model)
	{
		this.model = model;
		this.normalize_offset = (model != null) ? Compensator.normalizationOffset(model, normalization_config) : 0.0;
	}
	
	public CompensationModel loadModel(Path path) throws IOException
	{
		setModel(ModelIO.load(path));
		return model;
	}
	
	public double getNormalizeOffset()
	{
		return normalize_offset;
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public CompensationOutcome compensate(ImageProcessor ip)
	{
		requireModel();
		return Compensator.compensateImage(ip, model, conversion, extrapolation_config, normalize_offset);
	}
	
	/**
	 *	Compensate one file and write the result when an output path is given
	 */
	public CompensationOutcome compensate(Path input, Path output) throws IOException
	{
		requireModel();
		CompensationOutcome outcome = compensate(DepthImageIO.read(input));
		if(output != null)
		{
			DepthImageIO.write(outcome.compensated, output);
		}
		return outcome;
	}
	
	/**
	 *	Compensate every depth image of a directory into the output directory under the same file name.
	 *	Unreadable images are skipped and reported; failing to write the output aborts the batch.
	 */
	public Summary run(Path input_directory, Path output_directory) throws IOException
	{
		requireModel();
		List<Path> images = CalibrationDataset.listImages(input_directory);
		if(images.isEmpty())
		{
			throw new FileNotFoundException("No depth images found in " + input_directory);
		}
		Files.createDirectories(output_directory);
		
		Profiling timer = Profiling.tic("Compensation of " + images.size() + " images");
		List<CompensatedImage> results = new ArrayList<CompensatedImage>();
		List<BatchResult.ItemError> errors = new ArrayList<BatchResult.ItemError>();
		for(int i = 0; i < images.size(); ++i)
		{
			Path input = images.get(i);
			String name = input.getFileName().toString();
			IJ.showStatus("Compensating " + name + " (" + (i + 1) + "/" + images.size() + ")");
			IJ.showProgress(i, images.size());
			
			ImageProcessor ip;
			try
			{
				ip = DepthImageIO.read(input);
			}
			catch(IOException e)
			{
				errors.add(new BatchResult.ItemError(name, e.getMessage()));
				IJ.log("Skipped " + name + ": " + e.getMessage());
				continue;
			}
			CompensationOutcome outcome = compensate(ip);
			DepthImageIO.write(outcome.compensated, output_directory.resolve(name));
			results.add(new CompensatedImage(name, outcome));
		}
		IJ.showProgress(1.0);
		timer.toc();
		
		Summary summary = new Summary(new BatchResult<CompensatedImage>(images.size(), results, errors));
		IJ.showStatus(String.format("Compensated %d/%d images, average rate %.2f%%", results.size(), images.size(), summary.averageCompensationRate()));
		return summary;
	}
	
	private void requireModel()
	{
		if(model == null)
		{
			throw new IllegalStateException("No compensation model loaded");
		}
	}
}
