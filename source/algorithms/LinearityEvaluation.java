package algorithms;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

// import ImageJ classes
import ij.IJ;

// import own classes
import core.BatchResult;
import core.CompensationEffect;
import core.CompensationModel;
import core.InsufficientDataException;
import core.LinearityResult;
import utils.CalibrationDataset;
import utils.DepthImageIO;

/**
 *	Linearity of a test directory (CSV with actual displacements plus one depth image per position),
 *	before and, when a model is set, after compensation
 */
public class LinearityEvaluation
{
	/**
	 *	Per-image row; compensated is NaN without a model
	 */
	public static class Row
	{
		public final String name;
		public final double actual;
		public final double measured;
		public final double compensated;
		
		public Row(String name, double actual, double measured, double compensated)
		{
			this.name = name;
			this.actual = actual;
			this.measured = measured;
			this.compensated = compensated;
		}
	}
	
	public static class Evaluation
	{
		public final BatchResult<Row> rows;
		public final double full_scale;
		public final LinearityResult before;
		public final LinearityResult after; // null without a model
		
		public Evaluation(BatchResult<Row> rows, double full_scale, LinearityResult before, LinearityResult after)
		{
			this.rows = rows;
			this.full_scale = full_scale;
			this.before = before;
			this.after = after;
		}
		
		public boolean hasCompensation()
		{
			return after != null;
		}
		
		/**
		 *	Reduction of the linearity error in percent, 0 without a model
		 */
		public double improvement()
		{
			return (after != null) ? new CompensationEffect(before, after).improvement : 0.0;
		}
	}
	
	/**
	 *	Members
	 */
	public final CalibrationPipeline measurement;
	public final double full_scale;
	private CompensationModel model;
	
	// ////////////////////////////////////////////////////////////////////////
	
	public LinearityEvaluation(CalibrationPipeline measurement, double full_scale, CompensationModel model)
	{
		this.measurement = (measurement != null) ? measurement : new CalibrationPipeline();
		this.full_scale = (full_scale > 0.0) ? full_scale : Linearity.DEFAULT_FULL_SCALE;
		this.model = model;
	}
	
	public void setModel(CompensationModel model)
	{
		this.model = model;
	}
	
	public CompensationModel getModel()
	{
		return model;
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public Evaluation run(Path directory) throws IOException, InsufficientDataException
	{
		return run(CalibrationDataset.open(directory));
	}
	
	/**
	 *	@throws InsufficientDataException when fewer than two images can be measured
	 */
	public Evaluation run(CalibrationDataset dataset) throws InsufficientDataException
	{
		int total = dataset.size();
		List<String> names = new ArrayList<String>();
		List<Double> actual = new ArrayList<Double>();
		List<Double> measured = new ArrayList<Double>();
		List<BatchResult.ItemError> errors = new ArrayList<BatchResult.ItemError>();
		
		for(int i = 0; i < total; ++i)
		{
			Path path = dataset.image(i);
			String name = path.getFileName().toString();
			IJ.showStatus("Measuring " + name + " (" + (i + 1) + "/" + total + ")");
			IJ.showProgress(i, total);
			try
			{
				measured.add(measurement.measure(DepthImageIO.read(path)));
				actual.add(dataset.displacement(i));
				names.add(name);
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
		
		if(actual.size() < 2)
		{
			throw new InsufficientDataException("Insufficient usable images for linearity: " + actual.size() + " < 2");
		}
		
		double[] actual_abs = toArray(actual);
		double[] measured_abs = toArray(measured);
		LinearityResult before = Linearity.calculate(actual_abs, measured_abs, full_scale);
		LinearityResult after = null;
		double[] compensated_abs = null;
		if(model != null)
		{
			compensated_abs = Compensator.compensate(measured_abs, model, null);
			after = Linearity.calculate(actual_abs, compensated_abs, full_scale);
		}
		
		List<Row> rows = new ArrayList<Row>();
		for(int i = 0; i < actual_abs.length; ++i)
		{
			rows.add(new Row(names.get(i), actual_abs[i], measured_abs[i], (compensated_abs != null) ? compensated_abs[i] : Double.NaN));
		}
		return new Evaluation(new BatchResult<Row>(total, rows, errors), full_scale, before, after);
	}
	
	private static double[] toArray(List<Double> values)
	{
		double[] array = new double[values.size()];
		for(int i = 0; i < array.length; ++i)
		{
			array[i] = values.get(i);
		}
		return array;
	}
}
