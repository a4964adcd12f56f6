package plugins;

// import ImageJ classes
import ij.Prefs;
import ij.gui.GenericDialog;

// import own classes
import core.ExtrapolationConfig;
import core.FilterConfig;
import core.NormalizationConfig;
import core.PlaneFitConfig;
import core.RegionOfInterest;
import utils.DepthConversion;

/**
 *	Dialog fields shared by the depth compensation plugins. Every add method pre-fills its fields from
 *	the stored preferences; the matching read method takes the values back from the dialog (in the
 *	same order) and stores them.
 */
public class DialogSettings
{
	/**
	 *	Constants
	 */
	public static final String PREFS_PREFIX = "Depth_Compensation.";
	
	/**
	 *	Constructor
	 */
	private DialogSettings()
	{
		/* do nothing */
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public static void addRegionFields(GenericDialog gd)
	{
		gd.addMessage("Region of interest (-1 extends to the image edge)");
		gd.addNumericField("ROI_x", Prefs.get(PREFS_PREFIX + "roi_x", 0), 0);
		gd.addNumericField("ROI_y", Prefs.get(PREFS_PREFIX + "roi_y", 0), 0);
		gd.addNumericField("ROI_width", Prefs.get(PREFS_PREFIX + "roi_width", RegionOfInterest.TO_EDGE), 0);
		gd.addNumericField("ROI_height", Prefs.get(PREFS_PREFIX + "roi_height", RegionOfInterest.TO_EDGE), 0);
	}
	
	public static RegionOfInterest readRegion(GenericDialog gd)
	{
		int x = (int)gd.getNextNumber();
		int y = (int)gd.getNextNumber();
		int width = (int)gd.getNextNumber();
		int height = (int)gd.getNextNumber();
		Prefs.set(PREFS_PREFIX + "roi_x", x);
		Prefs.set(PREFS_PREFIX + "roi_y", y);
		Prefs.set(PREFS_PREFIX + "roi_width", width);
		Prefs.set(PREFS_PREFIX + "roi_height", height);
		return new RegionOfInterest(x, y, width, height);
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public static void addFilterFields(GenericDialog gd)
	{
		gd.addCheckbox("Filter", Prefs.get(PREFS_PREFIX + "filter", FilterConfig.DEFAULT_ENABLED));
		gd.addCheckbox("Outlier_rejection", Prefs.get(PREFS_PREFIX + "outlier_rejection", true));
		gd.addNumericField("Outlier_std_factor", Prefs.get(PREFS_PREFIX + "outlier_std_factor", FilterConfig.DEFAULT_OUTLIER_STD_FACTOR), 2);
		gd.addCheckbox("Median", Prefs.get(PREFS_PREFIX + "median", true));
		gd.addNumericField("Median_size", Prefs.get(PREFS_PREFIX + "median_size", FilterConfig.DEFAULT_MEDIAN_SIZE), 0);
		gd.addCheckbox("Gaussian", Prefs.get(PREFS_PREFIX + "gaussian", true));
		gd.addNumericField("Gaussian_sigma", Prefs.get(PREFS_PREFIX + "gaussian_sigma", FilterConfig.DEFAULT_GAUSSIAN_SIGMA), 2);
	}
	
	public static FilterConfig readFilter(GenericDialog gd)
	{
		boolean enabled = gd.getNextBoolean();
		boolean outlier_rejection = gd.getNextBoolean();
		double outlier_std_factor = gd.getNextNumber();
		boolean median = gd.getNextBoolean();
		int median_size = (int)gd.getNextNumber();
		boolean gaussian = gd.getNextBoolean();
		double gaussian_sigma = gd.getNextNumber();
		
		Prefs.set(PREFS_PREFIX + "filter", enabled);
		Prefs.set(PREFS_PREFIX + "outlier_rejection", outlier_rejection);
		Prefs.set(PREFS_PREFIX + "outlier_std_factor", outlier_std_factor);
		Prefs.set(PREFS_PREFIX + "median", median);
		Prefs.set(PREFS_PREFIX + "median_size", median_size);
		Prefs.set(PREFS_PREFIX + "gaussian", gaussian);
		Prefs.set(PREFS_PREFIX + "gaussian_sigma", gaussian_sigma);
		
		return new FilterConfig(enabled, outlier_rejection, median, gaussian, outlier_std_factor, median_size, gaussian_sigma);
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public static void addPlaneFitFields(GenericDialog gd)
	{
		gd.addNumericField("Min_valid_pixels", Prefs.get(PREFS_PREFIX + "min_valid_pixels", PlaneFitConfig.DEFAULT_MIN_VALID_PIXELS), 0);
		gd.addNumericField("Min_valid_ratio", Prefs.get(PREFS_PREFIX + "min_valid_ratio", PlaneFitConfig.DEFAULT_MIN_VALID_RATIO), 2);
	}
	
	public static PlaneFitConfig readPlaneFit(GenericDialog gd)
	{
		int min_valid_pixels = (int)gd.getNextNumber();
		double min_valid_ratio = gd.getNextNumber();
		Prefs.set(PREFS_PREFIX + "min_valid_pixels", min_valid_pixels);
		Prefs.set(PREFS_PREFIX + "min_valid_ratio", min_valid_ratio);
		return new PlaneFitConfig(min_valid_pixels, min_valid_ratio);
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public static void addConversionFields(GenericDialog gd)
	{
		gd.addNumericField("Depth_offset", Prefs.get(PREFS_PREFIX + "depth_offset", DepthConversion.DEFAULT_OFFSET), 1);
		gd.addNumericField("Depth_scale_factor", Prefs.get(PREFS_PREFIX + "depth_scale_factor", DepthConversion.DEFAULT_SCALE_FACTOR), 4);
		gd.addNumericField("Invalid_value", Prefs.get(PREFS_PREFIX + "invalid_value", DepthConversion.DEFAULT_INVALID_VALUE), 0);
	}
	
	public static DepthConversion readConversion(GenericDialog gd)
	{
		double offset = gd.getNextNumber();
		double scale_factor = gd.getNextNumber();
		int invalid_value = (int)gd.getNextNumber();
		Prefs.set(PREFS_PREFIX + "depth_offset", offset);
		Prefs.set(PREFS_PREFIX + "depth_scale_factor", scale_factor);
		Prefs.set(PREFS_PREFIX + "invalid_value", invalid_value);
		return new DepthConversion(offset, scale_factor, invalid_value);
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public static void addExtrapolationFields(GenericDialog gd)
	{
		gd.addCheckbox("Extrapolation", Prefs.get(PREFS_PREFIX + "extrapolation", ExtrapolationConfig.DEFAULT_ENABLED));
		gd.addNumericField("Max_extrapolation_low (mm)", Prefs.get(PREFS_PREFIX + "max_low", ExtrapolationConfig.DEFAULT_MAX_LOW), 2);
		gd.addNumericField("Max_extrapolation_high (mm)", Prefs.get(PREFS_PREFIX + "max_high", ExtrapolationConfig.DEFAULT_MAX_HIGH), 2);
		gd.addNumericField("Output_min (mm)", Prefs.get(PREFS_PREFIX + "output_min", ExtrapolationConfig.DEFAULT_OUTPUT_MIN), 2);
		gd.addNumericField("Output_max (mm)", Prefs.get(PREFS_PREFIX + "output_max", ExtrapolationConfig.DEFAULT_OUTPUT_MAX), 2);
		gd.addCheckbox("Clamp_output", Prefs.get(PREFS_PREFIX + "clamp_output", ExtrapolationConfig.DEFAULT_CLAMP_OUTPUT));
	}
	
	public static ExtrapolationConfig readExtrapolation(GenericDialog gd)
	{
		boolean enabled = gd.getNextBoolean();
		double max_low = gd.getNextNumber();
		double max_high = gd.getNextNumber();
		double output_min = gd.getNextNumber();
		double output_max = gd.getNextNumber();
		boolean clamp_output = gd.getNextBoolean();
		Prefs.set(PREFS_PREFIX + "extrapolation", enabled);
		Prefs.set(PREFS_PREFIX + "max_low", max_low);
		Prefs.set(PREFS_PREFIX + "max_high", max_high);
		Prefs.set(PREFS_PREFIX + "output_min", output_min);
		Prefs.set(PREFS_PREFIX + "output_max", output_max);
		Prefs.set(PREFS_PREFIX + "clamp_output", clamp_output);
		return new ExtrapolationConfig(enabled, max_low, max_high, output_min, output_max, clamp_output);
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public static void addNormalizationFields(GenericDialog gd)
	{
		gd.addCheckbox("Normalize", Prefs.get(PREFS_PREFIX + "normalize", NormalizationConfig.DEFAULT_ENABLED));
		gd.addNumericField("Target_center (mm)", Prefs.get(PREFS_PREFIX + "target_center", NormalizationConfig.DEFAULT_TARGET_CENTER), 3);
		gd.addCheckbox("Auto_offset", Prefs.get(PREFS_PREFIX + "auto_offset", NormalizationConfig.DEFAULT_AUTO_OFFSET));
		gd.addNumericField("Manual_offset (mm)", Prefs.get(PREFS_PREFIX + "manual_offset", NormalizationConfig.DEFAULT_MANUAL_OFFSET), 3);
	}
	
	public static NormalizationConfig readNormalization(GenericDialog gd)
	{
		boolean enabled = gd.getNextBoolean();
		double target_center = gd.getNextNumber();
		boolean auto_offset = gd.getNextBoolean();
		double manual_offset = gd.getNextNumber();
		Prefs.set(PREFS_PREFIX + "normalize", enabled);
		Prefs.set(PREFS_PREFIX + "target_center", target_center);
		Prefs.set(PREFS_PREFIX + "auto_offset", auto_offset);
		Prefs.set(PREFS_PREFIX + "manual_offset", manual_offset);
		return new NormalizationConfig(enabled, target_center, auto_offset, manual_offset);
	}
}
