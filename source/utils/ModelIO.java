package utils;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

// import Jackson classes
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

// import own classes
import core.BSpline;
import core.CompensationModel;

/**
 *	JSON persistence of compensation models.
 *	<p>
 *	Two layouts are written and read. The minimal layout holds only what compensation needs:
 *	<pre>
 *	{ model_type, version, knots, coefficients, k, x_range, y_range, calibration_points }
 *	</pre>
 *	The full layout keeps the forward curve and the raw calibration pairs:
 *	<pre>
 *	{ model_type, version, description, inverse_model: {t, c, k}, forward_model?: {t, c, k},
 *	  actual_range, measured_range, calibration_data: {num_points, actual_values, measured_values} }
 *	</pre>
 */
public class ModelIO
{
	/**
	 *	Constants
	 */
	public static final String EXTENSION = ".json";
	public static final String FULL_DESCRIPTION = "Depth compensation cubic spline model (full format)";
	public static final int DECIMALS = 6;
	public static final int RANGE_DECIMALS = 4;
	
	private static final String DEFAULT_MINIMAL_VERSION = "2.0";
	private static final String DEFAULT_FULL_VERSION = "2.1";
	
	private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
	
	/**
	 *	Constructor
	 */
	public ModelIO()
	{
		/* do nothing */
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	/**
	 *	Write the model, forcing the .json extension and creating missing parent directories
	 *
	 *	@return the path actually written
	 */
	public static Path save(CompensationModel model, Path path, boolean minimal) throws IOException
	{
		Path target = withJsonExtension(path);
		Path parent = target.toAbsolutePath().getParent();
		if(parent != null)
		{
			Files.createDirectories(parent);
		}
		MAPPER.writeValue(target.toFile(), toJson(model, minimal));
		return target;
	}
	
	public static CompensationModel load(Path path) throws IOException
	{
		if(!Files.isRegularFile(path))
		{
			throw new NoSuchFileException(path.toString(), null, "Model file does not exist");
		}
		JsonNode root = MAPPER.readTree(path.toFile());
		return parse(root);
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public static ObjectNode toJson(CompensationModel model, boolean minimal)
	{
		BSpline inverse = model.getInverse();
		ObjectNode root = MAPPER.createObjectNode();
		root.put("model_type", CompensationModel.MODEL_TYPE);
		root.put("version", model.getVersion());
		if(minimal)
		{
			root.set("knots", array(inverse.getKnots(), DECIMALS));
			root.set("coefficients", array(inverse.getCoefficients(), DECIMALS));
			root.put("k", inverse.getDegree());
			root.set("x_range", array(new double[]{model.getXMin(), model.getXMax()}, RANGE_DECIMALS));
			root.set("y_range", array(new double[]{model.getYMin(), model.getYMax()}, RANGE_DECIMALS));
			root.put("calibration_points", model.getCalibrationPoints());
			return root;
		}
		
		root.put("description", FULL_DESCRIPTION);
		root.set("inverse_model", spline(inverse));
		root.set("actual_range", array(new double[]{model.getYMin(), model.getYMax()}, RANGE_DECIMALS));
		root.set("measured_range", array(new double[]{model.getXMin(), model.getXMax()}, RANGE_DECIMALS));
		ObjectNode calibration = root.putObject("calibration_data");
		calibration.put("num_points", model.getCalibrationPoints());
		calibration.set("actual_values", array(model.hasCalibrationData() ? model.getActualValues() : new double[0], RANGE_DECIMALS));
		calibration.set("measured_values", array(model.hasCalibrationData() ? model.getMeasuredValues() : new double[0], RANGE_DECIMALS));
		if(model.hasForward())
		{
			root.set("forward_model", spline(model.getForward()));
		}
		return root;
	}
	
	/**
	 *	Build a model from either layout. A document with "knots" is read as the minimal layout,
	 *	one with "inverse_model" as the full layout.
	 *
	 *	@throws ModelFormatException if the document matches neither layout or misses required fields
	 */
	public static CompensationModel parse(JsonNode root) throws ModelFormatException
	{
		if(root == null || !root.isObject())
		{
			throw new ModelFormatException("Model document is not a JSON object");
		}
		try
		{
			if(root.has("knots"))
			{
				return parseMinimal(root);
			}
			if(root.has("inverse_model"))
			{
				return parseFull(root);
			}
		}
		catch(IllegalArgumentException e)
		{
			throw new ModelFormatException("Invalid model data: " + e.getMessage(), e);
		}
		throw new ModelFormatException("Unrecognized model format: expected \"knots\" or \"inverse_model\"");
	}
	
	private static CompensationModel parseMinimal(JsonNode root) throws ModelFormatException
	{
		BSpline inverse = new BSpline(doubles(root, "knots"), doubles(root, "coefficients"), integer(root, "k"));
		double[] x_range;
		double[] y_range;
		if(root.has("x_range"))
		{
			x_range = range(root, "x_range");
			y_range = root.has("y_range") ? range(root, "y_range") : x_range;
		}
		else
		{
			// infer from the knot domain, actual range approximated by the measured range
			x_range = new double[]{inverse.domainMin(), inverse.domainMax()};
			y_range = x_range;
		}
		int points = root.path("calibration_points").asInt(0);
		String version = root.path("version").asText(DEFAULT_MINIMAL_VERSION);
		return new CompensationModel(inverse, null, x_range[0], x_range[1], y_range[0], y_range[1], points, version, null, null);
	}
	
	private static CompensationModel parseFull(JsonNode root) throws ModelFormatException
	{
		BSpline inverse = readSpline(root.get("inverse_model"));
		BSpline forward = root.has("forward_model") ? readSpline(root.get("forward_model")) : null;
		double[] y_range = range(root, "actual_range");
		double[] x_range = range(root, "measured_range");
		
		double[] actual = null;
		double[] measured = null;
		JsonNode calibration = root.path("calibration_data");
		if(calibration.has("actual_values") && calibration.has("measured_values"))
		{
			actual = doubles(calibration, "actual_values");
			measured = doubles(calibration, "measured_values");
			if(actual.length == 0 && measured.length == 0)
			{
				actual = null;
				measured = null;
			}
		}
		int points = calibration.path("num_points").asInt(actual != null ? actual.length : 0);
		String version = root.path("version").asText(DEFAULT_FULL_VERSION);
		return new CompensationModel(inverse, forward, x_range[0], x_range[1], y_range[0], y_range[1], points, version, actual, measured);
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	private static ObjectNode spline(BSpline spline)
	{
		ObjectNode node = MAPPER.createObjectNode();
		node.set("t", array(spline.getKnots(), DECIMALS));
		node.set("c", array(spline.getCoefficients(), DECIMALS));
		node.put("k", spline.getDegree());
		return node;
	}
	
	private static BSpline readSpline(JsonNode node) throws ModelFormatException
	{
		if(node == null || !node.isObject())
		{
			throw new ModelFormatException("Spline entry is not a JSON object");
		}
		return new BSpline(doubles(node, "t"), doubles(node, "c"), integer(node, "k"));
	}
	
	private static ArrayNode array(double[] values, int decimals)
	{
		ArrayNode node = MAPPER.createArrayNode();
		for(double v : values)
		{
			node.add(round(v, decimals));
		}
		return node;
	}
	
	static double round(double value, int decimals)
	{
		if(Double.isNaN(value) || Double.isInfinite(value))
		{
			return value;
		}
		return BigDecimal.valueOf(value).setScale(decimals, RoundingMode.HALF_EVEN).doubleValue();
	}
	
	private static double[] doubles(JsonNode parent, String field) throws ModelFormatException
	{
		JsonNode node = parent.get(field);
		if(node == null || !node.isArray())
		{
			throw new ModelFormatException("Missing or non-array field \"" + field + "\"");
		}
		double[] values = new double[node.size()];
		for(int i = 0; i < values.length; ++i)
		{
			JsonNode element = node.get(i);
			if(!element.isNumber())
			{
				throw new ModelFormatException("Non-numeric entry in \"" + field + "\" at index " + i);
			}
			values[i] = element.asDouble();
		}
		return values;
	}
	
	private static double[] range(JsonNode parent, String field) throws ModelFormatException
	{
		double[] values = doubles(parent, field);
		if(values.length != 2)
		{
			throw new ModelFormatException("Field \"" + field + "\" must hold exactly two values");
		}
		return values;
	}
	
	private static int integer(JsonNode parent, String field) throws ModelFormatException
	{
		JsonNode node = parent.get(field);
		if(node == null || !node.canConvertToInt())
		{
			throw new ModelFormatException("Missing or non-integer field \"" + field + "\"");
		}
		return node.asInt();
	}
	
	private static Path withJsonExtension(Path path)
	{
		String name = path.getFileName().toString();
		if(name.toLowerCase().endsWith(EXTENSION))
		{
			return path;
		}
		int dot = name.lastIndexOf('.');
		String stem = (dot > 0) ? name.substring(0, dot) : name;
		return path.resolveSibling(stem + EXTENSION);
	}
}
