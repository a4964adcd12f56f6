package utils;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 *	Calibration directory: one CSV file with the actual displacement of every exposure and one depth
 *	image per exposure. Images are ordered by the last number in their file name and paired with the
 *	CSV rows in that order.
 */
public class CalibrationDataset
{
	/**
	 *	Constants
	 */
	public static final String[] DISPLACEMENT_COLUMNS = {"实际累计位移(mm)", "实际累计位移", "位移(mm)", "位移", "displacement", "Displacement"};
	
	private static final Pattern NUMBER = Pattern.compile("\\d+");
	private static final char BOM = '\uFEFF';
	
	/**
	 *	Members
	 */
	public final Path directory;
	public final Path csv_path;
	private final List<Double> displacements;
	private final List<Path> image_paths;
	
	// ////////////////////////////////////////////////////////////////////////
	
	public CalibrationDataset(Path directory, Path csv_path, List<Double> displacements, List<Path> image_paths)
	{
		this.directory = directory;
		this.csv_path = csv_path;
		this.displacements = Collections.unmodifiableList(new ArrayList<Double>(displacements));
		this.image_paths = Collections.unmodifiableList(new ArrayList<Path>(image_paths));
	}
	
	/**
	 *	Scan a calibration directory
	 *
	 *	@throws FileNotFoundException if the directory does not exist or holds no CSV file
	 */
	public static CalibrationDataset open(Path directory) throws IOException
	{
		if(!Files.isDirectory(directory))
		{
			throw new FileNotFoundException("Calibration directory does not exist: " + directory);
		}
		
		List<Path> csv_files = new ArrayList<Path>();
		try(DirectoryStream<Path> stream = Files.newDirectoryStream(directory))
		{
			for(Path p : stream)
			{
				if(Files.isRegularFile(p) && p.getFileName().toString().toLowerCase().endsWith(".csv"))
				{
					csv_files.add(p);
				}
			}
		}
		if(csv_files.isEmpty())
		{
			throw new FileNotFoundException("No CSV file found in calibration directory: " + directory);
		}
		Collections.sort(csv_files);
		Path csv_path = csv_files.get(0);
		
		return new CalibrationDataset(directory, csv_path, readDisplacements(csv_path), listImages(directory));
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public List<Double> getDisplacements()
	{
		return displacements;
	}
	
	public List<Path> getImagePaths()
	{
		return image_paths;
	}
	
	/**
	 *	Number of (displacement, image) pairs
	 */
	public int size()
	{
		return Math.min(displacements.size(), image_paths.size());
	}
	
	public double displacement(int i)
	{
		return displacements.get(i);
	}
	
	public Path image(int i)
	{
		return image_paths.get(i);
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	/**
	 *	PNG and TIFF files of a directory in natural order; empty if the directory does not exist
	 */
	public static List<Path> listImages(Path directory) throws IOException
	{
		List<Path> images = new ArrayList<Path>();
		if(!Files.isDirectory(directory))
		{
			return images;
		}
		try(DirectoryStream<Path> stream = Files.newDirectoryStream(directory))
		{
			for(Path p : stream)
			{
				if(Files.isRegularFile(p) && DepthImageIO.isDepthImageFile(p))
				{
					images.add(p);
				}
			}
		}
		sortNatural(images);
		return images;
	}
	
	/**
	 *	Sort by the last number in the file stem, then by name; files without a number count as 0
	 */
	public static void sortNatural(List<Path> paths)
	{
		Collections.sort(paths, new Comparator<Path>()
		{
			@Override
			public int compare(Path a, Path b)
			{
				int c = Long.compare(lastNumber(a), lastNumber(b));
				return (c != 0) ? c : a.getFileName().toString().compareTo(b.getFileName().toString());
			}
		});
	}
	
	static long lastNumber(Path path)
	{
		String name = path.getFileName().toString();
		int dot = name.lastIndexOf('.');
		String stem = (dot > 0) ? name.substring(0, dot) : name;
		Matcher m = NUMBER.matcher(stem);
		String last = null;
		while(m.find())
		{
			last = m.group();
		}
		if(last == null)
		{
			return 0;
		}
		try
		{
			return Long.parseLong(last);
		}
		catch(NumberFormatException e)
		{
			return Long.MAX_VALUE;
		}
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	/**
	 *	Displacement per data row, taken from the first accepted column holding a number.
	 *	Rows without a usable displacement are skipped.
	 */
	public static List<Double> readDisplacements(Path csv_path) throws IOException
	{
		List<Double> values = new ArrayList<Double>();
		try(BufferedReader reader = Files.newBufferedReader(csv_path, StandardCharsets.UTF_8))
		{
			String header_line = reader.readLine();
			if(header_line == null)
			{
				return values;
			}
			if(!header_line.isEmpty() && header_line.charAt(0) == BOM)
			{
				header_line = header_line.substring(1);
			}
			List<String> header = splitLine(header_line);
			
			// candidate column indices in order of preference
			List<Integer> columns = new ArrayList<Integer>();
			for(String name : DISPLACEMENT_COLUMNS)
			{
				int index = header.indexOf(name);
				if(index >= 0)
				{
					columns.add(index);
				}
			}
			
			String line;
			while((line = reader.readLine()) != null)
			{
				if(line.trim().isEmpty())
				{
					continue;
				}
				List<String> fields = splitLine(line);
				for(int index : columns)
				{
					Double value = (index < fields.size()) ? parseNumber(fields.get(index)) : null;
					if(value != null)
					{
						values.add(value);
						break;
					}
				}
			}
		}
		return values;
	}
	
	private static Double parseNumber(String field)
	{
		String text = field.trim();
		if(text.isEmpty())
		{
			return null;
		}
		try
		{
			return Double.valueOf(text);
		}
		catch(NumberFormatException e)
		{
			return null;
		}
	}
	
	/**
	 *	Split one CSV line on commas, honoring double quoted fields
	 */
	static List<String> splitLine(String line)
	{
		List<String> fields = new ArrayList<String>();
		StringBuilder current = new StringBuilder();
		boolean quoted = false;
		for(int i = 0; i < line.length(); ++i)
		{
			char ch = line.charAt(i);
			if(quoted)
			{
				if(ch == '"')
				{
					if(i + 1 < line.length() && line.charAt(i + 1) == '"')
					{
						current.append('"');
						++i;
					}
					else
					{
						quoted = false;
					}
				}
				else
				{
					current.append(ch);
				}
			}
			else if(ch == '"')
			{
				quoted = true;
			}
			else if(ch == ',')
			{
				fields.add(current.toString());
				current.setLength(0);
			}
			else
			{
				current.append(ch);
			}
		}
		fields.add(current.toString());
		return fields;
	}
}
