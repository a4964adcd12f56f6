package algorithms;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

// import ImageJ classes
import ij.ImagePlus;
import ij.io.FileSaver;
import ij.process.ByteProcessor;
import ij.process.ShortProcessor;

// import own classes
import utils.DepthConversion;
import utils.DepthImageIO;

/**
 *	Writes calibration style directories of small tilted depth images
 */
class SyntheticDepthImages
{
	static final int SIZE = 16;
	static final DepthConversion CONVERSION = new DepthConversion();
	
	/**
	 *	Plane with a slight tilt whose value at the origin is the given distance
	 */
	static ShortProcessor tiltedPlane(double distance)
	{
		int base = CONVERSION.distanceToGray(distance);
		ShortProcessor ip = new ShortProcessor(SIZE, SIZE);
		for(int py = 0; py < SIZE; ++py)
		{
			for(int px = 0; px < SIZE; ++px)
			{
				ip.set(px, py, base + 3 * px + 2 * py);
			}
		}
		return ip;
	}
	
	static ShortProcessor flat(double distance)
	{
		ShortProcessor ip = new ShortProcessor(SIZE, SIZE);
		ip.set(CONVERSION.distanceToGray(distance));
		return ip;
	}
	
	static ShortProcessor invalid()
	{
		ShortProcessor ip = new ShortProcessor(SIZE, SIZE);
		ip.set(CONVERSION.invalid_value);
		return ip;
	}
	
	static void writeCsv(Path directory, double[] displacements) throws IOException
	{
		StringBuilder csv = new StringBuilder("index,displacement\n");
		for(int i = 0; i < displacements.length; ++i)
		{
			csv.append(i + 1).append(',').append(displacements[i]).append('\n');
		}
		Files.createDirectories(directory);
		Files.write(directory.resolve("displacement.csv"), csv.toString().getBytes(StandardCharsets.UTF_8));
	}
	
	/**
	 *	One tilted image per measured distance, named depth_1.tif, depth_2.tif, ...
	 */
	static void writeImages(Path directory, double[] measured) throws IOException
	{
		for(int i = 0; i < measured.length; ++i)
		{
			DepthImageIO.write(tiltedPlane(measured[i]), directory.resolve("depth_" + (i + 1) + ".tif"));
		}
	}
	
	static void writeEightBit(Path path) throws IOException
	{
		if(!new FileSaver(new ImagePlus("8-bit", new ByteProcessor(SIZE, SIZE))).saveAsTiff(path.toString()))
		{
			throw new IOException("Could not write " + path);
		}
	}
}
