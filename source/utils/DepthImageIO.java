package utils;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

// import ImageJ classes
import ij.IJ;
import ij.ImagePlus;
import ij.io.FileSaver;
import ij.process.ImageProcessor;
import ij.process.ShortProcessor;

/**
 *	Reading and writing of 16-bit single channel depth images (PNG, TIFF)
 */
public class DepthImageIO
{
	/**
	 *	Constants
	 */
	public static final String[] IMAGE_EXTENSIONS = {".png", ".tif", ".tiff"};
	
	/**
	 *	Constructor
	 */
	public DepthImageIO()
	{
		/* do nothing */
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public static boolean isDepthImageFile(Path path)
	{
		String name = path.getFileName().toString().toLowerCase();
		for(String ext : IMAGE_EXTENSIONS)
		{
			if(name.endsWith(ext)) return true;
		}
		return false;
	}
	
	/**
	 *	Open a depth image
	 *
	 *	@throws FileNotFoundException if the file does not exist
	 *	@throws IOException if the file cannot be decoded or is not a 16-bit image
	 */
	public static ShortProcessor read(Path path) throws IOException
	{
		if(!Files.isRegularFile(path))
		{
			throw new FileNotFoundException("Image file does not exist: " + path);
		}
		ImagePlus imp = IJ.openImage(path.toString());
		if(imp == null)
		{
			throw new IOException("Could not open image: " + path);
		}
		if(imp.getBitDepth() != 16)
		{
			throw new IOException("Not a 16-bit depth image (" + imp.getBitDepth() + "-bit): " + path);
		}
		return (ShortProcessor)imp.getProcessor();
	}
	
	/**
	 *	Write a depth image as PNG or TIFF depending on the file extension, creating missing parent directories
	 */
	public static void write(ImageProcessor ip, Path path) throws IOException
	{
		Path parent = path.toAbsolutePath().getParent();
		if(parent != null)
		{
			Files.createDirectories(parent);
		}
		ImageProcessor out = (ip instanceof ShortProcessor) ? ip : ip.convertToShortProcessor(false);
		ImagePlus imp = new ImagePlus(path.getFileName().toString(), out);
		FileSaver saver = new FileSaver(imp);
		
		String name = path.getFileName().toString().toLowerCase();
		boolean saved;
		if(name.endsWith(".png"))
		{
			saved = saver.saveAsPng(path.toString());
		}
		else if(name.endsWith(".tif") || name.endsWith(".tiff"))
		{
			saved = saver.saveAsTiff(path.toString());
		}
		else
		{
			throw new IOException("Unsupported depth image extension: " + path);
		}
		if(!saved)
		{
			throw new IOException("Could not write image: " + path);
		}
	}
}
