package core;

import java.awt.Rectangle;

// import ImageJ classes
import ij.process.ImageProcessor;

/**
 *	Rectangular analysis region over a depth image; a width or height of -1 extends the region to the image edge
 */
public class RegionOfInterest
{
	/**
	 *	Constants
	 */
	public static final int TO_EDGE = -1;
	public static final RegionOfInterest FULL_IMAGE = new RegionOfInterest(0, 0, TO_EDGE, TO_EDGE);
	
	/**
	 *	Members
	 */
	public final int x, y;
	public final int width, height;
	
	// ////////////////////////////////////////////////////////////////////////
	
	public RegionOfInterest(int x, int y, int width, int height)
	{
		this.x = x;
		this.y = y;
		this.width = width;
		this.height = height;
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public boolean isFullImage()
	{
		return x == 0 && y == 0 && width == TO_EDGE && height == TO_EDGE;
	}
	
	/**
	 *	Region clipped against the image bounds; a region lying completely outside the image has zero area
	 */
	public Rectangle clip(ImageProcessor ip)
	{
		int image_width = ip.getWidth();
		int image_height = ip.getHeight();
		int x_start = Math.max(0, x);
		int y_start = Math.max(0, y);
		int x_end = (width == TO_EDGE) ? image_width : Math.min(image_width, x + width);
		int y_end = (height == TO_EDGE) ? image_height : Math.min(image_height, y + height);
		return new Rectangle(x_start, y_start, Math.max(0, x_end - x_start), Math.max(0, y_end - y_start));
	}
	
	public boolean isEmpty(ImageProcessor ip)
	{
		Rectangle r = clip(ip);
		return r.width == 0 || r.height == 0;
	}
	
	/**
	 *	Extract the region from an image. When both dimensions are {@link #TO_EDGE} the image itself is returned,
	 *	otherwise the clipped rectangle is copied.
	 *
	 *	@throws IllegalArgumentException if the region lies completely outside the image, see {@link #isEmpty}
	 */
	public ImageProcessor extract(ImageProcessor ip)
	{
		if(width == TO_EDGE && height == TO_EDGE)
		{
			return ip;
		}
		
		// processors need at least one pixel
		Rectangle r = clip(ip);
		if(r.width == 0 || r.height == 0)
		{
			throw new IllegalArgumentException("Empty ROI: " + this + " lies outside the " + ip.getWidth() + "x" + ip.getHeight() + " image");
		}
		
		ImageProcessor roi = ip.createProcessor(r.width, r.height);
		for(int py = 0; py < r.height; ++py)
		{
			for(int px = 0; px < r.width; ++px)
			{
				roi.setf(px, py, ip.getf(r.x + px, r.y + py));
			}
		}
		return roi;
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	@Override
	public boolean equals(Object o)
	{
		if(!(o instanceof RegionOfInterest)) return false;
		RegionOfInterest r = (RegionOfInterest)o;
		return r.x == x && r.y == y && r.width == width && r.height == height;
	}
	
	@Override
	public int hashCode()
	{
		return ((x * 31 + y) * 31 + width) * 31 + height;
	}
	
	@Override
	public String toString()
	{
		if(isFullImage()) return "ROI{full image}";
		String x_end = (width == TO_EDGE) ? "edge" : String.valueOf(x + width);
		String y_end = (height == TO_EDGE) ? "edge" : String.valueOf(y + height);
		return "ROI{x=[" + x + "," + x_end + "], y=[" + y + "," + y_end + "]}";
	}
}
