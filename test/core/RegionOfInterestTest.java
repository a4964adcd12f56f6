package core;

import java.awt.Rectangle;

import org.junit.jupiter.api.Test;

import ij.process.ImageProcessor;
import ij.process.ShortProcessor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RegionOfInterestTest
{
	private static ShortProcessor ramp(int width, int height)
	{
		ShortProcessor ip = new ShortProcessor(width, height);
		for(int py = 0; py < height; ++py)
		{
			for(int px = 0; px < width; ++px)
			{
				ip.set(px, py, py * 100 + px);
			}
		}
		return ip;
	}
	
	@Test
	void fullImage_returnsSameProcessor()
	{
		ShortProcessor ip = ramp(8, 6);
		assertSame(ip, RegionOfInterest.FULL_IMAGE.extract(ip));
		assertTrue(RegionOfInterest.FULL_IMAGE.isFullImage());
	}
	
	@Test
	void extract_copiesSubRectangle()
	{
		ImageProcessor roi = new RegionOfInterest(2, 1, 3, 2).extract(ramp(8, 6));
		assertEquals(3, roi.getWidth());
		assertEquals(2, roi.getHeight());
		assertEquals(102, roi.get(0, 0));
		assertEquals(204, roi.get(2, 1));
	}
	
	@Test
	void extract_toEdgeInOneDimension()
	{
		ImageProcessor roi = new RegionOfInterest(5, 2, RegionOfInterest.TO_EDGE, 2).extract(ramp(8, 6));
		assertEquals(3, roi.getWidth());
		assertEquals(2, roi.getHeight());
		assertEquals(207, roi.get(2, 0));
	}
	
	@Test
	void extract_clipsNegativeStartAndOversizedEnd()
	{
		ImageProcessor roi = new RegionOfInterest(-3, -2, 100, 4).extract(ramp(8, 6));
		assertEquals(8, roi.getWidth());
		assertEquals(2, roi.getHeight());
		assertEquals(0, roi.get(0, 0));
	}
	
	@Test
	void clip_regionOutsideImage_isEmpty()
	{
		RegionOfInterest outside = new RegionOfInterest(20, 20, 5, 5);
		ShortProcessor ip = ramp(8, 6);
		assertTrue(outside.isEmpty(ip));
		assertEquals(0, outside.clip(ip).width * outside.clip(ip).height);
		assertFalse(new RegionOfInterest(6, 4, 5, 5).isEmpty(ip));
		assertEquals(new Rectangle(6, 4, 2, 2), new RegionOfInterest(6, 4, 5, 5).clip(ip));
	}
	
	@Test
	void extract_regionOutsideAllZeroImage_throws()
	{
		// all-zero frames have a 0..0 display range
		ShortProcessor blank = new ShortProcessor(50, 50);
		assertThrows(IllegalArgumentException.class, () -> new RegionOfInterest(100, 100, 10, 10).extract(blank));
		assertThrows(IllegalArgumentException.class, () -> new RegionOfInterest(0, 50, RegionOfInterest.TO_EDGE, 3).extract(blank));
	}
	
	@Test
	void extract_doesNotAliasInput()
	{
		ShortProcessor ip = ramp(8, 6);
		ImageProcessor roi = new RegionOfInterest(0, 0, 2, 2).extract(ip);
		roi.set(0, 0, 999);
		assertEquals(0, ip.get(0, 0));
	}
}
