package filters;

import org.junit.jupiter.api.Test;

import ij.process.ImageProcessor;
import ij.process.ShortProcessor;

import core.FilterConfig;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;

class FilterChainTest
{
	private static final int INVALID = 65535;
	
	private static ShortProcessor constant(int width, int height, int value)
	{
		ShortProcessor ip = new ShortProcessor(width, height);
		ip.set(value);
		return ip;
	}
	
	@Test
	void outlierRejection_marksSpikeInvalid()
	{
		ShortProcessor ip = constant(20, 20, 1000);
		ip.set(3, 3, 1002);
		ip.set(10, 10, 5000);
		ImageProcessor out = OutlierRejection.run(ip, 3.0, INVALID);
		assertEquals(INVALID, out.get(10, 10));
		assertEquals(1002, out.get(3, 3));
		assertEquals(1000, out.get(0, 0));
		assertEquals(5000, ip.get(10, 10));
	}
	
	@Test
	void outlierRejection_allInvalid_returnsCopy()
	{
		ShortProcessor ip = constant(4, 4, INVALID);
		ImageProcessor out = OutlierRejection.run(ip, INVALID);
		assertNotSame(ip, out);
		assertEquals(INVALID, out.get(2, 2));
	}
	
	@Test
	void median_removesIsolatedPeak()
	{
		ShortProcessor ip = constant(9, 9, 500);
		ip.set(4, 4, 900);
		ImageProcessor out = Median.run(ip, 3, INVALID);
		assertEquals(500, out.get(4, 4));
	}
	
	@Test
	void median_keepsInvalidPositions()
	{
		ShortProcessor ip = constant(9, 9, 500);
		ip.set(2, 2, INVALID);
		ip.set(0, 8, INVALID);
		ImageProcessor out = Median.run(ip, 3, INVALID);
		assertEquals(INVALID, out.get(2, 2));
		assertEquals(INVALID, out.get(0, 8));
		assertEquals(500, out.get(2, 3));
	}
	
	@Test
	void gaussian_constantImage_isUnchanged()
	{
		ShortProcessor ip = constant(12, 10, 32768);
		ip.set(5, 5, INVALID);
		ImageProcessor out = Gaussian.run(ip, 1.0, INVALID);
		assertEquals(32768, out.get(0, 0));
		assertEquals(32768, out.get(11, 9));
		assertEquals(INVALID, out.get(5, 5));
	}
	
	@Test
	void gaussianKernel_radiusIsFourSigmaRounded()
	{
		assertEquals(9, Gaussian.computeKernelGaussian1D(1.0).length);
		assertEquals(13, Gaussian.computeKernelGaussian1D(1.5).length);
		double sum = 0.0;
		for(double k : Gaussian.computeKernelGaussian1D(2.0))
		{
			sum += k;
		}
		assertEquals(1.0, sum, 1e-12);
	}
	
	@Test
	void reflect_mirrorsAboutPixelEdges()
	{
		assertEquals(0, MaskFilter.reflect(-1, 5));
		assertEquals(1, MaskFilter.reflect(-2, 5));
		assertEquals(4, MaskFilter.reflect(5, 5));
		assertEquals(3, MaskFilter.reflect(6, 5));
		assertEquals(0, MaskFilter.reflect(3, 1));
	}
	
	@Test
	void chain_preservesInvalidMaskOfInput()
	{
		ShortProcessor ip = new ShortProcessor(16, 16);
		for(int py = 0; py < 16; ++py)
		{
			for(int px = 0; px < 16; ++px)
			{
				ip.set(px, py, 30000 + 3 * px + 2 * py);
			}
		}
		ip.set(1, 1, INVALID);
		ip.set(14, 7, INVALID);
		ip.set(0, 15, INVALID);
		
		ImageProcessor out = FilterChain.run(ip, new FilterConfig(), INVALID);
		for(int py = 0; py < 16; ++py)
		{
			for(int px = 0; px < 16; ++px)
			{
				if(ip.get(px, py) == INVALID)
				{
					assertEquals(INVALID, out.get(px, py));
				}
			}
		}
	}
	
	@Test
	void chain_disabled_returnsUnmodifiedCopy()
	{
		ShortProcessor ip = constant(5, 5, 1234);
		ip.set(2, 2, 4321);
		ImageProcessor out = FilterChain.run(ip, FilterConfig.disabled(), INVALID);
		assertNotSame(ip, out);
		assertEquals(4321, out.get(2, 2));
	}
	
	@Test
	void maskFilter_countsAndCollectsValidPixels()
	{
		ShortProcessor ip = constant(3, 2, 7);
		ip.set(1, 0, INVALID);
		assertEquals(5, MaskFilter.validCount(ip, INVALID));
		assertEquals(5, MaskFilter.validValues(ip, INVALID).length);
		boolean[] mask = MaskFilter.validMask(ip, INVALID);
		assertEquals(false, mask[1]);
		assertEquals(true, mask[3]);
	}
}
