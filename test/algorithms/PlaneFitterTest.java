package algorithms;

import org.junit.jupiter.api.Test;

import ij.process.FloatProcessor;
import ij.process.ShortProcessor;

import core.CalibrationResult;
import core.FilterConfig;
import core.InsufficientDataException;
import core.PlaneFitConfig;
import core.PlaneParameters;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlaneFitterTest
{
	private static final int INVALID = 65535;
	
	private static ShortProcessor plane(int width, int height, double a, double b, double c)
	{
		ShortProcessor ip = new ShortProcessor(width, height);
		for(int py = 0; py < height; ++py)
		{
			for(int px = 0; px < width; ++px)
			{
				ip.set(px, py, (int)Math.round(a * px + b * py + c));
			}
		}
		return ip;
	}
	
	@Test
	void fitPlane_recoversTiltAndOffset() throws InsufficientDataException
	{
		ShortProcessor ip = plane(100, 100, 2.0, 3.0, 1000.0);
		PlaneParameters p = PlaneFitter.fitPlane(ip, INVALID, 100);
		assertEquals(2.0, p.a, 0.1);
		assertEquals(3.0, p.b, 0.1);
		assertEquals(1000.0, p.c, 0.1);
	}
	
	@Test
	void fitPlane_ignoresInvalidPixels() throws InsufficientDataException
	{
		ShortProcessor ip = plane(40, 40, -1.0, 2.0, 20000.0);
		for(int i = 0; i < 40; ++i)
		{
			ip.set(i, i, INVALID);
		}
		PlaneParameters p = PlaneFitter.fitPlane(ip, INVALID, 100);
		assertEquals(-1.0, p.a, 1e-6);
		assertEquals(2.0, p.b, 1e-6);
		assertEquals(20000.0, p.c, 1e-6);
	}
	
	@Test
	void fitPlane_tooFewValidPixels_throws()
	{
		ShortProcessor ip = new ShortProcessor(10, 10);
		ip.set(INVALID);
		ip.set(1, 1, 100);
		ip.set(2, 5, 100);
		assertThrows(InsufficientDataException.class, () -> PlaneFitter.fitPlane(ip, INVALID, 3));
	}
	
	@Test
	void fitPlane_collinearPixels_throws()
	{
		ShortProcessor ip = new ShortProcessor(10, 10);
		ip.set(INVALID);
		for(int px = 0; px < 10; ++px)
		{
			ip.set(px, 4, 1000 + px);
		}
		assertThrows(InsufficientDataException.class, () -> PlaneFitter.fitPlane(ip, INVALID, 3));
	}
	
	@Test
	void flatness_isPeakToPeakOfValidDeviation()
	{
		ShortProcessor ip = new ShortProcessor(10, 10);
		ip.set(500);
		ip.set(3, 3, 510);
		ip.set(6, 6, 495);
		ip.set(8, 1, INVALID);
		PlaneParameters flat = new PlaneParameters(0.0, 0.0, 500.0);
		assertEquals(15.0, PlaneFitter.flatness(ip, flat, INVALID), 1e-9);
	}
	
	@Test
	void flatness_noValidPixels_isNaN()
	{
		ShortProcessor ip = new ShortProcessor(4, 4);
		ip.set(INVALID);
		assertTrue(Double.isNaN(PlaneFitter.flatness(ip, new PlaneParameters(0, 0, 0), INVALID)));
	}
	
	@Test
	void calibratePlane_removesTiltAndKeepsInvalid()
	{
		ShortProcessor ip = plane(20, 20, 1.0, 2.0, 3000.0);
		ip.set(5, 5, INVALID);
		FloatProcessor calibrated = PlaneFitter.calibratePlane(ip, new PlaneParameters(1.0, 2.0, 3000.0), INVALID);
		assertEquals(3000.0f, calibrated.getf(19, 19), 1e-3f);
		assertEquals(3000.0f, calibrated.getf(0, 0), 1e-3f);
		assertEquals((float)INVALID, calibrated.getf(5, 5));
	}
	
	@Test
	void calibrateImage_success_reportsPlaneAndMean()
	{
		ShortProcessor ip = plane(50, 50, 0.0, 0.0, 40000.0);
		CalibrationResult result = PlaneFitter.calibrateImage(ip, new FilterConfig(), INVALID, new PlaneFitConfig());
		assertTrue(result.isSuccess());
		CalibrationResult.Success success = result.asSuccess();
		assertEquals(40000.0, success.plane.c, 1e-3);
		assertEquals(0.0, success.flatness, 1e-3);
		assertEquals(40000.0, success.meanValidValue(INVALID), 1e-3);
		assertNotNull(success.filtered);
	}
	
	@Test
	void calibrateImage_withoutFilter_hasNoFilteredImage()
	{
		ShortProcessor ip = plane(50, 50, 1.0, 0.0, 40000.0);
		CalibrationResult result = PlaneFitter.calibrateImage(ip, false, new FilterConfig(), INVALID, new PlaneFitConfig());
		assertNull(result.asSuccess().filtered);
	}
	
	@Test
	void calibrateImage_lowValidRatio_fails()
	{
		// 200 valid pixels out of 10000 passes the count but not the 10% ratio
		ShortProcessor ip = new ShortProcessor(100, 100);
		ip.set(INVALID);
		for(int py = 0; py < 2; ++py)
		{
			for(int px = 0; px < 100; ++px)
			{
				ip.set(px, py, 1000);
			}
		}
		CalibrationResult result = PlaneFitter.calibrateImage(ip, false, new FilterConfig(), INVALID, new PlaneFitConfig());
		assertFalse(result.isSuccess());
		assertThrows(IllegalStateException.class, () -> result.asSuccess());
	}
}
