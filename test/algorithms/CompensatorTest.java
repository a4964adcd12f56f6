package algorithms;

import org.junit.jupiter.api.Test;

import ij.process.ShortProcessor;

import core.CompensationModel;
import core.CompensationOutcome;
import core.ExtrapolationConfig;
import core.NormalizationConfig;
import utils.DepthConversion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CompensatorTest
{
	private static final int INVALID = 65535;
	private final DepthConversion conversion = new DepthConversion();
	
	// invalid, in range (15 mm), extrapolation band (21 mm), far out of range (30 mm)
	private ShortProcessor sample()
	{
		ShortProcessor ip = new ShortProcessor(4, 1);
		ip.set(0, 0, INVALID);
		ip.set(1, 0, conversion.distanceToGray(15.0));
		ip.set(2, 0, conversion.distanceToGray(21.0));
		ip.set(3, 0, conversion.distanceToGray(30.0));
		return ip;
	}
	
	@Test
	void compensate_arrayMatchesScalar()
	{
		CompensationModel model = ExtrapolatorTest.linearModel();
		double[] measured = {11.0, 15.0, 19.5};
		double[] values = Compensator.compensate(measured, model, null);
		for(int i = 0; i < values.length; ++i)
		{
			assertEquals(values[i], Compensator.compensate(measured[i], model, null), 1e-12);
		}
		assertEquals(10.0, values[1], 1e-9);
	}
	
	@Test
	void compensateImage_withExtrapolation()
	{
		CompensationModel model = ExtrapolatorTest.linearModel();
		ShortProcessor ip = sample();
		CompensationOutcome outcome = Compensator.compensateImage(ip, model, conversion, new ExtrapolationConfig(), 0.0);
		
		assertEquals(INVALID, outcome.compensated.get(0, 0));
		assertEquals(conversion.distanceToGray(10.0), outcome.compensated.get(1, 0));
		assertEquals(conversion.distanceToGray(22.0), outcome.compensated.get(2, 0));
		assertEquals(ip.get(3, 0), outcome.compensated.get(3, 0));
		
		assertEquals(4, outcome.total_pixels);
		assertEquals(3, outcome.valid_pixels);
		assertEquals(1, outcome.invalid_pixels);
		assertEquals(1, outcome.in_range_pixels);
		assertEquals(1, outcome.extrapolated_pixels);
		assertEquals(2, outcome.compensated_pixels);
		assertEquals(1, outcome.out_of_range_pixels);
		assertEquals(50.0, outcome.compensationRate(), 1e-12);
		assertTrue(outcome.extrapolation_enabled);
	}
	
	@Test
	void compensateImage_withoutExtrapolation_onlyInRange()
	{
		CompensationModel model = ExtrapolatorTest.linearModel();
		ShortProcessor ip = sample();
		CompensationOutcome outcome = Compensator.compensateImage(ip, model, conversion, ExtrapolationConfig.disabled(), 0.0);
		
		assertEquals(ip.get(2, 0), outcome.compensated.get(2, 0));
		assertEquals(1, outcome.compensated_pixels);
		assertEquals(0, outcome.extrapolated_pixels);
		assertEquals(2, outcome.out_of_range_pixels);
		assertFalse(outcome.extrapolation_enabled);
	}
	
	@Test
	void compensateImage_leavesInputUntouched()
	{
		ShortProcessor ip = sample();
		int before = ip.get(1, 0);
		Compensator.compensateImage(ip, ExtrapolatorTest.linearModel());
		assertEquals(before, ip.get(1, 0));
	}
	
	@Test
	void compensateImage_allInvalid_keepsEverything()
	{
		ShortProcessor ip = new ShortProcessor(3, 3);
		ip.set(INVALID);
		CompensationOutcome outcome = Compensator.compensateImage(ip, ExtrapolatorTest.linearModel());
		assertEquals(0, outcome.valid_pixels);
		assertEquals(9, outcome.invalid_pixels);
		assertEquals(0.0, outcome.compensationRate(), 0.0);
		assertEquals(INVALID, outcome.compensated.get(1, 1));
	}
	
	@Test
	void compensateImage_appliesNormalizationOffset()
	{
		CompensationModel model = ExtrapolatorTest.linearModel();
		double offset = Compensator.normalizationOffset(model, 0.0);
		assertEquals(-10.0, offset, 1e-12);
		CompensationOutcome outcome = Compensator.compensateImage(sample(), model, conversion, ExtrapolationConfig.disabled(), offset);
		assertEquals(conversion.distanceToGray(0.0), outcome.compensated.get(1, 0));
		assertEquals(offset, outcome.normalize_offset, 0.0);
	}
	
	@Test
	void compensateImage_saturatedOutputStaysValid()
	{
		// maps 50.5 mm to about 55.4 mm, above the largest representable distance
		double[] measured = {20.0, 27.75, 35.5, 43.25, 51.0};
		double[] actual = {20.0, 29.0, 38.0, 47.0, 56.0};
		CompensationModel model = CompensationModelBuilder.build(actual, measured).getModel();
		ShortProcessor ip = new ShortProcessor(1, 1);
		ip.set(0, 0, conversion.distanceToGray(50.5));
		
		CompensationOutcome outcome = Compensator.compensateImage(ip, model, conversion, ExtrapolationConfig.disabled(), 0.0);
		assertEquals(1, outcome.compensated_pixels);
		assertEquals(INVALID - 1, outcome.compensated.get(0, 0));
	}
	
	@Test
	void compensateImage_zeroInvalidValue_neverWritesZero()
	{
		DepthConversion zero_invalid = conversion.withInvalidValue(0);
		ShortProcessor ip = new ShortProcessor(2, 1);
		ip.set(0, 0, 0);
		ip.set(1, 0, zero_invalid.distanceToGray(15.0));
		
		CompensationOutcome outcome = Compensator.compensateImage(ip, ExtrapolatorTest.linearModel(), zero_invalid, ExtrapolationConfig.disabled(), -100.0);
		assertEquals(1, outcome.invalid_pixels);
		assertEquals(0, outcome.compensated.get(0, 0));
		assertEquals(1, outcome.compensated.get(1, 0));
	}
	
	@Test
	void normalizationOffset_honorsConfig()
	{
		CompensationModel model = ExtrapolatorTest.linearModel();
		assertEquals(0.0, Compensator.normalizationOffset(model, new NormalizationConfig()), 0.0);
		assertEquals(-5.0, Compensator.normalizationOffset(model, NormalizationConfig.centeredAt(5.0)), 1e-12);
		assertEquals(1.25, Compensator.normalizationOffset(model, new NormalizationConfig(true, 0.0, false, 1.25)), 0.0);
	}
}
