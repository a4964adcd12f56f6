package algorithms;

import org.junit.jupiter.api.Test;

import core.BSpline;
import core.CompensationModel;
import core.ExtrapolationConfig;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

class ExtrapolatorTest
{
	// actual = 2 * (measured - 10) over measured [10, 20]
	static CompensationModel linearModel()
	{
		double[] measured = {10, 12, 14, 16, 18, 20};
		double[] actual = {0, 4, 8, 12, 16, 20};
		return CompensationModelBuilder.build(actual, measured).getModel();
	}
	
	private static final ExtrapolationConfig WIDE = new ExtrapolationConfig(true, 2.0, 2.0, -100.0, 100.0, true);
	
	@Test
	void apply_insideDomain_evaluatesSpline()
	{
		assertEquals(7.0, Extrapolator.apply(13.5, linearModel(), WIDE), 1e-9);
	}
	
	@Test
	void apply_belowDomain_followsLowerTangentUpToLimit()
	{
		CompensationModel model = linearModel();
		assertEquals(-1.0, Extrapolator.apply(9.5, model, WIDE), 1e-9);
		assertEquals(-4.0, Extrapolator.apply(8.0, model, WIDE), 1e-9);
		assertEquals(-4.0, Extrapolator.apply(2.0, model, WIDE), 1e-9);
	}
	
	@Test
	void apply_aboveDomain_followsUpperTangentUpToLimit()
	{
		CompensationModel model = linearModel();
		assertEquals(21.0, Extrapolator.apply(20.5, model, WIDE), 1e-9);
		assertEquals(24.0, Extrapolator.apply(35.0, model, WIDE), 1e-9);
	}
	
	@Test
	void apply_clampsOutputRegardlessOfSource()
	{
		ExtrapolationConfig narrow = new ExtrapolationConfig(true, 2.0, 2.0, 1.0, 15.0, true);
		CompensationModel model = linearModel();
		assertArrayEquals(new double[]{1.0, 1.0, 15.0, 15.0}, Extrapolator.apply(new double[]{9.0, 10.0, 19.0, 21.0}, model, narrow), 1e-9);
	}
	
	@Test
	void apply_defaultConfig_clampsToOutputRange()
	{
		assertEquals(0.0, Extrapolator.apply(9.0, linearModel(), null), 1e-9);
	}
	
	@Test
	void apply_continuousAtDomainBoundaries()
	{
		CompensationModel model = CompensationModelBuilder.build(CompensationModelBuilderTest.ACTUAL, CompensationModelBuilderTest.REFERENCE_MEASURED).getModel();
		BSpline spline = model.getInverse();
		double h = 1e-7;
		for(double edge : new double[]{spline.domainMin(), spline.domainMax()})
		{
			double inside = spline.evaluate(edge);
			assertEquals(inside, Extrapolator.apply(edge, model, WIDE), 1e-9);
			assertEquals(inside, Extrapolator.apply(edge - h, model, WIDE), 1e-5);
			assertEquals(inside, Extrapolator.apply(edge + h, model, WIDE), 1e-5);
		}
		// slope of the extension matches the spline at the seam
		double edge = spline.domainMax();
		double slope = spline.derivative().evaluate(edge);
		assertEquals(slope, (Extrapolator.apply(edge + 0.5, model, WIDE) - Extrapolator.apply(edge, model, WIDE)) / 0.5, 1e-9);
	}
	
	@Test
	void extendedRange_addsLimitsToMeasuredRange()
	{
		assertArrayEquals(new double[]{8.0, 22.5}, Extrapolator.extendedRange(linearModel(), new ExtrapolationConfig(true, 2.0, 2.5)), 1e-12);
	}
	
	@Test
	void statistics_countsAndDistances()
	{
		Extrapolator.Statistics stats = Extrapolator.statistics(new double[]{5, 10, 15, 21, 23}, linearModel());
		assertEquals(5, stats.total_count);
		assertEquals(2, stats.in_range_count);
		assertEquals(1, stats.below_range_count);
		assertEquals(2, stats.above_range_count);
		assertEquals(5.0, stats.below_range_max_distance, 1e-12);
		assertEquals(3.0, stats.above_range_max_distance, 1e-12);
	}
	
	@Test
	void disabled_extendsBoundaryPolynomialFarOutsideDomain()
	{
		// linear calibration data stays linear several domain widths away
		CompensationModel model = linearModel();
		ExtrapolationConfig off = ExtrapolationConfig.disabled();
		assertEquals(60.0, Compensator.compensate(40.0, model, off), 1e-6);
		assertEquals(80.0, Compensator.compensate(50.0, model, off), 1e-6);
		assertEquals(-60.0, Compensator.compensate(-20.0, model, off), 1e-6);
	}
	
	@Test
	void disabled_cubicDataContinuesBoundaryCubic()
	{
		double[] measured = {0, 1, 2, 3, 4, 5, 6};
		double[] actual = new double[measured.length];
		for(int i = 0; i < measured.length; ++i)
		{
			actual[i] = measured[i] * measured[i] * measured[i] + measured[i];
		}
		CompensationModel model = CompensationModelBuilder.build(actual, measured).getModel();
		assertEquals(12.0 * 12.0 * 12.0 + 12.0, Compensator.compensate(12.0, model, null), 1e-6);
		assertEquals(-6.0 * 6.0 * 6.0 - 6.0, Compensator.compensate(-6.0, model, null), 1e-6);
	}
}
