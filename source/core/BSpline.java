package core;

import java.util.Arrays;

/**
 *	Piecewise polynomial curve in B-spline form, described by a knot vector, coefficients and a degree.
 *	<p>
 *	The coefficient array may be longer than the number of basis functions (n - k - 1 for n knots);
 *	trailing entries are ignored. This is the layout used by FITPACK, where the coefficient array is padded
 *	to the length of the knot vector.
 *	<p>
 *	Evaluation outside [t[k], t[n-k-1]] continues the polynomial piece of the nearest boundary interval.
 */
public class BSpline
{
	private final double[] knots;
	private final double[] coefficients;
	private final int degree;
	
	// ////////////////////////////////////////////////////////////////////////
	
	public BSpline(double[] knots, double[] coefficients, int degree)
	{
		if(degree < 0)
		{
			throw new IllegalArgumentException("Spline degree must not be negative: " + degree);
		}
		if(knots.length < 2 * (degree + 1))
		{
			throw new IllegalArgumentException("A degree " + degree + " spline needs at least " + 2 * (degree + 1) + " knots, got " + knots.length);
		}
		if(coefficients.length < knots.length - degree - 1)
		{
			throw new IllegalArgumentException("Expected at least " + (knots.length - degree - 1) + " coefficients, got " + coefficients.length);
		}
		for(int i = 1; i < knots.length; ++i)
		{
			if(!(knots[i] >= knots[i-1]))
			{
				throw new IllegalArgumentException("Knot vector must be non-decreasing at index " + i);
			}
		}
		if(!(knots[degree] < knots[knots.length - degree - 1]))
		{
			throw new IllegalArgumentException("Spline domain is empty");
		}
		this.knots = knots.clone();
		this.coefficients = coefficients.clone();
		this.degree = degree;
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public double[] getKnots()
	{
		return knots.clone();
	}
	
	public double[] getCoefficients()
	{
		return coefficients.clone();
	}
	
	public int getDegree()
	{
		return degree;
	}
	
	public int basisCount()
	{
		return knots.length - degree - 1;
	}
	
	public double domainMin()
	{
		return knots[degree];
	}
	
	public double domainMax()
	{
		return knots[knots.length - degree - 1];
	}
	
	public boolean inDomain(double x)
	{
		return x >= domainMin() && x <= domainMax();
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	/**
	 *	Index l of the knot span [t[l], t[l+1]) used for x, limited to the spans of the domain
	 */
	public int findSpan(double x)
	{
		int l = degree;
		int last = knots.length - degree - 2;
		while(l < last && x >= knots[l+1])
		{
			++l;
		}
		return l;
	}
	
	/**
	 *	Evaluate the spline with de Boor's algorithm
	 */
	public double evaluate(double x)
	{
		int l = findSpan(x);
		double[] d = new double[degree + 1];
		for(int j = 0; j <= degree; ++j)
		{
			d[j] = coefficients[j + l - degree];
		}
		for(int r = 1; r <= degree; ++r)
		{
			for(int j = degree; j >= r; --j)
			{
				int i = j + l - degree;
				double alpha = (x - knots[i]) / (knots[i + degree + 1 - r] - knots[i]);
				d[j] = (1.0 - alpha) * d[j-1] + alpha * d[j];
			}
		}
		return d[degree];
	}
	
	public double[] evaluate(double[] xs)
	{
		double[] result = new double[xs.length];
		for(int i = 0; i < xs.length; ++i)
		{
			result[i] = evaluate(xs[i]);
		}
		return result;
	}
	
	/**
	 *	First derivative as a spline of one degree lower
	 */
	public BSpline derivative()
	{
		if(degree == 0)
		{
			throw new IllegalStateException("Cannot differentiate a piecewise constant spline");
		}
		int n = knots.length;
		double[] d_knots = Arrays.copyOfRange(knots, 1, n - 1);
		double[] d_coefficients = new double[n - degree - 2];
		for(int i = 0; i < d_coefficients.length; ++i)
		{
			double span = knots[i + degree + 1] - knots[i + 1];
			d_coefficients[i] = (span > 0.0) ? degree * (coefficients[i + 1] - coefficients[i]) / span : 0.0;
		}
		return new BSpline(d_knots, d_coefficients, degree - 1);
	}
	
	public double derivativeAt(double x)
	{
		return derivative().evaluate(x);
	}
	
	/**
	 *	Values of the degree+1 basis functions that are non-zero on span l, evaluated at x.
	 *	Entry r belongs to basis function l - degree + r.
	 */
	public static double[] basisFunctions(double[] knots, int degree, int l, double x)
	{
		double[] basis = new double[degree + 1];
		double[] left = new double[degree + 1];
		double[] right = new double[degree + 1];
		basis[0] = 1.0;
		for(int j = 1; j <= degree; ++j)
		{
			left[j] = x - knots[l + 1 - j];
			right[j] = knots[l + j] - x;
			double saved = 0.0;
			for(int r = 0; r < j; ++r)
			{
				double temp = basis[r] / (right[r + 1] + left[j - r]);
				basis[r] = saved + right[r + 1] * temp;
				saved = left[j - r] * temp;
			}
			basis[j] = saved;
		}
		return basis;
	}
	
	@Override
	public String toString()
	{
		return String.format("BSpline{k=%d, knots=%d, domain=[%.4f, %.4f]}", degree, knots.length, domainMin(), domainMax());
	}
}
