package algorithms;

// import Jama classes
import Jama.LUDecomposition;
import Jama.Matrix;

// import own classes
import core.BSpline;

/**
 *	Interpolating B-spline fit. Knots are placed the way FITPACK does for an interpolating (s = 0) curve:
 *	k+1 coincident knots at each end, interior knots at the data sites for odd k and halfway between data
 *	sites for even k. The returned coefficient array is padded with zeros to the length of the knot vector.
 */
public class SplineFitter
{
	/**
	 *	Constructor
	 */
	public SplineFitter()
	{
		/* do nothing */
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	/**
	 *	@param x strictly increasing sites
	 *	@param y values at the sites
	 *	@param degree spline degree, 1 &lt;= degree &lt; x.length
	 */
	public static BSpline interpolate(double[] x, double[] y, int degree)
	{
		int m = x.length;
		if(y.length != m)
		{
			throw new IllegalArgumentException("Site and value count differ: " + m + " != " + y.length);
		}
		if(degree < 1 || degree >= m)
		{
			throw new IllegalArgumentException("Degree " + degree + " needs between 2 and " + m + " points, got " + m);
		}
		for(int i = 1; i < m; ++i)
		{
			if(!(x[i] > x[i-1]))
			{
				throw new IllegalArgumentException("Sites must be strictly increasing at index " + i);
			}
		}
		
		double[] knots = interpolationKnots(x, degree);
		
		// collocation matrix, row i holds B_j(x_i)
		Matrix collocation = new Matrix(m, m);
		for(int i = 0; i < m; ++i)
		{
			int l = spanOf(knots, degree, x[i]);
			double[] basis = BSpline.basisFunctions(knots, degree, l, x[i]);
			for(int r = 0; r <= degree; ++r)
			{
				collocation.set(i, l - degree + r, basis[r]);
			}
		}
		
		LUDecomposition lu = collocation.lu();
		if(!lu.isNonsingular())
		{
			throw new IllegalArgumentException("Collocation matrix is singular");
		}
		Matrix solution = lu.solve(new Matrix(y, m));
		
		double[] coefficients = new double[knots.length];
		for(int j = 0; j < m; ++j)
		{
			coefficients[j] = solution.get(j, 0);
		}
		return new BSpline(knots, coefficients, degree);
	}
	
	public static double[] interpolationKnots(double[] x, int degree)
	{
		int m = x.length;
		double[] knots = new double[m + degree + 1];
		for(int i = 0; i <= degree; ++i)
		{
			knots[i] = x[0];
			knots[knots.length - 1 - i] = x[m - 1];
		}
		int interior = m - degree - 1;
		int half = degree / 2;
		for(int i = 0; i < interior; ++i)
		{
			int j = i + half + 1;
			knots[degree + 1 + i] = (degree % 2 == 1) ? x[j] : 0.5 * (x[j] + x[j - 1]);
		}
		return knots;
	}
	
	private static int spanOf(double[] knots, int degree, double x)
	{
		int l = degree;
		int last = knots.length - degree - 2;
		while(l < last && x >= knots[l + 1])
		{
			++l;
		}
		return l;
	}
}
