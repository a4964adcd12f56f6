package core;

/**
 *	Coefficients of the plane z = a*x + b*y + c
 */
public class PlaneParameters
{
	public final double a, b, c;
	
	public PlaneParameters(double a, double b, double c)
	{
		this.a = a;
		this.b = b;
		this.c = c;
	}
	
	public double valueAt(double x, double y)
	{
		return a * x + b * y + c;
	}
	
	@Override
	public String toString()
	{
		return String.format("z = %.6f*x + %.6f*y + %.3f", a, b, c);
	}
}
