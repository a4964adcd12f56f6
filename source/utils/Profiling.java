package utils;

// import ImageJ classes
import ij.IJ;

/**
 *	Wall clock timing of processing stages, reported to the ImageJ log
 */
public class Profiling
{
	/**
	 *	Members
	 */
	private final String label;
	private final long start;
	
	/**
	 *	Constructor
	 */
	private Profiling(String label)
	{
		this.label = label;
		this.start = System.nanoTime();
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public static Profiling tic(String label)
	{
		return new Profiling(label);
	}
	
	public long elapsed()
	{
		return System.nanoTime() - start;
	}
	
	/**
	 *	Log the elapsed time and return it in nanoseconds
	 */
	public long toc()
	{
		long elapsed = elapsed();
		IJ.log(label + " took " + format_time(elapsed));
		return elapsed;
	}
	
	public static String format_time(double time)
	{
		final String[] units = new String[]{"ns", "us", "ms", "sec", "min", "hours"};
		int unit = 0;
		while(time >= 1000 && unit < 3)
		{
			time /= 1000;
			++unit;
		}
		while(time >= 60 && unit >= 3 && unit < 5)
		{
			time /= 60;
			++unit;
		}
		return String.format("%.2f %s", time, units[unit]);
	}
}
