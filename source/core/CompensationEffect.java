package core;

/**
 *	Linearity before and after compensation on the same reference sequence
 */
public class CompensationEffect
{
	public final LinearityResult before;
	public final LinearityResult after;
	public final double improvement; // percent reduction of the linearity error
	
	public CompensationEffect(LinearityResult before, LinearityResult after)
	{
		this.before = before;
		this.after = after;
		this.improvement = (before.linearity != 0.0) ? 100.0 * (before.linearity - after.linearity) / before.linearity : 0.0;
	}
	
	@Override
	public String toString()
	{
		return String.format("CompensationEffect{before=%.4f%%, after=%.4f%%, improvement=%.2f%%}", before.linearity, after.linearity, improvement);
	}
}
