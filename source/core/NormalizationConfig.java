package core;

/**
 *	Shift applied to every compensated distance before it is written back as gray value
 */
public class NormalizationConfig
{
	public static final boolean DEFAULT_ENABLED = false;
	public static final double DEFAULT_TARGET_CENTER = 0.0;
	public static final boolean DEFAULT_AUTO_OFFSET = true;
	public static final double DEFAULT_MANUAL_OFFSET = 0.0;
	
	public final boolean enabled;
	public final double target_center;
	public final boolean auto_offset;
	public final double manual_offset;
	
	public NormalizationConfig()
	{
		this(DEFAULT_ENABLED, DEFAULT_TARGET_CENTER, DEFAULT_AUTO_OFFSET, DEFAULT_MANUAL_OFFSET);
	}
	
	public NormalizationConfig(boolean enabled, double target_center, boolean auto_offset, double manual_offset)
	{
		this.enabled = enabled;
		this.target_center = target_center;
		this.auto_offset = auto_offset;
		this.manual_offset = manual_offset;
	}
	
	public static NormalizationConfig centeredAt(double target_center)
	{
		return new NormalizationConfig(true, target_center, true, DEFAULT_MANUAL_OFFSET);
	}
}
