package core;

/**
 *	Outcome of building a compensation model from calibration pairs
 */
public abstract class ModelBuildResult
{
	private ModelBuildResult()
	{
		/* closed hierarchy */
	}
	
	public abstract boolean isSuccess();
	
	public abstract CompensationModel getModel();
	
	public static ModelBuildResult success(CompensationModel model)
	{
		return new Success(model);
	}
	
	public static ModelBuildResult failure(String reason)
	{
		return new Failure(reason);
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	public static final class Success extends ModelBuildResult
	{
		public final CompensationModel model;
		
		private Success(CompensationModel model)
		{
			this.model = model;
		}
		
		@Override
		public boolean isSuccess()
		{
			return true;
		}
		
		@Override
		public CompensationModel getModel()
		{
			return model;
		}
	}
	
	public static final class Failure extends ModelBuildResult
	{
		public final String reason;
		
		private Failure(String reason)
		{
			this.reason = reason;
		}
		
		@Override
		public boolean isSuccess()
		{
			return false;
		}
		
		@Override
		public CompensationModel getModel()
		{
			throw new IllegalStateException("Model build failed: " + reason);
		}
		
		@Override
		public String toString()
		{
			return "ModelBuildResult.Failure{" + reason + "}";
		}
	}
}
