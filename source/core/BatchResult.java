package core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 *	Results of a batch over many images. Items that could not be processed are listed in
 *	{@link #getErrors()} together with their reason; the batch itself continues past them.
 */
public class BatchResult<T>
{
	/**
	 *	One skipped item
	 */
	public static class ItemError
	{
		public final String name;
		public final String reason;
		
		public ItemError(String name, String reason)
		{
			this.name = name;
			this.reason = reason;
		}
		
		@Override
		public String toString()
		{
			return name + ": " + reason;
		}
	}
	
	// ////////////////////////////////////////////////////////////////////////
	
	private final int total;
	private final List<T> results;
	private final List<ItemError> errors;
	
	public BatchResult(int total, List<T> results, List<ItemError> errors)
	{
		this.total = total;
		this.results = Collections.unmodifiableList(new ArrayList<T>(results));
		this.errors = Collections.unmodifiableList(new ArrayList<ItemError>(errors));
	}
	
	public int getTotal()
	{
		return total;
	}
	
	public int getProcessed()
	{
		return results.size();
	}
	
	public int getFailed()
	{
		return errors.size();
	}
	
	public List<T> getResults()
	{
		return results;
	}
	
	public List<ItemError> getErrors()
	{
		return errors;
	}
}
