package org.tradesim.util.model.exceptions;

/**
 * Thrown by a parallel search when one of its workers failed.  The cause is the worker's own failure - normally a
 * {@link CapabilityException}.
 */
public class SearchWorkerException extends DecisionException
{
  private static final long serialVersionUID = 1L;

  private final int mWorkerIndex;

  public SearchWorkerException(int xiWorkerIndex, Throwable xiCause)
  {
    super("Search worker " + xiWorkerIndex + " failed: " + xiCause, xiCause);
    mWorkerIndex = xiWorkerIndex;
  }

  /**
   * @return the index (in dispatch order) of the worker that failed.
   */
  public int getWorkerIndex()
  {
    return mWorkerIndex;
  }
}
