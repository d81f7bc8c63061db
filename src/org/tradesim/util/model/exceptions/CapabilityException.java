package org.tradesim.util.model.exceptions;

/**
 * Thrown when a caller-supplied capability (a {@link org.tradesim.util.model.DomainModel} method or a value estimator)
 * fails during a search.
 *
 * <p>This always aborts the search in progress.  It is never interpreted as a terminal state or a "no decision".
 */
public class CapabilityException extends DecisionException
{
  private static final long serialVersionUID = 1L;

  /**
   * The capabilities the search calls out to.
   */
  public static enum Capability
  {
    LEGAL_ACTIONS,
    NEXT_STATE,
    IS_TERMINAL,
    REWARD,
    ACTING_ROLE,
    ESTIMATE
  }

  private final Capability mCapability;

  public CapabilityException(Capability xiCapability, String xiMessage)
  {
    super(xiCapability + ": " + xiMessage);
    mCapability = xiCapability;
  }

  public CapabilityException(Capability xiCapability, Throwable xiCause)
  {
    super(xiCapability + " failed: " + xiCause, xiCause);
    mCapability = xiCapability;
  }

  /**
   * @return the capability that failed.
   */
  public Capability getCapability()
  {
    return mCapability;
  }
}
