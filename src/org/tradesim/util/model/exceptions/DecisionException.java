package org.tradesim.util.model.exceptions;

/**
 * Abstract class for exceptions raised while reaching a decision.
 */
public abstract class DecisionException extends Exception
{
  private static final long serialVersionUID = 1L;

  protected DecisionException(String xiMessage)
  {
    super(xiMessage);
  }

  protected DecisionException(String xiMessage, Throwable xiCause)
  {
    super(xiMessage, xiCause);
  }
}
