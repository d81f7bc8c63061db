package org.tradesim.util.model.exceptions;

/**
 * Thrown when a supplied state fails the structural expectations of its domain, or can't be deserialized.
 */
public class InvalidStateException extends DecisionException
{
  private static final long serialVersionUID = 1L;

  public InvalidStateException(String xiMessage)
  {
    super(xiMessage);
  }

  public InvalidStateException(String xiMessage, Throwable xiCause)
  {
    super(xiMessage, xiCause);
  }
}
