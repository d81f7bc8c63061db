package org.tradesim.util.model;

/**
 * A discrete choice available to the deciding agent.
 *
 * <p>Implementations must be immutable value types.  The key returned by {@link #getKey()} identifies one class of
 * move within a decision cycle and is what parallel searches aggregate on, so two structurally different actions must
 * never return the same key.
 */
public interface Action
{
  /**
   * @return the identifying key of this action, e.g. "move:harbour".
   */
  public String getKey();
}
