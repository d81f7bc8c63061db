package org.tradesim.decision.parallel;

/**
 * The order in which the coordinator collects worker results.
 */
public enum CollectionOrder
{
  /**
   * Wait for each worker in the order it was dispatched.  A slow early worker delays collection of later ones that
   * have already finished.
   */
  DISPATCH,

  /**
   * Collect each worker's result as soon as it finishes.  Key encounter order (and so tie-breaking) then depends on
   * timing.
   */
  COMPLETION
}
