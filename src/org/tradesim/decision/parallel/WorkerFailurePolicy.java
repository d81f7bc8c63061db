package org.tradesim.decision.parallel;

/**
 * What the coordinator does when a search worker fails.
 */
public enum WorkerFailurePolicy
{
  /**
   * Abort the decision on the first failure, cancelling outstanding workers.
   */
  FAIL_FAST,

  /**
   * Exclude the failed worker's contribution and decide on the rest.  The decision fails only if every worker fails.
   */
  BEST_EFFORT
}
