package org.tradesim.decision.parallel;

/**
 * How the results of independent search workers are combined.
 */
public enum AggregationPolicy
{
  /**
   * Each worker credits its entire simulation budget, and the value of its chosen branch, to the single action it
   * judged best.  Values are summed across workers.
   */
  BEST_ACTION_CREDIT,

  /**
   * Each worker credits every root action it explored with that action's own visit count and accumulated value.
   */
  PER_ACTION_VISITS
}
