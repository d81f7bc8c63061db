package org.tradesim.decision.mcts;

/**
 * The ways in which a search can use a value estimator.
 */
public enum EstimatorRole
{
  /**
   * Score newly expanded nodes with the estimator instead of performing a rollout.
   */
  LEAF_EVALUATION,

  /**
   * Score newly expanded nodes with rollouts, but bias selection towards children that the estimator rates highly.
   * The bias decays as the child is visited.
   */
  SELECTION_PRIOR
}
