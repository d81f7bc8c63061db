package org.tradesim.decision.estimator;

/**
 * Interface for value estimators.
 *
 * <p>An estimator maps a (non-terminal) state to a prediction of the eventual reward from that state, in the range
 * [-1, 1], from the perspective of the agent acting at the root of the search.  Searches use estimators either in
 * place of rollouts or to bias selection (see {@link org.tradesim.decision.mcts.EstimatorRole}).
 *
 * <p>Estimators are optional.  A search with no estimator falls back to random rollouts.
 *
 * @param <S> - the state type.
 */
public interface ValueEstimator<S>
{
  /**
   * @return the estimated value of the state, in the range [-1, 1].
   *
   * @param xiState - the state.
   */
  public double estimate(S xiState);

  /**
   * @return an instance of the estimator that can be used independently of existing instances, on a different thread.
   *
   * An instance may return itself if it has no mutable state.
   */
  public ValueEstimator<S> createIndependentInstance();
}
