package org.tradesim.decision.estimator;

/**
 * Converts states into fixed-width numeric feature vectors suitable for a value estimator.
 *
 * @param <S> - the state type.
 */
public interface FeatureEncoder<S>
{
  /**
   * @return the length of every vector produced by {@link #encode}.
   */
  public int getWidth();

  /**
   * @return the features of the specified state.  Always {@link #getWidth()} long; unused positions are zero.
   *
   * @param xiState - the state.
   */
  public double[] encode(S xiState);
}
