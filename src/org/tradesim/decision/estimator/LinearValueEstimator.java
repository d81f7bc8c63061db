package org.tradesim.decision.estimator;

import java.util.Arrays;

/**
 * A hand-weighted estimator: tanh(bias + weights . features).
 *
 * @param <S> - the state type.
 */
public class LinearValueEstimator<S> implements ValueEstimator<S>
{
  private final FeatureEncoder<S> mEncoder;
  private final double[] mWeights;
  private final double mBias;

  /**
   * Create a linear estimator.
   *
   * @param xiEncoder - the feature encoder.
   * @param xiWeights - one weight per feature.
   * @param xiBias    - constant term.
   */
  public LinearValueEstimator(FeatureEncoder<S> xiEncoder, double[] xiWeights, double xiBias)
  {
    if (xiWeights.length != xiEncoder.getWidth())
    {
      throw new IllegalArgumentException("Expected " + xiEncoder.getWidth() + " weights, got " + xiWeights.length);
    }
    mEncoder = xiEncoder;
    mWeights = Arrays.copyOf(xiWeights, xiWeights.length);
    mBias = xiBias;
  }

  @Override
  public double estimate(S xiState)
  {
    double[] lFeatures = mEncoder.encode(xiState);
    double lSum = mBias;
    for (int lii = 0; lii < mWeights.length; lii++)
    {
      lSum += mWeights[lii] * lFeatures[lii];
    }
    return Math.tanh(lSum);
  }

  @Override
  public ValueEstimator<S> createIndependentInstance()
  {
    // Immutable.
    return this;
  }
}
