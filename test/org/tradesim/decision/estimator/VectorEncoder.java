package org.tradesim.decision.estimator;

import java.util.Arrays;

/**
 * Treats a state that is already a feature vector as its own encoding.
 */
class VectorEncoder implements FeatureEncoder<double[]>
{
  private final int mWidth;

  VectorEncoder(int xiWidth)
  {
    mWidth = xiWidth;
  }

  @Override
  public int getWidth()
  {
    return mWidth;
  }

  @Override
  public double[] encode(double[] xiState)
  {
    return Arrays.copyOf(xiState, mWidth);
  }
}
