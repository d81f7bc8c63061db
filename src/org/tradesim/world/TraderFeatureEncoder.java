package org.tradesim.world;

import java.util.List;
import java.util.Map;

import org.tradesim.decision.estimator.FeatureEncoder;

/**
 * Encodes trader states for a value estimator.
 *
 * <p>Layout:
 * <ul>
 * <li>gold, as a fraction of twice the starting gold (capped at 1)</li>
 * <li>load, as a fraction of capacity</li>
 * <li>turns remaining, as a fraction of the turn horizon (capped at 1)</li>
 * <li>location, one-hot over the world's locations</li>
 * <li>one slot per held item (in item order, up to the slot limit): one-hot over the world's items, followed by the
 * quantity as a fraction of capacity</li>
 * <li>zero padding up to the requested width</li>
 * </ul>
 */
public class TraderFeatureEncoder implements FeatureEncoder<TraderState>
{
  private static final int NUM_SCALAR_FEATURES = 3;

  private final List<String> mLocations;
  private final List<String> mItems;
  private final int mTurnHorizon;
  private final int mInventorySlots;
  private final int mWidth;

  /**
   * Create an encoder of the minimum width for the world.
   *
   * @see #TraderFeatureEncoder(TradeWorld, int, int, int)
   */
  public TraderFeatureEncoder(TradeWorld xiWorld, int xiTurnHorizon, int xiInventorySlots)
  {
    this(xiWorld, xiTurnHorizon, xiInventorySlots, getMinimumWidth(xiWorld, xiInventorySlots));
  }

  /**
   * Create an encoder.
   *
   * @param xiWorld          - the world.
   * @param xiTurnHorizon    - the number of turns treated as "plenty of time".
   * @param xiInventorySlots - the maximum number of distinct held items encoded.
   * @param xiWidth          - the width of the encoding.  At least {@link #getMinimumWidth}.
   */
  public TraderFeatureEncoder(TradeWorld xiWorld, int xiTurnHorizon, int xiInventorySlots, int xiWidth)
  {
    if (xiTurnHorizon < 1)
    {
      throw new IllegalArgumentException("Turn horizon must be at least 1, got " + xiTurnHorizon);
    }
    if (xiInventorySlots < 0)
    {
      throw new IllegalArgumentException("Negative number of inventory slots: " + xiInventorySlots);
    }
    int lMinimumWidth = getMinimumWidth(xiWorld, xiInventorySlots);
    if (xiWidth < lMinimumWidth)
    {
      throw new IllegalArgumentException("Encoding needs at least " + lMinimumWidth + " features, got " + xiWidth);
    }

    mLocations = xiWorld.getLocations();
    mItems = xiWorld.getItems();
    mTurnHorizon = xiTurnHorizon;
    mInventorySlots = xiInventorySlots;
    mWidth = xiWidth;
  }

  /**
   * @return the smallest width that can encode states in the specified world.
   */
  public static int getMinimumWidth(TradeWorld xiWorld, int xiInventorySlots)
  {
    return NUM_SCALAR_FEATURES +
           xiWorld.getLocations().size() +
           xiInventorySlots * (xiWorld.getItems().size() + 1);
  }

  @Override
  public int getWidth()
  {
    return mWidth;
  }

  @Override
  public double[] encode(TraderState xiState)
  {
    double[] lFeatures = new double[mWidth];
    int lCapacity = xiState.getCapacity();

    lFeatures[0] = Math.min(1.0, xiState.getGold() / (2.0 * xiState.getStartingGold()));
    lFeatures[1] = (lCapacity == 0) ? 0 : (double)xiState.getLoad() / lCapacity;
    lFeatures[2] = Math.min(1.0, (double)xiState.getTurnsRemaining() / mTurnHorizon);
    int lOffset = NUM_SCALAR_FEATURES;

    int lLocationIndex = mLocations.indexOf(xiState.getLocation());
    if (lLocationIndex >= 0)
    {
      lFeatures[lOffset + lLocationIndex] = 1;
    }
    lOffset += mLocations.size();

    int lSlot = 0;
    for (Map.Entry<String, Integer> lEntry : xiState.getInventory().entrySet())
    {
      if (lSlot == mInventorySlots)
      {
        break;
      }
      int lItemIndex = mItems.indexOf(lEntry.getKey());
      if (lItemIndex >= 0)
      {
        lFeatures[lOffset + lItemIndex] = 1;
      }
      lFeatures[lOffset + mItems.size()] = (lCapacity == 0) ? 0 : (double)lEntry.getValue() / lCapacity;
      lOffset += mItems.size() + 1;
      lSlot++;
    }

    return lFeatures;
  }
}
