package org.tradesim.world;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONStringer;

/**
 * Immutable snapshot of a trader: where it is, what it owns and how long it has left.
 */
public final class TraderState
{
  private final String mLocation;
  private final int mGold;
  private final int mStartingGold;
  private final int mCapacity;
  private final int mTurnsRemaining;
  private final SortedMap<String, Integer> mInventory;

  /**
   * Create a trader state.
   *
   * @param xiLocation       - where the trader is.
   * @param xiGold           - gold in hand.
   * @param xiStartingGold   - gold the trader started with, the baseline for the reward.
   * @param xiCapacity       - the maximum number of units the trader can carry.
   * @param xiTurnsRemaining - turns left before trading ends.
   * @param xiInventory      - item to quantity.  Items with a quantity of zero are dropped.
   */
  public TraderState(String xiLocation,
                     int xiGold,
                     int xiStartingGold,
                     int xiCapacity,
                     int xiTurnsRemaining,
                     Map<String, Integer> xiInventory)
  {
    mLocation = xiLocation;
    mGold = xiGold;
    mStartingGold = xiStartingGold;
    mCapacity = xiCapacity;
    mTurnsRemaining = xiTurnsRemaining;

    SortedMap<String, Integer> lInventory = new TreeMap<>();
    for (Map.Entry<String, Integer> lEntry : xiInventory.entrySet())
    {
      if (lEntry.getValue() != 0)
      {
        lInventory.put(lEntry.getKey(), lEntry.getValue());
      }
    }
    mInventory = Collections.unmodifiableSortedMap(lInventory);
  }

  public String getLocation()
  {
    return mLocation;
  }

  public int getGold()
  {
    return mGold;
  }

  public int getStartingGold()
  {
    return mStartingGold;
  }

  public int getCapacity()
  {
    return mCapacity;
  }

  public int getTurnsRemaining()
  {
    return mTurnsRemaining;
  }

  /**
   * @return item to quantity, sorted by item.
   */
  public SortedMap<String, Integer> getInventory()
  {
    return mInventory;
  }

  public int getQuantity(String xiItem)
  {
    Integer lQuantity = mInventory.get(xiItem);
    return (lQuantity == null) ? 0 : lQuantity;
  }

  /**
   * @return the total number of units carried.
   */
  public int getLoad()
  {
    int lLoad = 0;
    for (int lQuantity : mInventory.values())
    {
      lLoad += lQuantity;
    }
    return lLoad;
  }

  TraderState withLocation(String xiLocation, int xiTurnsUsed)
  {
    return new TraderState(xiLocation, mGold, mStartingGold, mCapacity, mTurnsRemaining - xiTurnsUsed, mInventory);
  }

  TraderState withTrade(String xiItem, int xiQuantityChange, int xiGoldChange)
  {
    SortedMap<String, Integer> lInventory = new TreeMap<>(mInventory);
    lInventory.put(xiItem, getQuantity(xiItem) + xiQuantityChange);
    return new TraderState(mLocation, mGold + xiGoldChange, mStartingGold, mCapacity, mTurnsRemaining - 1, lInventory);
  }

  /**
   * @return the state as JSON, with keys in sorted order so that equal states give identical text.
   */
  public String toJSONString()
  {
    JSONStringer lWriter = new JSONStringer();
    lWriter.object()
           .key("capacity").value(mCapacity)
           .key("gold").value(mGold)
           .key("inventory").object();
    for (Map.Entry<String, Integer> lEntry : mInventory.entrySet())
    {
      lWriter.key(lEntry.getKey()).value(lEntry.getValue().intValue());
    }
    lWriter.endObject()
           .key("location").value(mLocation)
           .key("startingGold").value(mStartingGold)
           .key("turnsRemaining").value(mTurnsRemaining)
           .endObject();
    return lWriter.toString();
  }

  /**
   * @return the state described by the specified JSON object.
   *
   * @throws JSONException if a field is missing or of the wrong type.
   */
  public static TraderState fromJSON(JSONObject xiState)
  {
    SortedMap<String, Integer> lInventory = new TreeMap<>();
    JSONObject lItems = xiState.optJSONObject("inventory");
    if (lItems != null)
    {
      for (String lItem : lItems.keySet())
      {
        lInventory.put(lItem, lItems.getInt(lItem));
      }
    }

    return new TraderState(xiState.getString("location"),
                           xiState.getInt("gold"),
                           xiState.getInt("startingGold"),
                           xiState.getInt("capacity"),
                           xiState.getInt("turnsRemaining"),
                           lInventory);
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (this == xiOther)
    {
      return true;
    }
    if (!(xiOther instanceof TraderState))
    {
      return false;
    }
    TraderState lOther = (TraderState)xiOther;
    return (mGold == lOther.mGold) &&
           (mStartingGold == lOther.mStartingGold) &&
           (mCapacity == lOther.mCapacity) &&
           (mTurnsRemaining == lOther.mTurnsRemaining) &&
           mLocation.equals(lOther.mLocation) &&
           mInventory.equals(lOther.mInventory);
  }

  @Override
  public int hashCode()
  {
    int lHash = mLocation.hashCode();
    lHash = 31 * lHash + mGold;
    lHash = 31 * lHash + mStartingGold;
    lHash = 31 * lHash + mCapacity;
    lHash = 31 * lHash + mTurnsRemaining;
    lHash = 31 * lHash + mInventory.hashCode();
    return lHash;
  }

  @Override
  public String toString()
  {
    return "at " + mLocation + " with " + mGold + " gold, " + mInventory + ", " + mTurnsRemaining + " turns left";
  }
}
