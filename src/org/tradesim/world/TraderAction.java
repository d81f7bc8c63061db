package org.tradesim.world;

import java.util.Locale;

import org.tradesim.util.model.Action;

/**
 * Something a trader can do in one step.  Buying and selling are always a single unit.
 */
public final class TraderAction implements Action
{
  /**
   * Action types.
   */
  public static enum Type
  {
    /**
     * Travel to a neighbouring location.
     */
    MOVE,

    /**
     * Buy one unit of an item from the local market.
     */
    BUY,

    /**
     * Sell one unit of an item to the local market.
     */
    SELL;
  }

  private final Type mType;
  private final String mTarget;
  private final String mKey;

  private TraderAction(Type xiType, String xiTarget)
  {
    mType = xiType;
    mTarget = xiTarget;
    mKey = xiType.name().toLowerCase(Locale.ROOT) + ":" + xiTarget;
  }

  public static TraderAction move(String xiDestination)
  {
    return new TraderAction(Type.MOVE, xiDestination);
  }

  public static TraderAction buy(String xiItem)
  {
    return new TraderAction(Type.BUY, xiItem);
  }

  public static TraderAction sell(String xiItem)
  {
    return new TraderAction(Type.SELL, xiItem);
  }

  /**
   * @return the action with the specified key, e.g. "move:mine" or "sell:iron".
   *
   * @throws IllegalArgumentException if the key is malformed.
   */
  public static TraderAction fromKey(String xiKey)
  {
    int lColon = xiKey.indexOf(':');
    if ((lColon <= 0) || (lColon == xiKey.length() - 1))
    {
      throw new IllegalArgumentException("Malformed action key: " + xiKey);
    }
    Type lType = Type.valueOf(xiKey.substring(0, lColon).toUpperCase(Locale.ROOT));
    return new TraderAction(lType, xiKey.substring(lColon + 1));
  }

  public Type getType()
  {
    return mType;
  }

  /**
   * @return the destination, for a move, or the item, for a trade.
   */
  public String getTarget()
  {
    return mTarget;
  }

  @Override
  public String getKey()
  {
    return mKey;
  }

  @Override
  public boolean equals(Object xiOther)
  {
    return (xiOther instanceof TraderAction) && mKey.equals(((TraderAction)xiOther).mKey);
  }

  @Override
  public int hashCode()
  {
    return mKey.hashCode();
  }

  @Override
  public String toString()
  {
    return mKey;
  }
}
