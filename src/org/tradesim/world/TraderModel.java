package org.tradesim.world;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.json.JSONException;
import org.json.JSONObject;
import org.tradesim.util.model.DomainModel;
import org.tradesim.util.model.exceptions.InvalidStateException;

/**
 * The rules of trading in a {@link TradeWorld}.
 *
 * <p>Moving takes as many turns as the route costs.  Buying or selling a unit takes one turn.  Trading ends when no
 * turns remain, or when the trader has nothing left it can do, at which point it is scored on its net worth relative
 * to the gold it started with.
 *
 * <p>A single trader acts throughout, so the acting role is always 0.
 */
public class TraderModel implements DomainModel<TraderState, TraderAction>
{
  private final TradeWorld mWorld;

  public TraderModel(TradeWorld xiWorld)
  {
    mWorld = xiWorld;
  }

  public TradeWorld getWorld()
  {
    return mWorld;
  }

  @Override
  public void validate(TraderState xiState) throws InvalidStateException
  {
    if ((xiState.getLocation() == null) || !mWorld.hasLocation(xiState.getLocation()))
    {
      throw new InvalidStateException("Unknown location: " + xiState.getLocation());
    }
    if (xiState.getGold() < 0)
    {
      throw new InvalidStateException("Negative gold: " + xiState.getGold());
    }
    if (xiState.getStartingGold() <= 0)
    {
      throw new InvalidStateException("Starting gold must be positive, got " + xiState.getStartingGold());
    }
    if (xiState.getCapacity() < 0)
    {
      throw new InvalidStateException("Negative capacity: " + xiState.getCapacity());
    }
    if (xiState.getTurnsRemaining() < 0)
    {
      throw new InvalidStateException("Negative turns remaining: " + xiState.getTurnsRemaining());
    }
    for (Map.Entry<String, Integer> lEntry : xiState.getInventory().entrySet())
    {
      if (!mWorld.hasItem(lEntry.getKey()))
      {
        throw new InvalidStateException("Unknown item in inventory: " + lEntry.getKey());
      }
      if (lEntry.getValue() < 0)
      {
        throw new InvalidStateException("Negative quantity of " + lEntry.getKey() + ": " + lEntry.getValue());
      }
    }
    if (xiState.getLoad() > xiState.getCapacity())
    {
      throw new InvalidStateException("Carrying " + xiState.getLoad() + " units with capacity " +
                                      xiState.getCapacity());
    }
  }

  /**
   * @return moves to affordable neighbours (by destination), then purchases, then sales (each by item, in world
   * order).
   */
  @Override
  public List<TraderAction> getLegalActions(TraderState xiState)
  {
    if (xiState.getTurnsRemaining() == 0)
    {
      return new ArrayList<>();
    }
    return getAvailableActions(xiState);
  }

  private List<TraderAction> getAvailableActions(TraderState xiState)
  {
    List<TraderAction> lActions = new ArrayList<>();
    String lLocation = xiState.getLocation();
    for (Map.Entry<String, Integer> lRoute : mWorld.getRoutes(lLocation).entrySet())
    {
      if (lRoute.getValue() <= xiState.getTurnsRemaining())
      {
        lActions.add(TraderAction.move(lRoute.getKey()));
      }
    }

    boolean lHasSpace = xiState.getLoad() < xiState.getCapacity();
    for (String lItem : mWorld.getItems())
    {
      Integer lBuyPrice = mWorld.getBuyPrice(lLocation, lItem);
      if (lHasSpace && (lBuyPrice != null) && (lBuyPrice <= xiState.getGold()))
      {
        lActions.add(TraderAction.buy(lItem));
      }
    }

    for (String lItem : mWorld.getItems())
    {
      if ((xiState.getQuantity(lItem) > 0) && (mWorld.getSellPrice(lLocation, lItem) != null))
      {
        lActions.add(TraderAction.sell(lItem));
      }
    }

    return lActions;
  }

  /**
   * @throws IllegalArgumentException if the action isn't legal in the state.
   */
  @Override
  public TraderState getNextState(TraderState xiState, TraderAction xiAction)
  {
    if (isTerminal(xiState))
    {
      throw new IllegalArgumentException("No actions are legal once trading has ended");
    }

    String lLocation = xiState.getLocation();
    String lTarget = xiAction.getTarget();
    switch (xiAction.getType())
    {
      case MOVE:
        Integer lCost = mWorld.getRoutes(lLocation).get(lTarget);
        if ((lCost == null) || (lCost > xiState.getTurnsRemaining()))
        {
          throw new IllegalArgumentException("Can't " + xiAction + " from " + lLocation);
        }
        return xiState.withLocation(lTarget, lCost);

      case BUY:
        Integer lBuyPrice = mWorld.getBuyPrice(lLocation, lTarget);
        if ((lBuyPrice == null) ||
            (lBuyPrice > xiState.getGold()) ||
            (xiState.getLoad() >= xiState.getCapacity()))
        {
          throw new IllegalArgumentException("Can't " + xiAction + " at " + lLocation);
        }
        return xiState.withTrade(lTarget, 1, -lBuyPrice);

      case SELL:
        Integer lSellPrice = mWorld.getSellPrice(lLocation, lTarget);
        if ((lSellPrice == null) || (xiState.getQuantity(lTarget) == 0))
        {
          throw new IllegalArgumentException("Can't " + xiAction + " at " + lLocation);
        }
        return xiState.withTrade(lTarget, -1, lSellPrice);

      default:
        throw new IllegalArgumentException("Unknown action type: " + xiAction.getType());
    }
  }

  /**
   * @return whether trading has ended, either because no turns remain or because the trader is stranded (nothing it
   * can afford, carry or sell, and no route it has time for).
   */
  @Override
  public boolean isTerminal(TraderState xiState)
  {
    return (xiState.getTurnsRemaining() == 0) || getAvailableActions(xiState).isEmpty();
  }

  @Override
  public int getActingRole(TraderState xiState)
  {
    return 0;
  }

  /**
   * @return the gain in net worth as a fraction of the starting gold, clamped to [-1, 1].
   */
  @Override
  public double getReward(TraderState xiState)
  {
    double lGain = getNetWorth(xiState) - xiState.getStartingGold();
    return Math.max(-1, Math.min(1, lGain / xiState.getStartingGold()));
  }

  /**
   * @return gold in hand plus the value of the inventory if sold at the current location.  Items the local market
   * won't buy are worth nothing.
   */
  public int getNetWorth(TraderState xiState)
  {
    int lNetWorth = xiState.getGold();
    for (Map.Entry<String, Integer> lEntry : xiState.getInventory().entrySet())
    {
      Integer lSellPrice = mWorld.getSellPrice(xiState.getLocation(), lEntry.getKey());
      if (lSellPrice != null)
      {
        lNetWorth += lSellPrice * lEntry.getValue();
      }
    }
    return lNetWorth;
  }

  @Override
  public String serialize(TraderState xiState)
  {
    return xiState.toJSONString();
  }

  @Override
  public TraderState deserialize(String xiSerialized) throws InvalidStateException
  {
    TraderState lState;
    try
    {
      lState = TraderState.fromJSON(new JSONObject(xiSerialized));
    }
    catch (JSONException lEx)
    {
      throw new InvalidStateException("Malformed trader state: " + lEx.getMessage(), lEx);
    }
    validate(lState);
    return lState;
  }
}
