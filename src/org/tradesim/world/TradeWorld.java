package org.tradesim.world;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * The static part of a trading world: locations joined by routes, and the prices each location's market pays and
 * charges for each item.
 *
 * <p>Routes are bidirectional.  A route's cost is the number of turns it takes to travel.
 */
public class TradeWorld
{
  private final List<String> mLocations;
  private final List<String> mItems;
  private final Map<String, SortedMap<String, Integer>> mRoutes;
  private final Map<String, Map<String, Price>> mPrices;

  /**
   * The prices of an item at one market.  Either price may be absent (null) if the market doesn't trade that way.
   */
  public static class Price
  {
    public final Integer mBuy;
    public final Integer mSell;

    public Price(Integer xiBuy, Integer xiSell)
    {
      mBuy = xiBuy;
      mSell = xiSell;
    }
  }

  private TradeWorld(Builder xiBuilder)
  {
    mLocations = Collections.unmodifiableList(new ArrayList<>(xiBuilder.mLocations));
    mItems = Collections.unmodifiableList(new ArrayList<>(xiBuilder.mItems));
    mRoutes = new LinkedHashMap<>();
    mPrices = new LinkedHashMap<>();
    for (String lLocation : mLocations)
    {
      mRoutes.put(lLocation, Collections.unmodifiableSortedMap(new TreeMap<>(xiBuilder.mRoutes.get(lLocation))));
      mPrices.put(lLocation, Collections.unmodifiableMap(new LinkedHashMap<>(xiBuilder.mPrices.get(lLocation))));
    }
  }

  /**
   * @return all locations, in declaration order.
   */
  public List<String> getLocations()
  {
    return mLocations;
  }

  /**
   * @return all tradeable items, in declaration order.
   */
  public List<String> getItems()
  {
    return mItems;
  }

  public boolean hasLocation(String xiLocation)
  {
    return mRoutes.containsKey(xiLocation);
  }

  public boolean hasItem(String xiItem)
  {
    return mItems.contains(xiItem);
  }

  /**
   * @return the locations directly reachable from the specified location, mapped to the travel cost.
   *
   * @param xiLocation - the location.
   */
  public SortedMap<String, Integer> getRoutes(String xiLocation)
  {
    SortedMap<String, Integer> lRoutes = mRoutes.get(xiLocation);
    return (lRoutes == null) ? Collections.<String, Integer>emptySortedMap() : lRoutes;
  }

  /**
   * @return the price the market at a location charges for an item, or null if it doesn't sell it.
   */
  public Integer getBuyPrice(String xiLocation, String xiItem)
  {
    Price lPrice = getPrice(xiLocation, xiItem);
    return (lPrice == null) ? null : lPrice.mBuy;
  }

  /**
   * @return the price the market at a location pays for an item, or null if it doesn't buy it.
   */
  public Integer getSellPrice(String xiLocation, String xiItem)
  {
    Price lPrice = getPrice(xiLocation, xiItem);
    return (lPrice == null) ? null : lPrice.mSell;
  }

  private Price getPrice(String xiLocation, String xiItem)
  {
    Map<String, Price> lMarket = mPrices.get(xiLocation);
    return (lMarket == null) ? null : lMarket.get(xiItem);
  }

  /**
   * Read a world from its JSON description.
   *
   * <pre>
   * {"locations": ["harbour", "mine"],
   *  "items": ["iron"],
   *  "routes": [{"from": "harbour", "to": "mine", "cost": 2}],
   *  "prices": {"mine": {"iron": {"buy": 5}}, "harbour": {"iron": {"sell": 9}}}}
   * </pre>
   *
   * @param xiJSON - the description.
   *
   * @throws IllegalArgumentException if the description is malformed.
   */
  public static TradeWorld fromJSON(String xiJSON)
  {
    try
    {
      JSONObject lWorld = new JSONObject(xiJSON);
      Builder lBuilder = new Builder();

      JSONArray lLocations = lWorld.getJSONArray("locations");
      for (int lii = 0; lii < lLocations.length(); lii++)
      {
        lBuilder.location(lLocations.getString(lii));
      }

      JSONArray lItems = lWorld.optJSONArray("items");
      for (int lii = 0; (lItems != null) && (lii < lItems.length()); lii++)
      {
        lBuilder.item(lItems.getString(lii));
      }

      JSONArray lRoutes = lWorld.optJSONArray("routes");
      for (int lii = 0; (lRoutes != null) && (lii < lRoutes.length()); lii++)
      {
        JSONObject lRoute = lRoutes.getJSONObject(lii);
        lBuilder.route(lRoute.getString("from"), lRoute.getString("to"), lRoute.optInt("cost", 1));
      }

      JSONObject lPrices = lWorld.optJSONObject("prices");
      if (lPrices != null)
      {
        for (String lLocation : lPrices.keySet())
        {
          JSONObject lMarket = lPrices.getJSONObject(lLocation);
          for (String lItem : lMarket.keySet())
          {
            JSONObject lPrice = lMarket.getJSONObject(lItem);
            lBuilder.price(lLocation,
                           lItem,
                           lPrice.has("buy") ? Integer.valueOf(lPrice.getInt("buy")) : null,
                           lPrice.has("sell") ? Integer.valueOf(lPrice.getInt("sell")) : null);
          }
        }
      }

      return lBuilder.build();
    }
    catch (JSONException lEx)
    {
      throw new IllegalArgumentException("Malformed world description: " + lEx.getMessage(), lEx);
    }
  }

  /**
   * Builder for worlds.
   */
  public static class Builder
  {
    private final List<String> mLocations = new ArrayList<>();
    private final List<String> mItems = new ArrayList<>();
    private final Map<String, Map<String, Integer>> mRoutes = new LinkedHashMap<>();
    private final Map<String, Map<String, Price>> mPrices = new LinkedHashMap<>();

    public Builder location(String xiLocation)
    {
      if (!mRoutes.containsKey(xiLocation))
      {
        mLocations.add(xiLocation);
        mRoutes.put(xiLocation, new TreeMap<String, Integer>());
        mPrices.put(xiLocation, new LinkedHashMap<String, Price>());
      }
      return this;
    }

    public Builder item(String xiItem)
    {
      if (!mItems.contains(xiItem))
      {
        mItems.add(xiItem);
      }
      return this;
    }

    /**
     * Add a bidirectional route.
     */
    public Builder route(String xiFrom, String xiTo, int xiCost)
    {
      checkLocation(xiFrom);
      checkLocation(xiTo);
      if (xiCost < 1)
      {
        throw new IllegalArgumentException("Route " + xiFrom + "-" + xiTo + " must cost at least 1 turn");
      }
      if (xiFrom.equals(xiTo))
      {
        throw new IllegalArgumentException("Route from " + xiFrom + " to itself");
      }
      mRoutes.get(xiFrom).put(xiTo, xiCost);
      mRoutes.get(xiTo).put(xiFrom, xiCost);
      return this;
    }

    /**
     * Set the prices of an item at a location.
     *
     * @param xiBuy  - what the market charges, or null if it doesn't sell the item.
     * @param xiSell - what the market pays, or null if it doesn't buy the item.
     */
    public Builder price(String xiLocation, String xiItem, Integer xiBuy, Integer xiSell)
    {
      checkLocation(xiLocation);
      if (!mItems.contains(xiItem))
      {
        throw new IllegalArgumentException("Unknown item " + xiItem);
      }
      if (((xiBuy != null) && (xiBuy < 0)) || ((xiSell != null) && (xiSell < 0)))
      {
        throw new IllegalArgumentException("Negative price for " + xiItem + " at " + xiLocation);
      }
      mPrices.get(xiLocation).put(xiItem, new Price(xiBuy, xiSell));
      return this;
    }

    public TradeWorld build()
    {
      if (mLocations.isEmpty())
      {
        throw new IllegalArgumentException("A world needs at least one location");
      }
      return new TradeWorld(this);
    }

    private void checkLocation(String xiLocation)
    {
      if (!mRoutes.containsKey(xiLocation))
      {
        throw new IllegalArgumentException("Unknown location " + xiLocation);
      }
    }
  }
}
