package org.tradesim.world;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * A small world: iron is cheap at the mine and dear at the harbour; the market sells grain but nobody buys it back.
 */
final class TradeWorldFixtures
{
  static final String WORLD_JSON =
      "{\"locations\": [\"mine\", \"harbour\", \"farm\"]," +
      " \"items\": [\"iron\", \"grain\"]," +
      " \"routes\": [{\"from\": \"mine\", \"to\": \"harbour\", \"cost\": 1}," +
      "              {\"from\": \"harbour\", \"to\": \"farm\", \"cost\": 3}]," +
      " \"prices\": {\"mine\": {\"iron\": {\"buy\": 2, \"sell\": 1}}," +
      "             \"harbour\": {\"iron\": {\"sell\": 10}, \"grain\": {\"buy\": 4}}," +
      "             \"farm\": {}}}";

  static TradeWorld world()
  {
    return TradeWorld.fromJSON(WORLD_JSON);
  }

  static TraderState trader(String xiLocation, int xiGold, int xiTurns, Map<String, Integer> xiInventory)
  {
    return new TraderState(xiLocation, xiGold, 10, 2, xiTurns, xiInventory);
  }

  static TraderState trader(String xiLocation, int xiGold, int xiTurns)
  {
    return trader(xiLocation, xiGold, xiTurns, Collections.<String, Integer>emptyMap());
  }

  static Map<String, Integer> items(Object... xiPairs)
  {
    Map<String, Integer> lItems = new TreeMap<>();
    for (int lii = 0; lii < xiPairs.length; lii += 2)
    {
      lItems.put((String)xiPairs[lii], (Integer)xiPairs[lii + 1]);
    }
    return lItems;
  }

  private TradeWorldFixtures()
  {
  }
}
