package org.tradesim.world;

import static org.tradesim.world.TradeWorldFixtures.items;
import static org.tradesim.world.TradeWorldFixtures.trader;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;
import org.tradesim.decision.config.DecisionConfiguration;
import org.tradesim.decision.config.DecisionConfiguration.CfgItem;
import org.tradesim.decision.parallel.ParallelSearchCoordinator;
import org.tradesim.decision.parallel.ParallelSearchResult;
import org.tradesim.util.model.exceptions.InvalidStateException;

public class TraderModelTests extends Assert
{
  private final TraderModel mModel = new TraderModel(TradeWorldFixtures.world());

  private static List<String> keys(List<TraderAction> xiActions)
  {
    List<String> lKeys = new ArrayList<>();
    for (TraderAction lAction : xiActions)
    {
      lKeys.add(lAction.getKey());
    }
    return lKeys;
  }

  @Test
  public void testLegalActions()
  {
    assertEquals(Arrays.asList("move:harbour", "buy:iron"),
                 keys(mModel.getLegalActions(trader("mine", 10, 5))));

    // The farm is too far; grain is for sale; iron can be sold.
    assertEquals(Arrays.asList("move:mine", "buy:grain", "sell:iron"),
                 keys(mModel.getLegalActions(trader("harbour", 10, 2, items("iron", 1)))));

    // No room.
    assertEquals(Arrays.asList("move:mine", "sell:iron"),
                 keys(mModel.getLegalActions(trader("harbour", 10, 2, items("iron", 2)))));

    // Can't afford it.
    assertEquals(Arrays.asList("move:mine"),
                 keys(mModel.getLegalActions(trader("harbour", 3, 2))));

    assertTrue(mModel.getLegalActions(trader("harbour", 10, 0, items("iron", 1))).isEmpty());
  }

  @Test
  public void testTrading()
  {
    TraderState state = trader("mine", 10, 5);

    state = mModel.getNextState(state, TraderAction.buy("iron"));
    assertEquals(8, state.getGold());
    assertEquals(1, state.getQuantity("iron"));
    assertEquals(4, state.getTurnsRemaining());

    state = mModel.getNextState(state, TraderAction.move("harbour"));
    assertEquals("harbour", state.getLocation());
    assertEquals(3, state.getTurnsRemaining());

    state = mModel.getNextState(state, TraderAction.sell("iron"));
    assertEquals(18, state.getGold());
    assertEquals(0, state.getQuantity("iron"));
    assertTrue(state.getInventory().isEmpty());
    assertEquals(2, state.getTurnsRemaining());
    assertEquals(10, state.getStartingGold());
  }

  @Test
  public void testNextStateLeavesInputAlone()
  {
    TraderState state = trader("mine", 10, 5);
    mModel.getNextState(state, TraderAction.buy("iron"));
    assertEquals(trader("mine", 10, 5), state);
  }

  @Test
  public void testIllegalActions()
  {
    TraderAction[] illegal = {TraderAction.sell("iron"), TraderAction.move("farm"), TraderAction.buy("grain")};
    for (TraderAction action : illegal)
    {
      try
      {
        mModel.getNextState(trader("mine", 10, 5), action);
        fail("Allowed " + action);
      }
      catch (IllegalArgumentException lEx)
      {
        // Expected
      }
    }
  }

  @Test
  public void testTerminalAndReward()
  {
    assertFalse(mModel.isTerminal(trader("harbour", 8, 1, items("iron", 1))));
    assertTrue(mModel.isTerminal(trader("harbour", 8, 0, items("iron", 1))));

    assertEquals(0.8, mModel.getReward(trader("harbour", 8, 0, items("iron", 1))), 1e-9);
    assertEquals(-0.1, mModel.getReward(trader("mine", 8, 0, items("iron", 1))), 1e-9);
    assertEquals(-0.2, mModel.getReward(trader("farm", 8, 0, items("iron", 1))), 1e-9);
    assertEquals(0, mModel.getReward(trader("farm", 10, 0)), 1e-9);
    assertEquals(1, mModel.getReward(trader("farm", 40, 0)), 1e-9);
    assertEquals(-1, mModel.getReward(trader("farm", 0, 0)), 1e-9);
  }

  @Test
  public void testStrandedTraderIsTerminal() throws Exception
  {
    // Iron can't be sold anywhere and the only route takes longer than the time left.
    TradeWorld world = new TradeWorld.Builder().location("a")
                                               .location("b")
                                               .item("iron")
                                               .item("salt")
                                               .route("a", "b", 3)
                                               .price("a", "iron", 6, null)
                                               .price("a", "salt", 2, 1)
                                               .build();
    TraderModel model = new TraderModel(world);
    TraderState start = new TraderState("a", 10, 10, 1, 2, items());
    assertEquals(Arrays.asList("buy:iron", "buy:salt"), keys(model.getLegalActions(start)));

    TraderState afterIron = model.getNextState(start, TraderAction.buy("iron"));
    assertEquals(1, afterIron.getTurnsRemaining());
    assertTrue(model.getLegalActions(afterIron).isEmpty());
    assertTrue(model.isTerminal(afterIron));
    assertEquals(-0.6, model.getReward(afterIron), 1e-9);

    TraderState afterSalt = model.getNextState(start, TraderAction.buy("salt"));
    assertFalse(model.isTerminal(afterSalt));

    // Stranded with iron scores -0.6, selling the salt back scores -0.1.
    DecisionConfiguration config = DecisionConfiguration.defaults().with(CfgItem.RANDOM_SEED, 17);
    try (ParallelSearchCoordinator coordinator = new ParallelSearchCoordinator(config))
    {
      ParallelSearchResult<TraderAction> result = coordinator.parallelSearch(start, model, null, 2, 200);
      assertTrue(result.isDecision());
      assertEquals(TraderAction.buy("salt"), result.getAction());
    }
  }

  @Test
  public void testActingRoleIsAlwaysTheTrader()
  {
    assertEquals(0, mModel.getActingRole(trader("mine", 10, 5)));
    assertEquals(0, mModel.getActingRole(trader("harbour", 10, 0, items("iron", 1))));
  }

  @Test
  public void testSerializedFormHasSortedKeys()
  {
    assertEquals("{\"capacity\":2,\"gold\":7,\"inventory\":{\"grain\":1,\"iron\":1},\"location\":\"harbour\"," +
                 "\"startingGold\":10,\"turnsRemaining\":3}",
                 mModel.serialize(trader("harbour", 7, 3, items("iron", 1, "grain", 1))));
    assertEquals("{\"capacity\":2,\"gold\":10,\"inventory\":{},\"location\":\"mine\"," +
                 "\"startingGold\":10,\"turnsRemaining\":5}",
                 mModel.serialize(trader("mine", 10, 5)));
  }

  @Test
  public void testSerialization() throws Exception
  {
    TraderState state = trader("harbour", 7, 3, items("grain", 1, "iron", 1));
    String serialized = mModel.serialize(state);
    TraderState copy = mModel.deserialize(serialized);

    assertEquals(state, copy);
    assertEquals(state.hashCode(), copy.hashCode());
    assertEquals(serialized, mModel.serialize(copy));
    assertEquals(Arrays.asList("grain", "iron"), new ArrayList<>(copy.getInventory().keySet()));
  }

  @Test
  public void testDeserializeRejectsBadInput()
  {
    String[] bad = {"not json",
                    "{\"location\": \"mine\"}",
                    "{\"location\": \"moon\", \"gold\": 1, \"startingGold\": 1, \"capacity\": 1, \"turnsRemaining\": 1}",
                    "{\"location\": \"mine\", \"gold\": 1, \"startingGold\": 1, \"capacity\": 1, " +
                    "\"turnsRemaining\": 1, \"inventory\": {\"iron\": 2}}"};
    for (String text : bad)
    {
      try
      {
        mModel.deserialize(text);
        fail("Accepted " + text);
      }
      catch (InvalidStateException lEx)
      {
        // Expected
      }
    }
  }

  @Test
  public void testValidate() throws Exception
  {
    mModel.validate(trader("farm", 0, 0));

    TraderState[] invalid = {new TraderState("mine", -1, 10, 2, 5, items()),
                             new TraderState("mine", 10, 0, 2, 5, items()),
                             new TraderState("mine", 10, 10, 2, -1, items()),
                             new TraderState("mine", 10, 10, 2, 5, items("gold bars", 1)),
                             new TraderState("mine", 10, 10, 2, 5, items("iron", -1)),
                             new TraderState(null, 10, 10, 2, 5, items())};
    for (TraderState state : invalid)
    {
      try
      {
        mModel.validate(state);
        fail("Accepted " + state);
      }
      catch (InvalidStateException lEx)
      {
        // Expected
      }
    }
  }

  @Test
  public void testActionKeys()
  {
    assertEquals("sell:iron", TraderAction.sell("iron").getKey());
    assertEquals(TraderAction.move("farm"), TraderAction.fromKey("move:farm"));
    assertEquals(TraderAction.Type.BUY, TraderAction.fromKey("buy:grain").getType());
    assertEquals("grain", TraderAction.fromKey("buy:grain").getTarget());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMalformedActionKey()
  {
    TraderAction.fromKey("teleport");
  }

  @Test
  public void testDecidesToBuyCheapIron() throws Exception
  {
    DecisionConfiguration config = DecisionConfiguration.defaults()
                                                         .with(CfgItem.RANDOM_SEED, 5)
                                                         .with(CfgItem.SIMULATIONS_PER_WORKER, 300);
    try (ParallelSearchCoordinator coordinator = new ParallelSearchCoordinator(config))
    {
      ParallelSearchResult<TraderAction> result = coordinator.parallelSearch(trader("mine", 10, 3), mModel, null);

      assertTrue(result.isDecision());
      assertEquals(TraderAction.buy("iron"), result.getAction());
      assertEquals(1200, result.getTotalSimulations());
    }
  }

  @Test
  public void testNoDecisionOnceTradingHasEnded() throws Exception
  {
    try (ParallelSearchCoordinator coordinator = new ParallelSearchCoordinator(DecisionConfiguration.defaults()))
    {
      ParallelSearchResult<TraderAction> result =
          coordinator.parallelSearch(trader("harbour", 10, 0, items("iron", 1)), mModel, null, 2, 10);
      assertFalse(result.isDecision());
    }
  }
}
