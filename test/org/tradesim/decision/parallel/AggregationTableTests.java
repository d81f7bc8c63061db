package org.tradesim.decision.parallel;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.junit.Assert;
import org.junit.Test;
import org.tradesim.decision.mcts.ActionStatistics;
import org.tradesim.decision.mcts.SearchResult;
import org.tradesim.util.model.KeyedAction;

public class AggregationTableTests extends Assert
{
  private static final KeyedAction A = new KeyedAction("a");
  private static final KeyedAction B = new KeyedAction("b");
  private static final KeyedAction C = new KeyedAction("c");

  private static SearchResult<KeyedAction> result(KeyedAction xiBest, int xiSimulations, Object... xiStats)
  {
    List<ActionStatistics<KeyedAction>> lStats = new ArrayList<>();
    int lBestVisits = 0;
    double lBestValue = 0;
    for (int lii = 0; lii < xiStats.length; lii += 3)
    {
      ActionStatistics<KeyedAction> lStat = new ActionStatistics<>((KeyedAction)xiStats[lii],
                                                                   (Integer)xiStats[lii + 1],
                                                                   (Double)xiStats[lii + 2]);
      lStats.add(lStat);
      if (lStat.getAction().equals(xiBest))
      {
        lBestVisits = lStat.getNumVisits();
        lBestValue = lStat.getTotalValue();
      }
    }
    return new SearchResult<>(xiBest, xiSimulations, lBestVisits, lBestValue, lStats);
  }

  private final List<SearchResult<KeyedAction>> mResults = Arrays.asList(result(A, 30, A, 20, 15.0, B, 10, 2.0),
                                                                         result(B, 30, A, 12, 3.0, B, 18, 9.0),
                                                                         result(A, 40, C, 5, -1.0, A, 35, 30.0),
                                                                         SearchResult.<KeyedAction>noDecision(0));

  private static AggregationTable<KeyedAction> merge(AggregationPolicy xiPolicy,
                                                     List<SearchResult<KeyedAction>> xiResults)
  {
    AggregationTable<KeyedAction> lTable = new AggregationTable<>(xiPolicy);
    for (SearchResult<KeyedAction> lResult : xiResults)
    {
      lTable.merge(lResult);
    }
    return lTable;
  }

  @Test
  public void testBestActionCredit()
  {
    AggregationTable<KeyedAction> table = merge(AggregationPolicy.BEST_ACTION_CREDIT, mResults);

    assertEquals(4, table.getNumMerged());
    assertEquals(100, table.getTotalSimulations());
    assertEquals(2, table.getRecords().size());
    assertEquals(70, table.getRecord("a").getTotalVisits());
    assertEquals(45.0, table.getRecord("a").getTotalValue(), 1e-9);
    assertEquals(2, table.getRecord("a").getContributions());
    assertEquals(30, table.getRecord("b").getTotalVisits());
    assertNull(table.getRecord("c"));
    assertEquals("a", table.getWinner().getKey());
  }

  @Test
  public void testPerActionVisits()
  {
    AggregationTable<KeyedAction> table = merge(AggregationPolicy.PER_ACTION_VISITS, mResults);

    assertEquals(3, table.getRecords().size());
    assertEquals(67, table.getRecord("a").getTotalVisits());
    assertEquals(48.0, table.getRecord("a").getTotalValue(), 1e-9);
    assertEquals(28, table.getRecord("b").getTotalVisits());
    assertEquals(5, table.getRecord("c").getTotalVisits());
    assertEquals(1, table.getRecord("c").getContributions());
    assertEquals("a", table.getWinner().getKey());
  }

  @Test
  public void testMergeOrderDoesNotMatter()
  {
    for (AggregationPolicy policy : AggregationPolicy.values())
    {
      AggregationTable<KeyedAction> expected = merge(policy, mResults);
      for (long seed = 0; seed < 10; seed++)
      {
        List<SearchResult<KeyedAction>> shuffled = new ArrayList<>(mResults);
        Collections.shuffle(shuffled, new Random(seed));
        AggregationTable<KeyedAction> actual = merge(policy, shuffled);

        assertEquals(expected.getWinner().getKey(), actual.getWinner().getKey());
        assertEquals(expected.getTotalSimulations(), actual.getTotalSimulations());
        assertEquals(expected.getRecords().size(), actual.getRecords().size());
        for (AggregationRecord<KeyedAction> record : expected.getRecords())
        {
          AggregationRecord<KeyedAction> other = actual.getRecord(record.getKey());
          assertEquals(record.getTotalVisits(), other.getTotalVisits());
          assertEquals(record.getTotalValue(), other.getTotalValue(), 1e-9);
          assertEquals(record.getContributions(), other.getContributions());
        }
      }
    }
  }

  @Test
  public void testTiesGoToKeySeenFirst()
  {
    AggregationTable<KeyedAction> table = new AggregationTable<>(AggregationPolicy.BEST_ACTION_CREDIT);
    table.merge(result(B, 10, B, 6, 1.0, A, 4, 0.0));
    table.merge(result(A, 10, A, 6, 1.0, B, 4, 0.0));

    assertEquals("b", table.getWinner().getKey());
    assertEquals("b", table.getRecords().get(0).getKey());
  }

  @Test
  public void testNoDecisionsLeaveNoWinner()
  {
    AggregationTable<KeyedAction> table = new AggregationTable<>(AggregationPolicy.PER_ACTION_VISITS);
    table.merge(SearchResult.<KeyedAction>noDecision(0));
    table.merge(SearchResult.<KeyedAction>noDecision(0));

    assertNull(table.getWinner());
    assertEquals(2, table.getNumMerged());
    assertTrue(table.getRecords().isEmpty());
  }
}
