package org.tradesim.decision.parallel;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.tradesim.decision.mcts.ActionStatistics;
import org.tradesim.decision.mcts.SearchResult;
import org.tradesim.util.model.Action;

/**
 * Table of aggregation records, keyed by action key, for a single decision.
 *
 * <p>Records are created the first time a key is seen and remember that order, which is used to break ties.
 *
 * @param <A> - the action type.
 */
public class AggregationTable<A extends Action>
{
  private final AggregationPolicy mPolicy;
  private final Map<String, AggregationRecord<A>> mRecords = new LinkedHashMap<>();
  private int mNumMerged = 0;
  private long mTotalSimulations = 0;

  public AggregationTable(AggregationPolicy xiPolicy)
  {
    mPolicy = xiPolicy;
  }

  /**
   * Fold a worker's result into the table.
   *
   * @param xiResult - the worker's result.  "No decision" results contribute nothing but their simulation count.
   */
  public void merge(SearchResult<A> xiResult)
  {
    mNumMerged++;
    mTotalSimulations += xiResult.getSimulationsEvaluated();

    if (!xiResult.isDecision())
    {
      return;
    }

    switch (mPolicy)
    {
      case BEST_ACTION_CREDIT:
        // The worker's whole budget goes to the action it judged best.
        recordFor(xiResult.getBestAction()).add(xiResult.getSimulationsEvaluated(), xiResult.getValue());
        break;

      case PER_ACTION_VISITS:
        for (ActionStatistics<A> lStats : xiResult.getActionStatistics())
        {
          recordFor(lStats.getAction()).add(lStats.getNumVisits(), lStats.getTotalValue());
        }
        break;

      default:
        throw new IllegalStateException("Unknown aggregation policy " + mPolicy);
    }
  }

  private AggregationRecord<A> recordFor(A xiAction)
  {
    AggregationRecord<A> lRecord = mRecords.get(xiAction.getKey());
    if (lRecord == null)
    {
      lRecord = new AggregationRecord<>(xiAction);
      mRecords.put(xiAction.getKey(), lRecord);
    }
    return lRecord;
  }

  /**
   * @return the record with the most visits, or null if no worker reached a decision.  Ties go to the key seen first.
   */
  public AggregationRecord<A> getWinner()
  {
    AggregationRecord<A> lWinner = null;
    for (AggregationRecord<A> lRecord : mRecords.values())
    {
      if ((lWinner == null) || (lRecord.getTotalVisits() > lWinner.getTotalVisits()))
      {
        lWinner = lRecord;
      }
    }
    return lWinner;
  }

  /**
   * @return the record for the specified key, or null.
   *
   * @param xiKey - the action key.
   */
  public AggregationRecord<A> getRecord(String xiKey)
  {
    return mRecords.get(xiKey);
  }

  /**
   * @return all records, in the order their keys were first seen.
   */
  public List<AggregationRecord<A>> getRecords()
  {
    return new ArrayList<>(mRecords.values());
  }

  /**
   * @return the number of worker results merged, including those with no decision.
   */
  public int getNumMerged()
  {
    return mNumMerged;
  }

  /**
   * @return the total number of simulations evaluated across all merged results.
   */
  public long getTotalSimulations()
  {
    return mTotalSimulations;
  }
}
