package org.tradesim.decision.parallel;

import java.util.List;

import org.tradesim.util.model.Action;

/**
 * The outcome of a parallel search: the chosen action (if any) and the merged statistics.
 *
 * @param <A> - the action type.
 */
public class ParallelSearchResult<A extends Action>
{
  private final AggregationRecord<A> mWinner;
  private final List<AggregationRecord<A>> mRecords;
  private final long mTotalSimulations;
  private final int mWorkersDispatched;
  private final int mWorkersFailed;

  ParallelSearchResult(AggregationTable<A> xiTable, int xiWorkersDispatched, int xiWorkersFailed)
  {
    mWinner = xiTable.getWinner();
    mRecords = xiTable.getRecords();
    mTotalSimulations = xiTable.getTotalSimulations();
    mWorkersDispatched = xiWorkersDispatched;
    mWorkersFailed = xiWorkersFailed;
  }

  /**
   * @return whether any worker reached a decision.
   */
  public boolean isDecision()
  {
    return mWinner != null;
  }

  /**
   * @return the chosen action, or null if there is no decision.
   */
  public A getAction()
  {
    return (mWinner == null) ? null : mWinner.getAction();
  }

  /**
   * @return the aggregation record of the chosen action, or null if there is no decision.
   */
  public AggregationRecord<A> getWinner()
  {
    return mWinner;
  }

  /**
   * @return the aggregated visits credited to the chosen action (0 if there is no decision).
   */
  public long getVisits()
  {
    return (mWinner == null) ? 0 : mWinner.getTotalVisits();
  }

  /**
   * @return the aggregated value credited to the chosen action (0 if there is no decision).
   */
  public double getValue()
  {
    return (mWinner == null) ? 0 : mWinner.getTotalValue();
  }

  /**
   * @return every aggregation record, in key encounter order.
   */
  public List<AggregationRecord<A>> getRecords()
  {
    return mRecords;
  }

  /**
   * @return the total simulations evaluated by all successful workers.
   */
  public long getTotalSimulations()
  {
    return mTotalSimulations;
  }

  public int getWorkersDispatched()
  {
    return mWorkersDispatched;
  }

  /**
   * @return the number of workers whose results were excluded because they failed.
   */
  public int getWorkersFailed()
  {
    return mWorkersFailed;
  }

  @Override
  public String toString()
  {
    String lOutcome = isDecision() ? mWinner.toString() : "no decision";
    return lOutcome + " from " + (mWorkersDispatched - mWorkersFailed) + "/" + mWorkersDispatched + " workers, " +
           mTotalSimulations + " simulations";
  }
}
