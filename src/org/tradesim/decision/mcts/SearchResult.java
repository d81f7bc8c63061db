package org.tradesim.decision.mcts;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.tradesim.util.model.Action;

/**
 * The outcome of a single search: the recommended action (if any) and the statistics behind it.
 *
 * @param <A> - the action type.
 */
public class SearchResult<A extends Action>
{
  private final A mBestAction;
  private final int mSimulationsEvaluated;
  private final int mVisits;
  private final double mValue;
  private final List<ActionStatistics<A>> mActionStatistics;

  /**
   * Create a result recommending an action.
   *
   * @param xiBestAction          - the recommended action.
   * @param xiSimulationsEvaluated - the number of simulations performed.
   * @param xiVisits              - the number of visits to the recommended action.
   * @param xiValue               - the accumulated value of the recommended action.
   * @param xiActionStatistics    - statistics for every action explored at the root, in the order first explored.
   */
  public SearchResult(A xiBestAction,
                      int xiSimulationsEvaluated,
                      int xiVisits,
                      double xiValue,
                      List<ActionStatistics<A>> xiActionStatistics)
  {
    mBestAction = xiBestAction;
    mSimulationsEvaluated = xiSimulationsEvaluated;
    mVisits = xiVisits;
    mValue = xiValue;
    mActionStatistics = Collections.unmodifiableList(new ArrayList<>(xiActionStatistics));
  }

  /**
   * @return a result recording that there was nothing to decide.
   *
   * @param xiSimulationsEvaluated - the number of simulations performed.
   */
  public static <A extends Action> SearchResult<A> noDecision(int xiSimulationsEvaluated)
  {
    return new SearchResult<>(null, xiSimulationsEvaluated, 0, 0, Collections.<ActionStatistics<A>>emptyList());
  }

  /**
   * @return whether the search recommended an action.
   */
  public boolean isDecision()
  {
    return mBestAction != null;
  }

  /**
   * @return the recommended action, or null if there was no decision to make.
   */
  public A getBestAction()
  {
    return mBestAction;
  }

  public int getSimulationsEvaluated()
  {
    return mSimulationsEvaluated;
  }

  /**
   * @return the number of visits to the recommended action.
   */
  public int getVisits()
  {
    return mVisits;
  }

  /**
   * @return the accumulated value of the recommended action.
   */
  public double getValue()
  {
    return mValue;
  }

  public List<ActionStatistics<A>> getActionStatistics()
  {
    return mActionStatistics;
  }

  /**
   * @return the statistics for the action with the specified key, or null if it wasn't explored.
   *
   * @param xiKey - the action key.
   */
  public ActionStatistics<A> getActionStatistics(String xiKey)
  {
    for (ActionStatistics<A> lStats : mActionStatistics)
    {
      if (lStats.getKey().equals(xiKey))
      {
        return lStats;
      }
    }
    return null;
  }

  @Override
  public String toString()
  {
    if (!isDecision())
    {
      return "No decision after " + mSimulationsEvaluated + " simulations";
    }
    return mBestAction.getKey() + " after " + mSimulationsEvaluated + " simulations (" + mVisits + " visits, value " +
           mValue + ")";
  }
}
