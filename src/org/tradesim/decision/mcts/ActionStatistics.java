package org.tradesim.decision.mcts;

import org.tradesim.util.model.Action;

/**
 * Visit and value statistics for one action available at the root of a search.
 *
 * @param <A> - the action type.
 */
public class ActionStatistics<A extends Action>
{
  private final A mAction;
  private final int mNumVisits;
  private final double mTotalValue;

  public ActionStatistics(A xiAction, int xiNumVisits, double xiTotalValue)
  {
    mAction = xiAction;
    mNumVisits = xiNumVisits;
    mTotalValue = xiTotalValue;
  }

  public A getAction()
  {
    return mAction;
  }

  public String getKey()
  {
    return mAction.getKey();
  }

  public int getNumVisits()
  {
    return mNumVisits;
  }

  /**
   * @return the sum of all simulation outcomes through this action.
   */
  public double getTotalValue()
  {
    return mTotalValue;
  }

  public double getMeanValue()
  {
    return mNumVisits == 0 ? 0 : mTotalValue / mNumVisits;
  }

  @Override
  public String toString()
  {
    return getKey() + " (" + mNumVisits + " visits, value " + mTotalValue + ")";
  }
}
