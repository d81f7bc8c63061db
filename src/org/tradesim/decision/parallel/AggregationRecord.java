package org.tradesim.decision.parallel;

import org.tradesim.util.model.Action;

/**
 * Accumulated worker contributions for one action key.
 *
 * @param <A> - the action type.
 */
public class AggregationRecord<A extends Action>
{
  private final String mKey;
  private final A mAction;
  private long mTotalVisits = 0;
  private double mTotalValue = 0;
  private int mContributions = 0;

  /**
   * @param xiAction - the first action seen with this key.  Used to replay the decision.
   */
  AggregationRecord(A xiAction)
  {
    mKey = xiAction.getKey();
    mAction = xiAction;
  }

  void add(long xiVisits, double xiValue)
  {
    mTotalVisits += xiVisits;
    mTotalValue += xiValue;
    mContributions++;
  }

  public String getKey()
  {
    return mKey;
  }

  public A getAction()
  {
    return mAction;
  }

  public long getTotalVisits()
  {
    return mTotalVisits;
  }

  public double getTotalValue()
  {
    return mTotalValue;
  }

  /**
   * @return the number of worker contributions folded into this record.
   */
  public int getContributions()
  {
    return mContributions;
  }

  @Override
  public String toString()
  {
    return mKey + " (" + mTotalVisits + " visits, value " + mTotalValue + ", " + mContributions + " contributions)";
  }
}
