package org.tradesim.util.model;

/**
 * An action that is nothing but its key.
 */
public final class KeyedAction implements Action
{
  private final String mKey;

  public KeyedAction(String xiKey)
  {
    mKey = xiKey;
  }

  @Override
  public String getKey()
  {
    return mKey;
  }

  @Override
  public boolean equals(Object xiOther)
  {
    return (xiOther instanceof KeyedAction) && mKey.equals(((KeyedAction)xiOther).mKey);
  }

  @Override
  public int hashCode()
  {
    return mKey.hashCode();
  }

  @Override
  public String toString()
  {
    return mKey;
  }
}
