package org.tradesim.util.model;

import java.util.List;

import org.tradesim.util.model.exceptions.CapabilityException;
import org.tradesim.util.model.exceptions.InvalidStateException;

/**
 * The rules of the world, as seen by the search.
 *
 * <p>The search never assumes a concrete domain.  Everything it needs to know about states and actions comes through
 * this interface, which the surrounding simulation implements.
 *
 * <p>Implementations must be safe for concurrent use by several searches.  In practice that means they hold no
 * mutable state: states are immutable and {@link #getNextState} returns a new state rather than modifying its input.
 *
 * @param <S> - the state type.  Must implement value equality.
 * @param <A> - the action type.
 */
public interface DomainModel<S, A extends Action>
{
  /**
   * Check that a state meets the structural expectations of the domain.
   *
   * @param xiState - the state.
   *
   * @throws InvalidStateException if the state is malformed.
   */
  public void validate(S xiState) throws InvalidStateException;

  /**
   * @return the legal actions in the specified state, in a stable order.  Empty if there are none.
   *
   * @param xiState - the state.
   */
  public List<A> getLegalActions(S xiState) throws CapabilityException;

  /**
   * Apply an action.  Must not modify the input state.
   *
   * @param xiState  - the state.
   * @param xiAction - a legal action in that state.
   *
   * @return the resulting state.
   */
  public S getNextState(S xiState, A xiAction) throws CapabilityException;

  /**
   * @return whether the state is terminal.
   *
   * @param xiState - the state.
   */
  public boolean isTerminal(S xiState) throws CapabilityException;

  /**
   * Returns the reward in a terminal state, from the perspective of the agent acting in the state where the search
   * started.  Rewards are in the range [-1, 1].
   *
   * @param xiState - a terminal state.
   */
  public double getReward(S xiState) throws CapabilityException;

  /**
   * @return the index of the agent choosing the next action in the specified state.  Single-agent domains return 0.
   *
   * @param xiState - the state.
   */
  public int getActingRole(S xiState) throws CapabilityException;

  /**
   * Serialize a state.  The result must be stable: deserializing it (in any thread or process) yields a state equal to
   * the original.
   *
   * @param xiState - the state.
   */
  public String serialize(S xiState);

  /**
   * @return the state described by the specified text.
   *
   * @param xiSerialized - text produced by {@link #serialize}.
   *
   * @throws InvalidStateException if the text doesn't describe a valid state.
   */
  public S deserialize(String xiSerialized) throws InvalidStateException;
}
