package org.tradesim.decision.mcts;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.tradesim.util.model.Action;
import org.tradesim.util.model.exceptions.CapabilityException;

/**
 * A node in a search tree.
 *
 * <p>Values are accumulated from the perspective of the agent that chose the action leading to this node (for the
 * root, the agent acting at the root), so a parent always wants to select the child with the highest mean value.
 *
 * @param <S> - the state type.
 * @param <A> - the action type.
 */
public class SearchTreeNode<S, A extends Action>
{
  private final SearchTree<S, A> tree;
  private final SearchTreeNode<S, A> parent;
  private final A action;
  private final S state;
  private final boolean terminal;
  private final int choosingRole;
  private final int actingRole;
  private final List<SearchTreeNode<S, A>> children = new ArrayList<>();
  private List<A> untriedActions = null;
  private double prior = 0;
  protected int numVisits = 0;
  protected double totalValue = 0;

  SearchTreeNode(SearchTree<S, A> xiTree,
                 SearchTreeNode<S, A> xiParent,
                 A xiAction,
                 S xiState) throws CapabilityException
  {
    tree = xiTree;
    parent = xiParent;
    action = xiAction;
    state = xiState;
    terminal = tree.isTerminal(state);

    if (terminal)
    {
      // Nobody acts in a terminal state.  Keep the parent's role so that the values stay comparable.
      actingRole = (parent == null) ? 0 : parent.actingRole;
    }
    else
    {
      actingRole = tree.getActingRole(state);
    }
    choosingRole = (parent == null) ? actingRole : parent.actingRole;
  }

  public S getState()
  {
    return state;
  }

  /**
   * @return the action that led to this node, or null for the root.
   */
  public A getAction()
  {
    return action;
  }

  public SearchTreeNode<S, A> getParent()
  {
    return parent;
  }

  public List<SearchTreeNode<S, A>> getChildren()
  {
    return Collections.unmodifiableList(children);
  }

  public int getNumVisits()
  {
    return numVisits;
  }

  public double getTotalValue()
  {
    return totalValue;
  }

  public double getMeanValue()
  {
    return numVisits == 0 ? 0 : totalValue / numVisits;
  }

  public boolean isTerminal()
  {
    return terminal;
  }

  int getActingRole()
  {
    return actingRole;
  }

  /**
   * @return whether any legal action in this node has not yet been given a child.
   */
  public boolean hasUntriedActions() throws CapabilityException
  {
    if (terminal)
    {
      return false;
    }
    if (untriedActions == null)
    {
      untriedActions = new ArrayList<>(tree.getLegalActions(state));
    }
    return !untriedActions.isEmpty();
  }

  public boolean hasChildren()
  {
    return !children.isEmpty();
  }

  /**
   * Create a child for one of the untried actions, chosen uniformly at random.
   *
   * @return the new child.
   */
  SearchTreeNode<S, A> expand() throws CapabilityException
  {
    assert((untriedActions != null) && !untriedActions.isEmpty());

    A lAction = untriedActions.remove(tree.getRandom().nextInt(untriedActions.size()));
    S lChildState = tree.getNextState(state, lAction);
    SearchTreeNode<S, A> lChild = new SearchTreeNode<>(tree, this, lAction, lChildState);

    if (tree.usesPrior())
    {
      double lEstimate = lChild.terminal ? tree.getReward(lChildState) : tree.estimate(lChildState);
      lChild.prior = lChild.toOwnPerspective(lEstimate);
    }

    children.add(lChild);
    return lChild;
  }

  /**
   * Select the child with the highest upper confidence bound.  Ties go to the child created first.
   */
  SearchTreeNode<S, A> select()
  {
    double bestSelectionScore = -Double.MAX_VALUE;
    SearchTreeNode<S, A> result = null;

    for (SearchTreeNode<S, A> child : children)
    {
      double selectionScore = explorationScore(child) + exploitationScore(child) + priorScore(child);

      if (selectionScore > bestSelectionScore)
      {
        bestSelectionScore = selectionScore;
        result = child;
      }
    }

    return result;
  }

  protected double explorationScore(SearchTreeNode<S, A> child)
  {
    if (child.numVisits == 0)
    {
      return Double.MAX_VALUE;
    }

    assert(numVisits > 0);
    return tree.getExplorationWeight() * Math.sqrt(Math.log(numVisits) / child.numVisits);
  }

  protected double exploitationScore(SearchTreeNode<S, A> child)
  {
    return child.getMeanValue();
  }

  protected double priorScore(SearchTreeNode<S, A> child)
  {
    if (!tree.usesPrior())
    {
      return 0;
    }
    return tree.getPriorWeight() * child.prior / (1 + child.numVisits);
  }

  /**
   * Add a simulation outcome to this node and all its ancestors.
   *
   * @param xiOutcome - the outcome, from the perspective of the agent acting at the root.
   */
  void backPropagate(double xiOutcome)
  {
    for (SearchTreeNode<S, A> lNode = this; lNode != null; lNode = lNode.parent)
    {
      lNode.numVisits++;
      lNode.totalValue += lNode.toOwnPerspective(xiOutcome);
    }
  }

  private double toOwnPerspective(double xiValue)
  {
    return (choosingRole == tree.getRootRole()) ? xiValue : -xiValue;
  }
}
