package org.tradesim.decision.mcts;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.Random;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tradesim.decision.estimator.ValueEstimator;
import org.tradesim.util.model.Action;
import org.tradesim.util.model.DomainModel;
import org.tradesim.util.model.exceptions.CapabilityException;
import org.tradesim.util.model.exceptions.CapabilityException.Capability;

/**
 * A single Monte-Carlo search tree.
 *
 * <p>Each call to {@link #grow()} performs one simulation: select, expand, simulate, back-propagate.  A tree is used
 * by a single thread and is never shared.
 *
 * <p>All calls out to the domain model and the estimator go through this class, which reports any failure as a
 * {@link CapabilityException}.
 *
 * @param <S> - the state type.
 * @param <A> - the action type.
 */
public class SearchTree<S, A extends Action>
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final DomainModel<S, A> model;
  private final ValueEstimator<S> estimator;
  private final EstimatorRole estimatorRole;
  private final double explorationWeight;
  private final double priorWeight;
  private final int rolloutDepthLimit;
  private final Random random;
  private SearchTreeNode<S, A> root = null;
  private int numSimulations = 0;

  /**
   * Create a search tree.
   *
   * @param xiModel             - the domain model.
   * @param xiEstimator         - the value estimator, or null to rely on rollouts.
   * @param xiEstimatorRole     - how to use the estimator.
   * @param xiExplorationWeight - the exploration weight.
   * @param xiPriorWeight       - the weight of the estimator's prior, when it is used for selection.
   * @param xiRolloutDepthLimit - the maximum length of a rollout.
   * @param xiRandom            - the source of all randomness used by the tree.
   */
  public SearchTree(DomainModel<S, A> xiModel,
                    ValueEstimator<S> xiEstimator,
                    EstimatorRole xiEstimatorRole,
                    double xiExplorationWeight,
                    double xiPriorWeight,
                    int xiRolloutDepthLimit,
                    Random xiRandom)
  {
    model = xiModel;
    estimator = xiEstimator;
    estimatorRole = xiEstimatorRole;
    explorationWeight = xiExplorationWeight;
    priorWeight = xiPriorWeight;
    rolloutDepthLimit = xiRolloutDepthLimit;
    random = xiRandom;
  }

  /**
   * Discard the tree and start again from the specified state.
   *
   * @param xiRootState - the new root state.
   */
  public void clear(S xiRootState) throws CapabilityException
  {
    numSimulations = 0;
    root = new SearchTreeNode<>(this, null, null, xiRootState);
  }

  /**
   * @return whether there is anything to decide, i.e. the root is non-terminal and has legal actions.
   */
  public boolean hasChoice() throws CapabilityException
  {
    return !root.isTerminal() && (root.hasUntriedActions() || root.hasChildren());
  }

  /**
   * Perform a single simulation.
   */
  public void grow() throws CapabilityException
  {
    // Select
    SearchTreeNode<S, A> lNode = root;
    while (!lNode.isTerminal() && !lNode.hasUntriedActions() && lNode.hasChildren())
    {
      lNode = lNode.select();
    }

    // Expand
    if (lNode.hasUntriedActions())
    {
      lNode = lNode.expand();
    }

    // Simulate and back-propagate
    double lOutcome = simulate(lNode);
    lNode.backPropagate(lOutcome);
    numSimulations++;
  }

  /**
   * @return the value of a node, from the perspective of the agent acting at the root.
   */
  private double simulate(SearchTreeNode<S, A> xiNode) throws CapabilityException
  {
    if (xiNode.isTerminal())
    {
      return getReward(xiNode.getState());
    }

    if ((estimator != null) && (estimatorRole == EstimatorRole.LEAF_EVALUATION))
    {
      return estimate(xiNode.getState());
    }

    return playout(xiNode.getState());
  }

  /**
   * Play uniformly random actions from the specified state until reaching a terminal state.
   */
  private double playout(S xiState) throws CapabilityException
  {
    S lState = xiState;
    for (int lDepth = 0; ; lDepth++)
    {
      if (isTerminal(lState))
      {
        return getReward(lState);
      }

      if (lDepth >= rolloutDepthLimit)
      {
        // Truncated.  Fall back to the estimator if there is one, otherwise score as neutral.
        return (estimator != null) ? estimate(lState) : 0;
      }

      List<A> lLegalActions = getLegalActions(lState);
      if (lLegalActions.isEmpty())
      {
        LOGGER.debug("Rollout reached a non-terminal state with no legal actions");
        return 0;
      }

      lState = getNextState(lState, lLegalActions.get(random.nextInt(lLegalActions.size())));
    }
  }

  /**
   * @return the result of the search so far.  The best action is the root child with the most visits; ties go to
   * the child created first.
   */
  public SearchResult<A> getResult()
  {
    SearchTreeNode<S, A> lBestChild = null;
    List<ActionStatistics<A>> lStatistics = new ArrayList<>();

    for (SearchTreeNode<S, A> lChild : root.getChildren())
    {
      lStatistics.add(new ActionStatistics<>(lChild.getAction(), lChild.getNumVisits(), lChild.getTotalValue()));
      if ((lBestChild == null) || (lChild.getNumVisits() > lBestChild.getNumVisits()))
      {
        lBestChild = lChild;
      }
    }

    if (lBestChild == null)
    {
      return SearchResult.noDecision(numSimulations);
    }

    return new SearchResult<>(lBestChild.getAction(),
                              numSimulations,
                              lBestChild.getNumVisits(),
                              lBestChild.getTotalValue(),
                              lStatistics);
  }

  /**
   * Log the scores of the immediate children of the root.
   */
  public void dumpRootData()
  {
    for (SearchTreeNode<S, A> lChild : root.getChildren())
    {
      LOGGER.debug("Action " + lChild.getAction().getKey() + " scores: " + lChild.getMeanValue() + " after " +
                   lChild.getNumVisits() + " visits");
    }
  }

  public SearchTreeNode<S, A> getRoot()
  {
    return root;
  }

  public int getNumSimulations()
  {
    return numSimulations;
  }

  Random getRandom()
  {
    return random;
  }

  double getExplorationWeight()
  {
    return explorationWeight;
  }

  double getPriorWeight()
  {
    return priorWeight;
  }

  boolean usesPrior()
  {
    return (estimator != null) && (estimatorRole == EstimatorRole.SELECTION_PRIOR);
  }

  int getRootRole()
  {
    return root.getActingRole();
  }

  List<A> getLegalActions(S xiState) throws CapabilityException
  {
    List<A> lActions;
    try
    {
      lActions = model.getLegalActions(xiState);
    }
    catch (RuntimeException lEx)
    {
      throw new CapabilityException(Capability.LEGAL_ACTIONS, lEx);
    }

    if (lActions == null)
    {
      throw new CapabilityException(Capability.LEGAL_ACTIONS, "returned null");
    }

    // Results are merged by key, so keys must identify actions.
    Set<String> lKeys = new HashSet<>();
    for (A lAction : lActions)
    {
      if (!lKeys.add(lAction.getKey()))
      {
        throw new CapabilityException(Capability.LEGAL_ACTIONS, "duplicate action key " + lAction.getKey());
      }
    }
    return lActions;
  }

  S getNextState(S xiState, A xiAction) throws CapabilityException
  {
    S lNextState;
    try
    {
      lNextState = model.getNextState(xiState, xiAction);
    }
    catch (RuntimeException lEx)
    {
      throw new CapabilityException(Capability.NEXT_STATE, lEx);
    }

    if (lNextState == null)
    {
      throw new CapabilityException(Capability.NEXT_STATE, "returned null for " + xiAction.getKey());
    }
    return lNextState;
  }

  boolean isTerminal(S xiState) throws CapabilityException
  {
    try
    {
      return model.isTerminal(xiState);
    }
    catch (RuntimeException lEx)
    {
      throw new CapabilityException(Capability.IS_TERMINAL, lEx);
    }
  }

  double getReward(S xiState) throws CapabilityException
  {
    double lReward;
    try
    {
      lReward = model.getReward(xiState);
    }
    catch (RuntimeException lEx)
    {
      throw new CapabilityException(Capability.REWARD, lEx);
    }

    if (Double.isNaN(lReward))
    {
      throw new CapabilityException(Capability.REWARD, "returned NaN");
    }
    return lReward;
  }

  int getActingRole(S xiState) throws CapabilityException
  {
    try
    {
      return model.getActingRole(xiState);
    }
    catch (RuntimeException lEx)
    {
      throw new CapabilityException(Capability.ACTING_ROLE, lEx);
    }
  }

  double estimate(S xiState) throws CapabilityException
  {
    double lEstimate;
    try
    {
      lEstimate = estimator.estimate(xiState);
    }
    catch (RuntimeException lEx)
    {
      throw new CapabilityException(Capability.ESTIMATE, lEx);
    }

    if (Double.isNaN(lEstimate))
    {
      throw new CapabilityException(Capability.ESTIMATE, "returned NaN");
    }
    return Math.max(-1, Math.min(1, lEstimate));
  }
}
