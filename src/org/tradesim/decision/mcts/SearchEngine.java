package org.tradesim.decision.mcts;

import java.util.Random;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tradesim.decision.config.DecisionConfiguration;
import org.tradesim.decision.estimator.ValueEstimator;
import org.tradesim.util.model.Action;
import org.tradesim.util.model.DomainModel;
import org.tradesim.util.model.exceptions.CapabilityException;
import org.tradesim.util.model.exceptions.InvalidStateException;

/**
 * Single-threaded Monte-Carlo tree search.
 *
 * <p>Every call to {@link #search} builds a fresh tree; nothing is carried over between calls apart from the state of
 * the random number generator.
 *
 * @param <S> - the state type.
 * @param <A> - the action type.
 */
public class SearchEngine<S, A extends Action>
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final DecisionConfiguration mConfig;
  private final ValueEstimator<S> mEstimator;
  private final Random mRandom;

  /**
   * Create a search engine.
   *
   * @param xiConfig    - the configuration.
   * @param xiEstimator - the value estimator, or null to rely on random rollouts.
   * @param xiRandom    - the source of randomness.  Seed it for repeatable searches.
   */
  public SearchEngine(DecisionConfiguration xiConfig, ValueEstimator<S> xiEstimator, Random xiRandom)
  {
    mConfig = xiConfig;
    mEstimator = xiEstimator;
    mRandom = xiRandom;
  }

  /**
   * Search for the best action from the specified state.
   *
   * @param xiRootState      - the state to decide in.
   * @param xiModel          - the domain model.
   * @param xiNumSimulations - the number of simulations to perform.
   *
   * @return the result.  If the root state is terminal or has no legal actions, the result is "no decision".
   *
   * @throws InvalidStateException if the root state fails validation.
   * @throws CapabilityException if the domain model or estimator fails during the search.
   */
  public SearchResult<A> search(S xiRootState, DomainModel<S, A> xiModel, int xiNumSimulations)
      throws InvalidStateException, CapabilityException
  {
    if (xiNumSimulations < 1)
    {
      throw new IllegalArgumentException("Number of simulations must be at least 1, got " + xiNumSimulations);
    }
    if (xiRootState == null)
    {
      throw new InvalidStateException("No root state");
    }
    try
    {
      xiModel.validate(xiRootState);
    }
    catch (RuntimeException lEx)
    {
      throw new InvalidStateException("Root state failed validation: " + lEx, lEx);
    }

    SearchTree<S, A> lTree = new SearchTree<>(xiModel,
                                              mEstimator,
                                              mConfig.getEstimatorRole(),
                                              mConfig.getExplorationWeight(),
                                              mConfig.getPriorWeight(),
                                              mConfig.getRolloutDepthLimit(),
                                              mRandom);
    lTree.clear(xiRootState);

    if (!lTree.hasChoice())
    {
      LOGGER.debug("Nothing to decide - root is terminal or has no legal actions");
      return SearchResult.noDecision(0);
    }

    for (int lii = 0; lii < xiNumSimulations; lii++)
    {
      lTree.grow();
    }

    if (LOGGER.isDebugEnabled())
    {
      lTree.dumpRootData();
    }

    SearchResult<A> lResult = lTree.getResult();
    LOGGER.debug("Processed " + lTree.getNumSimulations() + " simulations, and playing: " + lResult);
    return lResult;
  }
}
