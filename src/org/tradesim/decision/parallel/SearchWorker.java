package org.tradesim.decision.parallel;

import java.util.Random;
import java.util.concurrent.Callable;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tradesim.decision.config.DecisionConfiguration;
import org.tradesim.decision.estimator.ValueEstimator;
import org.tradesim.decision.mcts.SearchEngine;
import org.tradesim.decision.mcts.SearchResult;
import org.tradesim.util.model.Action;
import org.tradesim.util.model.DomainModel;
import org.tradesim.util.model.exceptions.DecisionException;
import org.tradesim.util.model.exceptions.SearchWorkerException;

/**
 * One independent search, run on a pool thread.
 *
 * <p>A worker shares nothing mutable with its siblings.  It receives the root as a serialized snapshot, from which it
 * builds its own copy, and owns its own tree, estimator instance and random number generator.
 *
 * @param <S> - the state type.
 * @param <A> - the action type.
 */
class SearchWorker<S, A extends Action> implements Callable<SearchResult<A>>
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final int mIndex;
  private final String mSnapshot;
  private final DomainModel<S, A> mModel;
  private final DecisionConfiguration mConfig;
  private final ValueEstimator<S> mEstimator;
  private final Random mRandom;
  private final int mNumSimulations;

  SearchWorker(int xiIndex,
               String xiSnapshot,
               DomainModel<S, A> xiModel,
               DecisionConfiguration xiConfig,
               ValueEstimator<S> xiEstimator,
               Random xiRandom,
               int xiNumSimulations)
  {
    mIndex = xiIndex;
    mSnapshot = xiSnapshot;
    mModel = xiModel;
    mConfig = xiConfig;
    mEstimator = xiEstimator;
    mRandom = xiRandom;
    mNumSimulations = xiNumSimulations;
  }

  @Override
  public SearchResult<A> call() throws SearchWorkerException
  {
    long lStartTime = System.currentTimeMillis();
    try
    {
      S lRootState = mModel.deserialize(mSnapshot);
      SearchEngine<S, A> lEngine = new SearchEngine<>(mConfig, mEstimator, mRandom);
      SearchResult<A> lResult = lEngine.search(lRootState, mModel, mNumSimulations);

      LOGGER.debug("Worker " + mIndex + " finished in " + (System.currentTimeMillis() - lStartTime) + "ms: " +
                   lResult);
      return lResult;
    }
    catch (DecisionException | RuntimeException lEx)
    {
      throw new SearchWorkerException(mIndex, lEx);
    }
  }
}
