package org.tradesim.decision.parallel;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tradesim.decision.config.DecisionConfiguration;
import org.tradesim.decision.estimator.ValueEstimator;
import org.tradesim.decision.mcts.SearchResult;
import org.tradesim.util.model.Action;
import org.tradesim.util.model.DomainModel;
import org.tradesim.util.model.exceptions.CapabilityException;
import org.tradesim.util.model.exceptions.CapabilityException.Capability;
import org.tradesim.util.model.exceptions.InvalidStateException;
import org.tradesim.util.model.exceptions.SearchWorkerException;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Runs several independent searches from the same root on a fixed pool of threads and merges their results into a
 * single decision.
 *
 * <p>Each call is independent of previous calls.  There is no timeout: a worker that never finishes blocks the
 * decision, so callers needing bounded latency must impose their own deadline (interrupting the calling thread
 * cancels the outstanding workers).
 */
public class ParallelSearchCoordinator implements AutoCloseable
{
  private static final Logger LOGGER = LogManager.getLogger();
  private static final Logger STATS_LOGGER = LogManager.getLogger("stats");

  private final DecisionConfiguration mConfig;
  private final ExecutorService mExecutor;

  /**
   * Create a coordinator with a pool of {@link DecisionConfiguration#getNumWorkers()} threads.
   *
   * @param xiConfig - the configuration.
   */
  public ParallelSearchCoordinator(DecisionConfiguration xiConfig)
  {
    mConfig = xiConfig;
    mExecutor = Executors.newFixedThreadPool(xiConfig.getNumWorkers(),
                                             new ThreadFactoryBuilder().setNameFormat("SearchWorker-%d")
                                                                       .setDaemon(true)
                                                                       .build());
  }

  /**
   * Decide using the configured number of workers and simulations.
   *
   * @see #parallelSearch(Object, DomainModel, ValueEstimator, int, int)
   */
  public <S, A extends Action> ParallelSearchResult<A> parallelSearch(S xiRootState,
                                                                      DomainModel<S, A> xiModel,
                                                                      ValueEstimator<S> xiEstimator)
      throws InvalidStateException, CapabilityException, SearchWorkerException, InterruptedException
  {
    return parallelSearch(xiRootState,
                          xiModel,
                          xiEstimator,
                          mConfig.getNumWorkers(),
                          mConfig.getSimulationsPerWorker());
  }

  /**
   * Decide on an action by running independent searches and merging their results.
   *
   * @param xiRootState            - the state to decide in.
   * @param xiModel                - the domain model.
   * @param xiEstimator            - the value estimator, or null to rely on rollouts.  Each worker gets its own
   *                                 independent instance.
   * @param xiNumWorkers           - the number of independent searches.
   * @param xiSimulationsPerWorker - the number of simulations in each search.
   *
   * @return the merged result.  "No decision" if no worker reached a decision.
   *
   * @throws InvalidStateException if the root state fails validation or doesn't survive serialization.
   * @throws CapabilityException   if the estimator can't produce an instance for every worker.  No worker is started.
   * @throws SearchWorkerException if a worker failed (the first failure, when failing fast; or when every worker
   *                               failed, with best-effort collection).
   * @throws InterruptedException  if interrupted while waiting.  Outstanding workers are cancelled.
   */
  public <S, A extends Action> ParallelSearchResult<A> parallelSearch(S xiRootState,
                                                                      DomainModel<S, A> xiModel,
                                                                      ValueEstimator<S> xiEstimator,
                                                                      int xiNumWorkers,
                                                                      int xiSimulationsPerWorker)
      throws InvalidStateException, CapabilityException, SearchWorkerException, InterruptedException
  {
    if (xiNumWorkers < 1)
    {
      throw new IllegalArgumentException("Number of workers must be at least 1, got " + xiNumWorkers);
    }
    if (xiSimulationsPerWorker < 1)
    {
      throw new IllegalArgumentException("Simulations per worker must be at least 1, got " + xiSimulationsPerWorker);
    }

    long lStartTime = System.currentTimeMillis();
    String lSnapshot = snapshot(xiRootState, xiModel);

    // Give each worker its own estimator before dispatching any of them.
    List<ValueEstimator<S>> lEstimators = new ArrayList<>(xiNumWorkers);
    for (int lii = 0; lii < xiNumWorkers; lii++)
    {
      lEstimators.add(createIndependentEstimator(xiEstimator));
    }

    CompletionService<SearchResult<A>> lCompletionService = new ExecutorCompletionService<>(mExecutor);
    List<Future<SearchResult<A>>> lFutures = new ArrayList<>(xiNumWorkers);
    Map<Future<SearchResult<A>>, Integer> lWorkerIndices = new HashMap<>();
    AggregationTable<A> lTable = new AggregationTable<>(mConfig.getAggregationPolicy());
    List<SearchWorkerException> lFailures = new ArrayList<>();
    try
    {
      // Dispatch the workers.
      for (int lii = 0; lii < xiNumWorkers; lii++)
      {
        SearchWorker<S, A> lWorker = new SearchWorker<>(lii,
                                                        lSnapshot,
                                                        xiModel,
                                                        mConfig,
                                                        lEstimators.get(lii),
                                                        createRandom(lii),
                                                        xiSimulationsPerWorker);
        Future<SearchResult<A>> lFuture = lCompletionService.submit(lWorker);
        lFutures.add(lFuture);
        lWorkerIndices.put(lFuture, lii);
      }

      // Collect and merge the results.
      for (int lii = 0; lii < xiNumWorkers; lii++)
      {
        Future<SearchResult<A>> lFuture;
        if (mConfig.getCollectionOrder() == CollectionOrder.COMPLETION)
        {
          lFuture = lCompletionService.take();
        }
        else
        {
          lFuture = lFutures.get(lii);
        }

        try
        {
          lTable.merge(lFuture.get());
        }
        catch (ExecutionException lEx)
        {
          SearchWorkerException lFailure = asWorkerFailure(lEx, lWorkerIndices.get(lFuture));
          if (mConfig.getWorkerFailurePolicy() == WorkerFailurePolicy.FAIL_FAST)
          {
            throw lFailure;
          }

          LOGGER.warn("Excluding failed worker from the decision", lFailure);
          lFailures.add(lFailure);
        }
      }
    }
    finally
    {
      // No-op for workers that have finished.
      for (Future<SearchResult<A>> lFuture : lFutures)
      {
        lFuture.cancel(true);
      }
    }

    if (lFailures.size() == xiNumWorkers)
    {
      throw lFailures.get(0);
    }

    ParallelSearchResult<A> lResult = new ParallelSearchResult<>(lTable, xiNumWorkers, lFailures.size());
    long lElapsed = System.currentTimeMillis() - lStartTime;

    LOGGER.info("Decided " + lResult + " in " + lElapsed + "ms");
    STATS_LOGGER.info("decision=" + (lResult.isDecision() ? lResult.getWinner().getKey() : "none") +
                      ",visits=" + lResult.getVisits() +
                      ",value=" + lResult.getValue() +
                      ",simulations=" + lResult.getTotalSimulations() +
                      ",workers=" + xiNumWorkers +
                      ",failed=" + lFailures.size() +
                      ",elapsed_ms=" + lElapsed);

    return lResult;
  }

  /**
   * Stop all search workers.
   */
  @Override
  public void close()
  {
    LOGGER.debug("Stop search workers");
    mExecutor.shutdownNow();
  }

  private static <S, A extends Action> String snapshot(S xiRootState, DomainModel<S, A> xiModel)
      throws InvalidStateException
  {
    if (xiRootState == null)
    {
      throw new InvalidStateException("No root state");
    }

    String lSnapshot;
    try
    {
      xiModel.validate(xiRootState);
      lSnapshot = xiModel.serialize(xiRootState);
    }
    catch (RuntimeException lEx)
    {
      throw new InvalidStateException("Root state can't be prepared for search: " + lEx, lEx);
    }

    // Workers rebuild the root from the snapshot, so it must come back unchanged.
    S lCopy;
    try
    {
      lCopy = xiModel.deserialize(lSnapshot);
    }
    catch (RuntimeException lEx)
    {
      throw new InvalidStateException("Root state snapshot can't be read back: " + lEx, lEx);
    }
    if (!xiRootState.equals(lCopy))
    {
      throw new InvalidStateException("Root state changed when serialized: " + lSnapshot);
    }

    return lSnapshot;
  }

  private static <S> ValueEstimator<S> createIndependentEstimator(ValueEstimator<S> xiEstimator)
      throws CapabilityException
  {
    if (xiEstimator == null)
    {
      return null;
    }

    ValueEstimator<S> lInstance;
    try
    {
      lInstance = xiEstimator.createIndependentInstance();
    }
    catch (RuntimeException lEx)
    {
      throw new CapabilityException(Capability.ESTIMATE, lEx);
    }

    if (lInstance == null)
    {
      throw new CapabilityException(Capability.ESTIMATE, "no independent instance");
    }
    return lInstance;
  }

  private Random createRandom(int xiWorkerIndex)
  {
    Long lSeed = mConfig.getRandomSeed();
    return (lSeed == null) ? new Random() : new Random(lSeed + xiWorkerIndex);
  }

  private static SearchWorkerException asWorkerFailure(ExecutionException xiEx, int xiWorkerIndex)
  {
    Throwable lCause = xiEx.getCause();
    if (lCause instanceof SearchWorkerException)
    {
      return (SearchWorkerException)lCause;
    }
    return new SearchWorkerException(xiWorkerIndex, lCause);
  }
}
