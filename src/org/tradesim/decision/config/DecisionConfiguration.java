package org.tradesim.decision.config;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map.Entry;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tradesim.decision.mcts.EstimatorRole;
import org.tradesim.decision.parallel.AggregationPolicy;
import org.tradesim.decision.parallel.CollectionOrder;
import org.tradesim.decision.parallel.WorkerFailurePolicy;

/**
 * Configuration for reaching a decision.
 *
 * <p>Instances are immutable and are passed explicitly to every entry point.  Values come from a set of properties
 * keyed by {@link CfgItem}; anything not configured takes the item's default.
 */
public class DecisionConfiguration
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Available configuration items.
   */
  public static enum CfgItem
  {
    /**
     * Weight of the exploration term in the upper confidence bound.  Must be positive.
     */
    EXPLORATION_WEIGHT("1.0"),

    /**
     * The number of independent search workers.
     */
    NUM_WORKERS(4),

    /**
     * The number of simulations each worker runs.
     */
    SIMULATIONS_PER_WORKER(1000),

    /**
     * Seed for the search's random number generators.  Leave unset for fresh entropy on every decision.
     */
    RANDOM_SEED(null),

    /**
     * Maximum number of steps in a single rollout.
     */
    ROLLOUT_DEPTH_LIMIT(1000),

    /**
     * How the value estimator (if any) is used.
     */
    ESTIMATOR_ROLE(EstimatorRole.LEAF_EVALUATION.name()),

    /**
     * Weight of the estimator's prior when it is used to bias selection.
     */
    PRIOR_WEIGHT("1.0"),

    /**
     * How worker results are folded together.
     */
    AGGREGATION_POLICY(AggregationPolicy.BEST_ACTION_CREDIT.name()),

    /**
     * The order in which worker results are collected.
     */
    COLLECTION_ORDER(CollectionOrder.DISPATCH.name()),

    /**
     * What to do when a worker fails.
     */
    WORKER_FAILURE_POLICY(WorkerFailurePolicy.FAIL_FAST.name()),

    /**
     * Path of a saved neural network to use as the value estimator.
     */
    ESTIMATOR_NETWORK_FILE(null);

    /**
     * Default value, as a string.
     */
    public final String mDefault;

    private CfgItem(String xiDefault)
    {
      mDefault = xiDefault;
    }

    private CfgItem(int xiDefault)
    {
      mDefault = "" + xiDefault;
    }
  }

  private final Properties mProperties;

  private final double mExplorationWeight;
  private final int mNumWorkers;
  private final int mSimulationsPerWorker;
  private final Long mRandomSeed;
  private final int mRolloutDepthLimit;
  private final EstimatorRole mEstimatorRole;
  private final double mPriorWeight;
  private final AggregationPolicy mAggregationPolicy;
  private final CollectionOrder mCollectionOrder;
  private final WorkerFailurePolicy mWorkerFailurePolicy;

  private DecisionConfiguration(Properties xiProperties)
  {
    mProperties = new Properties();
    mProperties.putAll(xiProperties);

    mExplorationWeight = parseDouble(CfgItem.EXPLORATION_WEIGHT);
    if (!(mExplorationWeight > 0))
    {
      throw new IllegalArgumentException("EXPLORATION_WEIGHT must be positive, got " + mExplorationWeight);
    }

    mNumWorkers = parseInt(CfgItem.NUM_WORKERS);
    if (mNumWorkers < 1)
    {
      throw new IllegalArgumentException("NUM_WORKERS must be at least 1, got " + mNumWorkers);
    }

    mSimulationsPerWorker = parseInt(CfgItem.SIMULATIONS_PER_WORKER);
    if (mSimulationsPerWorker < 1)
    {
      throw new IllegalArgumentException("SIMULATIONS_PER_WORKER must be at least 1, got " + mSimulationsPerWorker);
    }

    String lSeed = getCfgStr(CfgItem.RANDOM_SEED);
    mRandomSeed = (lSeed == null || lSeed.trim().isEmpty()) ? null : Long.valueOf(parseLong(CfgItem.RANDOM_SEED));

    mRolloutDepthLimit = parseInt(CfgItem.ROLLOUT_DEPTH_LIMIT);
    if (mRolloutDepthLimit < 1)
    {
      throw new IllegalArgumentException("ROLLOUT_DEPTH_LIMIT must be at least 1, got " + mRolloutDepthLimit);
    }

    mEstimatorRole = parseEnum(CfgItem.ESTIMATOR_ROLE, EstimatorRole.class);
    mPriorWeight = parseDouble(CfgItem.PRIOR_WEIGHT);
    if (mPriorWeight < 0)
    {
      throw new IllegalArgumentException("PRIOR_WEIGHT must not be negative, got " + mPriorWeight);
    }

    mAggregationPolicy = parseEnum(CfgItem.AGGREGATION_POLICY, AggregationPolicy.class);
    mCollectionOrder = parseEnum(CfgItem.COLLECTION_ORDER, CollectionOrder.class);
    mWorkerFailurePolicy = parseEnum(CfgItem.WORKER_FAILURE_POLICY, WorkerFailurePolicy.class);
  }

  /**
   * @return a configuration in which every item takes its default.
   */
  public static DecisionConfiguration defaults()
  {
    return new DecisionConfiguration(new Properties());
  }

  /**
   * @return a configuration built from the specified properties.
   *
   * @param xiProperties - the properties, keyed by {@link CfgItem} name.
   *
   * @throws IllegalArgumentException if any value is invalid.
   */
  public static DecisionConfiguration fromProperties(Properties xiProperties)
  {
    for (Object lKey : xiProperties.keySet())
    {
      if (!isKnownItem((String)lKey))
      {
        LOGGER.warn("Unknown configuration parameter: '" + lKey + "'");
      }
    }
    return new DecisionConfiguration(xiProperties);
  }

  /**
   * @return a configuration read from a properties stream.
   *
   * @param xiStream - the stream.  The caller remains responsible for closing it.
   */
  public static DecisionConfiguration load(InputStream xiStream) throws IOException
  {
    Properties lProperties = new Properties();
    lProperties.load(xiStream);
    return fromProperties(lProperties);
  }

  /**
   * @return a configuration read from a properties file.
   *
   * @param xiFilename - the file.
   */
  public static DecisionConfiguration load(String xiFilename) throws IOException
  {
    try (InputStream lPropStream = new FileInputStream(xiFilename))
    {
      return load(lPropStream);
    }
  }

  /**
   * @return a copy of this configuration with one item overridden.
   *
   * @param xiKey   - the item to override.
   * @param xiValue - the new value.
   */
  public DecisionConfiguration with(CfgItem xiKey, Object xiValue)
  {
    Properties lProperties = new Properties();
    lProperties.putAll(mProperties);
    lProperties.setProperty(xiKey.toString(), String.valueOf(xiValue));
    return new DecisionConfiguration(lProperties);
  }

  /**
   * @return the specified String configuration value, or the default if not configured.
   *
   * @param xiKey - the item.
   */
  public String getCfgStr(CfgItem xiKey)
  {
    return mProperties.getProperty(xiKey.toString(), xiKey.mDefault);
  }

  public double getExplorationWeight()
  {
    return mExplorationWeight;
  }

  public int getNumWorkers()
  {
    return mNumWorkers;
  }

  public int getSimulationsPerWorker()
  {
    return mSimulationsPerWorker;
  }

  /**
   * @return the configured random seed, or null if none is configured.
   */
  public Long getRandomSeed()
  {
    return mRandomSeed;
  }

  public int getRolloutDepthLimit()
  {
    return mRolloutDepthLimit;
  }

  public EstimatorRole getEstimatorRole()
  {
    return mEstimatorRole;
  }

  public double getPriorWeight()
  {
    return mPriorWeight;
  }

  public AggregationPolicy getAggregationPolicy()
  {
    return mAggregationPolicy;
  }

  public CollectionOrder getCollectionOrder()
  {
    return mCollectionOrder;
  }

  public WorkerFailurePolicy getWorkerFailurePolicy()
  {
    return mWorkerFailurePolicy;
  }

  /**
   * @return the path of the saved estimator network, or null if none is configured.
   */
  public String getEstimatorNetworkFile()
  {
    return getCfgStr(CfgItem.ESTIMATOR_NETWORK_FILE);
  }

  /**
   * Log the effective configuration.
   */
  public void logConfig()
  {
    LOGGER.info("Running with decision configuration:");
    for (CfgItem lItem : CfgItem.values())
    {
      LOGGER.info("\t" + lItem + " = " + getCfgStr(lItem) + " (default: " + lItem.mDefault + ")");
    }
    for (Entry<Object, Object> e : mProperties.entrySet())
    {
      if (!isKnownItem((String)e.getKey()))
      {
        LOGGER.warn("Unknown configuration parameter: '" + e.getKey() + "'");
      }
    }
  }

  private static boolean isKnownItem(String xiKey)
  {
    try
    {
      CfgItem.valueOf(xiKey);
      return true;
    }
    catch (IllegalArgumentException lEx)
    {
      return false;
    }
  }

  private int parseInt(CfgItem xiKey)
  {
    String lValue = getCfgStr(xiKey);
    try
    {
      return Integer.parseInt(lValue.trim());
    }
    catch (NumberFormatException lEx)
    {
      throw new IllegalArgumentException(xiKey + " is not an integer: '" + lValue + "'", lEx);
    }
  }

  private long parseLong(CfgItem xiKey)
  {
    String lValue = getCfgStr(xiKey);
    try
    {
      return Long.parseLong(lValue.trim());
    }
    catch (NumberFormatException lEx)
    {
      throw new IllegalArgumentException(xiKey + " is not an integer: '" + lValue + "'", lEx);
    }
  }

  private double parseDouble(CfgItem xiKey)
  {
    String lValue = getCfgStr(xiKey);
    try
    {
      return Double.parseDouble(lValue.trim());
    }
    catch (NumberFormatException lEx)
    {
      throw new IllegalArgumentException(xiKey + " is not a number: '" + lValue + "'", lEx);
    }
  }

  private <E extends Enum<E>> E parseEnum(CfgItem xiKey, Class<E> xiType)
  {
    String lValue = getCfgStr(xiKey);
    try
    {
      return Enum.valueOf(xiType, lValue.trim());
    }
    catch (IllegalArgumentException lEx)
    {
      throw new IllegalArgumentException(xiKey + " has unknown value '" + lValue + "'", lEx);
    }
  }
}
