package org.tradesim.decision.config;

import java.io.InputStream;
import java.util.Properties;

import org.junit.Assert;
import org.junit.Test;
import org.tradesim.decision.config.DecisionConfiguration.CfgItem;
import org.tradesim.decision.mcts.EstimatorRole;
import org.tradesim.decision.parallel.AggregationPolicy;
import org.tradesim.decision.parallel.CollectionOrder;
import org.tradesim.decision.parallel.WorkerFailurePolicy;

public class DecisionConfigurationTests extends Assert
{
  @Test
  public void testDefaults()
  {
    DecisionConfiguration config = DecisionConfiguration.defaults();

    assertEquals(1.0, config.getExplorationWeight(), 0);
    assertEquals(4, config.getNumWorkers());
    assertEquals(1000, config.getSimulationsPerWorker());
    assertNull(config.getRandomSeed());
    assertEquals(1000, config.getRolloutDepthLimit());
    assertEquals(EstimatorRole.LEAF_EVALUATION, config.getEstimatorRole());
    assertEquals(1.0, config.getPriorWeight(), 0);
    assertEquals(AggregationPolicy.BEST_ACTION_CREDIT, config.getAggregationPolicy());
    assertEquals(CollectionOrder.DISPATCH, config.getCollectionOrder());
    assertEquals(WorkerFailurePolicy.FAIL_FAST, config.getWorkerFailurePolicy());
    assertNull(config.getEstimatorNetworkFile());
  }

  @Test
  public void testFromProperties()
  {
    Properties properties = new Properties();
    properties.setProperty("EXPLORATION_WEIGHT", "1.41");
    properties.setProperty("NUM_WORKERS", " 8 ");
    properties.setProperty("RANDOM_SEED", "-17");
    properties.setProperty("ESTIMATOR_ROLE", "SELECTION_PRIOR");
    properties.setProperty("SOMETHING_ELSE", "ignored");

    DecisionConfiguration config = DecisionConfiguration.fromProperties(properties);

    assertEquals(1.41, config.getExplorationWeight(), 1e-9);
    assertEquals(8, config.getNumWorkers());
    assertEquals(Long.valueOf(-17), config.getRandomSeed());
    assertEquals(EstimatorRole.SELECTION_PRIOR, config.getEstimatorRole());
    assertEquals(1000, config.getSimulationsPerWorker());
  }

  @Test
  public void testLoadFromStream() throws Exception
  {
    DecisionConfiguration config;
    try (InputStream stream = getClass().getResourceAsStream("/decision-test.properties"))
    {
      assertNotNull(stream);
      config = DecisionConfiguration.load(stream);
    }

    assertEquals(2, config.getNumWorkers());
    assertEquals(50, config.getSimulationsPerWorker());
    assertEquals(Long.valueOf(42), config.getRandomSeed());
    assertEquals(AggregationPolicy.PER_ACTION_VISITS, config.getAggregationPolicy());
    assertEquals(CollectionOrder.COMPLETION, config.getCollectionOrder());
  }

  @Test
  public void testWithLeavesOriginalUnchanged()
  {
    DecisionConfiguration original = DecisionConfiguration.defaults();
    DecisionConfiguration changed = original.with(CfgItem.NUM_WORKERS, 2)
                                            .with(CfgItem.WORKER_FAILURE_POLICY, WorkerFailurePolicy.BEST_EFFORT);

    assertEquals(4, original.getNumWorkers());
    assertEquals(WorkerFailurePolicy.FAIL_FAST, original.getWorkerFailurePolicy());
    assertEquals(2, changed.getNumWorkers());
    assertEquals(WorkerFailurePolicy.BEST_EFFORT, changed.getWorkerFailurePolicy());
    assertEquals("2", changed.getCfgStr(CfgItem.NUM_WORKERS));
  }

  @Test
  public void testRejectsInvalidValues()
  {
    Object[][] invalid = {{CfgItem.EXPLORATION_WEIGHT, 0},
                          {CfgItem.EXPLORATION_WEIGHT, -1.5},
                          {CfgItem.EXPLORATION_WEIGHT, "NaN"},
                          {CfgItem.NUM_WORKERS, 0},
                          {CfgItem.NUM_WORKERS, "many"},
                          {CfgItem.SIMULATIONS_PER_WORKER, 0},
                          {CfgItem.RANDOM_SEED, "1.5"},
                          {CfgItem.ROLLOUT_DEPTH_LIMIT, 0},
                          {CfgItem.PRIOR_WEIGHT, -0.1},
                          {CfgItem.ESTIMATOR_ROLE, "ORACLE"},
                          {CfgItem.AGGREGATION_POLICY, "MAJORITY"},
                          {CfgItem.COLLECTION_ORDER, "RANDOM"},
                          {CfgItem.WORKER_FAILURE_POLICY, "IGNORE"}};

    for (Object[] item : invalid)
    {
      try
      {
        DecisionConfiguration.defaults().with((CfgItem)item[0], item[1]);
        fail("Accepted " + item[0] + " = " + item[1]);
      }
      catch (IllegalArgumentException lEx)
      {
        assertTrue(lEx.getMessage(), lEx.getMessage().contains(item[0].toString()));
      }
    }
  }
}
