package org.tradesim.apps;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.tradesim.decision.config.DecisionConfiguration;
import org.tradesim.decision.estimator.NeuralValueEstimator;
import org.tradesim.decision.estimator.ValueEstimator;
import org.tradesim.decision.parallel.AggregationRecord;
import org.tradesim.decision.parallel.ParallelSearchCoordinator;
import org.tradesim.decision.parallel.ParallelSearchResult;
import org.tradesim.util.model.exceptions.DecisionException;
import org.tradesim.world.TradeWorld;
import org.tradesim.world.TraderAction;
import org.tradesim.world.TraderFeatureEncoder;
import org.tradesim.world.TraderModel;
import org.tradesim.world.TraderState;

/**
 * Simple command line app for making a single trading decision.
 */
public final class DecisionRunner
{
  private static final Logger LOGGER = LogManager.getLogger();

  private static final int NUM_FIXED_ARGS = 2;

  public static void main(String[] args) throws IOException, InterruptedException
  {
    if (args.length < NUM_FIXED_ARGS)
    {
      System.out.println("DecisionRunner [world.json] [state.json] [decision.properties]");
      System.out.println("example: DecisionRunner world.json trader.json search.properties");
      return;
    }

    DecisionConfiguration config = (args.length > NUM_FIXED_ARGS) ? DecisionConfiguration.load(args[2]) :
                                                                     DecisionConfiguration.defaults();
    config.logConfig();

    TradeWorld world;
    TraderState state;
    try
    {
      world = TradeWorld.fromJSON(readFile(args[0]));
      state = TraderState.fromJSON(new JSONObject(readFile(args[1])));
    }
    catch (JSONException | IllegalArgumentException lEx)
    {
      LOGGER.error("Failed to read the world or the trader's state", lEx);
      return;
    }
    TraderModel model = new TraderModel(world);

    ValueEstimator<TraderState> estimator = null;
    if (config.getEstimatorNetworkFile() != null)
    {
      // The network must take exactly the features the world produces.
      TraderFeatureEncoder encoder = new TraderFeatureEncoder(world,
                                                              Math.max(1, state.getTurnsRemaining()),
                                                              world.getItems().size());
      try
      {
        estimator = NeuralValueEstimator.fromFile(config.getEstimatorNetworkFile(), encoder);
      }
      catch (IllegalArgumentException lEx)
      {
        LOGGER.error("Value estimator in " + config.getEstimatorNetworkFile() + " doesn't fit this world", lEx);
        return;
      }
    }

    try (ParallelSearchCoordinator coordinator = new ParallelSearchCoordinator(config))
    {
      ParallelSearchResult<TraderAction> result = coordinator.parallelSearch(state, model, estimator);
      if (!result.isDecision())
      {
        LOGGER.info("Nothing to decide " + state);
        return;
      }

      for (AggregationRecord<TraderAction> record : result.getRecords())
      {
        LOGGER.info("  " + record);
      }
      LOGGER.info("Chose " + result.getAction().getKey() + " " + state);
    }
    catch (DecisionException lEx)
    {
      LOGGER.error("Failed to decide", lEx);
    }
  }

  private static String readFile(String xiFilename) throws IOException
  {
    return new String(Files.readAllBytes(Paths.get(xiFilename)), StandardCharsets.UTF_8);
  }
}
