package org.tradesim.decision.estimator;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.neuroph.core.NeuralNetwork;
import org.neuroph.nnet.MultiLayerPerceptron;
import org.neuroph.util.TransferFunctionType;

/**
 * A value estimator backed by a pre-trained neural network.
 *
 * <p>The network takes the encoded features of a state as input and has a single output, which is read as the value
 * of the state.  Outputs are clamped to [-1, 1], so a network with a tanh output layer is the natural fit.
 *
 * <p>Training is done elsewhere.  This class only evaluates.  Evaluating a Neuroph network updates its internal
 * neuron state, so an instance must only be used by one thread at a time; use {@link #createIndependentInstance()} to
 * get one per worker.
 *
 * @param <S> - the state type.
 */
public class NeuralValueEstimator<S> implements ValueEstimator<S>
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final FeatureEncoder<S> mEncoder;
  private final NeuralNetwork<?> mNetwork;

  /**
   * Create an estimator from an existing network.
   *
   * @param xiEncoder - the feature encoder.
   * @param xiNetwork - the network.  Its input count must match the encoder's width.
   */
  public NeuralValueEstimator(FeatureEncoder<S> xiEncoder, NeuralNetwork<?> xiNetwork)
  {
    if (xiNetwork.getInputsCount() != xiEncoder.getWidth())
    {
      throw new IllegalArgumentException("Network has " + xiNetwork.getInputsCount() + " inputs but the encoder " +
                                         "produces " + xiEncoder.getWidth() + " features");
    }
    if (xiNetwork.getOutputsCount() < 1)
    {
      throw new IllegalArgumentException("Network has no outputs");
    }
    mEncoder = xiEncoder;
    mNetwork = xiNetwork;
  }

  /**
   * Load an estimator from a saved network.
   *
   * @param xiFilename - the file the network was saved to.
   * @param xiEncoder  - the feature encoder the network was trained with.
   */
  public static <S> NeuralValueEstimator<S> fromFile(String xiFilename, FeatureEncoder<S> xiEncoder)
  {
    NeuralNetwork<?> lNetwork = NeuralNetwork.createFromFile(xiFilename);

    LOGGER.info("Reloaded a value estimator with " + lNetwork.getInputsCount() + " inputs & " +
                lNetwork.getOutputsCount() + " outputs from " + xiFilename);

    return new NeuralValueEstimator<>(xiEncoder, lNetwork);
  }

  /**
   * Create an estimator around a freshly initialised (untrained) network with one hidden layer.
   *
   * @param xiEncoder     - the feature encoder.
   * @param xiHiddenUnits - the number of hidden units.
   */
  public static <S> NeuralValueEstimator<S> createUntrained(FeatureEncoder<S> xiEncoder, int xiHiddenUnits)
  {
    int lInputSize = xiEncoder.getWidth();
    double lInitialWeightMax = 1 / Math.sqrt(lInputSize);
    double lInitialWeightMin = -lInitialWeightMax;

    MultiLayerPerceptron lNetwork = new MultiLayerPerceptron(TransferFunctionType.TANH,
                                                             lInputSize,
                                                             xiHiddenUnits,
                                                             1);
    lNetwork.randomizeWeights(lInitialWeightMin, lInitialWeightMax);

    LOGGER.info("Created a value estimator with " + lNetwork.getInputsCount() + " inputs & " +
                xiHiddenUnits + " hidden units");

    return new NeuralValueEstimator<>(xiEncoder, lNetwork);
  }

  @Override
  public double estimate(S xiState)
  {
    double[] lInputs = mEncoder.encode(xiState);
    mNetwork.setInput(lInputs);
    mNetwork.calculate();

    double lValue = mNetwork.getOutput()[0];
    if (Double.isNaN(lValue))
    {
      throw new IllegalStateException("Network produced NaN");
    }
    return Math.max(-1, Math.min(1, lValue));
  }

  @Override
  public ValueEstimator<S> createIndependentInstance()
  {
    return new NeuralValueEstimator<>(mEncoder, copyNetwork(mNetwork));
  }

  /**
   * @return the underlying network.
   */
  public NeuralNetwork<?> getNetwork()
  {
    return mNetwork;
  }

  private static NeuralNetwork<?> copyNetwork(NeuralNetwork<?> xiNetwork)
  {
    try
    {
      ByteArrayOutputStream lBytes = new ByteArrayOutputStream();
      try (ObjectOutputStream lOut = new ObjectOutputStream(lBytes))
      {
        lOut.writeObject(xiNetwork);
      }

      try (ObjectInputStream lIn = new ObjectInputStream(new ByteArrayInputStream(lBytes.toByteArray())))
      {
        return (NeuralNetwork<?>)lIn.readObject();
      }
    }
    catch (IOException | ClassNotFoundException lEx)
    {
      throw new IllegalStateException("Failed to copy value network", lEx);
    }
  }
}
