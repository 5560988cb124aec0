package com.verlumen.maintenance.simulation;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.maintenance.markov.TransitionMatrix;
import com.verlumen.maintenance.model.CostModel;
import com.verlumen.maintenance.model.Policy;
import java.util.stream.IntStream;

final class PolicyEvaluatorImpl implements PolicyEvaluator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final StateSamplerFactory samplerFactory;

  @Inject
  PolicyEvaluatorImpl(StateSamplerFactory samplerFactory) {
    this.samplerFactory = samplerFactory;
  }

  @Override
  public double evaluate(
      Policy policy, TransitionMatrix matrix, CostModel costModel, SimulationConfig config) {
    return estimate(policy, matrix, costModel, config).mean();
  }

  @Override
  public CostEstimate estimate(
      Policy policy, TransitionMatrix matrix, CostModel costModel, SimulationConfig config) {
    checkNotNull(config);
    validate(policy, matrix, costModel);

    double[][] rows = effectiveMatrix(policy, matrix).toArray();
    double[] rates = new double[config.numTrials()];
    IntStream.range(0, config.numTrials())
        .parallel()
        .forEach(trial -> rates[trial] = runTrial(rows, policy, costModel, config, trial));

    // Summed in trial order so the result does not depend on scheduling.
    double sum = 0;
    for (double rate : rates) {
      sum += rate;
    }
    double mean = sum / rates.length;
    double squares = 0;
    for (double rate : rates) {
      squares += (rate - mean) * (rate - mean);
    }
    double standardError =
        rates.length > 1 ? Math.sqrt(squares / (rates.length - 1) / rates.length) : 0.0;

    logger.atFine().log(
        "Policy %s: %.4f per period (se %.4f, %d trials)",
        policy, mean, standardError, rates.length);
    return new CostEstimate(mean, standardError, rates.length);
  }

  @Override
  public TransitionMatrix effectiveMatrix(Policy policy, TransitionMatrix matrix) {
    validate(policy, matrix);
    return matrix.withDeterministicTransitions(
        ImmutableSet.copyOf(policy.maintainedStates()), MaintenanceTrial.BEST_STATE);
  }

  private double runTrial(
      double[][] rows, Policy policy, CostModel costModel, SimulationConfig config, int index) {
    MaintenanceTrial trial =
        new MaintenanceTrial(
            rows, policy, costModel, samplerFactory.create(config.seed(), index));
    double cost = 0;
    for (int period = 0; period < config.horizon(); period++) {
      cost += trial.step();
    }
    return cost / config.horizon();
  }

  private static void validate(Policy policy, TransitionMatrix matrix) {
    checkNotNull(policy);
    checkNotNull(matrix);
    matrix.requireDegradationChain();
    policy.checkFits(matrix.numStates());
  }

  private static void validate(Policy policy, TransitionMatrix matrix, CostModel costModel) {
    validate(policy, matrix);
    checkNotNull(costModel).checkFits(matrix.numStates());
  }
}
