package com.verlumen.maintenance.simulation;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import com.verlumen.maintenance.markov.TransitionMatrix;
import com.verlumen.maintenance.model.CostModel;
import com.verlumen.maintenance.model.ErrorKind;
import com.verlumen.maintenance.model.MaintenanceModelException;
import com.verlumen.maintenance.model.Policy;

final class TrajectorySimulatorImpl implements TrajectorySimulator {
  private final PolicyEvaluator policyEvaluator;
  private final StateSamplerFactory samplerFactory;

  @Inject
  TrajectorySimulatorImpl(PolicyEvaluator policyEvaluator, StateSamplerFactory samplerFactory) {
    this.policyEvaluator = policyEvaluator;
    this.samplerFactory = samplerFactory;
  }

  @Override
  public ImmutableList<TrajectoryStep> simulate(
      Policy policy, TransitionMatrix matrix, CostModel costModel, int length, long seed) {
    MaintenanceModelException.check(
        length > 0,
        ErrorKind.INVALID_SIMULATION_CONFIG,
        "trajectory length must be positive, got %s",
        length);
    double[][] rows = policyEvaluator.effectiveMatrix(policy, matrix).toArray();
    checkNotNull(costModel).checkFits(matrix.numStates());

    MaintenanceTrial trial =
        new MaintenanceTrial(rows, policy, costModel, samplerFactory.create(seed, 0));
    ImmutableList.Builder<TrajectoryStep> steps = ImmutableList.builderWithExpectedSize(length);
    for (int period = 0; period < length; period++) {
      int observed = trial.state();
      double cost = trial.step();
      steps.add(new TrajectoryStep(period, observed, trial.lastOutcome(), cost));
    }
    return steps.build();
  }
}
