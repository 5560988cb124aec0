package com.verlumen.maintenance.simulation;

import com.google.common.collect.ImmutableList;
import com.verlumen.maintenance.markov.TransitionMatrix;
import com.verlumen.maintenance.model.CostModel;
import com.verlumen.maintenance.model.Policy;

/**
 * Runs a single trial with the same rules as {@link PolicyEvaluator} and returns every period
 * instead of an aggregate cost. Used to show how an asset behaves under a chosen policy.
 */
public interface TrajectorySimulator {
  /**
   * Simulates {@code length} periods starting from the best state.
   *
   * @throws com.verlumen.maintenance.model.MaintenanceModelException of kind {@code
   *     INVALID_SIMULATION_CONFIG} if {@code length} is not positive, or another kind if the
   *     inputs do not fit the chain
   */
  ImmutableList<TrajectoryStep> simulate(
      Policy policy, TransitionMatrix matrix, CostModel costModel, int length, long seed);
}
