package com.verlumen.maintenance.planner;

import com.google.common.collect.ImmutableList;
import com.verlumen.maintenance.discovery.OptimizationResult;
import com.verlumen.maintenance.discovery.OptimizationTrace;
import com.verlumen.maintenance.model.Policy;
import com.verlumen.maintenance.simulation.TrajectoryStep;

/**
 * Everything a planning run produces for reporting.
 *
 * @param meanTimeToFailure expected periods until failure from the best state, unmanaged chain
 * @param stationaryDistribution stationary diagnostic of the unmanaged chain
 * @param optimization best policy, its cost and the per-generation trace
 * @param baselineCost cost per period of never maintaining, under the same simulation settings
 * @param trajectory one simulated run under the best policy
 */
public record MaintenancePlan(
    String scenarioName,
    double meanTimeToFailure,
    ImmutableList<Double> stationaryDistribution,
    OptimizationResult optimization,
    double baselineCost,
    ImmutableList<TrajectoryStep> trajectory) {

  public Policy bestPolicy() {
    return optimization.bestPolicy();
  }

  public double bestCost() {
    return optimization.bestCost();
  }

  public OptimizationTrace trace() {
    return optimization.trace();
  }

  /** Cost per period saved by the best policy relative to never maintaining. */
  public double expectedSaving() {
    return baselineCost - optimization.bestCost();
  }
}
