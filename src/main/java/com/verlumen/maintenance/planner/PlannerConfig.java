package com.verlumen.maintenance.planner;

import static com.google.common.base.Preconditions.checkNotNull;

import com.verlumen.maintenance.discovery.OptimizerConfig;
import com.verlumen.maintenance.model.ErrorKind;
import com.verlumen.maintenance.model.MaintenanceModelException;

/**
 * Settings for a planning run.
 *
 * @param optimizerConfig search and simulation settings; the simulation config also prices the
 *     baseline
 * @param trajectoryLength number of periods in the sample trajectory under the chosen policy
 */
public record PlannerConfig(OptimizerConfig optimizerConfig, int trajectoryLength) {
  public static final int DEFAULT_TRAJECTORY_LENGTH = 100;

  public PlannerConfig {
    checkNotNull(optimizerConfig);
    MaintenanceModelException.check(
        trajectoryLength > 0,
        ErrorKind.INVALID_SIMULATION_CONFIG,
        "trajectoryLength must be positive, got %s",
        trajectoryLength);
  }

  static PlannerConfig defaults() {
    return new PlannerConfig(OptimizerConfig.defaults(), DEFAULT_TRAJECTORY_LENGTH);
  }
}
