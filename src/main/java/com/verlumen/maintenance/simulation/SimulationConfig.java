package com.verlumen.maintenance.simulation;

import com.verlumen.maintenance.model.ErrorKind;
import com.verlumen.maintenance.model.MaintenanceModelException;

/**
 * Monte Carlo settings for one policy evaluation.
 *
 * @param numTrials number of independent trials to average
 * @param horizon number of periods simulated per trial
 * @param seed root seed; trial {@code i} draws from a stream derived from {@code (seed, i)}
 */
public record SimulationConfig(int numTrials, int horizon, long seed) {
  public SimulationConfig {
    MaintenanceModelException.check(
        numTrials > 0,
        ErrorKind.INVALID_SIMULATION_CONFIG,
        "numTrials must be positive, got %s",
        numTrials);
    MaintenanceModelException.check(
        horizon > 0,
        ErrorKind.INVALID_SIMULATION_CONFIG,
        "horizon must be positive, got %s",
        horizon);
  }

  /** Returns a copy of this config that draws from a different root seed. */
  public SimulationConfig withSeed(long newSeed) {
    return new SimulationConfig(numTrials, horizon, newSeed);
  }
}
