package com.verlumen.maintenance.discovery;

import static com.google.common.base.Preconditions.checkNotNull;

import com.verlumen.maintenance.model.ErrorKind;
import com.verlumen.maintenance.model.MaintenanceModelException;
import com.verlumen.maintenance.simulation.SimulationConfig;

/**
 * Settings for one genetic search.
 *
 * @param populationSize number of policies alive in every generation
 * @param numGenerations number of evolve steps
 * @param mutationRate probability that an offspring gets exactly one bit flipped
 * @param simulationConfig how each policy is evaluated; its seed also drives the search operators
 */
public record OptimizerConfig(
    int populationSize,
    int numGenerations,
    double mutationRate,
    SimulationConfig simulationConfig) {

  public OptimizerConfig {
    checkNotNull(simulationConfig);
    MaintenanceModelException.check(
        populationSize >= GAConstants.MIN_POPULATION_SIZE,
        ErrorKind.INVALID_OPTIMIZER_CONFIG,
        "populationSize must be at least %s, got %s",
        GAConstants.MIN_POPULATION_SIZE,
        populationSize);
    MaintenanceModelException.check(
        numGenerations > 0,
        ErrorKind.INVALID_OPTIMIZER_CONFIG,
        "numGenerations must be positive, got %s",
        numGenerations);
    MaintenanceModelException.check(
        mutationRate >= 0 && mutationRate <= 1,
        ErrorKind.INVALID_OPTIMIZER_CONFIG,
        "mutationRate must be within [0, 1], got %s",
        mutationRate);
  }

  /** The configuration used when no flags are given. */
  public static OptimizerConfig defaults() {
    return new OptimizerConfig(
        GAConstants.DEFAULT_POPULATION_SIZE,
        GAConstants.DEFAULT_MAX_GENERATIONS,
        GAConstants.DEFAULT_MUTATION_RATE,
        new SimulationConfig(
            GAConstants.DEFAULT_NUM_TRIALS, GAConstants.DEFAULT_HORIZON, GAConstants.DEFAULT_SEED));
  }
}
