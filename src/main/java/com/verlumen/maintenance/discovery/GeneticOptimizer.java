package com.verlumen.maintenance.discovery;

import com.verlumen.maintenance.markov.TransitionMatrix;
import com.verlumen.maintenance.model.CostModel;

/**
 * Orchestrates a genetic search for the cheapest preventive-maintenance policy.
 *
 * <p>Implementations of this interface:
 *
 * <ul>
 *   <li>Draw a random initial population of policies.
 *   <li>Score every policy with the {@link com.verlumen.maintenance.simulation.PolicyEvaluator}.
 *   <li>Keep the cheaper half, breed the other half from it by crossover and mutation.
 *   <li>Return the cheapest policy of the final population with the best cost of every generation.
 * </ul>
 *
 * <p>The population size stays fixed across generations.
 */
public interface GeneticOptimizer {
  /**
   * Runs the search.
   *
   * @param matrix the unmanaged degradation chain
   * @param costModel costs charged during simulation
   * @param config population, generation, mutation and simulation settings
   * @return the best policy found, its cost and the per-generation trace
   * @throws com.verlumen.maintenance.model.MaintenanceModelException if the inputs are invalid or
   *     any fitness evaluation fails
   */
  OptimizationResult optimize(TransitionMatrix matrix, CostModel costModel, OptimizerConfig config);
}
