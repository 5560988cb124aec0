package com.verlumen.maintenance.simulation;

import com.verlumen.maintenance.markov.TransitionMatrix;
import com.verlumen.maintenance.model.CostModel;
import com.verlumen.maintenance.model.Policy;

/**
 * Estimates the long-run average cost per period of a maintenance policy by Monte Carlo
 * simulation.
 *
 * <p>Every trial starts in the best state and runs for {@code horizon} periods under the rules of
 * the policy. The accumulated cost of a trial divided by the horizon is its cost rate; the estimate
 * is the mean rate over all trials. Trials are independent and may run concurrently, each drawing
 * from its own stream derived from the configured seed, so the same inputs always produce the same
 * estimate.
 */
public interface PolicyEvaluator {
  /**
   * Estimates the average cost per period of {@code policy}.
   *
   * @throws com.verlumen.maintenance.model.MaintenanceModelException if the policy length, the
   *     matrix layout or the cost model does not fit the chain
   */
  double evaluate(
      Policy policy, TransitionMatrix matrix, CostModel costModel, SimulationConfig config);

  /** Like {@link #evaluate} but also reports the sampling error of the estimate. */
  CostEstimate estimate(
      Policy policy, TransitionMatrix matrix, CostModel costModel, SimulationConfig config);

  /**
   * Returns the transition matrix the policy induces: every maintained state moves to the best
   * state with probability one, all other rows are unchanged.
   */
  TransitionMatrix effectiveMatrix(Policy policy, TransitionMatrix matrix);
}
