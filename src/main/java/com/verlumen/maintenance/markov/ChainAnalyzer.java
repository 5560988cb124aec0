package com.verlumen.maintenance.markov;

import com.google.common.collect.ImmutableList;

/**
 * Exact linear-algebra analysis of a degradation chain.
 *
 * <p>These quantities describe the unmanaged chain. They are reported as diagnostics next to an
 * optimized policy and are not part of the policy search.
 */
public interface ChainAnalyzer {
  /**
   * Solves {@code pi (P - I) = 0} with {@code sum(pi) = 1} in the least-squares sense and
   * renormalizes the result.
   *
   * <p>For a chain with an absorbing state the solution puts all mass on that state. Only an
   * irreducible, aperiodic chain has a stationary distribution that is useful for planning.
   *
   * @param matrix the transition matrix
   * @return one probability per state, summing to one
   * @throws com.verlumen.maintenance.model.MaintenanceModelException of kind {@code
   *     SINGULAR_STATIONARY_SYSTEM} if the solution is not unique
   */
  ImmutableList<Double> stationaryDistribution(TransitionMatrix matrix);

  /**
   * Computes the fundamental matrix {@code N = (I - Q)^-1}, where {@code Q} is the transient block
   * of the chain (every state except the last, absorbing one).
   *
   * @throws com.verlumen.maintenance.model.MaintenanceModelException of kind {@code
   *     INVALID_TRANSITION_MATRIX} if the last state is not absorbing, or {@code
   *     SINGULAR_FUNDAMENTAL_MATRIX} if {@code I - Q} is not invertible
   */
  double[][] fundamentalMatrix(TransitionMatrix matrix);

  /**
   * Expected number of periods until failure for every starting state. The entry for the absorbing
   * state is zero.
   */
  ImmutableList<Double> meanTimesToAbsorption(TransitionMatrix matrix);

  /**
   * Expected number of periods until failure when starting from {@code initialState}.
   *
   * @param matrix the unmanaged degradation chain
   * @param initialState the starting state, 0 being the best condition
   * @return the row sum of the fundamental matrix for {@code initialState}, or zero if it is the
   *     absorbing state
   */
  double meanTimeToAbsorption(TransitionMatrix matrix, int initialState);
}
