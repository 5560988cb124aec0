package com.verlumen.maintenance.simulation;

/** Draws the next state from a categorical distribution over states. */
public interface StateSampler {
  /**
   * Samples an index of {@code distribution}.
   *
   * @param distribution non-negative probabilities summing to one
   * @return {@code j} with probability {@code distribution[j]}
   */
  int nextState(double[] distribution);
}
