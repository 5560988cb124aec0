package com.verlumen.maintenance.discovery;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;

/** The best cost found in each generation, in generation order. */
public record OptimizationTrace(ImmutableList<Double> bestCostByGeneration) {
  public OptimizationTrace {
    checkNotNull(bestCostByGeneration);
  }

  public int size() {
    return bestCostByGeneration.size();
  }

  public double finalBestCost() {
    checkState(!bestCostByGeneration.isEmpty(), "Trace is empty");
    return bestCostByGeneration.get(bestCostByGeneration.size() - 1);
  }

  /** Whether no generation reported a higher best cost than the generation before it. */
  public boolean isNonIncreasing() {
    for (int i = 1; i < bestCostByGeneration.size(); i++) {
      if (bestCostByGeneration.get(i) > bestCostByGeneration.get(i - 1)) {
        return false;
      }
    }
    return true;
  }
}
