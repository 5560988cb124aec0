package com.verlumen.maintenance.planner;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.verlumen.maintenance.markov.TransitionMatrix;
import com.verlumen.maintenance.model.CostModel;

/**
 * A validated planning problem: a degradation chain with the costs charged on it.
 *
 * @param stateLabels optional display names, one per state when present
 */
public record Scenario(
    String name,
    ImmutableList<String> stateLabels,
    TransitionMatrix matrix,
    CostModel costModel) {

  public Scenario {
    checkNotNull(name);
    checkNotNull(stateLabels);
    checkNotNull(matrix);
    checkNotNull(costModel);
    matrix.requireDegradationChain();
    costModel.checkFits(matrix.numStates());
    checkArgument(
        stateLabels.isEmpty() || stateLabels.size() == matrix.numStates(),
        "Expected %s state labels, got %s",
        matrix.numStates(),
        stateLabels.size());
  }

  /** Display name of {@code state}, falling back to its index. */
  public String label(int state) {
    return stateLabels.isEmpty() ? String.valueOf(state) : stateLabels.get(state);
  }
}
