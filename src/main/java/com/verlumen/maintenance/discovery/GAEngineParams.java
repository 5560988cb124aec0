package com.verlumen.maintenance.discovery;

import com.verlumen.maintenance.markov.TransitionMatrix;
import com.verlumen.maintenance.model.CostModel;
import com.verlumen.maintenance.model.Policy;
import java.util.random.RandomGenerator;

/**
 * Everything needed to build an engine for one run.
 *
 * @param random source for the initial population, cut points and mutations
 */
record GAEngineParams(
    TransitionMatrix matrix,
    CostModel costModel,
    OptimizerConfig config,
    RandomGenerator random) {

  int policyLength() {
    return Policy.lengthFor(matrix.numStates());
  }
}
