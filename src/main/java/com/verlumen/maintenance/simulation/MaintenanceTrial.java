package com.verlumen.maintenance.simulation;

import com.verlumen.maintenance.model.CostModel;
import com.verlumen.maintenance.model.Policy;

/**
 * The step rules of a single simulated trial. Each call to {@link #step()} advances one period:
 * maintained states are reset to the best state at the preventive cost, any other state draws its
 * successor, and a draw of the failed state charges the failure cost and restarts from the best
 * state.
 *
 * <p>Instances are confined to one thread.
 */
final class MaintenanceTrial {
  static final int BEST_STATE = 0;

  private final Policy policy;
  private final double[][] rows;
  private final int failedState;
  private final CostModel costModel;
  private final StateSampler sampler;

  private int state = BEST_STATE;
  private StepOutcome lastOutcome;

  MaintenanceTrial(double[][] rows, Policy policy, CostModel costModel, StateSampler sampler) {
    this.rows = rows;
    this.failedState = rows.length - 1;
    this.policy = policy;
    this.costModel = costModel;
    this.sampler = sampler;
  }

  int state() {
    return state;
  }

  StepOutcome lastOutcome() {
    return lastOutcome;
  }

  /** Advances one period and returns the cost charged in it. */
  double step() {
    if (policy.maintains(state)) {
      state = BEST_STATE;
      lastOutcome = StepOutcome.PREVENTIVE_MAINTENANCE;
      return costModel.preventiveCost();
    }
    int next = sampler.nextState(rows[state]);
    if (next == failedState) {
      double cost = costModel.failureCost(state);
      state = BEST_STATE;
      lastOutcome = StepOutcome.FAILURE_REPAIR;
      return cost;
    }
    state = next;
    lastOutcome = StepOutcome.DETERIORATED;
    return 0.0;
  }
}
