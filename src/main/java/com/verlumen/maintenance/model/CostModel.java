package com.verlumen.maintenance.model;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Doubles;

/**
 * Costs charged while simulating a maintenance policy.
 *
 * @param preventiveCost charged each time preventive maintenance resets the asset
 * @param repairCostByState charged on failure, indexed by the state the asset failed from
 * @param productionLossCost charged on every failure in addition to the repair cost
 */
public record CostModel(
    double preventiveCost, ImmutableList<Double> repairCostByState, double productionLossCost) {

  public CostModel {
    checkNotNull(repairCostByState);
    checkCost("preventiveCost", preventiveCost);
    checkCost("productionLossCost", productionLossCost);
    for (int state = 0; state < repairCostByState.size(); state++) {
      checkCost("repairCostByState[" + state + "]", repairCostByState.get(state));
    }
  }

  public static CostModel create(
      double preventiveCost, double[] repairCostByState, double productionLossCost) {
    return new CostModel(
        preventiveCost,
        ImmutableList.copyOf(Doubles.asList(repairCostByState)),
        productionLossCost);
  }

  /** Repair plus production loss for a failure out of {@code fromState}. */
  public double failureCost(int fromState) {
    return repairCostByState.get(fromState) + productionLossCost;
  }

  /**
   * Verifies that this model carries exactly one repair cost per state.
   *
   * @throws MaintenanceModelException of kind {@link ErrorKind#INVALID_COST_MODEL} otherwise
   */
  public void checkFits(int numStates) {
    MaintenanceModelException.check(
        repairCostByState.size() == numStates,
        ErrorKind.INVALID_COST_MODEL,
        "%s repair costs given for a %s-state chain",
        repairCostByState.size(),
        numStates);
  }

  private static void checkCost(String name, double value) {
    MaintenanceModelException.check(
        Double.isFinite(value) && value >= 0,
        ErrorKind.INVALID_COST_MODEL,
        "%s must be a finite non-negative number, got %s",
        name,
        value);
  }
}
