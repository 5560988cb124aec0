package com.verlumen.maintenance.planner;

import java.util.List;

/**
 * POJO representing a maintenance scenario as written in YAML or JSON. Converted into a validated
 * {@link Scenario} by {@link ScenarioLoader}.
 */
public final class ScenarioConfig {
  private String name;
  private String description;
  private List<String> stateLabels;
  private List<List<Double>> transitionMatrix;
  private Double preventiveCost;
  private List<Double> repairCostByState;
  private Double productionLossCost;

  public ScenarioConfig() {}

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public List<String> getStateLabels() {
    return stateLabels;
  }

  public void setStateLabels(List<String> stateLabels) {
    this.stateLabels = stateLabels;
  }

  public List<List<Double>> getTransitionMatrix() {
    return transitionMatrix;
  }

  public void setTransitionMatrix(List<List<Double>> transitionMatrix) {
    this.transitionMatrix = transitionMatrix;
  }

  public Double getPreventiveCost() {
    return preventiveCost;
  }

  public void setPreventiveCost(Double preventiveCost) {
    this.preventiveCost = preventiveCost;
  }

  public List<Double> getRepairCostByState() {
    return repairCostByState;
  }

  public void setRepairCostByState(List<Double> repairCostByState) {
    this.repairCostByState = repairCostByState;
  }

  public Double getProductionLossCost() {
    return productionLossCost;
  }

  public void setProductionLossCost(Double productionLossCost) {
    this.productionLossCost = productionLossCost;
  }
}
