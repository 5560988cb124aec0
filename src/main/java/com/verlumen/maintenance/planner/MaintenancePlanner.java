package com.verlumen.maintenance.planner;

/**
 * Produces a maintenance plan for a scenario: diagnostics of the unmanaged chain, the best policy
 * found by the genetic search, the never-maintain baseline and a sample trajectory.
 */
public interface MaintenancePlanner {
  MaintenancePlan plan(Scenario scenario, PlannerConfig config);
}
