package com.verlumen.maintenance.simulation;

/** What happened to the asset during one simulated period. */
public enum StepOutcome {
  /** The asset moved along the chain without failing (possibly staying in place). */
  DETERIORATED,
  /** The policy reset the asset to the best state at the preventive cost. */
  PREVENTIVE_MAINTENANCE,
  /** The asset failed, was charged repair and production loss, and restarted in the best state. */
  FAILURE_REPAIR
}
