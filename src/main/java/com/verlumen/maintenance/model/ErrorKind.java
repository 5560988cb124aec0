package com.verlumen.maintenance.model;

/** Classifies the ways a maintenance model or run configuration can be rejected. */
public enum ErrorKind {
  /** A row does not sum to one, an entry is negative, or the matrix is not square. */
  INVALID_TRANSITION_MATRIX("Invalid transition matrix"),
  /** The repair-cost sequence has the wrong length or a cost is negative. */
  INVALID_COST_MODEL("Invalid cost model"),
  /** A policy does not carry one flag per maintainable state. */
  INVALID_POLICY_LENGTH("Invalid policy length"),
  /** {@code I - Q} cannot be inverted, so some transient state never fails. */
  SINGULAR_FUNDAMENTAL_MATRIX("Singular fundamental matrix"),
  /** The stationary equations do not have a unique solution. */
  SINGULAR_STATIONARY_SYSTEM("Singular stationary system"),
  /** Non-positive trial count or horizon. */
  INVALID_SIMULATION_CONFIG("Invalid simulation config"),
  /** Population, generation count or mutation rate out of range. */
  INVALID_OPTIMIZER_CONFIG("Invalid optimizer config");

  private final String defaultMessage;

  ErrorKind(String defaultMessage) {
    this.defaultMessage = defaultMessage;
  }

  public String defaultMessage() {
    return defaultMessage;
  }
}
