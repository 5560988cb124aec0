package com.verlumen.maintenance.simulation;

/**
 * A Monte Carlo estimate of the long-run average cost per period.
 *
 * @param mean mean of the per-trial cost rates
 * @param standardError sample standard deviation of the rates divided by {@code sqrt(numTrials)};
 *     zero for a single trial
 * @param numTrials number of trials behind the estimate
 */
public record CostEstimate(double mean, double standardError, int numTrials) {
  private static final double Z_95 = 1.959963984540054;

  /** Half-width of the normal-approximation 95% confidence interval around {@link #mean()}. */
  public double halfWidth95() {
    return Z_95 * standardError;
  }
}
