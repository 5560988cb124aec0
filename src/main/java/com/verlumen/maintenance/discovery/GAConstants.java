package com.verlumen.maintenance.discovery;

/**
 * Constants used throughout the genetic algorithm optimization process.
 * Extracted to a separate class to avoid duplication and facilitate changes.
 */
public final class GAConstants {
  public static final int DEFAULT_POPULATION_SIZE = 20;
  public static final int DEFAULT_MAX_GENERATIONS = 30;
  public static final double DEFAULT_MUTATION_RATE = 0.2;
  public static final int DEFAULT_NUM_TRIALS = 200;
  public static final int DEFAULT_HORIZON = 500;
  public static final long DEFAULT_SEED = 42L;

  /** Half of each generation is replaced by offspring of the surviving half. */
  static final double OFFSPRING_FRACTION = 0.5;

  static final int MIN_POPULATION_SIZE = 2;

  private GAConstants() {}
}
