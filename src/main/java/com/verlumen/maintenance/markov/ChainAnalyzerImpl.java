package com.verlumen.maintenance.markov;

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.common.primitives.Doubles;
import com.google.inject.Inject;
import com.verlumen.maintenance.model.ErrorKind;
import com.verlumen.maintenance.model.MaintenanceModelException;

final class ChainAnalyzerImpl implements ChainAnalyzer {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  @Inject
  ChainAnalyzerImpl() {}

  @Override
  public ImmutableList<Double> stationaryDistribution(TransitionMatrix matrix) {
    checkNotNull(matrix);
    int n = matrix.numStates();
    double[][] p = matrix.toArray();

    // Rows 0..n-1 hold (P^T - I), the last row enforces sum(pi) = 1.
    double[][] system = new double[n + 1][n];
    double[] rhs = new double[n + 1];
    for (int i = 0; i < n; i++) {
      for (int j = 0; j < n; j++) {
        system[i][j] = p[j][i] - (i == j ? 1.0 : 0.0);
      }
      system[n][i] = 1.0;
    }
    rhs[n] = 1.0;

    double[] pi;
    try {
      pi = LinearSystems.leastSquares(system, rhs);
    } catch (ArithmeticException e) {
      throw new MaintenanceModelException(
          ErrorKind.SINGULAR_STATIONARY_SYSTEM,
          "chain " + matrix + " has no unique stationary distribution",
          e);
    }

    double total = 0;
    for (double value : pi) {
      total += value;
    }
    for (int i = 0; i < n; i++) {
      pi[i] /= total;
    }
    return ImmutableList.copyOf(Doubles.asList(pi));
  }

  @Override
  public double[][] fundamentalMatrix(TransitionMatrix matrix) {
    checkNotNull(matrix);
    matrix.requireAbsorbingLastState();
    int transientStates = matrix.absorbingState();
    double[][] identityMinusQ = new double[transientStates][transientStates];
    for (int i = 0; i < transientStates; i++) {
      for (int j = 0; j < transientStates; j++) {
        identityMinusQ[i][j] = (i == j ? 1.0 : 0.0) - matrix.probability(i, j);
      }
    }
    try {
      return LinearSystems.invert(identityMinusQ);
    } catch (ArithmeticException e) {
      throw new MaintenanceModelException(
          ErrorKind.SINGULAR_FUNDAMENTAL_MATRIX,
          "I - Q is not invertible; some transient state cannot reach failure",
          e);
    }
  }

  @Override
  public ImmutableList<Double> meanTimesToAbsorption(TransitionMatrix matrix) {
    double[][] fundamental = fundamentalMatrix(matrix);
    ImmutableList.Builder<Double> times = ImmutableList.builder();
    for (double[] row : fundamental) {
      double sum = 0;
      for (double visits : row) {
        sum += visits;
      }
      times.add(sum);
    }
    times.add(0.0);
    return times.build();
  }

  @Override
  public double meanTimeToAbsorption(TransitionMatrix matrix, int initialState) {
    checkNotNull(matrix);
    checkElementIndex(initialState, matrix.numStates(), "initialState");
    double time = meanTimesToAbsorption(matrix).get(initialState);
    logger.atFine().log("Mean time to failure from state %d: %.4f periods", initialState, time);
    return time;
  }
}
