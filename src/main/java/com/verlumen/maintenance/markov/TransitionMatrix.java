package com.verlumen.maintenance.markov;

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Doubles;
import com.verlumen.maintenance.model.ErrorKind;
import com.verlumen.maintenance.model.MaintenanceModelException;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * An immutable row-stochastic matrix of one-period transition probabilities.
 *
 * <p>Entry {@code (i, j)} is the probability of moving from state {@code i} to state {@code j} in
 * one period. Every instance has been checked to be square, non-negative and to have rows summing
 * to one within {@link #ROW_SUM_TOLERANCE}.
 */
public final class TransitionMatrix {
  public static final double ROW_SUM_TOLERANCE = 1e-9;

  /** The minimum chain size for which a maintenance policy has at least one flag. */
  public static final int MIN_DEGRADATION_STATES = 3;

  private final double[][] probabilities;

  private TransitionMatrix(double[][] probabilities) {
    this.probabilities = probabilities;
  }

  /**
   * Creates a transition matrix from a copy of {@code rows}.
   *
   * @throws MaintenanceModelException of kind {@link ErrorKind#INVALID_TRANSITION_MATRIX} if the
   *     matrix is empty, not square, has a negative or non-finite entry, or a row that does not sum
   *     to one
   */
  public static TransitionMatrix of(double[][] rows) {
    checkNotNull(rows);
    MaintenanceModelException.check(
        rows.length > 0, ErrorKind.INVALID_TRANSITION_MATRIX, "matrix has no rows");
    double[][] copy = new double[rows.length][];
    for (int i = 0; i < rows.length; i++) {
      checkNotNull(rows[i], "row %s is null", i);
      MaintenanceModelException.check(
          rows[i].length == rows.length,
          ErrorKind.INVALID_TRANSITION_MATRIX,
          "row %s has %s entries but the matrix has %s rows",
          i,
          rows[i].length,
          rows.length);
      copy[i] = rows[i].clone();
      checkRow(i, copy[i]);
    }
    return new TransitionMatrix(copy);
  }

  public static TransitionMatrix of(List<? extends List<Double>> rows) {
    checkNotNull(rows);
    double[][] array = new double[rows.size()][];
    for (int i = 0; i < rows.size(); i++) {
      array[i] = Doubles.toArray(checkNotNull(rows.get(i), "row %s is null", i));
    }
    return of(array);
  }

  public int numStates() {
    return probabilities.length;
  }

  /** The index of the failed state, which is always the last one. */
  public int absorbingState() {
    return probabilities.length - 1;
  }

  public double probability(int from, int to) {
    checkElementIndex(from, numStates());
    checkElementIndex(to, numStates());
    return probabilities[from][to];
  }

  /** Returns a copy of the outgoing distribution of {@code state}. */
  public double[] row(int state) {
    checkElementIndex(state, numStates());
    return probabilities[state].clone();
  }

  /** Returns a deep copy of the underlying array. */
  public double[][] toArray() {
    double[][] copy = new double[probabilities.length][];
    for (int i = 0; i < probabilities.length; i++) {
      copy[i] = probabilities[i].clone();
    }
    return copy;
  }

  public ImmutableList<ImmutableList<Double>> toRows() {
    ImmutableList.Builder<ImmutableList<Double>> rows = ImmutableList.builder();
    for (double[] row : probabilities) {
      rows.add(ImmutableList.copyOf(Doubles.asList(row)));
    }
    return rows.build();
  }

  /** Whether {@code state} transitions to itself with probability one. */
  public boolean isAbsorbing(int state) {
    checkElementIndex(state, numStates());
    return probabilities[state][state] == 1.0;
  }

  /**
   * Verifies that the last state is absorbing, which is what the chain analysis relies on.
   *
   * @throws MaintenanceModelException of kind {@link ErrorKind#INVALID_TRANSITION_MATRIX} otherwise
   */
  public void requireAbsorbingLastState() {
    MaintenanceModelException.check(
        numStates() >= 2,
        ErrorKind.INVALID_TRANSITION_MATRIX,
        "an absorbing chain needs at least 2 states, got %s",
        numStates());
    MaintenanceModelException.check(
        isAbsorbing(absorbingState()),
        ErrorKind.INVALID_TRANSITION_MATRIX,
        "the last state must be absorbing, its row is %s",
        Arrays.toString(probabilities[absorbingState()]));
  }

  /**
   * Verifies the degradation-chain layout shared by the analyzer and the optimizer: state 0 is the
   * best condition, the last state is the unique absorbing (failed) state and there are at least
   * {@link #MIN_DEGRADATION_STATES} states.
   *
   * @throws MaintenanceModelException of kind {@link ErrorKind#INVALID_TRANSITION_MATRIX} otherwise
   */
  public void requireDegradationChain() {
    MaintenanceModelException.check(
        numStates() >= MIN_DEGRADATION_STATES,
        ErrorKind.INVALID_TRANSITION_MATRIX,
        "a degradation chain needs at least %s states, got %s",
        MIN_DEGRADATION_STATES,
        numStates());
    requireAbsorbingLastState();
    for (int state = 0; state < absorbingState(); state++) {
      MaintenanceModelException.check(
          !isAbsorbing(state),
          ErrorKind.INVALID_TRANSITION_MATRIX,
          "state %s is absorbing but only the last state may be",
          state);
    }
  }

  /**
   * Returns a copy of this matrix in which every state in {@code states} moves to {@code target}
   * with probability one.
   */
  public TransitionMatrix withDeterministicTransitions(Set<Integer> states, int target) {
    checkElementIndex(target, numStates());
    double[][] rows = toArray();
    for (int state : states) {
      checkElementIndex(state, numStates());
      Arrays.fill(rows[state], 0.0);
      rows[state][target] = 1.0;
    }
    return new TransitionMatrix(rows);
  }

  private static void checkRow(int index, double[] row) {
    double sum = 0;
    for (int j = 0; j < row.length; j++) {
      MaintenanceModelException.check(
          Double.isFinite(row[j]) && row[j] >= 0,
          ErrorKind.INVALID_TRANSITION_MATRIX,
          "entry (%s, %s) must be a finite probability, got %s",
          index,
          j,
          row[j]);
      sum += row[j];
    }
    MaintenanceModelException.check(
        Math.abs(sum - 1.0) <= ROW_SUM_TOLERANCE,
        ErrorKind.INVALID_TRANSITION_MATRIX,
        "row %s sums to %s",
        index,
        sum);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof TransitionMatrix
        && Arrays.deepEquals(probabilities, ((TransitionMatrix) o).probabilities);
  }

  @Override
  public int hashCode() {
    return Arrays.deepHashCode(probabilities);
  }

  @Override
  public String toString() {
    return Arrays.deepToString(probabilities);
  }
}
