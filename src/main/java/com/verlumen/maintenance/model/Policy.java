package com.verlumen.maintenance.model;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import java.util.Collections;
import java.util.stream.IntStream;

/**
 * A preventive-maintenance policy: one flag per maintainable state.
 *
 * <p>States are numbered from 0 (best condition) to {@code numStates - 1} (failed). Only the states
 * strictly between those two are maintainable, so flag {@code i} belongs to state {@code i + 1}.
 * A set flag means the asset is reset to the best state at the preventive cost whenever it is
 * observed in that state.
 */
public record Policy(ImmutableList<Boolean> flags) {
  public Policy {
    checkNotNull(flags);
  }

  /** Creates a policy from 0/1 values, one per maintainable state. */
  public static Policy of(int... bits) {
    ImmutableList.Builder<Boolean> flags = ImmutableList.builder();
    for (int bit : bits) {
      checkArgument(bit == 0 || bit == 1, "Policy bits must be 0 or 1, got %s", bit);
      flags.add(bit == 1);
    }
    return new Policy(flags.build());
  }

  /** The do-nothing policy: the asset always runs to failure. */
  public static Policy never(int length) {
    return new Policy(ImmutableList.copyOf(Collections.nCopies(length, false)));
  }

  /** Maintains in every maintainable state. */
  public static Policy always(int length) {
    return new Policy(ImmutableList.copyOf(Collections.nCopies(length, true)));
  }

  /** Number of policy flags required for a chain with {@code numStates} states. */
  public static int lengthFor(int numStates) {
    return numStates - 2;
  }

  public int length() {
    return flags.size();
  }

  /** Whether {@code state} is one of the states this policy has a flag for. */
  public boolean isMaintainable(int state) {
    return state >= 1 && state <= flags.size();
  }

  /** Whether preventive maintenance is performed when the asset is observed in {@code state}. */
  public boolean maintains(int state) {
    return isMaintainable(state) && flags.get(state - 1);
  }

  /** Chain states in which this policy performs maintenance, in ascending order. */
  public ImmutableList<Integer> maintainedStates() {
    return IntStream.rangeClosed(1, flags.size())
        .filter(this::maintains)
        .boxed()
        .collect(toImmutableList());
  }

  public ImmutableList<Integer> bits() {
    return flags.stream().map(flag -> flag ? 1 : 0).collect(toImmutableList());
  }

  /**
   * Verifies that this policy fits a chain with {@code numStates} states.
   *
   * @throws MaintenanceModelException of kind {@link ErrorKind#INVALID_POLICY_LENGTH} otherwise
   */
  public void checkFits(int numStates) {
    MaintenanceModelException.check(
        length() == lengthFor(numStates),
        ErrorKind.INVALID_POLICY_LENGTH,
        "policy %s has %s flags but a %s-state chain needs %s",
        this,
        length(),
        numStates,
        lengthFor(numStates));
  }

  @Override
  public String toString() {
    return bits().toString();
  }
}
