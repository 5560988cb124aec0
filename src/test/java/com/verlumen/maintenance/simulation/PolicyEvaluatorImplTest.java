package com.verlumen.maintenance.simulation;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.testing.fieldbinder.Bind;
import com.google.inject.testing.fieldbinder.BoundFieldModule;
import com.verlumen.maintenance.markov.TransitionMatrix;
import com.verlumen.maintenance.model.CostModel;
import com.verlumen.maintenance.model.ErrorKind;
import com.verlumen.maintenance.model.MaintenanceModelException;
import com.verlumen.maintenance.model.Policy;
import com.verlumen.maintenance.testing.ReferenceModel;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PolicyEvaluatorImplTest {
  private static final SimulationConfig CONFIG = new SimulationConfig(200, 500, 42);

  private static final TransitionMatrix THREE_STATES =
      TransitionMatrix.of(new double[][] {{0.5, 0.5, 0}, {0, 0.5, 0.5}, {0, 0, 1}});
  private static final CostModel THREE_STATE_COSTS =
      CostModel.create(5, new double[] {0, 3, 0}, 20);

  @Bind private StateSamplerFactory samplerFactory = new StateSamplerFactoryImpl();

  @Inject private PolicyEvaluatorImpl evaluator;

  private TransitionMatrix matrix;
  private CostModel costModel;

  @Before
  public void setUp() {
    matrix = ReferenceModel.matrix();
    costModel = ReferenceModel.costModel();
    Guice.createInjector(BoundFieldModule.of(this)).injectMembers(this);
  }

  @Test
  public void evaluate_sameInputs_isBitIdentical() {
    double first = evaluator.evaluate(Policy.of(0, 1, 1), matrix, costModel, CONFIG);
    double second = evaluator.evaluate(Policy.of(0, 1, 1), matrix, costModel, CONFIG);

    assertThat(first).isEqualTo(second);
  }

  @Test
  public void evaluate_differentSeeds_giveDifferentEstimates() {
    double first = evaluator.evaluate(Policy.never(3), matrix, costModel, CONFIG);
    double second = evaluator.evaluate(Policy.never(3), matrix, costModel, CONFIG.withSeed(43));

    assertThat(first).isNotEqualTo(second);
  }

  @Test
  public void evaluate_alwaysAndNeverMaintain_differ() {
    double always = evaluator.evaluate(Policy.always(3), matrix, costModel, CONFIG);
    double never = evaluator.evaluate(Policy.never(3), matrix, costModel, CONFIG);

    assertThat(always).isNotEqualTo(never);
  }

  @Test
  public void evaluate_maintainingLateStates_beatsRunningToFailure() {
    double never = evaluator.evaluate(Policy.never(3), matrix, costModel, CONFIG);

    assertThat(evaluator.evaluate(Policy.of(0, 0, 1), matrix, costModel, CONFIG)).isLessThan(never);
    assertThat(evaluator.evaluate(Policy.of(0, 1, 1), matrix, costModel, CONFIG)).isLessThan(never);
  }

  @Test
  public void evaluate_neverMaintain_approximatesRenewalRate() {
    // One failure per 11.8-period cycle, each costing 20 plus the expected repair cost.
    double never = evaluator.evaluate(Policy.never(3), matrix, costModel, CONFIG);

    assertThat(never).isWithin(0.25).of(2.67);
  }

  @Test
  public void evaluate_alwaysMaintain_approximatesTwoStateRenewalRate() {
    double always = evaluator.evaluate(Policy.always(3), matrix, costModel, CONFIG);

    assertThat(always).isWithin(0.1).of(0.966);
  }

  @Test
  public void estimate_reportsTrialsAndStandardError() {
    CostEstimate estimate = evaluator.estimate(Policy.never(3), matrix, costModel, CONFIG);

    assertThat(estimate.numTrials()).isEqualTo(200);
    assertThat(estimate.standardError()).isGreaterThan(0.0);
    assertThat(estimate.mean())
        .isEqualTo(evaluator.evaluate(Policy.never(3), matrix, costModel, CONFIG));
  }

  @Test
  public void estimate_moreTrials_shrinksStandardError() {
    CostEstimate few =
        evaluator.estimate(Policy.never(3), matrix, costModel, new SimulationConfig(25, 500, 42));
    CostEstimate many =
        evaluator.estimate(Policy.never(3), matrix, costModel, new SimulationConfig(1600, 500, 42));

    assertThat(many.standardError()).isLessThan(few.standardError());
  }

  @Test
  public void estimate_unrelatedSeeds_agreeWithinShrinkingInterval() {
    double previousHalfWidth = Double.MAX_VALUE;
    for (int numTrials : new int[] {200, 1600}) {
      CostEstimate first =
          evaluator.estimate(
              Policy.never(3), matrix, costModel, new SimulationConfig(numTrials, 500, 1));
      CostEstimate second =
          evaluator.estimate(
              Policy.never(3),
              matrix,
              costModel,
              new SimulationConfig(numTrials, 500, 987654321));
      double combinedHalfWidth = Math.hypot(first.halfWidth95(), second.halfWidth95());

      assertThat(Math.abs(first.mean() - second.mean())).isLessThan(2 * combinedHalfWidth);
      assertThat(combinedHalfWidth).isLessThan(previousHalfWidth);
      previousHalfWidth = combinedHalfWidth;
    }
  }

  @Test
  public void estimate_singleTrial_hasZeroStandardError() {
    CostEstimate estimate =
        evaluator.estimate(Policy.never(3), matrix, costModel, new SimulationConfig(1, 500, 42));

    assertThat(estimate.standardError()).isEqualTo(0.0);
  }

  @Test
  public void evaluate_maintainedState_chargesPreventiveCostAndResets() {
    PolicyEvaluatorImpl scripted = new PolicyEvaluatorImpl((seed, stream) -> lastPositiveSampler());

    // 0 -> 1, maintain, 0 -> 1, maintain: two preventive actions in four periods.
    double rate =
        scripted.evaluate(
            Policy.of(1), THREE_STATES, THREE_STATE_COSTS, new SimulationConfig(3, 4, 1));

    assertThat(rate).isEqualTo(2.5);
  }

  @Test
  public void evaluate_failure_chargesRepairOfPreviousStateAndRestarts() {
    PolicyEvaluatorImpl scripted = new PolicyEvaluatorImpl((seed, stream) -> lastPositiveSampler());

    // 0 -> 1, 1 -> failed (3 + 20), restart in 0, repeat.
    CostEstimate estimate =
        scripted.estimate(
            Policy.of(0), THREE_STATES, THREE_STATE_COSTS, new SimulationConfig(3, 4, 1));

    assertThat(estimate.mean()).isEqualTo(11.5);
    assertThat(estimate.standardError()).isEqualTo(0.0);
  }

  @Test
  public void evaluate_policyLengthMismatch_throwsInvalidPolicyLength() {
    MaintenanceModelException thrown =
        assertThrows(
            MaintenanceModelException.class,
            () -> evaluator.evaluate(Policy.of(0, 1), matrix, costModel, CONFIG));

    assertThat(thrown.kind()).isEqualTo(ErrorKind.INVALID_POLICY_LENGTH);
  }

  @Test
  public void evaluate_costModelLengthMismatch_throwsInvalidCostModel() {
    CostModel shortCosts = CostModel.create(5, new double[] {0, 2, 8}, 20);

    MaintenanceModelException thrown =
        assertThrows(
            MaintenanceModelException.class,
            () -> evaluator.evaluate(Policy.of(0, 1, 1), matrix, shortCosts, CONFIG));

    assertThat(thrown.kind()).isEqualTo(ErrorKind.INVALID_COST_MODEL);
  }

  @Test
  public void evaluate_lastStateNotAbsorbing_throwsInvalidTransitionMatrix() {
    TransitionMatrix recurrent =
        TransitionMatrix.of(new double[][] {{0.5, 0.5, 0}, {0, 0.5, 0.5}, {0.5, 0, 0.5}});

    MaintenanceModelException thrown =
        assertThrows(
            MaintenanceModelException.class,
            () -> evaluator.evaluate(Policy.of(1), recurrent, THREE_STATE_COSTS, CONFIG));

    assertThat(thrown.kind()).isEqualTo(ErrorKind.INVALID_TRANSITION_MATRIX);
  }

  @Test
  public void effectiveMatrix_resetsMaintainedStatesToBestState() {
    TransitionMatrix effective = evaluator.effectiveMatrix(Policy.of(0, 1, 1), matrix);

    assertThat(effective.row(2)).usingExactEquality().containsExactly(1.0, 0.0, 0.0, 0.0, 0.0);
    assertThat(effective.row(3)).usingExactEquality().containsExactly(1.0, 0.0, 0.0, 0.0, 0.0);
    assertThat(effective.row(1)).usingExactEquality().containsExactly(matrix.row(1)).inOrder();
    assertThat(effective.isAbsorbing(4)).isTrue();
  }

  private static StateSampler lastPositiveSampler() {
    return distribution -> {
      for (int j = distribution.length - 1; j >= 0; j--) {
        if (distribution[j] > 0) {
          return j;
        }
      }
      throw new IllegalArgumentException("No positive entry");
    };
  }
}
