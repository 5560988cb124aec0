package com.verlumen.maintenance.markov;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.truth.Correspondence;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.verlumen.maintenance.model.ErrorKind;
import com.verlumen.maintenance.model.MaintenanceModelException;
import com.verlumen.maintenance.testing.ReferenceModel;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ChainAnalyzerImplTest {
  private static final double TOLERANCE = 1e-9;

  @Inject private ChainAnalyzer analyzer;

  @Before
  public void setUp() {
    Guice.createInjector(MarkovModule.create()).injectMembers(this);
  }

  @Test
  public void meanTimeToAbsorption_referenceChainFromBestState() {
    double time = analyzer.meanTimeToAbsorption(ReferenceModel.matrix(), 0);

    assertThat(time).isWithin(TOLERANCE).of(ReferenceModel.MEAN_TIME_TO_FAILURE);
  }

  @Test
  public void meanTimesToAbsorption_coversEveryState() {
    assertThat(analyzer.meanTimesToAbsorption(ReferenceModel.matrix()))
        .comparingElementsUsing(Correspondence.tolerance(TOLERANCE))
        .containsExactly(11.8, 7.9, 5.0, 2.5, 0.0)
        .inOrder();
  }

  @Test
  public void meanTimeToAbsorption_fromAbsorbingState_isZero() {
    assertThat(analyzer.meanTimeToAbsorption(ReferenceModel.matrix(), 4)).isEqualTo(0.0);
  }

  @Test
  public void meanTimeToAbsorption_initialStateOutOfRange_throws() {
    assertThrows(
        IndexOutOfBoundsException.class,
        () -> analyzer.meanTimeToAbsorption(ReferenceModel.matrix(), 5));
  }

  @Test
  public void fundamentalMatrix_referenceChain_countsExpectedVisits() {
    double[][] fundamental = analyzer.fundamentalMatrix(ReferenceModel.matrix());

    assertThat(fundamental).hasLength(4);
    // Staying in state 0 is geometric with success probability 0.2.
    assertThat(fundamental[0][0]).isWithin(TOLERANCE).of(5.0);
    assertThat(fundamental[3][3]).isWithin(TOLERANCE).of(2.5);
    // Degradation is one-way, so better states are never revisited.
    assertThat(fundamental[2][1]).isWithin(TOLERANCE).of(0.0);
  }

  @Test
  public void fundamentalMatrix_closedTransientClass_throwsSingular() {
    // States 1 and 2 only move between each other and never reach failure.
    TransitionMatrix matrix =
        TransitionMatrix.of(
            new double[][] {
              {0.80, 0.15, 0.03, 0.01, 0.01},
              {0.00, 0.50, 0.50, 0.00, 0.00},
              {0.00, 0.50, 0.50, 0.00, 0.00},
              {0.00, 0.00, 0.00, 0.60, 0.40},
              {0.00, 0.00, 0.00, 0.00, 1.00},
            });

    MaintenanceModelException thrown =
        assertThrows(MaintenanceModelException.class, () -> analyzer.fundamentalMatrix(matrix));

    assertThat(thrown.kind()).isEqualTo(ErrorKind.SINGULAR_FUNDAMENTAL_MATRIX);
    assertThat(thrown).hasCauseThat().isInstanceOf(ArithmeticException.class);
  }

  @Test
  public void meanTimeToAbsorption_secondAbsorbingState_throwsSingular() {
    TransitionMatrix matrix =
        TransitionMatrix.of(new double[][] {{0.8, 0.1, 0.1}, {0, 1, 0}, {0, 0, 1}});

    MaintenanceModelException thrown =
        assertThrows(
            MaintenanceModelException.class, () -> analyzer.meanTimeToAbsorption(matrix, 0));

    assertThat(thrown.kind()).isEqualTo(ErrorKind.SINGULAR_FUNDAMENTAL_MATRIX);
  }

  @Test
  public void meanTimeToAbsorption_lastStateNotAbsorbing_throwsInvalidMatrix() {
    TransitionMatrix matrix = TransitionMatrix.of(new double[][] {{0.9, 0.1}, {0.5, 0.5}});

    MaintenanceModelException thrown =
        assertThrows(
            MaintenanceModelException.class, () -> analyzer.meanTimeToAbsorption(matrix, 0));

    assertThat(thrown.kind()).isEqualTo(ErrorKind.INVALID_TRANSITION_MATRIX);
  }

  @Test
  public void stationaryDistribution_absorbingChain_concentratesOnFailedState() {
    assertThat(analyzer.stationaryDistribution(ReferenceModel.matrix()))
        .comparingElementsUsing(Correspondence.tolerance(TOLERANCE))
        .containsExactly(0.0, 0.0, 0.0, 0.0, 1.0)
        .inOrder();
  }

  @Test
  public void stationaryDistribution_irreducibleChain() {
    TransitionMatrix matrix = TransitionMatrix.of(new double[][] {{0.9, 0.1}, {0.5, 0.5}});

    assertThat(analyzer.stationaryDistribution(matrix))
        .comparingElementsUsing(Correspondence.tolerance(TOLERANCE))
        .containsExactly(5.0 / 6.0, 1.0 / 6.0)
        .inOrder();
  }

  @Test
  public void stationaryDistribution_twoClosedClasses_throwsSingular() {
    TransitionMatrix identity = TransitionMatrix.of(new double[][] {{1, 0}, {0, 1}});

    MaintenanceModelException thrown =
        assertThrows(
            MaintenanceModelException.class, () -> analyzer.stationaryDistribution(identity));

    assertThat(thrown.kind()).isEqualTo(ErrorKind.SINGULAR_STATIONARY_SYSTEM);
  }
}
