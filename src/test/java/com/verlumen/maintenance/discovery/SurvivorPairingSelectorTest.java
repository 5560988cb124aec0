package com.verlumen.maintenance.discovery;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.verlumen.maintenance.model.Policy;
import io.jenetics.BitGene;
import io.jenetics.Optimize;
import io.jenetics.Phenotype;
import io.jenetics.util.ISeq;
import java.util.stream.IntStream;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SurvivorPairingSelectorTest {
  private final PolicyGenotypeConverter converter = new PolicyGenotypeConverterImpl();
  private final SurvivorPairingSelector<BitGene, Double> selector = new SurvivorPairingSelector<>();

  @Test
  public void select_takesParentsFromBestSurvivorsInOrder() {
    ISeq<Phenotype<BitGene, Double>> population = population(4.0, 1.0, 3.0, 2.0);

    ISeq<Phenotype<BitGene, Double>> parents = selector.select(population, 2, Optimize.MINIMUM);

    assertThat(fitnesses(parents)).containsExactly(1.0, 2.0).inOrder();
  }

  @Test
  public void select_moreParentsThanSurvivors_wrapsAround() {
    ISeq<Phenotype<BitGene, Double>> population = population(5.0, 1.0, 4.0, 2.0, 3.0);

    // Five individuals and three offspring leave two survivors.
    ISeq<Phenotype<BitGene, Double>> parents = selector.select(population, 3, Optimize.MINIMUM);

    assertThat(fitnesses(parents)).containsExactly(1.0, 2.0, 1.0).inOrder();
  }

  @Test
  public void select_maximizing_prefersHighFitness() {
    ISeq<Phenotype<BitGene, Double>> population = population(4.0, 1.0, 3.0, 2.0);

    ISeq<Phenotype<BitGene, Double>> parents = selector.select(population, 2, Optimize.MAXIMUM);

    assertThat(fitnesses(parents)).containsExactly(4.0, 3.0).inOrder();
  }

  @Test
  public void select_zeroCount_returnsEmpty() {
    assertThat(selector.select(population(1.0, 2.0), 0, Optimize.MINIMUM).isEmpty()).isTrue();
  }

  private ISeq<Phenotype<BitGene, Double>> population(double... fitnesses) {
    return IntStream.range(0, fitnesses.length)
        .mapToObj(
            i ->
                Phenotype.<BitGene, Double>of(
                    converter.toGenotype(Policy.of(i % 2, 1)), 1, fitnesses[i]))
        .collect(ISeq.toISeq());
  }

  private static ImmutableList<Double> fitnesses(
      ISeq<Phenotype<BitGene, Double>> phenotypes) {
    return phenotypes.stream().map(Phenotype::fitness).collect(toImmutableList());
  }
}
