package com.verlumen.maintenance.discovery;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.inject.Guice;
import com.google.inject.Inject;
import com.verlumen.maintenance.model.Policy;
import io.jenetics.BitChromosome;
import io.jenetics.BitGene;
import io.jenetics.Genotype;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PolicyGenotypeConverterImplTest {
  @Inject private PolicyGenotypeConverterImpl converter;

  @Before
  public void setUp() {
    Guice.createInjector().injectMembers(this);
  }

  @Test
  public void toGenotype_encodesFlagsAsBitsInOrder() {
    Genotype<BitGene> genotype = converter.toGenotype(Policy.of(1, 0, 1, 1));

    assertThat(genotype.length()).isEqualTo(1);
    assertThat(genotype.chromosome().length()).isEqualTo(4);
    assertThat(genotype.chromosome().get(0).bit()).isTrue();
    assertThat(genotype.chromosome().get(1).bit()).isFalse();
    assertThat(genotype.chromosome().get(3).bit()).isTrue();
  }

  @Test
  public void toPolicy_restoresEncodedPolicy() {
    Policy policy = Policy.of(0, 1, 1);

    assertThat(converter.toPolicy(converter.toGenotype(policy))).isEqualTo(policy);
  }

  @Test
  public void toPolicy_multipleChromosomes_throws() {
    Genotype<BitGene> genotype = Genotype.of(BitChromosome.of(3), BitChromosome.of(3));

    assertThrows(IllegalArgumentException.class, () -> converter.toPolicy(genotype));
  }

  @Test
  public void toGenotype_emptyPolicy_throws() {
    assertThrows(IllegalArgumentException.class, () -> converter.toGenotype(Policy.never(0)));
  }
}
