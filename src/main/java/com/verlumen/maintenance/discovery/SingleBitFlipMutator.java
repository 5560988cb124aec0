package com.verlumen.maintenance.discovery;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import io.jenetics.Alterer;
import io.jenetics.AltererResult;
import io.jenetics.BitGene;
import io.jenetics.Chromosome;
import io.jenetics.Genotype;
import io.jenetics.Phenotype;
import io.jenetics.util.MSeq;
import io.jenetics.util.Seq;
import java.util.random.RandomGenerator;

/**
 * With probability {@code rate}, flips exactly one uniformly chosen bit of an individual. Unlike
 * Jenetics' {@code Mutator}, which tests every gene, an individual is mutated at most once.
 */
final class SingleBitFlipMutator<C extends Comparable<? super C>> implements Alterer<BitGene, C> {
  private final double rate;
  private final RandomGenerator random;

  SingleBitFlipMutator(double rate, RandomGenerator random) {
    checkArgument(rate >= 0 && rate <= 1, "Mutation rate must be within [0, 1]: %s", rate);
    this.rate = rate;
    this.random = checkNotNull(random);
  }

  @Override
  public AltererResult<BitGene, C> alter(Seq<Phenotype<BitGene, C>> population, long generation) {
    MSeq<Phenotype<BitGene, C>> offspring = MSeq.of(population);
    int alterations = 0;
    for (int i = 0; i < offspring.size(); i++) {
      if (random.nextDouble() >= rate) {
        continue;
      }
      Chromosome<BitGene> chromosome = offspring.get(i).genotype().chromosome();
      int bit = random.nextInt(chromosome.length());
      offspring.set(i, Phenotype.of(Genotype.of(flip(chromosome, bit)), generation));
      alterations++;
    }
    return new AltererResult<>(offspring.toISeq(), alterations);
  }

  static Chromosome<BitGene> flip(Chromosome<BitGene> chromosome, int index) {
    MSeq<BitGene> genes = MSeq.ofLength(chromosome.length());
    for (int i = 0; i < chromosome.length(); i++) {
      BitGene gene = chromosome.get(i);
      genes.set(i, i == index ? BitGene.of(!gene.bit()) : gene);
    }
    return chromosome.newInstance(genes.toISeq());
  }

  @Override
  public String toString() {
    return "SingleBitFlipMutator[rate=" + rate + "]";
  }
}
