package com.verlumen.maintenance.discovery;

import static com.google.common.base.Preconditions.checkNotNull;

import io.jenetics.Alterer;
import io.jenetics.AltererResult;
import io.jenetics.Chromosome;
import io.jenetics.Gene;
import io.jenetics.Genotype;
import io.jenetics.Phenotype;
import io.jenetics.util.MSeq;
import io.jenetics.util.Seq;
import java.util.random.RandomGenerator;

/**
 * Single-point crossover over consecutive pairs of the population: individuals 0 and 1 are crossed,
 * then 2 and 3, and so on. A trailing unpaired individual crosses with itself and is passed through
 * unchanged.
 *
 * <p>For parents {@code a} and {@code b} of length {@code L} a cut point {@code k} is drawn
 * uniformly from {@code [1, L - 1]} and the children are {@code a[0, k) + b[k, L)} and {@code
 * b[0, k) + a[k, L)}. Chromosomes shorter than two genes cannot be cut and are passed through.
 */
final class SuffixSwapCrossover<G extends Gene<?, G>, C extends Comparable<? super C>>
    implements Alterer<G, C> {
  private final RandomGenerator random;

  SuffixSwapCrossover(RandomGenerator random) {
    this.random = checkNotNull(random);
  }

  @Override
  public AltererResult<G, C> alter(Seq<Phenotype<G, C>> population, long generation) {
    MSeq<Phenotype<G, C>> offspring = MSeq.of(population);
    int alterations = 0;
    for (int i = 0; i + 1 < offspring.size(); i += 2) {
      Chromosome<G> first = offspring.get(i).genotype().chromosome();
      Chromosome<G> second = offspring.get(i + 1).genotype().chromosome();
      int length = first.length();
      if (length < 2) {
        continue;
      }
      int cut = 1 + random.nextInt(length - 1);
      offspring.set(i, Phenotype.of(Genotype.of(splice(first, second, cut)), generation));
      offspring.set(i + 1, Phenotype.of(Genotype.of(splice(second, first, cut)), generation));
      alterations += 2;
    }
    return new AltererResult<>(offspring.toISeq(), alterations);
  }

  /** Genes {@code [0, cut)} of {@code head} followed by genes {@code [cut, L)} of {@code tail}. */
  static <G extends Gene<?, G>> Chromosome<G> splice(
      Chromosome<G> head, Chromosome<G> tail, int cut) {
    MSeq<G> genes = MSeq.ofLength(head.length());
    for (int i = 0; i < head.length(); i++) {
      genes.set(i, i < cut ? head.get(i) : tail.get(i));
    }
    return head.newInstance(genes.toISeq());
  }

  @Override
  public String toString() {
    return "SuffixSwapCrossover";
  }
}
