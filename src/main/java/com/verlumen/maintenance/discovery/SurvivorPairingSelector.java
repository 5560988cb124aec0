package com.verlumen.maintenance.discovery;

import io.jenetics.Gene;
import io.jenetics.Optimize;
import io.jenetics.Phenotype;
import io.jenetics.Selector;
import io.jenetics.TruncationSelector;
import io.jenetics.util.ISeq;
import io.jenetics.util.MSeq;
import io.jenetics.util.Seq;

/**
 * Picks offspring parents from the surviving half of the population.
 *
 * <p>The survivors are the best {@code population.size() - count} individuals, best first. Parents
 * are taken from them in order, wrapping around when more parents than survivors are needed, so
 * that sequential pairing in the crossover matches survivor 0 with 1, 2 with 3 and so on. An odd
 * trailing parent is left unpaired and therefore crosses with itself.
 */
final class SurvivorPairingSelector<G extends Gene<?, G>, C extends Comparable<? super C>>
    implements Selector<G, C> {
  private final TruncationSelector<G, C> truncation = new TruncationSelector<>();

  @Override
  public ISeq<Phenotype<G, C>> select(Seq<Phenotype<G, C>> population, int count, Optimize opt) {
    if (count <= 0 || population.isEmpty()) {
      return ISeq.empty();
    }
    int survivorCount = Math.max(1, population.size() - count);
    ISeq<Phenotype<G, C>> survivors = truncation.select(population, survivorCount, opt);

    MSeq<Phenotype<G, C>> parents = MSeq.ofLength(count);
    for (int i = 0; i < count; i++) {
      parents.set(i, survivors.get(i % survivors.size()));
    }
    return parents.toISeq();
  }

  @Override
  public String toString() {
    return "SurvivorPairingSelector";
  }
}
