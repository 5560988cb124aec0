package com.verlumen.maintenance.discovery;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import com.verlumen.maintenance.model.Policy;
import io.jenetics.BitChromosome;
import io.jenetics.BitGene;
import io.jenetics.Chromosome;
import io.jenetics.Genotype;
import java.util.BitSet;

final class PolicyGenotypeConverterImpl implements PolicyGenotypeConverter {
  @Inject
  PolicyGenotypeConverterImpl() {}

  @Override
  public Policy toPolicy(Genotype<BitGene> genotype) {
    checkArgument(
        genotype.length() == 1, "Expected a single chromosome, got %s", genotype.length());
    Chromosome<BitGene> chromosome = genotype.chromosome();
    ImmutableList.Builder<Boolean> flags =
        ImmutableList.builderWithExpectedSize(chromosome.length());
    for (int i = 0; i < chromosome.length(); i++) {
      flags.add(chromosome.get(i).bit());
    }
    return new Policy(flags.build());
  }

  @Override
  public Genotype<BitGene> toGenotype(Policy policy) {
    checkArgument(policy.length() > 0, "Cannot encode an empty policy");
    BitSet bits = new BitSet(policy.length());
    for (int i = 0; i < policy.length(); i++) {
      bits.set(i, policy.flags().get(i));
    }
    return Genotype.of(BitChromosome.of(bits, policy.length()));
  }
}
