package com.verlumen.maintenance.discovery;

import com.verlumen.maintenance.model.Policy;
import io.jenetics.BitGene;
import io.jenetics.Genotype;

/**
 * Converts between maintenance policies and the single-chromosome bit genotypes the genetic
 * engine evolves. Bit {@code i} of the chromosome is flag {@code i} of the policy.
 */
interface PolicyGenotypeConverter {
  Policy toPolicy(Genotype<BitGene> genotype);

  Genotype<BitGene> toGenotype(Policy policy);
}
