package com.verlumen.maintenance.discovery;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.maintenance.model.Policy;
import io.jenetics.BitGene;
import io.jenetics.Genotype;
import io.jenetics.TruncationSelector;
import io.jenetics.engine.Engine;
import io.jenetics.util.Factory;
import java.util.concurrent.Executor;
import java.util.random.RandomGenerator;

final class GAEngineFactoryImpl implements GAEngineFactory {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final FitnessFunctionFactory fitnessFunctionFactory;
  private final PolicyGenotypeConverter genotypeConverter;
  private final Executor executor;

  @Inject
  GAEngineFactoryImpl(
      FitnessFunctionFactory fitnessFunctionFactory,
      PolicyGenotypeConverter genotypeConverter,
      Executor executor) {
    this.fitnessFunctionFactory = fitnessFunctionFactory;
    this.genotypeConverter = genotypeConverter;
    this.executor = executor;
  }

  @Override
  public Engine<BitGene, Double> createEngine(GAEngineParams params) {
    OptimizerConfig config = params.config();
    logger.atFine().log(
        "Building engine: population=%d, mutationRate=%.3f, policyLength=%d",
        config.populationSize(), config.mutationRate(), params.policyLength());

    // Survivors are the best half; offspring are bred from that same half.
    return Engine.builder(
            fitnessFunctionFactory.create(
                params.matrix(), params.costModel(), config.simulationConfig()),
            createGenotypeFactory(params.policyLength(), params.random()))
        .executor(executor)
        .populationSize(config.populationSize())
        .offspringFraction(GAConstants.OFFSPRING_FRACTION)
        .survivorsSelector(new TruncationSelector<>())
        .offspringSelector(new SurvivorPairingSelector<>())
        .alterers(
            new SuffixSwapCrossover<>(params.random()),
            new SingleBitFlipMutator<>(config.mutationRate(), params.random()))
        // Survivors must never be replaced by fresh random individuals because of their age.
        .maximalPhenotypeAge(config.numGenerations() + 1L)
        .minimizing()
        .build();
  }

  /** Uniformly random policies drawn from {@code random}. */
  private Factory<Genotype<BitGene>> createGenotypeFactory(int length, RandomGenerator random) {
    return () -> {
      int[] bits = new int[length];
      for (int i = 0; i < length; i++) {
        bits[i] = random.nextBoolean() ? 1 : 0;
      }
      return genotypeConverter.toGenotype(Policy.of(bits));
    };
  }
}
