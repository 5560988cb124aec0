package com.verlumen.maintenance.discovery;

import com.google.inject.Inject;
import com.verlumen.maintenance.markov.TransitionMatrix;
import com.verlumen.maintenance.model.CostModel;
import com.verlumen.maintenance.simulation.PolicyEvaluator;
import com.verlumen.maintenance.simulation.SimulationConfig;
import io.jenetics.BitGene;
import io.jenetics.Genotype;
import java.util.function.Function;

/**
 * Scores genotypes with the {@link PolicyEvaluator}. Evaluation failures are not penalized here;
 * they propagate and abort the run, since a malformed model affects every individual alike.
 */
final class FitnessFunctionFactoryImpl implements FitnessFunctionFactory {
  private final PolicyEvaluator policyEvaluator;
  private final PolicyGenotypeConverter genotypeConverter;

  @Inject
  FitnessFunctionFactoryImpl(
      PolicyEvaluator policyEvaluator, PolicyGenotypeConverter genotypeConverter) {
    this.policyEvaluator = policyEvaluator;
    this.genotypeConverter = genotypeConverter;
  }

  @Override
  public Function<Genotype<BitGene>, Double> create(
      TransitionMatrix matrix, CostModel costModel, SimulationConfig simulationConfig) {
    return genotype ->
        policyEvaluator.evaluate(
            genotypeConverter.toPolicy(genotype), matrix, costModel, simulationConfig);
  }
}
