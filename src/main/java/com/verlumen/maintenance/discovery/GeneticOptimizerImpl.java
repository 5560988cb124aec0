package com.verlumen.maintenance.discovery;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.collect.ImmutableSet.toImmutableSet;

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.maintenance.markov.TransitionMatrix;
import com.verlumen.maintenance.model.CostModel;
import com.verlumen.maintenance.model.MaintenanceModelException;
import com.verlumen.maintenance.model.Policy;
import com.verlumen.maintenance.simulation.PolicyEvaluator;
import io.jenetics.BitGene;
import io.jenetics.engine.Engine;
import io.jenetics.engine.EvolutionResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Implementation of the GeneticOptimizer interface. This class coordinates the overall GA run but
 * delegates engine construction and fitness scoring to specialized classes.
 */
final class GeneticOptimizerImpl implements GeneticOptimizer {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final GAEngineFactory engineFactory;
  private final PolicyEvaluator policyEvaluator;
  private final PolicyGenotypeConverter genotypeConverter;

  @Inject
  GeneticOptimizerImpl(
      GAEngineFactory engineFactory,
      PolicyEvaluator policyEvaluator,
      PolicyGenotypeConverter genotypeConverter) {
    this.engineFactory = engineFactory;
    this.policyEvaluator = policyEvaluator;
    this.genotypeConverter = genotypeConverter;
  }

  @Override
  public OptimizationResult optimize(
      TransitionMatrix matrix, CostModel costModel, OptimizerConfig config) {
    checkNotNull(matrix);
    checkNotNull(costModel);
    checkNotNull(config);
    matrix.requireDegradationChain();
    costModel.checkFits(matrix.numStates());

    logger.atInfo().log(
        "Starting policy search: %d states, population %d, %d generations",
        matrix.numStates(), config.populationSize(), config.numGenerations());

    Engine<BitGene, Double> engine =
        engineFactory.createEngine(
            new GAEngineParams(
                matrix, costModel, config, new Random(config.simulationConfig().seed())));

    List<Double> trace = new ArrayList<>(config.numGenerations());
    EvolutionResult<BitGene, Double> last;
    try {
      last =
          engine.stream()
              .limit(config.numGenerations())
              .peek(result -> recordGeneration(result, trace))
              .reduce((previous, current) -> current)
              .orElseThrow();
    } catch (RuntimeException e) {
      throw unwrap(e);
    }

    OptimizationResult result = finalizeRun(last, matrix, costModel, config, trace);
    logger.atInfo().log(
        "Policy search finished: best policy %s at %.4f per period",
        result.bestPolicy(), result.bestCost());
    return result;
  }

  private static void recordGeneration(
      EvolutionResult<BitGene, Double> result, List<Double> trace) {
    trace.add(result.bestFitness());
    logger.atInfo().log(
        "Generation %d: best cost %.4f", result.generation(), result.bestFitness());
  }

  /** Re-evaluates every distinct policy of the final population and keeps the cheapest. */
  private OptimizationResult finalizeRun(
      EvolutionResult<BitGene, Double> last,
      TransitionMatrix matrix,
      CostModel costModel,
      OptimizerConfig config,
      List<Double> trace) {
    ImmutableSet<Policy> candidates =
        last.population().stream()
            .map(phenotype -> genotypeConverter.toPolicy(phenotype.genotype()))
            .collect(toImmutableSet());

    Policy bestPolicy = null;
    double bestCost = Double.POSITIVE_INFINITY;
    for (Policy candidate : candidates) {
      double cost =
          policyEvaluator.evaluate(candidate, matrix, costModel, config.simulationConfig());
      if (cost < bestCost) {
        bestCost = cost;
        bestPolicy = candidate;
      }
    }
    return new OptimizationResult(
        checkNotNull(bestPolicy), bestCost, new OptimizationTrace(ImmutableList.copyOf(trace)));
  }

  // The engine reports evaluation failures wrapped in its own concurrency exceptions.
  private static RuntimeException unwrap(RuntimeException e) {
    for (Throwable cause : Throwables.getCausalChain(e)) {
      if (cause instanceof MaintenanceModelException) {
        return (MaintenanceModelException) cause;
      }
    }
    return e;
  }
}
