package com.verlumen.maintenance.discovery;

import com.verlumen.maintenance.markov.TransitionMatrix;
import com.verlumen.maintenance.model.CostModel;
import com.verlumen.maintenance.simulation.SimulationConfig;
import io.jenetics.BitGene;
import io.jenetics.Genotype;
import java.util.function.Function;

/** Creates the fitness function the genetic engine minimizes. */
interface FitnessFunctionFactory {
  /**
   * Returns a function mapping a policy genotype to its estimated cost per period. Every call of
   * the function simulates with the same seed, so a policy always scores the same within a run.
   */
  Function<Genotype<BitGene>, Double> create(
      TransitionMatrix matrix, CostModel costModel, SimulationConfig simulationConfig);
}
