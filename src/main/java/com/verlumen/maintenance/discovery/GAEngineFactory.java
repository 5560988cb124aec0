package com.verlumen.maintenance.discovery;

import io.jenetics.BitGene;
import io.jenetics.engine.Engine;

/** Defines the contract for creating genetic algorithm engines. */
interface GAEngineFactory {
  /**
   * Creates a genetic algorithm engine configured for the given run.
   *
   * @param params the chain, cost model, configuration and random source of the run
   * @return an engine minimizing the estimated cost per period
   */
  Engine<BitGene, Double> createEngine(GAEngineParams params);
}
