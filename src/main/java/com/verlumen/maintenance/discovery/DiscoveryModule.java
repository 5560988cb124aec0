package com.verlumen.maintenance.discovery;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

public final class DiscoveryModule extends AbstractModule {
  public static DiscoveryModule create() {
    return new DiscoveryModule();
  }

  private DiscoveryModule() {}

  @Override
  protected void configure() {
    bind(FitnessFunctionFactory.class).to(FitnessFunctionFactoryImpl.class);
    bind(GAEngineFactory.class).to(GAEngineFactoryImpl.class);
    bind(GeneticOptimizer.class).to(GeneticOptimizerImpl.class);
    bind(PolicyGenotypeConverter.class).to(PolicyGenotypeConverterImpl.class);
  }

  /** Fitness evaluations of a generation run here and are joined before selection. */
  @Provides
  Executor provideEvaluationExecutor() {
    return ForkJoinPool.commonPool();
  }
}
