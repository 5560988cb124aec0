package com.verlumen.maintenance.simulation;

import com.google.inject.AbstractModule;

public final class SimulationModule extends AbstractModule {
  public static SimulationModule create() {
    return new SimulationModule();
  }

  private SimulationModule() {}

  @Override
  protected void configure() {
    bind(PolicyEvaluator.class).to(PolicyEvaluatorImpl.class);
    bind(StateSamplerFactory.class).to(StateSamplerFactoryImpl.class);
    bind(TrajectorySimulator.class).to(TrajectorySimulatorImpl.class);
  }
}
