package com.verlumen.maintenance.planner;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.verlumen.maintenance.discovery.DiscoveryModule;
import com.verlumen.maintenance.markov.MarkovModule;
import com.verlumen.maintenance.simulation.SimulationModule;

@AutoValue
abstract class PlannerModule extends AbstractModule {
  static PlannerModule create(Scenario scenario, PlannerConfig plannerConfig) {
    return new AutoValue_PlannerModule(scenario, plannerConfig);
  }

  abstract Scenario scenario();

  abstract PlannerConfig plannerConfig();

  @Override
  protected void configure() {
    bind(MaintenancePlanner.class).to(MaintenancePlannerImpl.class);

    install(MarkovModule.create());
    install(SimulationModule.create());
    install(DiscoveryModule.create());
  }

  @Provides
  Scenario provideScenario() {
    return scenario();
  }

  @Provides
  PlannerConfig providePlannerConfig() {
    return plannerConfig();
  }
}
