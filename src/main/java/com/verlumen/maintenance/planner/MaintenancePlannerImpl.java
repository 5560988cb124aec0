package com.verlumen.maintenance.planner;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.maintenance.discovery.GeneticOptimizer;
import com.verlumen.maintenance.discovery.OptimizationResult;
import com.verlumen.maintenance.discovery.OptimizerConfig;
import com.verlumen.maintenance.markov.ChainAnalyzer;
import com.verlumen.maintenance.model.Policy;
import com.verlumen.maintenance.simulation.PolicyEvaluator;
import com.verlumen.maintenance.simulation.TrajectorySimulator;
import com.verlumen.maintenance.simulation.TrajectoryStep;

final class MaintenancePlannerImpl implements MaintenancePlanner {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final int BEST_STATE = 0;

  private final ChainAnalyzer chainAnalyzer;
  private final GeneticOptimizer geneticOptimizer;
  private final PolicyEvaluator policyEvaluator;
  private final TrajectorySimulator trajectorySimulator;

  @Inject
  MaintenancePlannerImpl(
      ChainAnalyzer chainAnalyzer,
      GeneticOptimizer geneticOptimizer,
      PolicyEvaluator policyEvaluator,
      TrajectorySimulator trajectorySimulator) {
    this.chainAnalyzer = chainAnalyzer;
    this.geneticOptimizer = geneticOptimizer;
    this.policyEvaluator = policyEvaluator;
    this.trajectorySimulator = trajectorySimulator;
  }

  @Override
  public MaintenancePlan plan(Scenario scenario, PlannerConfig config) {
    OptimizerConfig optimizerConfig = config.optimizerConfig();
    logger.atInfo().log("Planning maintenance for scenario %s", scenario.name());

    // Diagnostics describe the raw chain; the search works on policy-modified chains.
    double meanTimeToFailure =
        chainAnalyzer.meanTimeToAbsorption(scenario.matrix(), BEST_STATE);
    ImmutableList<Double> stationary = chainAnalyzer.stationaryDistribution(scenario.matrix());
    logger.atInfo().log(
        "Unmanaged chain: %.2f periods to failure from %s",
        meanTimeToFailure, scenario.label(BEST_STATE));

    OptimizationResult optimization =
        geneticOptimizer.optimize(scenario.matrix(), scenario.costModel(), optimizerConfig);

    Policy baseline = Policy.never(Policy.lengthFor(scenario.matrix().numStates()));
    double baselineCost =
        policyEvaluator.evaluate(
            baseline,
            scenario.matrix(),
            scenario.costModel(),
            optimizerConfig.simulationConfig());

    ImmutableList<TrajectoryStep> trajectory =
        trajectorySimulator.simulate(
            optimization.bestPolicy(),
            scenario.matrix(),
            scenario.costModel(),
            config.trajectoryLength(),
            optimizerConfig.simulationConfig().seed());

    MaintenancePlan plan =
        new MaintenancePlan(
            scenario.name(),
            meanTimeToFailure,
            stationary,
            optimization,
            baselineCost,
            trajectory);
    logger.atInfo().log(
        "Best policy %s costs %.4f per period against %.4f for never maintaining (saving %.4f)",
        plan.bestPolicy(), plan.bestCost(), plan.baselineCost(), plan.expectedSaving());
    return plan;
  }
}
