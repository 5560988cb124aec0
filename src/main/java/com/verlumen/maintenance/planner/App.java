package com.verlumen.maintenance.planner;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.verlumen.maintenance.discovery.GAConstants;
import com.verlumen.maintenance.discovery.OptimizerConfig;
import com.verlumen.maintenance.simulation.SimulationConfig;
import com.verlumen.maintenance.simulation.StepOutcome;
import com.verlumen.maintenance.simulation.TrajectoryStep;
import java.io.IOException;
import java.io.InputStream;
import java.util.logging.LogManager;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.Namespace;

final class App {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final String LOGGING_CONFIG = "/logging.properties";

  private final MaintenancePlanner planner;
  private final Scenario scenario;
  private final PlannerConfig plannerConfig;

  @Inject
  App(MaintenancePlanner planner, Scenario scenario, PlannerConfig plannerConfig) {
    this.planner = planner;
    this.scenario = scenario;
    this.plannerConfig = plannerConfig;
  }

  MaintenancePlan run() {
    MaintenancePlan plan = planner.plan(scenario, plannerConfig);
    logger.atInfo().log("Scenario: %s", plan.scenarioName());
    logger.atInfo().log("Mean time to failure (unmanaged): %.3f periods", plan.meanTimeToFailure());
    logger.atInfo().log("Best policy: %s", plan.bestPolicy());
    logger.atInfo().log("Best cost per period: %.4f", plan.bestCost());
    logger.atInfo().log("Never-maintain cost per period: %.4f", plan.baselineCost());
    logger.atInfo().log("Best cost by generation: %s", plan.trace().bestCostByGeneration());
    logger.atInfo().log(
        "Sample trajectory: %d periods, %d preventive actions, %d failures",
        plan.trajectory().size(),
        count(plan, StepOutcome.PREVENTIVE_MAINTENANCE),
        count(plan, StepOutcome.FAILURE_REPAIR));
    return plan;
  }

  private static long count(MaintenancePlan plan, StepOutcome outcome) {
    return plan.trajectory().stream().map(TrajectoryStep::outcome).filter(outcome::equals).count();
  }

  public static void main(String[] args) throws Exception {
    configureLogging();
    logger.atInfo().log("Maintenance planner starting up with %d arguments", args.length);
    try {
      Namespace namespace = createParser().parseArgs(args);
      String scenarioPath = namespace.getString("scenario");
      Scenario scenario =
          scenarioPath == null
              ? ScenarioLoader.loadReference()
              : ScenarioLoader.load(scenarioPath);
      PlannerModule module = PlannerModule.create(scenario, toPlannerConfig(namespace));
      App app = Guice.createInjector(module).getInstance(App.class);
      logger.atInfo().log("Guice initialization complete, running planner");
      app.run();
    } catch (Exception e) {
      logger.atSevere().withCause(e).log("Fatal error while planning maintenance");
      throw e;
    }
  }

  static PlannerConfig toPlannerConfig(Namespace namespace) {
    SimulationConfig simulationConfig =
        new SimulationConfig(
            namespace.getInt("trials"), namespace.getInt("horizon"), namespace.getLong("seed"));
    OptimizerConfig optimizerConfig =
        new OptimizerConfig(
            namespace.getInt("populationSize"),
            namespace.getInt("generations"),
            namespace.getDouble("mutationRate"),
            simulationConfig);
    return new PlannerConfig(optimizerConfig, namespace.getInt("trajectoryLength"));
  }

  static ArgumentParser createParser() {
    ArgumentParser parser = ArgumentParsers.newFor("MaintenancePlanner")
      .build()
      .defaultHelp(true)
      .description("Searches for a cost-minimizing preventive-maintenance policy");

    parser.addArgument("--scenario")
      .help("Path to a scenario file (.yaml, .yml or .json); the reference scenario if omitted");

    // Genetic search
    parser.addArgument("--populationSize")
      .type(Integer.class)
      .setDefault(GAConstants.DEFAULT_POPULATION_SIZE)
      .help("Number of policies per generation");

    parser.addArgument("--generations")
      .type(Integer.class)
      .setDefault(GAConstants.DEFAULT_MAX_GENERATIONS)
      .help("Number of generations to evolve");

    parser.addArgument("--mutationRate")
      .type(Double.class)
      .setDefault(GAConstants.DEFAULT_MUTATION_RATE)
      .help("Probability that an offspring gets one bit flipped");

    // Monte Carlo evaluation
    parser.addArgument("--trials")
      .type(Integer.class)
      .setDefault(GAConstants.DEFAULT_NUM_TRIALS)
      .help("Simulation trials per policy evaluation");

    parser.addArgument("--horizon")
      .type(Integer.class)
      .setDefault(GAConstants.DEFAULT_HORIZON)
      .help("Periods simulated per trial");

    parser.addArgument("--seed")
      .type(Long.class)
      .setDefault(GAConstants.DEFAULT_SEED)
      .help("Root random seed for simulation and search");

    parser.addArgument("--trajectoryLength")
      .type(Integer.class)
      .setDefault(PlannerConfig.DEFAULT_TRAJECTORY_LENGTH)
      .help("Periods in the sample trajectory under the best policy");

    return parser;
  }

  private static void configureLogging() throws IOException {
    try (InputStream is = App.class.getResourceAsStream(LOGGING_CONFIG)) {
      if (is != null) {
        LogManager.getLogManager().readConfiguration(is);
      }
    }
  }
}
