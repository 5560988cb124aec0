package com.verlumen.maintenance.planner;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Doubles;
import com.google.gson.Gson;
import com.verlumen.maintenance.markov.TransitionMatrix;
import com.verlumen.maintenance.model.CostModel;
import com.verlumen.maintenance.model.ErrorKind;
import com.verlumen.maintenance.model.MaintenanceModelException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.yaml.snakeyaml.Yaml;

/** Utility class for loading maintenance scenarios from YAML and JSON. */
public final class ScenarioLoader {
  /** Classpath location of the bundled five-state reference scenario. */
  public static final String REFERENCE_SCENARIO = "scenarios/reference.yaml";

  private static final Gson GSON = new Gson();

  private ScenarioLoader() {}

  /**
   * Loads a scenario from a file, auto-detecting format based on extension.
   *
   * @param path The path to the scenario file (.json or .yaml/.yml)
   * @return The validated scenario
   */
  public static Scenario load(String path) {
    String lowerPath = path.toLowerCase();
    String content;
    try {
      content = Files.readString(Path.of(path), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new RuntimeException("Failed to load scenario from: " + path, e);
    }
    if (lowerPath.endsWith(".yaml") || lowerPath.endsWith(".yml")) {
      return toScenario(parseYaml(content));
    } else if (lowerPath.endsWith(".json")) {
      return toScenario(GSON.fromJson(content, ScenarioConfig.class));
    }
    throw new IllegalArgumentException(
        "Unsupported file format. Use .json, .yaml, or .yml: " + path);
  }

  /**
   * Loads a scenario from a YAML resource on the classpath.
   *
   * @param resourcePath The classpath resource path
   * @return The validated scenario
   */
  public static Scenario loadResource(String resourcePath) {
    String normalizedPath = resourcePath.startsWith("/") ? resourcePath : "/" + resourcePath;
    try (InputStream is = ScenarioLoader.class.getResourceAsStream(normalizedPath)) {
      if (is == null) {
        throw new RuntimeException("Resource not found: " + resourcePath);
      }
      return toScenario(parseYaml(new String(is.readAllBytes(), StandardCharsets.UTF_8)));
    } catch (IOException e) {
      throw new RuntimeException("Failed to load scenario from resource: " + resourcePath, e);
    }
  }

  public static Scenario loadReference() {
    return loadResource(REFERENCE_SCENARIO);
  }

  /** Parses YAML into the raw configuration POJO without validating it. Empty input gives null. */
  public static ScenarioConfig parseYaml(String yamlContent) {
    Object document = new Yaml().load(yamlContent);
    if (document == null) {
      return null;
    }
    MaintenanceModelException.check(
        document instanceof Map,
        ErrorKind.INVALID_TRANSITION_MATRIX,
        "scenario document must be a mapping, got %s",
        document.getClass().getSimpleName());
    return GSON.fromJson(GSON.toJson(document), ScenarioConfig.class);
  }

  /**
   * Validates a raw configuration and converts it into a {@link Scenario}.
   *
   * @throws MaintenanceModelException if the matrix or the costs are missing or invalid
   */
  public static Scenario toScenario(ScenarioConfig config) {
    MaintenanceModelException.check(
        config != null, ErrorKind.INVALID_TRANSITION_MATRIX, "scenario document is empty");
    MaintenanceModelException.check(
        config.getTransitionMatrix() != null,
        ErrorKind.INVALID_TRANSITION_MATRIX,
        "scenario %s has no transitionMatrix",
        config.getName());
    MaintenanceModelException.check(
        config.getPreventiveCost() != null
            && config.getRepairCostByState() != null
            && config.getProductionLossCost() != null,
        ErrorKind.INVALID_COST_MODEL,
        "scenario %s must define preventiveCost, repairCostByState and productionLossCost",
        config.getName());

    TransitionMatrix matrix = TransitionMatrix.of(config.getTransitionMatrix());
    CostModel costModel =
        CostModel.create(
            config.getPreventiveCost(),
            Doubles.toArray(config.getRepairCostByState()),
            config.getProductionLossCost());
    return new Scenario(
        config.getName() == null ? "unnamed" : config.getName(),
        config.getStateLabels() == null
            ? ImmutableList.of()
            : ImmutableList.copyOf(config.getStateLabels()),
        matrix,
        costModel);
  }
}
