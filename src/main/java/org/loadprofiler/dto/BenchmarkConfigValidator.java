package org.loadprofiler.dto;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.loadprofiler.exception.BenchmarkConfigurationException;
import org.loadprofiler.load.pattern.ShapingPattern;

/** Rejects plans that cannot be run, before any load is generated. */
public final class BenchmarkConfigValidator {

  private BenchmarkConfigValidator() {}

  public static void validate(BenchmarkConfig config) {
    List<String> problems = new ArrayList<>();

    if (config.getName() == null || config.getName().isBlank()) {
      problems.add("name must not be blank");
    }
    requirePositive("duration", config::parsedDuration, problems);
    requireNonNegative("rampUpTime", config::parsedRampUpTime, problems);
    requireNonNegative("warmupDuration", config::parsedWarmupDuration, problems);
    requireNonNegative("cooldownDuration", config::parsedCooldownDuration, problems);
    requirePositive("sampleInterval", config::parsedSampleInterval, problems);

    if (config.getMaxConcurrency() <= 0) {
      problems.add("maxConcurrency must be > 0 but was " + config.getMaxConcurrency());
    }
    if (!(config.getTargetRps() > 0)) {
      problems.add("targetRps must be > 0 but was " + config.getTargetRps());
    }
    if (config.getWindowSizeSeconds() <= 0) {
      problems.add("windowSizeSeconds must be > 0 but was " + config.getWindowSizeSeconds());
    }
    if (config.getThresholds() == null) {
      problems.add("thresholds must be set");
    }

    validateOperations(config.getOperations(), problems);

    for (ShapingPattern pattern : config.effectivePatterns()) {
      if (pattern == null) {
        problems.add("patterns must not contain null entries");
      } else {
        problems.addAll(pattern.validate());
      }
    }

    if (!problems.isEmpty()) {
      throw new BenchmarkConfigurationException(problems);
    }
  }

  private static void validateOperations(OperationRegistry registry, List<String> problems) {
    if (registry == null || registry.isEmpty()) {
      problems.add("at least one operation must be registered");
      return;
    }
    for (Operation operation : registry.list()) {
      if (!(operation.getWeight() > 0) || Double.isInfinite(operation.getWeight())) {
        problems.add("operation " + operation.getName() + " must have weight > 0");
      }
      if (operation.getTimeoutMs() <= 0) {
        problems.add("operation " + operation.getName() + " must have timeoutMs > 0");
      }
    }
    if (!(registry.totalWeight() > 0)) {
      problems.add("total operation weight must be > 0");
    }
  }

  private static void requirePositive(
      String field, Supplier<Duration> duration, List<String> problems) {
    try {
      var value = duration.get();
      if (value.isZero() || value.isNegative()) {
        problems.add(field + " must be > 0");
      }
    } catch (IllegalArgumentException e) {
      problems.add(field + ": " + e.getMessage());
    }
  }

  private static void requireNonNegative(
      String field, Supplier<Duration> duration, List<String> problems) {
    try {
      duration.get();
    } catch (IllegalArgumentException e) {
      problems.add(field + ": " + e.getMessage());
    }
  }
}
