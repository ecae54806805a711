package org.loadprofiler.report;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Compares a run with the previous run of the same test. Throughput regresses when it drops;
 * latency and memory regress when they grow. The error rate is compared in percentage points.
 */
public final class RegressionAnalyzer {

  static final double[] THROUGHPUT_DROP_PCT = {5, 10, 25};
  static final double[] GROWTH_PCT = {10, 20, 50};
  static final double[] ERROR_RATE_POINTS = {1, 5, 10};

  private RegressionAnalyzer() {}

  public static List<Regression> analyze(MetricsSnapshot previous, MetricsSnapshot current) {
    List<Regression> regressions = new ArrayList<>();

    if (previous.throughput() > 0) {
      double change = percentChange(previous.throughput(), current.throughput());
      Regression.Level level = levelFor(-change, THROUGHPUT_DROP_PCT, false);
      if (level != null) {
        regressions.add(
            regression(
                "throughput",
                previous.throughput(),
                current.throughput(),
                change,
                -cutoff(level, THROUGHPUT_DROP_PCT),
                level));
      }
    }

    growth("averageResponseTime", previous.averageResponseTimeMs(), current.averageResponseTimeMs())
        .ifPresent(regressions::add);
    growth("p95ResponseTime", previous.p95ResponseTimeMs(), current.p95ResponseTimeMs())
        .ifPresent(regressions::add);
    growth("memory", previous.peakHeapMb(), current.peakHeapMb()).ifPresent(regressions::add);

    double points = current.errorRatePct() - previous.errorRatePct();
    Regression.Level errorLevel = levelFor(points, ERROR_RATE_POINTS, true);
    if (errorLevel != null) {
      regressions.add(
          regression(
              "errorRate",
              previous.errorRatePct(),
              current.errorRatePct(),
              points,
              cutoff(errorLevel, ERROR_RATE_POINTS),
              errorLevel));
    }

    return regressions;
  }

  private static Optional<Regression> growth(String metric, double previous, double current) {
    if (previous <= 0) {
      return Optional.empty();
    }
    double change = percentChange(previous, current);
    Regression.Level level = levelFor(change, GROWTH_PCT, false);
    if (level == null) {
      return Optional.empty();
    }
    return Optional.of(
        regression(metric, previous, current, change, cutoff(level, GROWTH_PCT), level));
  }

  static double percentChange(double previous, double current) {
    return (current - previous) / previous * 100;
  }

  /** Highest level whose cutoff is exceeded (or reached, when {@code inclusive}); {@code null} below all. */
  static Regression.Level levelFor(double value, double[] cutoffs, boolean inclusive) {
    Regression.Level[] levels = Regression.Level.values();
    for (int i = cutoffs.length - 1; i >= 0; i--) {
      if (inclusive ? value >= cutoffs[i] : value > cutoffs[i]) {
        return levels[i];
      }
    }
    return null;
  }

  private static double cutoff(Regression.Level level, double[] cutoffs) {
    return cutoffs[level.ordinal()];
  }

  private static Regression regression(
      String metric,
      double previous,
      double current,
      double change,
      double threshold,
      Regression.Level level) {
    return Regression.builder()
        .metric(metric)
        .previousValue(previous)
        .currentValue(current)
        .changePercent(change)
        .threshold(threshold)
        .level(level)
        .build();
  }
}
