package org.loadprofiler.report;

import java.util.ArrayList;
import java.util.List;
import org.loadprofiler.dto.PerformanceThresholds;

/** Checks a run's key metrics against its thresholds. A run succeeds when nothing is returned. */
public final class ThresholdEvaluator {

  public static final String RESPONSE_TIME = "responseTime";
  public static final String MEMORY = "memory";
  public static final String THROUGHPUT = "throughput";
  public static final String ERROR_RATE = "errorRate";
  public static final String CPU = "cpu";
  public static final String DATABASE_LATENCY = "databaseLatency";

  private ThresholdEvaluator() {}

  public static List<ThresholdViolation> evaluate(
      MetricsSnapshot metrics, PerformanceThresholds thresholds) {
    List<ThresholdViolation> violations = new ArrayList<>();

    if (metrics.averageResponseTimeMs() > thresholds.getMaxResponseTimeMs()) {
      violations.add(
          violation(
              RESPONSE_TIME,
              metrics.averageResponseTimeMs(),
              thresholds.getMaxResponseTimeMs(),
              "Average response time (%.1fms) exceeds threshold (%.1fms)"));
    }
    if (metrics.peakHeapMb() > thresholds.getMaxMemoryMb()) {
      violations.add(
          violation(
              MEMORY,
              metrics.peakHeapMb(),
              thresholds.getMaxMemoryMb(),
              "Memory usage (%.0fMB) exceeds threshold (%.0fMB)"));
    }
    if (metrics.throughput() < thresholds.getMinThroughput()) {
      violations.add(
          violation(
              THROUGHPUT,
              metrics.throughput(),
              thresholds.getMinThroughput(),
              "Throughput (%.2f ops/s) is below threshold (%.2f ops/s)"));
    }
    if (metrics.errorRatePct() > thresholds.getMaxErrorRatePct()) {
      violations.add(
          violation(
              ERROR_RATE,
              metrics.errorRatePct(),
              thresholds.getMaxErrorRatePct(),
              "Error rate (%.2f%%) exceeds threshold (%.2f%%)"));
    }
    if (metrics.cpuUtilizationPct() > thresholds.getMaxCpuUtilizationPct()) {
      violations.add(
          violation(
              CPU,
              metrics.cpuUtilizationPct(),
              thresholds.getMaxCpuUtilizationPct(),
              "CPU utilization (%.1f%%) exceeds threshold (%.1f%%)"));
    }
    if (metrics.averageQueryTimeMs() > thresholds.getMaxDatabaseLatencyMs()) {
      violations.add(
          violation(
              DATABASE_LATENCY,
              metrics.averageQueryTimeMs(),
              thresholds.getMaxDatabaseLatencyMs(),
              "Database query time (%.1fms) exceeds threshold (%.1fms)"));
    }

    return violations;
  }

  private static ThresholdViolation violation(
      String metric, double actual, double limit, String format) {
    return ThresholdViolation.builder()
        .metric(metric)
        .actual(actual)
        .limit(limit)
        .description(String.format(format, actual, limit))
        .build();
  }
}
