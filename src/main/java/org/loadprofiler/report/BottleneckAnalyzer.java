package org.loadprofiler.report;

import java.util.ArrayList;
import java.util.List;
import org.loadprofiler.metrics.Severity;

/** Attributes each threshold violation to a resource category with fixed remediation advice. */
public final class BottleneckAnalyzer {

  private BottleneckAnalyzer() {}

  public static List<Bottleneck> analyze(List<ThresholdViolation> violations) {
    List<Bottleneck> bottlenecks = new ArrayList<>();
    for (ThresholdViolation violation : violations) {
      bottlenecks.add(toBottleneck(violation));
    }
    return bottlenecks;
  }

  static Bottleneck toBottleneck(ThresholdViolation violation) {
    Bottleneck.BottleneckBuilder builder =
        Bottleneck.builder().description(violation.getDescription());

    switch (violation.getMetric()) {
      case ThresholdEvaluator.MEMORY:
        return builder
            .type(Bottleneck.Type.MEMORY)
            .severity(Severity.HIGH)
            .impact("May cause out-of-memory errors and performance degradation")
            .location("Application heap")
            .recommendations(
                List.of(
                    "Implement object pooling",
                    "Review memory allocations",
                    "Add garbage collection optimization"))
            .build();
      case ThresholdEvaluator.CPU:
        return builder
            .type(Bottleneck.Type.CPU)
            .severity(Severity.MEDIUM)
            .impact("Reduced throughput and increased response times")
            .location("CPU-intensive operations")
            .recommendations(
                List.of(
                    "Optimize algorithms",
                    "Implement caching",
                    "Use worker threads for heavy operations"))
            .build();
      case ThresholdEvaluator.DATABASE_LATENCY:
        return builder
            .type(Bottleneck.Type.DATABASE)
            .severity(Severity.HIGH)
            .impact("Slow database operations affecting overall performance")
            .location("Database queries")
            .recommendations(
                List.of(
                    "Add database indexes",
                    "Optimize slow queries",
                    "Implement query caching",
                    "Consider connection pooling"))
            .build();
      case ThresholdEvaluator.ERROR_RATE:
        return builder
            .type(Bottleneck.Type.NETWORK)
            .severity(Severity.HIGH)
            .impact("Failed operations reduce effective throughput and hide latency problems")
            .location("Operation invocations")
            .recommendations(
                List.of(
                    "Inspect the most frequent error messages",
                    "Add retries with backoff for transient failures",
                    "Validate operation inputs before invoking"))
            .build();
      case ThresholdEvaluator.RESPONSE_TIME:
        return builder
            .type(Bottleneck.Type.NETWORK)
            .severity(violation.getActual() > 2 * violation.getLimit() ? Severity.HIGH : Severity.MEDIUM)
            .impact("Slow responses limit throughput under bounded concurrency")
            .location("Operation invocations")
            .recommendations(
                List.of(
                    "Profile the slowest operations",
                    "Reduce per-invocation work",
                    "Cache results of repeated calls"))
            .build();
      default:
        return builder
            .type(Bottleneck.Type.NETWORK)
            .severity(Severity.MEDIUM)
            .impact("The service cannot sustain the expected load")
            .location("Operation invocations")
            .recommendations(
                List.of(
                    "Increase the concurrency limit",
                    "Reduce per-invocation latency",
                    "Batch small operations"))
            .build();
    }
  }
}
