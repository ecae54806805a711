package org.loadprofiler.dto;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

/** Pass/fail limits for a benchmark run. A run succeeds only when every limit holds. */
@Getter
@Builder(toBuilder = true)
@Jacksonized
@ToString
public class PerformanceThresholds {

  /** Upper bound on the mean invocation latency. */
  @Builder.Default private final double maxResponseTimeMs = 1000;

  /** Upper bound on peak heap usage during the run. */
  @Builder.Default private final double maxMemoryMb = 512;

  /** Lower bound on completed invocations per second. */
  @Builder.Default private final double minThroughput = 1;

  /** Upper bound on failed invocations, in percent of all invocations. */
  @Builder.Default private final double maxErrorRatePct = 5;

  /** Upper bound on mean process CPU load, in percent. */
  @Builder.Default private final double maxCpuUtilizationPct = 90;

  /** Upper bound on mean instrumented query latency. */
  @Builder.Default private final double maxDatabaseLatencyMs = 100;
}
