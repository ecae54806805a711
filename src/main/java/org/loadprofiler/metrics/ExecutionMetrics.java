package org.loadprofiler.metrics;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/** Invocation statistics for the main phase of a run. */
@Data
@Builder
public class ExecutionMetrics {
  private final long durationMs;

  private final long totalInvocations;
  private final long successfulInvocations;
  private final long failedInvocations;
  private final double errorRatePct;

  private final double averageResponseTimeMs;
  private final long p50ResponseTimeMs;
  private final long p95ResponseTimeMs;
  private final long p99ResponseTimeMs;
  private final long minResponseTimeMs;
  private final long maxResponseTimeMs;

  /** Completed invocations per second over the whole main phase. */
  private final double throughput;

  private final double peakWindowThroughput;

  private final Map<String, Long> invocationsByOperation;
  private final ErrorSummary errorSummary;
  private final List<ErrorInfo> recentErrors;
}
