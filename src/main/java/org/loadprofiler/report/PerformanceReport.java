package org.loadprofiler.report;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import org.loadprofiler.db.QueryMetrics;
import org.loadprofiler.memory.MemoryAnalysis;
import org.loadprofiler.metrics.ExecutionMetrics;
import org.loadprofiler.metrics.WindowSummary;

/**
 * Outcome of one benchmark run. Built once by {@link ReportAssembler}; its lists are unmodifiable.
 */
@Value
@Builder
public class PerformanceReport {

  public static final String TERMINATION_DURATION_COMPLETED = "DURATION_COMPLETED";
  public static final String TERMINATION_CANCELLED = "CANCELLED";

  private final String runId;
  private final String testName;
  private final String description;
  private final Instant startTime;
  private final Instant endTime;
  private final long durationMs;
  private final String terminationReason;

  private final ExecutionMetrics execution;
  private final MemoryAnalysis memory;

  /** {@code null} when the run had no instrumented database access. */
  private final QueryMetrics database;

  private final double cpuUtilizationPct;
  private final List<WindowSummary> windows;
  private final MetricsSnapshot keyMetrics;

  private final List<ThresholdViolation> thresholdViolations;
  private final List<Bottleneck> bottlenecks;
  private final List<Recommendation> recommendations;
  private final List<Regression> regressions;

  private final boolean success;
  private final TestSummary summary;
}
