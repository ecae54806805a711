package org.loadprofiler.report;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.loadprofiler.db.QueryMetrics;
import org.loadprofiler.dto.BenchmarkConfig;
import org.loadprofiler.memory.MemoryAnalysis;
import org.loadprofiler.memory.MemoryUnits;
import org.loadprofiler.metrics.ExecutionMetrics;
import org.loadprofiler.metrics.WindowSummary;

/** Turns the raw results of a run into its report. */
public class ReportAssembler {

  private final String runId;
  private final BenchmarkConfig config;
  private Instant startTime;
  private Instant endTime;
  private String terminationReason = PerformanceReport.TERMINATION_DURATION_COMPLETED;
  private ExecutionMetrics execution;
  private MemoryAnalysis memory;
  private QueryMetrics database;
  private List<WindowSummary> windows = List.of();
  private MetricsSnapshot baseline;

  public ReportAssembler(String runId, BenchmarkConfig config) {
    this.runId = runId;
    this.config = config;
  }

  public ReportAssembler period(Instant startTime, Instant endTime) {
    this.startTime = startTime;
    this.endTime = endTime;
    return this;
  }

  public ReportAssembler terminationReason(String terminationReason) {
    this.terminationReason = terminationReason;
    return this;
  }

  public ReportAssembler execution(ExecutionMetrics execution, List<WindowSummary> windows) {
    this.execution = execution;
    this.windows = windows;
    return this;
  }

  public ReportAssembler memory(MemoryAnalysis memory) {
    this.memory = memory;
    return this;
  }

  /** @param database {@code null} when nothing was instrumented */
  public ReportAssembler database(QueryMetrics database) {
    this.database = database;
    return this;
  }

  public ReportAssembler baseline(Optional<MetricsSnapshot> baseline) {
    this.baseline = baseline.orElse(null);
    return this;
  }

  public PerformanceReport assemble() {
    MetricsSnapshot keyMetrics = keyMetrics(execution, memory, database);
    List<ThresholdViolation> violations =
        List.copyOf(ThresholdEvaluator.evaluate(keyMetrics, config.getThresholds()));

    return PerformanceReport.builder()
        .runId(runId)
        .testName(config.getName())
        .description(config.getDescription())
        .startTime(startTime)
        .endTime(endTime)
        .durationMs(Duration.between(startTime, endTime).toMillis())
        .terminationReason(terminationReason)
        .execution(execution)
        .memory(memory)
        .database(database)
        .cpuUtilizationPct(keyMetrics.cpuUtilizationPct())
        .windows(windows != null ? List.copyOf(windows) : List.of())
        .keyMetrics(keyMetrics)
        .thresholdViolations(violations)
        .bottlenecks(List.copyOf(BottleneckAnalyzer.analyze(violations)))
        .recommendations(List.copyOf(RecommendationEngine.generate(keyMetrics)))
        .regressions(
            baseline != null
                ? List.copyOf(RegressionAnalyzer.analyze(baseline, keyMetrics))
                : List.of())
        .success(violations.isEmpty())
        .summary(ScoreCalculator.summarize(execution, keyMetrics, config.getTargetRps()))
        .build();
  }

  static MetricsSnapshot keyMetrics(
      ExecutionMetrics execution, MemoryAnalysis memory, QueryMetrics database) {
    return new MetricsSnapshot(
        execution.getThroughput(),
        execution.getAverageResponseTimeMs(),
        execution.getP95ResponseTimeMs(),
        execution.getErrorRatePct(),
        memory != null ? MemoryUnits.toMb(memory.getPeakHeapUsedBytes()) : 0,
        memory != null ? memory.getAverageCpuLoadPct() : 0,
        database != null ? database.getAverageQueryTimeMs() : 0,
        database != null ? database.getSlowQueryCount() : 0,
        memory != null && memory.getLeaks() != null ? memory.getLeaks().size() : 0);
  }
}
