package org.loadprofiler.event;

import org.loadprofiler.db.SlowQueryRecord;
import org.loadprofiler.dto.BenchmarkConfig;
import org.loadprofiler.load.BenchmarkPhaseManager.BenchmarkPhase;
import org.loadprofiler.memory.GcEvent;
import org.loadprofiler.memory.MemoryLeak;
import org.loadprofiler.memory.MemoryUnits;
import org.loadprofiler.memory.PressurePoint;
import org.loadprofiler.memory.ResourceSnapshot;
import org.loadprofiler.report.PerformanceReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingBenchmarkListener implements BenchmarkListener {

  private static final Logger log = LoggerFactory.getLogger(LoggingBenchmarkListener.class);

  @Override
  public void onRunStarted(String runId, BenchmarkConfig config) {
    log.info(
        "Run {} started: {} for {} at up to {} concurrent",
        runId,
        config.getName(),
        config.getDuration(),
        config.getMaxConcurrency());
  }

  @Override
  public void onPhaseChanged(String runId, BenchmarkPhase previous, BenchmarkPhase current) {
    log.info("Run {} phase: {} -> {}", runId, previous, current);
  }

  @Override
  public void onRunCompleted(PerformanceReport report) {
    log.info(
        "Run {} completed: success={}, score={}, throughput={} ops/s",
        report.getRunId(),
        report.isSuccess(),
        String.format("%.1f", report.getSummary().getOverallScore()),
        String.format("%.2f", report.getExecution().getThroughput()));
  }

  @Override
  public void onSample(ResourceSnapshot snapshot) {
    log.trace(
        "Sample: heap={}MB rss={}MB cpu={}",
        String.format("%.1f", MemoryUnits.toMb(snapshot.heapUsed())),
        String.format("%.1f", MemoryUnits.toMb(snapshot.rss())),
        snapshot.processCpuLoad());
  }

  @Override
  public void onLeakDetected(MemoryLeak leak) {
    log.warn("Memory leak suspected ({} / {}): {}", leak.getType(), leak.getSeverity(), leak.getDescription());
  }

  @Override
  public void onPressureDetected(PressurePoint pressurePoint) {
    log.warn(
        "Memory pressure ({} / {}): {}",
        pressurePoint.getType(),
        pressurePoint.getSeverity(),
        pressurePoint.getDescription());
  }

  @Override
  public void onGcEvent(GcEvent event) {
    log.debug(
        "GC {} ({}): {}ms, freed {}KB",
        event.collector(),
        event.cause(),
        event.durationMs(),
        event.freed() / MemoryUnits.KB);
  }

  @Override
  public void onSlowQuery(SlowQueryRecord record) {
    log.warn("Slow query ({}ms) on {}: {}", record.getDurationMs(), record.getTablesTouched(), record.getSql());
  }
}
