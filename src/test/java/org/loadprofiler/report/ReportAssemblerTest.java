package org.loadprofiler.report;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.loadprofiler.db.QueryMetrics;
import org.loadprofiler.dto.BenchmarkConfig;
import org.loadprofiler.dto.PerformanceThresholds;
import org.loadprofiler.memory.LeakType;
import org.loadprofiler.memory.MemoryAnalysis;
import org.loadprofiler.memory.MemoryLeak;
import org.loadprofiler.memory.MemoryUnits;
import org.loadprofiler.metrics.ExecutionMetrics;
import org.loadprofiler.metrics.Severity;

class ReportAssemblerTest {

  private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
  private static final Instant END = START.plusSeconds(60);

  private static final BenchmarkConfig CONFIG =
      BenchmarkConfig.builder().name("checkout").description("cart to order").targetRps(10).build();

  private static ExecutionMetrics execution(double throughput, double errorRate, double avgMs) {
    long total = 1000;
    long failed = Math.round(total * errorRate / 100);
    return ExecutionMetrics.builder()
        .durationMs(60_000)
        .totalInvocations(total)
        .successfulInvocations(total - failed)
        .failedInvocations(failed)
        .errorRatePct(errorRate)
        .averageResponseTimeMs(avgMs)
        .p95ResponseTimeMs(Math.round(avgMs * 2))
        .throughput(throughput)
        .build();
  }

  private static MemoryAnalysis memory(long peakHeapMb, List<MemoryLeak> leaks) {
    return MemoryAnalysis.builder()
        .sampleCount(60)
        .peakHeapUsedBytes(peakHeapMb * MemoryUnits.MB)
        .averageCpuLoadPct(30)
        .leaks(leaks)
        .recommendations(List.of())
        .build();
  }

  private static ReportAssembler assembler(ExecutionMetrics execution, MemoryAnalysis memory) {
    return new ReportAssembler("run-1", CONFIG)
        .period(START, END)
        .execution(execution, List.of())
        .memory(memory)
        .baseline(Optional.empty());
  }

  @Test
  @DisplayName("A run inside every threshold succeeds and scores near 100")
  void shouldSucceedWithinThresholds() {
    // Given
    ReportAssembler assembler = assembler(execution(50, 0, 20), memory(100, List.of()));

    // When
    PerformanceReport report = assembler.assemble();

    // Then
    assertTrue(report.isSuccess());
    assertEquals("checkout", report.getTestName());
    assertEquals("cart to order", report.getDescription());
    assertEquals(60_000, report.getDurationMs());
    assertEquals(PerformanceReport.TERMINATION_DURATION_COMPLETED, report.getTerminationReason());
    assertTrue(report.getThresholdViolations().isEmpty());
    assertTrue(report.getBottlenecks().isEmpty());
    assertTrue(report.getRegressions().isEmpty());
    assertNull(report.getDatabase());
    assertEquals(30, report.getCpuUtilizationPct());

    TestSummary summary = report.getSummary();
    assertEquals(100, summary.getThroughputScore());
    assertEquals(100, summary.getErrorScore());
    assertEquals(100 - 100.0 / 1024 * 10, summary.getMemoryEfficiency(), 1e-9);
    assertEquals(100, summary.getDatabaseEfficiency());
    assertEquals(99.76, summary.getOverallScore(), 0.01);
  }

  @Test
  @DisplayName("Each broken threshold becomes a violation and a bottleneck")
  void shouldReportViolationsAndBottlenecks() {
    // Given
    ReportAssembler assembler =
        assembler(execution(50, 20, 2500), memory(600, List.of()))
            .terminationReason(PerformanceReport.TERMINATION_CANCELLED);

    // When
    PerformanceReport report = assembler.assemble();

    // Then
    assertFalse(report.isSuccess());
    assertEquals(PerformanceReport.TERMINATION_CANCELLED, report.getTerminationReason());
    List<String> violated =
        report.getThresholdViolations().stream()
            .map(ThresholdViolation::getMetric)
            .collect(Collectors.toList());
    assertEquals(
        List.of(
            ThresholdEvaluator.RESPONSE_TIME,
            ThresholdEvaluator.MEMORY,
            ThresholdEvaluator.ERROR_RATE),
        violated);

    List<Bottleneck> bottlenecks = report.getBottlenecks();
    assertEquals(3, bottlenecks.size());
    assertEquals(Bottleneck.Type.NETWORK, bottlenecks.get(0).getType());
    assertEquals(Severity.HIGH, bottlenecks.get(0).getSeverity());
    assertEquals(Bottleneck.Type.MEMORY, bottlenecks.get(1).getType());
    assertEquals(0, report.getSummary().getErrorScore());
  }

  @Test
  void shouldFlagDatabaseLatency() {
    QueryMetrics database =
        QueryMetrics.builder()
            .totalQueries(10)
            .averageQueryTimeMs(250)
            .slowQueryCount(4)
            .slowQueries(List.of())
            .build();

    PerformanceReport report =
        assembler(execution(50, 0, 20), memory(100, List.of())).database(database).assemble();

    assertFalse(report.isSuccess());
    assertEquals(Bottleneck.Type.DATABASE, report.getBottlenecks().get(0).getType());
    assertEquals(4, report.getKeyMetrics().slowQueryCount());
    assertEquals(75, report.getSummary().getDatabaseEfficiency(), 1e-9);
  }

  @Nested
  @DisplayName("Regressions")
  class Regressions {

    @Test
    void shouldCompareAgainstBaseline() {
      MetricsSnapshot baseline = new MetricsSnapshot(100, 20, 40, 0, 100, 30, 0, 0, 0);

      PerformanceReport report =
          assembler(execution(50, 0, 20), memory(100, List.of()))
              .baseline(Optional.of(baseline))
              .assemble();

      Map<String, Regression> regressions =
          report.getRegressions().stream()
              .collect(Collectors.toMap(Regression::getMetric, r -> r));
      assertEquals(1, regressions.size());
      assertEquals(Regression.Level.SEVERE, regressions.get("throughput").getLevel());
      assertTrue(report.isSuccess());
    }
  }

  @Test
  @DisplayName("Recommendations follow throughput, leaks and slow queries")
  void shouldGenerateRecommendations() {
    MemoryLeak leak =
        MemoryLeak.builder()
            .type(LeakType.SUDDEN)
            .severity(Severity.HIGH)
            .growthBytes(64 * MemoryUnits.MB)
            .build();
    BenchmarkConfig relaxed =
        CONFIG.toBuilder()
            .thresholds(PerformanceThresholds.builder().maxDatabaseLatencyMs(1000).build())
            .build();

    PerformanceReport report =
        new ReportAssembler("run-2", relaxed)
            .period(START, END)
            .execution(execution(50, 0, 20), List.of())
            .memory(memory(100, List.of(leak)))
            .database(QueryMetrics.builder().averageQueryTimeMs(5).slowQueryCount(1).build())
            .baseline(Optional.empty())
            .assemble();

    List<String> titles =
        report.getRecommendations().stream()
            .map(Recommendation::getTitle)
            .collect(Collectors.toList());
    assertEquals(
        List.of("Optimize Operation Throughput", "Fix Memory Leaks", "Optimize Database Queries"),
        titles);
    assertEquals(Severity.CRITICAL, report.getRecommendations().get(1).getPriority());
  }

  @Test
  void shouldDeriveKeyMetricsWithoutMemoryOrDatabase() {
    MetricsSnapshot metrics = ReportAssembler.keyMetrics(execution(12, 1, 30), null, null);

    assertEquals(12, metrics.throughput());
    assertEquals(60, metrics.p95ResponseTimeMs());
    assertEquals(0, metrics.peakHeapMb());
    assertEquals(0, metrics.leakCount());
  }

  @Test
  @DisplayName("Emitted reports cannot be changed through their lists")
  void shouldExposeUnmodifiableLists() {
    // Given
    MetricsSnapshot baseline = new MetricsSnapshot(100, 20, 40, 0, 100, 30, 0, 0, 0);
    PerformanceReport report =
        assembler(execution(50, 20, 2500), memory(600, List.of()))
            .baseline(Optional.of(baseline))
            .assemble();

    // When / Then
    assertFalse(report.getThresholdViolations().isEmpty());
    assertThrows(UnsupportedOperationException.class, () -> report.getThresholdViolations().clear());
    assertThrows(UnsupportedOperationException.class, () -> report.getBottlenecks().clear());
    assertThrows(UnsupportedOperationException.class, () -> report.getRecommendations().clear());
    assertThrows(UnsupportedOperationException.class, () -> report.getRegressions().clear());
    assertThrows(UnsupportedOperationException.class, () -> report.getWindows().clear());
    assertEquals(3, report.getBottlenecks().size());
  }
}
