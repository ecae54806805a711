package org.loadprofiler.metrics;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class RunMetricsTest {

  private ScheduledExecutorService scheduler;
  private RunMetrics metrics;

  @BeforeEach
  void setUp() {
    scheduler = Executors.newScheduledThreadPool(1);
    metrics = new RunMetrics(scheduler, 1);
  }

  @AfterEach
  void tearDown() throws InterruptedException {
    metrics.shutdown();
    scheduler.shutdownNow();
    scheduler.awaitTermination(1, TimeUnit.SECONDS);
  }

  @Nested
  @DisplayName("Aggregation")
  class Aggregation {

    @Test
    void shouldComputeErrorRateInPercent() {
      // Given
      Instant now = Instant.now();
      for (int i = 0; i < 8; i++) {
        metrics.recordInvocation(InvocationRecord.success("op", now, 10));
      }
      metrics.recordInvocation(
          InvocationRecord.failure("op", now, 20, ErrorKind.OPERATION_FAILURE, "boom"));
      metrics.recordInvocation(
          InvocationRecord.failure("op", now, 30, ErrorKind.OPERATION_TIMEOUT, "late"));

      // Then
      assertEquals(10, metrics.getTotalInvocations());
      assertEquals(2, metrics.getFailedInvocations());
      assertEquals(20.0, metrics.getErrorRate(), 1e-9);
      assertEquals(13.0, metrics.getAverageResponseTime(), 1e-9);
    }

    @Test
    @DisplayName("Nearest-rank percentiles over 1..100")
    void shouldComputeNearestRankPercentiles() {
      Instant now = Instant.now();
      for (long d = 100; d >= 1; d--) {
        metrics.recordInvocation(InvocationRecord.success("op", now, d));
      }

      assertEquals(50, metrics.getPercentileResponseTime(50));
      assertEquals(95, metrics.getPercentileResponseTime(95));
      assertEquals(99, metrics.getPercentileResponseTime(99));
    }

    @Test
    void shouldReportZeroesWhenEmpty() {
      ExecutionMetrics summary = metrics.summarize(Duration.ofSeconds(1));

      assertEquals(0, summary.getTotalInvocations());
      assertEquals(0.0, summary.getErrorRatePct());
      assertEquals(0, summary.getP95ResponseTimeMs());
      assertEquals(0.0, summary.getThroughput());
    }
  }

  @Test
  @DisplayName("Summary breaks errors down by kind and operation")
  void shouldSummarizeErrors() {
    // Given
    Instant now = Instant.now();
    metrics.recordInvocation(InvocationRecord.success("read", now, 5));
    metrics.recordInvocation(
        InvocationRecord.failure("write", now, 5, ErrorKind.VALIDATION_FAILURE, "bad row"));
    metrics.recordInvocation(
        InvocationRecord.failure("write", now, 5, ErrorKind.OPERATION_FAILURE, "locked"));

    // When
    ExecutionMetrics summary = metrics.summarize(Duration.ofSeconds(2));

    // Then
    assertEquals(1.5, summary.getThroughput(), 1e-9);
    assertEquals(2L, summary.getErrorSummary().getErrorsByOperation().get("write"));
    assertEquals(1L, summary.getErrorSummary().getErrorsByKind().get(ErrorKind.VALIDATION_FAILURE));
    assertEquals(2L, summary.getInvocationsByOperation().get("write"));
    assertEquals(2, summary.getRecentErrors().size());
  }

  @Test
  @DisplayName("Records from concurrent workers are all counted")
  void shouldCountConcurrentRecords() throws Exception {
    // Given
    ExecutorService pool = Executors.newFixedThreadPool(8);
    List<Future<?>> futures = new ArrayList<>();

    // When
    for (int t = 0; t < 8; t++) {
      futures.add(
          pool.submit(
              () -> {
                for (int i = 0; i < 500; i++) {
                  metrics.recordInvocation(InvocationRecord.success("op", Instant.now(), 1));
                }
              }));
    }
    for (Future<?> future : futures) {
      future.get(5, TimeUnit.SECONDS);
    }
    pool.shutdown();

    // Then
    assertEquals(4_000, metrics.getTotalInvocations());
    assertEquals(4_000, metrics.getRecords().size());
  }

  @Test
  @DisplayName("Windows rotate on schedule and close on shutdown")
  void shouldRotateWindows() {
    metrics.recordInvocation(InvocationRecord.success("op", Instant.now(), 10));

    await().atMost(Duration.ofSeconds(3)).until(() -> !metrics.getMetricsWindows().isEmpty());
    metrics.shutdown();

    List<WindowSummary> windows = metrics.summarizeWindows();
    assertTrue(windows.size() >= 2);
    assertEquals(1, metrics.getMetricsWindows().get(0).getInvocationCount().get());
  }
}
