package org.loadprofiler.report;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.loadprofiler.dto.BenchmarkConfig;

class BaselineRegistryTest {

  private BaselineRegistry registry;

  @BeforeEach
  void setUp() {
    registry = new BaselineRegistry().init();
  }

  @AfterEach
  void tearDown() {
    registry.dispose();
  }

  private static PerformanceReport report(String runId, String testName, double throughput) {
    return PerformanceReport.builder()
        .runId(runId)
        .testName(testName)
        .startTime(Instant.now())
        .endTime(Instant.now())
        .keyMetrics(new MetricsSnapshot(throughput, 10, 20, 0, 100, 10, 0, 0, 0))
        .build();
  }

  @Test
  @DisplayName("Completing a run stores the report and replaces the baseline")
  void shouldReplaceBaselineOnCompletion() {
    // Given
    BenchmarkConfig config = BenchmarkConfig.builder().name("checkout").build();
    registry.beginRun("run-1", config);
    assertTrue(registry.getActiveRuns().containsKey("run-1"));

    // When
    registry.completeRun(report("run-1", "checkout", 40));
    registry.beginRun("run-2", config);
    registry.completeRun(report("run-2", "checkout", 25));

    // Then
    assertTrue(registry.getActiveRuns().isEmpty());
    assertEquals(25, registry.getBaseline("checkout").orElseThrow().throughput());
    assertEquals(2, registry.getResults().size());
    assertEquals("run-1", registry.getResult("run-1").orElseThrow().getRunId());
  }

  @Test
  void shouldKeepBaselinesPerTestName() {
    registry.completeRun(report("a", "search", 10));
    registry.completeRun(report("b", "upload", 20));

    assertEquals(10, registry.getBaseline("search").orElseThrow().throughput());
    assertEquals(20, registry.getBaseline("upload").orElseThrow().throughput());
    assertTrue(registry.getBaseline("unknown").isEmpty());
  }

  @Test
  void shouldForgetAbandonedRunWithoutTouchingBaseline() {
    registry.updateBaseline("search", new MetricsSnapshot(5, 1, 1, 0, 1, 0, 0, 0, 0));
    registry.beginRun("failed", BenchmarkConfig.builder().name("search").build());

    registry.abandonRun("failed");

    assertTrue(registry.getActiveRuns().isEmpty());
    assertTrue(registry.getResult("failed").isEmpty());
    assertEquals(5, registry.getBaseline("search").orElseThrow().throughput());
  }

  @Test
  @DisplayName("Dispose clears state and blocks further use until re-initialized")
  void shouldRequireInitialization() {
    registry.completeRun(report("a", "search", 10));

    registry.dispose();

    assertFalse(registry.isInitialized());
    assertThrows(IllegalStateException.class, () -> registry.getBaseline("search"));
    registry.init();
    assertTrue(registry.getBaseline("search").isEmpty());
  }
}
