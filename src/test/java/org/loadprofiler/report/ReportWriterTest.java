package org.loadprofiler.report;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.loadprofiler.util.JsonUtil;

class ReportWriterTest {

  @TempDir Path tempDir;

  private static PerformanceReport report(String testName) {
    return report(testName, "run-42");
  }

  private static PerformanceReport report(String testName, String runId) {
    return PerformanceReport.builder()
        .runId(runId)
        .testName(testName)
        .startTime(Instant.parse("2024-03-05T10:15:00Z"))
        .endTime(Instant.parse("2024-03-05T10:16:30.250Z"))
        .durationMs(90_250)
        .terminationReason(PerformanceReport.TERMINATION_DURATION_COMPLETED)
        .keyMetrics(new MetricsSnapshot(12.5, 40, 95, 0.5, 128, 30, 0, 0, 0))
        .thresholdViolations(List.of())
        .success(true)
        .build();
  }

  @Test
  void shouldNameFileAfterTestAndEndTime() {
    assertEquals(
        "checkout_flow-2024-03-05T10-16-30-250Z-run-42.json",
        ReportWriter.fileName(report("checkout flow")));
  }

  @Test
  void shouldSanitizeUnsafeNames() {
    assertEquals("a_b_c.d-e", ReportWriter.sanitize(" a/b\\c.d-e "));
    assertEquals("benchmark", ReportWriter.sanitize("  "));
    assertEquals("benchmark", ReportWriter.sanitize(null));
  }

  @Test
  void shouldWriteReportAsJson() throws IOException {
    // Given
    Path reports = tempDir.resolve("nested").resolve("reports");
    ReportWriter writer = new ReportWriter(reports);

    // When
    Optional<Path> written = writer.write(report("checkout"));

    // Then
    assertTrue(written.isPresent());
    assertTrue(Files.exists(written.get()));
    JsonNode json = JsonUtil.mapper().readTree(written.get().toFile());
    assertEquals("run-42", json.get("runId").asText());
    assertEquals("2024-03-05T10:16:30.250Z", json.get("endTime").asText());
    assertEquals(12.5, json.get("keyMetrics").get("throughput").asDouble());
    assertTrue(json.get("success").asBoolean());
  }

  @Test
  void shouldReturnEmptyWhenDirectoryCannotBeCreated() throws IOException {
    Path blocker = Files.writeString(tempDir.resolve("not-a-dir"), "x");

    Optional<Path> written = new ReportWriter(blocker.resolve("reports")).write(report("x"));

    assertTrue(written.isEmpty());
  }

  @Test
  void shouldKeepReportsOfRunsEndingInTheSameMillisecond() throws IOException {
    // Given
    ReportWriter writer = new ReportWriter(tempDir);
    PerformanceReport first = report("checkout", "3f2a9c1e-0d4b-4a43-9d55-1f0c2b6e7a10");
    PerformanceReport second = report("checkout", "b71c04d2-5e8f-4c6a-8a1b-0e9d3c2f4b55");

    // When
    Path firstFile = writer.write(first).orElseThrow();
    Path secondFile = writer.write(second).orElseThrow();

    // Then
    assertNotEquals(firstFile, secondFile);
    assertTrue(firstFile.getFileName().toString().endsWith("-3f2a9c1e.json"));
    try (Stream<Path> files = Files.list(tempDir)) {
      assertEquals(2, files.count());
    }
  }
}
