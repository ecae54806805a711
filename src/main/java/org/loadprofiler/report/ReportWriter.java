package org.loadprofiler.report;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import org.loadprofiler.util.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes reports as indented JSON, one file per run, named {@code
 * <test-name>-<yyyy-MM-dd'T'HH-mm-ss-SSS'Z'>-<run-id prefix>.json} from the run's end time.
 */
public class ReportWriter {

  private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);
  private static final DateTimeFormatter FILE_TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss-SSS'Z'").withZone(ZoneOffset.UTC);

  private static final int RUN_ID_CHARS = 8;

  private final Path reportsDirectory;

  public ReportWriter(Path reportsDirectory) {
    this.reportsDirectory = reportsDirectory;
  }

  /** @return the written file, or empty when writing failed */
  public Optional<Path> write(PerformanceReport report) {
    Path file = reportsDirectory.resolve(fileName(report));
    try {
      Files.createDirectories(reportsDirectory);
      JsonUtil.write(file, report);
      log.info("Performance report saved: {}", file);
      return Optional.of(file);
    } catch (IOException | RuntimeException e) {
      log.error("Failed to write performance report for run {} to {}", report.getRunId(), file, e);
      return Optional.empty();
    }
  }

  static String fileName(PerformanceReport report) {
    return sanitize(report.getTestName())
        + "-"
        + FILE_TIMESTAMP.format(report.getEndTime())
        + "-"
        + runIdPrefix(report.getRunId())
        + ".json";
  }

  private static String runIdPrefix(String runId) {
    if (runId == null || runId.isBlank()) {
      return "run";
    }
    String safe = sanitize(runId);
    return safe.length() > RUN_ID_CHARS ? safe.substring(0, RUN_ID_CHARS) : safe;
  }

  static String sanitize(String testName) {
    if (testName == null || testName.isBlank()) {
      return "benchmark";
    }
    return testName.trim().replaceAll("[^A-Za-z0-9._-]+", "_");
  }

  public Path getReportsDirectory() {
    return reportsDirectory;
  }
}
