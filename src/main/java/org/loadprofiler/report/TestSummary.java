package org.loadprofiler.report;

import lombok.Builder;
import lombok.Data;

/** Headline counts and the 0-100 sub-scores that make up the overall score. */
@Data
@Builder
public class TestSummary {
  private final long totalOperations;
  private final long successfulOperations;
  private final long failedOperations;
  private final double averageResponseTimeMs;
  private final double throughput;
  private final double errorRatePct;

  private final double throughputScore;
  private final double errorScore;
  private final double memoryEfficiency;
  private final double databaseEfficiency;
  private final double overallScore;
}
