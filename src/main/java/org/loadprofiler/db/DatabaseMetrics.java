package org.loadprofiler.db;

import java.util.List;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class DatabaseMetrics {
  private final String benchmarkName;
  private final int iterations;
  private final int concurrency;
  private final long durationMs;

  private final long executedStatements;
  private final long failedStatements;
  private final long validationFailures;
  private final double statementsPerSecond;

  private final QueryMetrics queries;

  /** {@code null} when no storage inspector was available or inspection failed. */
  private final StorageMetrics storage;

  private final List<String> existingIndexes;
  private final List<MissingIndex> missingIndexes;
  private final List<DatabaseInsight> insights;
  private final List<OptimizationRecommendation> recommendations;
}
