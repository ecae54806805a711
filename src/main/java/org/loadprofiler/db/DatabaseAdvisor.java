package org.loadprofiler.db;

import java.util.ArrayList;
import java.util.List;
import org.loadprofiler.metrics.Severity;

/** Derives insights and tuning advice from collected database metrics. */
public final class DatabaseAdvisor {

  static final double SLOW_AVERAGE_QUERY_MS = 100;
  static final double HIGH_FRAGMENTATION_PCT = 20;

  private DatabaseAdvisor() {}

  public static List<DatabaseInsight> insights(
      QueryMetrics queries, StorageMetrics storage, List<MissingIndex> missingIndexes) {
    List<DatabaseInsight> insights = new ArrayList<>();

    if (queries.getAverageQueryTimeMs() > SLOW_AVERAGE_QUERY_MS) {
      insights.add(
          DatabaseInsight.builder()
              .category(DatabaseInsight.Category.QUERY)
              .severity(Severity.HIGH)
              .title("Slow Average Query Performance")
              .description(
                  String.format(
                      "Average query time of %.2fms exceeds the %.0fms threshold",
                      queries.getAverageQueryTimeMs(), SLOW_AVERAGE_QUERY_MS))
              .build());
    }

    if (storage != null && storage.getFragmentationPct() > HIGH_FRAGMENTATION_PCT) {
      insights.add(
          DatabaseInsight.builder()
              .category(DatabaseInsight.Category.STORAGE)
              .severity(Severity.MEDIUM)
              .title("High Database Fragmentation")
              .description(
                  String.format(
                      "Database fragmentation at %.1f%% indicates optimization needed",
                      storage.getFragmentationPct()))
              .build());
    }

    if (!missingIndexes.isEmpty()) {
      insights.add(
          DatabaseInsight.builder()
              .category(DatabaseInsight.Category.INDEX)
              .severity(Severity.MEDIUM)
              .title("Missing Database Indexes")
              .description(missingIndexes.size() + " potentially beneficial indexes identified")
              .build());
    }

    return insights;
  }

  public static List<OptimizationRecommendation> recommendations(
      QueryMetrics queries, StorageMetrics storage, List<MissingIndex> missingIndexes) {
    List<OptimizationRecommendation> recommendations = new ArrayList<>();

    if (queries.getSlowQueryCount() > 0) {
      recommendations.add(
          OptimizationRecommendation.builder()
              .type(OptimizationRecommendation.Type.QUERY)
              .priority(1)
              .title("Optimize Slow Queries")
              .description(queries.getSlowQueryCount() + " slow queries detected")
              .implementation("Review query execution plans and add appropriate indexes")
              .sqlCommands(List.of("EXPLAIN QUERY PLAN <slow query>"))
              .build());
    }

    for (MissingIndex missingIndex : missingIndexes) {
      recommendations.add(
          OptimizationRecommendation.builder()
              .type(OptimizationRecommendation.Type.INDEX)
              .priority(2)
              .title("Add Index for " + missingIndex.getTable())
              .description(missingIndex.getRecommendation())
              .implementation(
                  "Create composite index on " + String.join(", ", missingIndex.getColumns()))
              .sqlCommands(List.of(missingIndex.getCreateStatement()))
              .build());
    }

    if (storage != null && storage.isVacuumRecommended()) {
      recommendations.add(
          OptimizationRecommendation.builder()
              .type(OptimizationRecommendation.Type.CONFIGURATION)
              .priority(2)
              .title("Reclaim Free Pages")
              .description(
                  String.format(
                      "%d of %d pages are free", storage.getFreePages(), storage.getPageCount()))
              .implementation("Run VACUUM during a maintenance window")
              .sqlCommands(List.of("VACUUM"))
              .build());
    }

    recommendations.add(
        OptimizationRecommendation.builder()
            .type(OptimizationRecommendation.Type.CONFIGURATION)
            .priority(3)
            .title("Optimize SQLite Configuration")
            .description("Tune SQLite PRAGMA settings for better performance")
            .implementation("Apply performance-oriented PRAGMA settings")
            .sqlCommands(
                List.of(
                    "PRAGMA journal_mode = WAL",
                    "PRAGMA synchronous = NORMAL",
                    "PRAGMA cache_size = 10000",
                    "PRAGMA temp_store = MEMORY"))
            .build());

    return recommendations;
  }
}
