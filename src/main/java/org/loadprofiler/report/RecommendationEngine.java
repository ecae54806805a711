package org.loadprofiler.report;

import java.util.ArrayList;
import java.util.List;
import org.loadprofiler.metrics.Severity;

public final class RecommendationEngine {

  static final double LOW_THROUGHPUT = 100;

  private RecommendationEngine() {}

  public static List<Recommendation> generate(MetricsSnapshot metrics) {
    List<Recommendation> recommendations = new ArrayList<>();

    if (metrics.throughput() < LOW_THROUGHPUT) {
      recommendations.add(
          Recommendation.builder()
              .category(Recommendation.Category.PERFORMANCE)
              .priority(Severity.HIGH)
              .title("Optimize Operation Throughput")
              .description("Current throughput is below optimal levels")
              .implementation("Implement batch processing and async operations")
              .estimatedImpact("2-3x throughput improvement")
              .effort(Recommendation.Effort.MEDIUM)
              .build());
    }

    if (metrics.leakCount() > 0) {
      recommendations.add(
          Recommendation.builder()
              .category(Recommendation.Category.RELIABILITY)
              .priority(Severity.CRITICAL)
              .title("Fix Memory Leaks")
              .description("Memory leaks detected that could cause application crashes")
              .implementation("Review object lifecycle and implement proper cleanup")
              .estimatedImpact("Prevent memory-related crashes")
              .effort(Recommendation.Effort.HIGH)
              .build());
    }

    if (metrics.slowQueryCount() > 0) {
      recommendations.add(
          Recommendation.builder()
              .category(Recommendation.Category.PERFORMANCE)
              .priority(Severity.MEDIUM)
              .title("Optimize Database Queries")
              .description("Slow queries detected affecting performance")
              .implementation("Add indexes and optimize query structure")
              .estimatedImpact("50-80% query performance improvement")
              .effort(Recommendation.Effort.LOW)
              .build());
    }

    return recommendations;
  }
}
