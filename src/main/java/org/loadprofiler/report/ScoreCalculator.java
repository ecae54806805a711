package org.loadprofiler.report;

import org.loadprofiler.metrics.ExecutionMetrics;

/**
 * Overall score: the unweighted mean of four 0-100 sub-scores for throughput against target, error
 * rate, heap footprint and query latency.
 */
public final class ScoreCalculator {

  private ScoreCalculator() {}

  public static TestSummary summarize(
      ExecutionMetrics execution, MetricsSnapshot metrics, double targetRps) {
    double throughputScore =
        targetRps > 0 ? Math.min(100, metrics.throughput() / targetRps * 100) : 100;
    double errorScore = Math.max(0, 100 - metrics.errorRatePct() * 10);
    double memoryEfficiency = Math.max(0, 100 - metrics.peakHeapMb() / 1024 * 10);
    double databaseEfficiency = Math.max(0, 100 - metrics.averageQueryTimeMs() / 10);

    return TestSummary.builder()
        .totalOperations(execution.getTotalInvocations())
        .successfulOperations(execution.getSuccessfulInvocations())
        .failedOperations(execution.getFailedInvocations())
        .averageResponseTimeMs(execution.getAverageResponseTimeMs())
        .throughput(metrics.throughput())
        .errorRatePct(metrics.errorRatePct())
        .throughputScore(throughputScore)
        .errorScore(errorScore)
        .memoryEfficiency(memoryEfficiency)
        .databaseEfficiency(databaseEfficiency)
        .overallScore((throughputScore + errorScore + memoryEfficiency + databaseEfficiency) / 4)
        .build();
  }
}
