package org.loadprofiler.report;

/**
 * The headline numbers of one run: what thresholds are checked against and what a baseline keeps
 * for the next run of the same test.
 *
 * @param peakHeapMb peak heap used during the main phase
 * @param cpuUtilizationPct mean process CPU load; 0 when the platform does not report it
 * @param averageQueryTimeMs mean instrumented query latency; 0 when nothing was instrumented
 */
public record MetricsSnapshot(
    double throughput,
    double averageResponseTimeMs,
    long p95ResponseTimeMs,
    double errorRatePct,
    double peakHeapMb,
    double cpuUtilizationPct,
    double averageQueryTimeMs,
    long slowQueryCount,
    int leakCount) {}
