package org.loadprofiler.memory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Turns a sampled series into a {@link MemoryAnalysis}. */
public class MemoryAnalyzer {

  private static final double LEAK_FIX_RATE = 100 * MemoryUnits.KB;
  private static final double SLOW_PAUSE_MS = 50;
  private static final double FREQUENT_COLLECTIONS_PER_MINUTE = 10;
  private static final double LOW_EFFICIENCY_BYTES_PER_MS = 1000;

  private final TrendAnalyzer trendAnalyzer;

  public MemoryAnalyzer(TrendAnalyzer trendAnalyzer) {
    this.trendAnalyzer = trendAnalyzer;
  }

  public MemoryAnalysis analyze(
      Instant startTime,
      Instant endTime,
      List<ResourceSnapshot> snapshots,
      List<GcEvent> gcEvents,
      List<MemoryLeak> leaks,
      List<PressurePoint> pressurePoints) {
    List<MemoryTrend> trends = trendAnalyzer.analyze(snapshots);
    double spanMinutes = Math.max(1, endTime.toEpochMilli() - startTime.toEpochMilli()) / 60_000.0;
    GcAnalysis gcAnalysis = analyzeGc(gcEvents, spanMinutes);

    long peakHeap = snapshots.stream().mapToLong(ResourceSnapshot::heapUsed).max().orElse(0);
    double averageHeap =
        snapshots.stream().mapToLong(ResourceSnapshot::heapUsed).average().orElse(0);
    long growth =
        snapshots.size() > 1
            ? snapshots.get(snapshots.size() - 1).heapUsed() - snapshots.get(0).heapUsed()
            : 0;
    double averageCpu =
        snapshots.stream()
                .mapToDouble(ResourceSnapshot::processCpuLoad)
                .filter(load -> load >= 0)
                .average()
                .orElse(0)
            * 100;

    double averageGcEfficiency =
        gcEvents.isEmpty()
            ? 100
            : gcEvents.stream()
                .mapToDouble(e -> e.durationMs() > 0 ? (double) e.freed() / e.durationMs() : 0)
                .average()
                .orElse(0);
    double memoryEfficiency = Math.max(0, 100 - (double) growth / (100 * MemoryUnits.MB));
    double gcScore = Math.min(100, averageGcEfficiency / 10);
    double stabilityScore = growth < 50 * MemoryUnits.MB ? 100 : 50;

    return MemoryAnalysis.builder()
        .startTime(startTime)
        .endTime(endTime)
        .sampleCount(snapshots.size())
        .peakHeapUsedBytes(peakHeap)
        .averageHeapUsedBytes(averageHeap)
        .heapGrowthBytes(growth)
        .peakRssBytes(snapshots.stream().mapToLong(ResourceSnapshot::rss).max().orElse(0))
        .peakExternalBytes(snapshots.stream().mapToLong(ResourceSnapshot::external).max().orElse(0))
        .averageCpuLoadPct(averageCpu)
        .leaks(List.copyOf(leaks))
        .trends(trends)
        .pressurePoints(List.copyOf(pressurePoints))
        .gcAnalysis(gcAnalysis)
        .recommendations(recommend(trends, gcAnalysis))
        .memoryEfficiency(memoryEfficiency)
        .overallScore((gcScore + memoryEfficiency + stabilityScore) / 3)
        .build();
  }

  GcAnalysis analyzeGc(List<GcEvent> events, double spanMinutes) {
    long totalPause = events.stream().mapToLong(GcEvent::durationMs).sum();
    long totalFreed = events.stream().mapToLong(GcEvent::freed).sum();
    double averagePause = events.isEmpty() ? 0 : (double) totalPause / events.size();
    double efficiency = totalPause > 0 ? (double) totalFreed / totalPause : 0;
    double frequency = spanMinutes > 0 ? events.size() / spanMinutes : 0;

    List<String> recommendations = new ArrayList<>();
    if (averagePause > SLOW_PAUSE_MS) {
      recommendations.add("Consider tuning GC parameters to reduce pause times");
    }
    if (frequency > FREQUENT_COLLECTIONS_PER_MINUTE) {
      recommendations.add("High GC frequency indicates memory pressure - review allocation patterns");
    }
    if (totalPause > 0 && efficiency < LOW_EFFICIENCY_BYTES_PER_MS) {
      recommendations.add(
          "Low GC efficiency - investigate memory fragmentation and object lifetimes");
    }

    return GcAnalysis.builder()
        .totalCollections(events.size())
        .totalPauseMs(totalPause)
        .averagePauseMs(averagePause)
        .maxPauseMs(events.stream().mapToLong(GcEvent::durationMs).max().orElse(0))
        .totalFreedBytes(totalFreed)
        .efficiency(efficiency)
        .collectionsPerMinute(frequency)
        .recommendations(recommendations)
        .build();
  }

  private List<MemoryRecommendation> recommend(List<MemoryTrend> trends, GcAnalysis gcAnalysis) {
    List<MemoryRecommendation> recommendations = new ArrayList<>();

    Optional<MemoryTrend> heapTrend = find(trends, "heapUsed");
    if (heapTrend.isPresent()
        && heapTrend.get().getDirection() == TrendDirection.INCREASING
        && heapTrend.get().getSlopeBytesPerSec() > LEAK_FIX_RATE) {
      recommendations.add(
          MemoryRecommendation.builder()
              .category(MemoryRecommendation.Category.LEAK_FIX)
              .priority(1)
              .title("Address Memory Growth")
              .description(
                  String.format(
                      "Heap usage is growing at %dKB/sec",
                      Math.round(heapTrend.get().getSlopeBytesPerSec() / MemoryUnits.KB)))
              .implementation("Review object lifecycle management and release references early")
              .build());
    }

    if (gcAnalysis.getAveragePauseMs() > SLOW_PAUSE_MS) {
      recommendations.add(
          MemoryRecommendation.builder()
              .category(MemoryRecommendation.Category.GC_TUNING)
              .priority(2)
              .title("Optimize Garbage Collection")
              .description(
                  String.format(
                      "Average GC pause time of %.2fms affects performance",
                      gcAnalysis.getAveragePauseMs()))
              .implementation("Reduce allocation churn and review collector and heap sizing")
              .build());
    }

    Optional<MemoryTrend> externalTrend = find(trends, "external");
    if (externalTrend.isPresent()
        && externalTrend.get().getDirection() == TrendDirection.INCREASING) {
      recommendations.add(
          MemoryRecommendation.builder()
              .category(MemoryRecommendation.Category.OPTIMIZATION)
              .priority(3)
              .title("Optimize Off-Heap Memory Usage")
              .description(
                  "Off-heap memory usage is increasing, indicating potential buffer or stream leaks")
              .implementation("Review direct buffer usage and close streams and channels")
              .build());
    }

    return recommendations;
  }

  private static Optional<MemoryTrend> find(List<MemoryTrend> trends, String metric) {
    return trends.stream().filter(trend -> metric.equals(trend.getMetric())).findFirst();
  }
}
