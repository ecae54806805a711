package org.loadprofiler.memory;

import static org.junit.jupiter.api.Assertions.*;
import static org.loadprofiler.memory.MemoryUnits.MB;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TrendAnalyzerTest {

  private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

  private final TrendAnalyzer analyzer = new TrendAnalyzer();

  private static List<ResourceSnapshot> series(int count, long spacingMs, long stepBytes) {
    List<ResourceSnapshot> snapshots = new ArrayList<>();
    for (int i = 0; i < count; i++) {
      snapshots.add(
          ScriptedMemoryReader.snapshot(START.plusMillis(i * spacingMs), 200 * MB + i * stepBytes));
    }
    return snapshots;
  }

  @Test
  @DisplayName("A steady climb is increasing with full confidence")
  void shouldDetectIncreasingTrend() {
    // When
    Optional<MemoryTrend> trend =
        analyzer.analyze("heapUsed", series(12, 1_000, MB), ResourceSnapshot::heapUsed);

    // Then
    assertTrue(trend.isPresent());
    assertEquals(TrendDirection.INCREASING, trend.get().getDirection());
    assertEquals(MB, trend.get().getSlopeBytesPerSec(), 1.0);
    assertEquals(1.0, trend.get().getConfidence(), 1e-9);
    assertEquals(12, trend.get().getSamples());
  }

  @Test
  void shouldScaleSlopeBySampleSpacing() {
    Optional<MemoryTrend> trend =
        analyzer.analyze("heapUsed", series(10, 2_000, MB), ResourceSnapshot::heapUsed);

    assertEquals(MB / 2.0, trend.orElseThrow().getSlopeBytesPerSec(), 1.0);
  }

  @Test
  void shouldDetectDecreasingTrend() {
    MemoryTrend trend =
        analyzer.analyze("heapUsed", series(10, 1_000, -MB), ResourceSnapshot::heapUsed).orElseThrow();

    assertEquals(TrendDirection.DECREASING, trend.getDirection());
  }

  @Test
  @DisplayName("Flat or dead-zone slopes are stable")
  void shouldTreatSmallSlopesAsStable() {
    MemoryTrend flat =
        analyzer.analyze("heapUsed", series(10, 1_000, 0), ResourceSnapshot::heapUsed).orElseThrow();
    MemoryTrend tiny =
        analyzer.analyze("heapUsed", series(10, 1_000, 512), ResourceSnapshot::heapUsed).orElseThrow();

    assertEquals(TrendDirection.STABLE, flat.getDirection());
    assertEquals(0.0, flat.getConfidence());
    assertEquals(TrendDirection.STABLE, tiny.getDirection());
  }

  @Test
  void shouldNeedMinimumSamples() {
    assertTrue(analyzer.analyze(series(9, 1_000, MB)).isEmpty());
  }

  @Test
  void shouldTrackEveryMemoryMetric() {
    List<MemoryTrend> trends = analyzer.analyze(series(10, 1_000, MB));

    assertEquals(
        List.of("heapUsed", "heapCommitted", "external", "rss"),
        trends.stream().map(MemoryTrend::getMetric).toList());
    assertEquals(TrendDirection.STABLE, trends.get(2).getDirection());
    assertEquals(TrendDirection.INCREASING, trends.get(3).getDirection());
  }
}
