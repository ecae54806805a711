package org.loadprofiler.memory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.ToLongFunction;

/**
 * Least-squares trend of a memory metric against sample order. The slope is converted to bytes per
 * second using the mean spacing of the samples.
 */
public class TrendAnalyzer {

  public static final int DEFAULT_MIN_SAMPLES = 10;
  public static final double DEFAULT_DEAD_ZONE_BYTES_PER_SEC = MemoryUnits.KB;

  private static final Map<String, ToLongFunction<ResourceSnapshot>> TRACKED_METRICS =
      new LinkedHashMap<>();

  static {
    TRACKED_METRICS.put("heapUsed", ResourceSnapshot::heapUsed);
    TRACKED_METRICS.put("heapCommitted", ResourceSnapshot::heapCommitted);
    TRACKED_METRICS.put("external", ResourceSnapshot::external);
    TRACKED_METRICS.put("rss", ResourceSnapshot::rss);
  }

  private final int minSamples;
  private final double deadZone;

  public TrendAnalyzer() {
    this(DEFAULT_MIN_SAMPLES, DEFAULT_DEAD_ZONE_BYTES_PER_SEC);
  }

  public TrendAnalyzer(int minSamples, double deadZoneBytesPerSec) {
    this.minSamples = Math.max(2, minSamples);
    this.deadZone = deadZoneBytesPerSec;
  }

  /** Trends for every tracked metric; empty when there are too few snapshots. */
  public List<MemoryTrend> analyze(List<ResourceSnapshot> snapshots) {
    List<MemoryTrend> trends = new ArrayList<>();
    TRACKED_METRICS.forEach(
        (name, extractor) -> analyze(name, snapshots, extractor).ifPresent(trends::add));
    return trends;
  }

  public Optional<MemoryTrend> analyze(
      String metric, List<ResourceSnapshot> snapshots, ToLongFunction<ResourceSnapshot> extractor) {
    int n = snapshots.size();
    if (n < minSamples) {
      return Optional.empty();
    }

    double meanX = (n - 1) / 2.0;
    double meanY = 0;
    for (ResourceSnapshot snapshot : snapshots) {
      meanY += extractor.applyAsLong(snapshot);
    }
    meanY /= n;

    double sxy = 0;
    double sxx = 0;
    double syy = 0;
    for (int i = 0; i < n; i++) {
      double dx = i - meanX;
      double dy = extractor.applyAsLong(snapshots.get(i)) - meanY;
      sxy += dx * dy;
      sxx += dx * dx;
      syy += dy * dy;
    }

    double slopePerSample = sxx > 0 ? sxy / sxx : 0;
    double correlation = sxx > 0 && syy > 0 ? sxy / Math.sqrt(sxx * syy) : 0;

    long spanMs =
        snapshots.get(n - 1).timestamp().toEpochMilli() - snapshots.get(0).timestamp().toEpochMilli();
    double secondsPerSample = spanMs > 0 ? spanMs / 1000.0 / (n - 1) : 1.0;
    double slopePerSecond = slopePerSample / secondsPerSample;

    TrendDirection direction;
    if (slopePerSecond > deadZone) {
      direction = TrendDirection.INCREASING;
    } else if (slopePerSecond < -deadZone) {
      direction = TrendDirection.DECREASING;
    } else {
      direction = TrendDirection.STABLE;
    }

    return Optional.of(
        MemoryTrend.builder()
            .metric(metric)
            .direction(direction)
            .slopeBytesPerSec(slopePerSecond)
            .confidence(Math.abs(correlation))
            .samples(n)
            .build());
  }
}
