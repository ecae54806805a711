package org.loadprofiler.memory;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class MemoryAnalysis {
  private final Instant startTime;
  private final Instant endTime;
  private final int sampleCount;

  private final long peakHeapUsedBytes;
  private final double averageHeapUsedBytes;
  private final long heapGrowthBytes;
  private final long peakRssBytes;
  private final long peakExternalBytes;

  /** Mean process CPU load in percent; 0 when the platform does not report it. */
  private final double averageCpuLoadPct;

  private final List<MemoryLeak> leaks;
  private final List<MemoryTrend> trends;
  private final List<PressurePoint> pressurePoints;
  private final GcAnalysis gcAnalysis;
  private final List<MemoryRecommendation> recommendations;

  private final double memoryEfficiency;
  private final double overallScore;
}
