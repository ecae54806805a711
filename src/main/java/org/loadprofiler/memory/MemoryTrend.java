package org.loadprofiler.memory;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class MemoryTrend {
  private final String metric;
  private final TrendDirection direction;
  private final double slopeBytesPerSec;

  /** Absolute Pearson correlation of the metric against sample order, in {@code [0, 1]}. */
  private final double confidence;

  private final int samples;
}
