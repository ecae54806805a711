package org.loadprofiler.memory;

import java.time.Duration;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class SamplerSettings {
  @Builder.Default private final Duration interval = Duration.ofSeconds(1);
  @Builder.Default private final int capacity = 1000;
  @Builder.Default private final int leakWindow = LeakDetector.DEFAULT_WINDOW;
  @Builder.Default private final long leakThresholdBytes = LeakDetector.DEFAULT_THRESHOLD_BYTES;
  @Builder.Default private final int trendMinSamples = TrendAnalyzer.DEFAULT_MIN_SAMPLES;

  @Builder.Default
  private final double trendDeadZoneBytesPerSec = TrendAnalyzer.DEFAULT_DEAD_ZONE_BYTES_PER_SEC;
}
