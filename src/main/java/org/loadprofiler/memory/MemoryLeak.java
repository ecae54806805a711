package org.loadprofiler.memory;

import java.time.Instant;
import lombok.Builder;
import lombok.Data;
import org.loadprofiler.metrics.Severity;

@Data
@Builder
public class MemoryLeak {
  private final Instant detectedAt;
  private final LeakType type;
  private final Severity severity;
  private final long growthBytes;
  private final double growthRateBytesPerSec;
  private final double windowSeconds;
  private final String description;
  private final String recommendation;
}
