package org.loadprofiler.memory;

import java.time.Instant;
import lombok.Builder;
import lombok.Data;
import org.loadprofiler.metrics.Severity;

@Data
@Builder
public class PressurePoint {
  private final Instant timestamp;
  private final PressureType type;
  private final Severity severity;
  private final double value;
  private final double threshold;
  private final String description;
}
