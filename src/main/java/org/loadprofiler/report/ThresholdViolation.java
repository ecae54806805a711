package org.loadprofiler.report;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ThresholdViolation {
  private final String metric;
  private final double actual;
  private final double limit;
  private final String description;
}
