package org.loadprofiler.report;

import lombok.Builder;
import lombok.Data;
import org.loadprofiler.metrics.Severity;

@Data
@Builder
public class Recommendation {

  public enum Category {
    PERFORMANCE,
    SCALABILITY,
    RELIABILITY,
    EFFICIENCY
  }

  public enum Effort {
    LOW,
    MEDIUM,
    HIGH
  }

  private final Category category;
  private final Severity priority;
  private final String title;
  private final String description;
  private final String implementation;
  private final String estimatedImpact;
  private final Effort effort;
}
