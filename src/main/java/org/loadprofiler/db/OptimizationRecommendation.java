package org.loadprofiler.db;

import java.util.List;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class OptimizationRecommendation {

  public enum Type {
    QUERY,
    INDEX,
    CONFIGURATION
  }

  private final Type type;
  private final int priority;
  private final String title;
  private final String description;
  private final String implementation;
  private final List<String> sqlCommands;
}
