package org.loadprofiler.memory;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class MemoryRecommendation {

  public enum Category {
    LEAK_FIX,
    GC_TUNING,
    OPTIMIZATION
  }

  private final Category category;
  private final int priority;
  private final String title;
  private final String description;
  private final String implementation;
}
