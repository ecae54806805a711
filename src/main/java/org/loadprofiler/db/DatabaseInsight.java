package org.loadprofiler.db;

import lombok.Builder;
import lombok.Data;
import org.loadprofiler.metrics.Severity;

@Data
@Builder
public class DatabaseInsight {

  public enum Category {
    QUERY,
    STORAGE,
    INDEX
  }

  private final Category category;
  private final Severity severity;
  private final String title;
  private final String description;
}
