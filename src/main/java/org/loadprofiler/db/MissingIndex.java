package org.loadprofiler.db;

import java.util.List;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class MissingIndex {
  private final String table;
  private final List<String> columns;
  private final List<String> queryPatterns;
  private final String recommendation;
  private final String createStatement;
}
