package org.loadprofiler.metrics;

import java.util.Map;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ErrorSummary {
  private final long totalErrors;
  private final Map<ErrorKind, Long> errorsByKind;
  private final Map<String, Long> errorsByOperation;
  private final Map<String, Long> errorsByMessage;
}
