package org.loadprofiler.metrics;

import java.time.Instant;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ErrorInfo {
  private final Instant timestamp;
  private final String operationName;
  private final ErrorKind kind;
  private final String message;
}
