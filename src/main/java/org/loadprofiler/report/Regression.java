package org.loadprofiler.report;

import lombok.Builder;
import lombok.Data;

/** A metric that moved the wrong way against the previous run of the same test. */
@Data
@Builder
public class Regression {

  public enum Level {
    MINOR,
    MAJOR,
    SEVERE
  }

  private final String metric;
  private final double currentValue;
  private final double previousValue;

  /** Relative change in percent, or the difference in percentage points for the error rate. */
  private final double changePercent;

  /** The cutoff that was crossed for {@link #level}. */
  private final double threshold;

  private final Level level;
}
