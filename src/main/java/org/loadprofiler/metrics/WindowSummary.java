package org.loadprofiler.metrics;

import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/** Aggregates of one fixed-size window of the main phase, as written to the report. */
@Data
@Builder
public class WindowSummary {
  private final int windowNumber;
  private final Instant startTime;
  private final Instant endTime;
  private final int windowSizeSeconds;

  private final long invocations;
  private final long failures;
  private final double errorRatePct;

  private final double averageResponseTimeMs;
  private final long p50ResponseTimeMs;
  private final long p95ResponseTimeMs;
  private final long p99ResponseTimeMs;
  private final long minResponseTimeMs;
  private final long maxResponseTimeMs;

  /** Invocations per second over the window's actual span. */
  private final double throughput;
}
