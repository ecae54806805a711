package org.loadprofiler.memory;

import java.time.Instant;

/**
 * Point-in-time process health. {@code external} is memory held outside the heap (non-heap pools
 * plus direct and mapped buffers); {@code processCpuLoad} is in {@code [0, 1]} or negative when the
 * platform does not report it.
 */
public record ResourceSnapshot(
    Instant timestamp,
    long heapUsed,
    long heapCommitted,
    long heapMax,
    long external,
    long rss,
    long gcCount,
    long gcTimeMs,
    double processCpuLoad) {

  /** Used heap relative to the ceiling the heap can grow to. */
  public double heapUtilization() {
    long limit = heapMax > 0 ? heapMax : heapCommitted;
    return limit > 0 ? (double) heapUsed / limit : 0.0;
  }
}
