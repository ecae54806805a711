package org.loadprofiler.memory;

import java.time.Instant;

/** One completed collection with heap occupancy before and after. */
public record GcEvent(
    Instant timestamp,
    long durationMs,
    long heapBefore,
    long heapAfter,
    String collector,
    String cause) {

  public long freed() {
    return Math.max(0, heapBefore - heapAfter);
  }
}
