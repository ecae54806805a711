package org.loadprofiler.memory;

import java.util.ArrayList;
import java.util.List;
import org.loadprofiler.metrics.Severity;

/** Checks the latest state of the sampled series for allocation, collection and heap pressure. */
public class PressureDetector {

  static final int MIN_SNAPSHOTS = 5;
  static final long ALLOCATION_SPIKE_BYTES = 50 * MemoryUnits.MB;
  static final int GC_WINDOW = 10;
  static final int MIN_GC_EVENTS = 5;
  static final double GC_PAUSE_THRESHOLD_MS = 100;
  static final double HEAP_UTILIZATION_THRESHOLD = 0.9;

  public List<PressurePoint> detect(List<ResourceSnapshot> snapshots, List<GcEvent> gcEvents) {
    List<PressurePoint> points = new ArrayList<>();
    if (snapshots.size() < MIN_SNAPSHOTS) {
      return points;
    }

    ResourceSnapshot current = snapshots.get(snapshots.size() - 1);
    ResourceSnapshot previous = snapshots.get(snapshots.size() - 2);

    long heapIncrease = current.heapUsed() - previous.heapUsed();
    if (heapIncrease > ALLOCATION_SPIKE_BYTES) {
      points.add(
          PressurePoint.builder()
              .timestamp(current.timestamp())
              .type(PressureType.ALLOCATION_SPIKE)
              .severity(Severity.HIGH)
              .value(heapIncrease)
              .threshold(ALLOCATION_SPIKE_BYTES)
              .description(
                  String.format(
                      "Large heap allocation of %dMB between samples",
                      Math.round(MemoryUnits.toMb(heapIncrease))))
              .build());
    }

    List<GcEvent> recentGc =
        gcEvents.subList(Math.max(0, gcEvents.size() - GC_WINDOW), gcEvents.size());
    if (recentGc.size() >= MIN_GC_EVENTS) {
      double averagePause = recentGc.stream().mapToLong(GcEvent::durationMs).average().orElse(0);
      if (averagePause > GC_PAUSE_THRESHOLD_MS) {
        points.add(
            PressurePoint.builder()
                .timestamp(current.timestamp())
                .type(PressureType.GC_PRESSURE)
                .severity(Severity.MEDIUM)
                .value(averagePause)
                .threshold(GC_PAUSE_THRESHOLD_MS)
                .description(
                    String.format("High GC pressure with %.2fms average pause time", averagePause))
                .build());
      }
    }

    double utilization = current.heapUtilization();
    if (utilization > HEAP_UTILIZATION_THRESHOLD) {
      points.add(
          PressurePoint.builder()
              .timestamp(current.timestamp())
              .type(PressureType.HEAP_EXHAUSTION)
              .severity(Severity.CRITICAL)
              .value(utilization)
              .threshold(HEAP_UTILIZATION_THRESHOLD)
              .description(String.format("High heap utilization at %.1f%%", utilization * 100))
              .build());
    }

    return points;
  }
}
