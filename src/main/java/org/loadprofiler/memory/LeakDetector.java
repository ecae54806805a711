package org.loadprofiler.memory;

import java.util.List;
import java.util.Optional;
import org.loadprofiler.metrics.Severity;

/**
 * Flags sustained heap growth across a window of consecutive snapshots.
 *
 * <p>Growth over the threshold is a candidate leak, typed by its rate: above 1 MB/s it is sudden,
 * below 100 KB/s gradual, anything between event-based.
 */
public class LeakDetector {

  public static final int DEFAULT_WINDOW = 10;
  public static final long DEFAULT_THRESHOLD_BYTES = 10L * MemoryUnits.MB;

  private static final double SUDDEN_RATE = MemoryUnits.MB;
  private static final double GRADUAL_RATE = 100 * MemoryUnits.KB;

  private final int window;
  private final long thresholdBytes;

  public LeakDetector() {
    this(DEFAULT_WINDOW, DEFAULT_THRESHOLD_BYTES);
  }

  public LeakDetector(int window, long thresholdBytes) {
    if (window < 2) {
      throw new IllegalArgumentException("Leak window needs at least 2 snapshots: " + window);
    }
    this.window = window;
    this.thresholdBytes = thresholdBytes;
  }

  public int getWindow() {
    return window;
  }

  /** Examines the most recent {@code window} snapshots of {@code history}. */
  public Optional<MemoryLeak> detect(List<ResourceSnapshot> history) {
    if (history.size() < window) {
      return Optional.empty();
    }
    List<ResourceSnapshot> recent = history.subList(history.size() - window, history.size());
    ResourceSnapshot first = recent.get(0);
    ResourceSnapshot last = recent.get(recent.size() - 1);

    long growth = last.heapUsed() - first.heapUsed();
    if (growth <= thresholdBytes) {
      return Optional.empty();
    }

    double seconds =
        Math.max(0.001, (last.timestamp().toEpochMilli() - first.timestamp().toEpochMilli()) / 1000.0);
    double rate = growth / seconds;

    return Optional.of(
        MemoryLeak.builder()
            .detectedAt(last.timestamp())
            .type(classify(rate))
            .severity(severity(growth, rate))
            .growthBytes(growth)
            .growthRateBytesPerSec(rate)
            .windowSeconds(seconds)
            .description(
                String.format(
                    "Heap grew %dMB over %.1fs (%.1fKB/s)",
                    Math.round((double) growth / MemoryUnits.MB),
                    seconds,
                    rate / MemoryUnits.KB))
            .recommendation(recommendation(growth))
            .build());
  }

  static LeakType classify(double rateBytesPerSec) {
    if (rateBytesPerSec > SUDDEN_RATE) {
      return LeakType.SUDDEN;
    }
    if (rateBytesPerSec > 0 && rateBytesPerSec < GRADUAL_RATE) {
      return LeakType.GRADUAL;
    }
    return LeakType.EVENT_BASED;
  }

  static Severity severity(long growthBytes, double rateBytesPerSec) {
    if (growthBytes > 100 * MemoryUnits.MB || rateBytesPerSec > 10 * MemoryUnits.MB) {
      return Severity.CRITICAL;
    }
    if (growthBytes > 50 * MemoryUnits.MB || rateBytesPerSec > 5 * MemoryUnits.MB) {
      return Severity.HIGH;
    }
    if (growthBytes > 20 * MemoryUnits.MB || rateBytesPerSec > MemoryUnits.MB) {
      return Severity.MEDIUM;
    }
    return Severity.LOW;
  }

  private static String recommendation(long growthBytes) {
    if (growthBytes > 50 * MemoryUnits.MB) {
      return "Critical memory leak detected. Review object lifecycle management and listener cleanup.";
    }
    if (growthBytes > 20 * MemoryUnits.MB) {
      return "Significant memory growth detected. Check for unclosed resources and lingering references.";
    }
    return "Minor memory growth detected. Monitor continued growth and review caching strategies.";
  }
}
