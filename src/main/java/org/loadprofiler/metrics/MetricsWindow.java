package org.loadprofiler.metrics;

import com.google.common.collect.EvictingQueue;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAccumulator;
import lombok.Getter;

/**
 * Counters for one fixed-length slice of the main phase. Percentiles come from the most recent
 * {@value #LATENCY_RESERVOIR} durations recorded into the window.
 */
public class MetricsWindow {

  static final int LATENCY_RESERVOIR = 1000;

  @Getter private final int windowNumber;
  @Getter private final Instant startTime;
  @Getter private final int windowSizeSeconds;
  @Getter private volatile Instant endTime;

  @Getter private final AtomicLong invocationCount = new AtomicLong(0);
  private final AtomicLong failures = new AtomicLong(0);
  private final AtomicLong durationSumMs = new AtomicLong(0);
  private final LongAccumulator fastestMs = new LongAccumulator(Math::min, Long.MAX_VALUE);
  private final LongAccumulator slowestMs = new LongAccumulator(Math::max, Long.MIN_VALUE);

  private final EvictingQueue<Long> recentDurations = EvictingQueue.create(LATENCY_RESERVOIR);

  public MetricsWindow(int windowNumber, Instant startTime, int windowSizeSeconds) {
    this.windowNumber = windowNumber;
    this.startTime = startTime;
    this.windowSizeSeconds = windowSizeSeconds;
  }

  public void record(InvocationRecord record) {
    long duration = record.durationMs();
    invocationCount.incrementAndGet();
    durationSumMs.addAndGet(duration);
    fastestMs.accumulate(duration);
    slowestMs.accumulate(duration);
    if (!record.succeeded()) {
      failures.incrementAndGet();
    }
    synchronized (recentDurations) {
      recentDurations.add(duration);
    }
  }

  public void close(Instant endTime) {
    this.endTime = endTime;
  }

  public long getFailureCount() {
    return failures.get();
  }

  /** Failed share of the window's invocations, in percent. */
  public double getErrorRate() {
    long count = invocationCount.get();
    return count == 0 ? 0.0 : failures.get() * 100.0 / count;
  }

  public double getAverageResponseTime() {
    long count = invocationCount.get();
    return count == 0 ? 0.0 : (double) durationSumMs.get() / count;
  }

  public long getMinResponseTime() {
    long fastest = fastestMs.get();
    return fastest == Long.MAX_VALUE ? 0 : fastest;
  }

  public long getMaxResponseTime() {
    long slowest = slowestMs.get();
    return slowest == Long.MIN_VALUE ? 0 : slowest;
  }

  public long getPercentileResponseTime(double percentile) {
    List<Long> durations;
    synchronized (recentDurations) {
      durations = new ArrayList<>(recentDurations);
    }
    return Percentiles.of(durations, percentile);
  }

  /** Invocations per second over the window's actual span once closed, its nominal size before. */
  public double getThroughput() {
    double seconds = windowSizeSeconds;
    if (endTime != null) {
      long spanMs = Duration.between(startTime, endTime).toMillis();
      if (spanMs > 0) {
        seconds = spanMs / 1000.0;
      }
    }
    return seconds > 0 ? invocationCount.get() / seconds : 0.0;
  }

  public WindowSummary summarize() {
    return WindowSummary.builder()
        .windowNumber(windowNumber)
        .startTime(startTime)
        .endTime(endTime)
        .windowSizeSeconds(windowSizeSeconds)
        .invocations(invocationCount.get())
        .failures(failures.get())
        .errorRatePct(getErrorRate())
        .averageResponseTimeMs(getAverageResponseTime())
        .p50ResponseTimeMs(getPercentileResponseTime(50.0))
        .p95ResponseTimeMs(getPercentileResponseTime(95.0))
        .p99ResponseTimeMs(getPercentileResponseTime(99.0))
        .minResponseTimeMs(getMinResponseTime())
        .maxResponseTimeMs(getMaxResponseTime())
        .throughput(getThroughput())
        .build();
  }
}
