package org.loadprofiler.load;

import com.google.common.base.Stopwatch;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.loadprofiler.dto.Operation;
import org.loadprofiler.load.pattern.ShapingPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues invocations for one pattern over a fixed duration. Stops issuing once the duration has
 * elapsed or the shared cancel flag is set; invocations already in flight are awaited so their
 * outcomes are recorded.
 */
public class TrafficShaper {

  private static final Logger log = LoggerFactory.getLogger(TrafficShaper.class);
  private static final long PAUSE_CHUNK_MS = 100;

  private final ShapingPattern pattern;
  private final WeightedSelector<Operation> selector;
  private final OperationExecutor executor;
  private final int maxConcurrency;
  private final Duration duration;
  private final Duration rampUp;
  private final AtomicBoolean cancelled;
  private final AtomicLong issued = new AtomicLong(0);

  private volatile Stopwatch stopwatch;

  public TrafficShaper(
      ShapingPattern pattern,
      WeightedSelector<Operation> selector,
      OperationExecutor executor,
      int maxConcurrency,
      Duration duration,
      Duration rampUp,
      AtomicBoolean cancelled) {
    this.pattern = pattern;
    this.selector = selector;
    this.executor = executor;
    this.maxConcurrency = maxConcurrency;
    this.duration = duration;
    this.rampUp = rampUp;
    this.cancelled = cancelled;
  }

  /** Runs the pattern's strategy on the calling thread until the duration elapses or the run is cancelled. */
  public void run() {
    stopwatch = Stopwatch.createStarted();
    log.info(
        "Shaping {} traffic for {}s (max {} concurrent)",
        pattern.type(),
        duration.getSeconds(),
        maxConcurrency);

    ShapingStrategy strategy = new ShapingStrategyFactory().createStrategy(pattern);
    try {
      strategy.execute(this);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.debug("{} shaper interrupted", pattern.type());
    }

    log.info("{} shaper finished after {} invocations", pattern.type(), issued.get());
  }

  public boolean isActive() {
    return !cancelled.get()
        && !Thread.currentThread().isInterrupted()
        && elapsedMs() < duration.toMillis();
  }

  public long elapsedMs() {
    return stopwatch == null ? 0 : stopwatch.elapsed(TimeUnit.MILLISECONDS);
  }

  /** Issues up to {@code count} invocations through the gate and waits until all have completed. */
  void issueBatch(int count) throws InterruptedException {
    List<CompletableFuture<?>> batch = new ArrayList<>(count);
    for (int i = 0; i < count && isActive(); i++) {
      batch.add(executor.submit(selector.select()));
      issued.incrementAndGet();
    }
    if (!batch.isEmpty()) {
      CompletableFuture.allOf(batch.toArray(new CompletableFuture<?>[0])).join();
    }
  }

  /** Sleeps in short chunks, never past the end of the run and not at all once cancelled. */
  void pause(long millis) throws InterruptedException {
    long remaining = Math.min(millis, duration.toMillis() - elapsedMs());
    while (remaining > 0 && isActive()) {
      long chunk = Math.min(remaining, PAUSE_CHUNK_MS);
      Thread.sleep(chunk);
      remaining -= chunk;
    }
  }

  public ShapingPattern getPattern() {
    return pattern;
  }

  public int getMaxConcurrency() {
    return maxConcurrency;
  }

  public Duration getDuration() {
    return duration;
  }

  public Duration getRampUp() {
    return rampUp;
  }

  public long getIssuedCount() {
    return issued.get();
  }
}
