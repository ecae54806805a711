package org.loadprofiler.load;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.loadprofiler.event.BenchmarkListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks the phase of the current run. Phases advance {@code IDLE -> WARMUP -> MAIN -> COOLDOWN ->
 * REPORTING -> IDLE}; warmup and cooldown may be skipped, and any phase may fall back to {@code
 * IDLE} when a run aborts.
 */
public class BenchmarkPhaseManager {

  private static final Logger log = LoggerFactory.getLogger(BenchmarkPhaseManager.class);

  public enum BenchmarkPhase {
    IDLE,
    WARMUP,
    MAIN,
    COOLDOWN,
    REPORTING
  }

  private static final Map<BenchmarkPhase, Set<BenchmarkPhase>> TRANSITIONS =
      Map.of(
          BenchmarkPhase.IDLE, EnumSet.of(BenchmarkPhase.WARMUP, BenchmarkPhase.MAIN),
          BenchmarkPhase.WARMUP, EnumSet.of(BenchmarkPhase.MAIN, BenchmarkPhase.IDLE),
          BenchmarkPhase.MAIN,
              EnumSet.of(BenchmarkPhase.COOLDOWN, BenchmarkPhase.REPORTING, BenchmarkPhase.IDLE),
          BenchmarkPhase.COOLDOWN, EnumSet.of(BenchmarkPhase.REPORTING, BenchmarkPhase.IDLE),
          BenchmarkPhase.REPORTING, EnumSet.of(BenchmarkPhase.IDLE));

  private final AtomicReference<BenchmarkPhase> currentPhase =
      new AtomicReference<>(BenchmarkPhase.IDLE);
  private final AtomicBoolean running = new AtomicBoolean(false);
  private final BenchmarkListener listener;
  private volatile String runId;

  public BenchmarkPhaseManager(BenchmarkListener listener) {
    this.listener = listener;
  }

  /** Claims the manager for a run; fails if another run holds it. */
  public void startRun(String runId) {
    if (!running.compareAndSet(false, true)) {
      throw new IllegalStateException("A benchmark run is already in progress: " + this.runId);
    }
    this.runId = runId;
  }

  public void transitionTo(BenchmarkPhase next) {
    BenchmarkPhase previous = currentPhase.get();
    if (!TRANSITIONS.get(previous).contains(next)) {
      throw new IllegalStateException("Illegal phase transition: " + previous + " -> " + next);
    }
    if (!currentPhase.compareAndSet(previous, next)) {
      throw new IllegalStateException("Concurrent phase transition from " + previous);
    }
    log.debug("Phase transition: {} -> {}", previous, next);
    listener.onPhaseChanged(runId, previous, next);
  }

  /** Returns to {@code IDLE} from wherever the run stopped and releases the manager. */
  public void finishRun() {
    if (currentPhase.get() != BenchmarkPhase.IDLE) {
      transitionTo(BenchmarkPhase.IDLE);
    }
    running.set(false);
  }

  public BenchmarkPhase getCurrentPhase() {
    return currentPhase.get();
  }

  public boolean isRunning() {
    return running.get();
  }
}
