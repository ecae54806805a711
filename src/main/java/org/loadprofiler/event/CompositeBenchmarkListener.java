package org.loadprofiler.event;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.loadprofiler.db.SlowQueryRecord;
import org.loadprofiler.dto.BenchmarkConfig;
import org.loadprofiler.load.BenchmarkPhaseManager.BenchmarkPhase;
import org.loadprofiler.memory.GcEvent;
import org.loadprofiler.memory.MemoryLeak;
import org.loadprofiler.memory.PressurePoint;
import org.loadprofiler.memory.ResourceSnapshot;
import org.loadprofiler.report.PerformanceReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Fans callbacks out to registered listeners. A failing listener is logged and skipped. */
public class CompositeBenchmarkListener implements BenchmarkListener {

  private static final Logger log = LoggerFactory.getLogger(CompositeBenchmarkListener.class);

  private final List<BenchmarkListener> listeners = new CopyOnWriteArrayList<>();

  public CompositeBenchmarkListener(List<BenchmarkListener> listeners) {
    this.listeners.addAll(listeners);
  }

  public void add(BenchmarkListener listener) {
    listeners.add(listener);
  }

  public void remove(BenchmarkListener listener) {
    listeners.remove(listener);
  }

  private void dispatch(String event, Consumer<BenchmarkListener> callback) {
    for (BenchmarkListener listener : listeners) {
      try {
        callback.accept(listener);
      } catch (RuntimeException e) {
        log.warn("Listener {} failed handling {}", listener.getClass().getSimpleName(), event, e);
      }
    }
  }

  @Override
  public void onRunStarted(String runId, BenchmarkConfig config) {
    dispatch("run-started", listener -> listener.onRunStarted(runId, config));
  }

  @Override
  public void onPhaseChanged(String runId, BenchmarkPhase previous, BenchmarkPhase current) {
    dispatch("phase-changed", listener -> listener.onPhaseChanged(runId, previous, current));
  }

  @Override
  public void onRunCompleted(PerformanceReport report) {
    dispatch("run-completed", listener -> listener.onRunCompleted(report));
  }

  @Override
  public void onSample(ResourceSnapshot snapshot) {
    dispatch("sample", listener -> listener.onSample(snapshot));
  }

  @Override
  public void onLeakDetected(MemoryLeak leak) {
    dispatch("leak", listener -> listener.onLeakDetected(leak));
  }

  @Override
  public void onPressureDetected(PressurePoint pressurePoint) {
    dispatch("pressure", listener -> listener.onPressureDetected(pressurePoint));
  }

  @Override
  public void onGcEvent(GcEvent event) {
    dispatch("gc-event", listener -> listener.onGcEvent(event));
  }

  @Override
  public void onSlowQuery(SlowQueryRecord record) {
    dispatch("slow-query", listener -> listener.onSlowQuery(record));
  }
}
