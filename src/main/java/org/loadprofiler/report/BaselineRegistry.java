package org.loadprofiler.report;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.loadprofiler.dto.BenchmarkConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Baselines, completed reports and in-progress runs for any number of orchestrators. Must be
 * {@link #init() initialized} before use; {@link #dispose()} clears everything.
 *
 * <p>The baseline of a test is replaced by the metrics of each completed run, so regressions are
 * always measured against the previous run.
 */
public class BaselineRegistry {

  private static final Logger log = LoggerFactory.getLogger(BaselineRegistry.class);

  private final Map<String, MetricsSnapshot> baselines = new ConcurrentHashMap<>();
  private final Map<String, PerformanceReport> results = new ConcurrentHashMap<>();
  private final Map<String, BenchmarkConfig> activeRuns = new ConcurrentHashMap<>();
  private final AtomicBoolean initialized = new AtomicBoolean(false);

  public BaselineRegistry init() {
    if (initialized.compareAndSet(false, true)) {
      log.debug("Baseline registry initialized");
    }
    return this;
  }

  public void dispose() {
    if (initialized.compareAndSet(true, false)) {
      if (!activeRuns.isEmpty()) {
        log.warn("Disposing baseline registry with {} active runs", activeRuns.size());
      }
      baselines.clear();
      results.clear();
      activeRuns.clear();
      log.debug("Baseline registry disposed");
    }
  }

  public boolean isInitialized() {
    return initialized.get();
  }

  public Optional<MetricsSnapshot> getBaseline(String testName) {
    checkInitialized();
    return Optional.ofNullable(baselines.get(testName));
  }

  public void updateBaseline(String testName, MetricsSnapshot metrics) {
    checkInitialized();
    baselines.put(testName, metrics);
  }

  public void beginRun(String runId, BenchmarkConfig config) {
    checkInitialized();
    activeRuns.put(runId, config);
  }

  /** Records a completed run and makes its metrics the test's new baseline. */
  public void completeRun(PerformanceReport report) {
    checkInitialized();
    activeRuns.remove(report.getRunId());
    results.put(report.getRunId(), report);
    baselines.put(report.getTestName(), report.getKeyMetrics());
  }

  /** Forgets a run that ended without a report. */
  public void abandonRun(String runId) {
    checkInitialized();
    activeRuns.remove(runId);
  }

  public Optional<PerformanceReport> getResult(String runId) {
    checkInitialized();
    return Optional.ofNullable(results.get(runId));
  }

  public List<PerformanceReport> getResults() {
    checkInitialized();
    return new ArrayList<>(results.values());
  }

  public Map<String, BenchmarkConfig> getActiveRuns() {
    checkInitialized();
    return Map.copyOf(activeRuns);
  }

  private void checkInitialized() {
    Preconditions.checkState(initialized.get(), "Baseline registry is not initialized");
  }
}
