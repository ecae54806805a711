package org.loadprofiler.event;

import org.loadprofiler.db.SlowQueryRecord;
import org.loadprofiler.dto.BenchmarkConfig;
import org.loadprofiler.load.BenchmarkPhaseManager.BenchmarkPhase;
import org.loadprofiler.memory.GcEvent;
import org.loadprofiler.memory.MemoryLeak;
import org.loadprofiler.memory.PressurePoint;
import org.loadprofiler.memory.ResourceSnapshot;
import org.loadprofiler.report.PerformanceReport;

/**
 * Callbacks raised while a benchmark runs. Every method has an empty default so implementations
 * override only what they need. Callbacks arrive on sampler, worker and orchestrator threads and
 * must not block.
 */
public interface BenchmarkListener {

  BenchmarkListener NOOP = new BenchmarkListener() {};

  default void onRunStarted(String runId, BenchmarkConfig config) {}

  default void onPhaseChanged(String runId, BenchmarkPhase previous, BenchmarkPhase current) {}

  default void onRunCompleted(PerformanceReport report) {}

  default void onSample(ResourceSnapshot snapshot) {}

  default void onLeakDetected(MemoryLeak leak) {}

  default void onPressureDetected(PressurePoint pressurePoint) {}

  default void onGcEvent(GcEvent event) {}

  default void onSlowQuery(SlowQueryRecord record) {}
}
