package org.loadprofiler.load;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import org.loadprofiler.db.InstrumentedQueryExecutor;
import org.loadprofiler.db.QueryMetrics;
import org.loadprofiler.dto.BenchmarkConfig;
import org.loadprofiler.dto.BenchmarkConfigValidator;
import org.loadprofiler.dto.Operation;
import org.loadprofiler.event.BenchmarkListener;
import org.loadprofiler.event.CompositeBenchmarkListener;
import org.loadprofiler.event.LoggingBenchmarkListener;
import org.loadprofiler.exception.BenchmarkException;
import org.loadprofiler.load.BenchmarkPhaseManager.BenchmarkPhase;
import org.loadprofiler.load.pattern.ShapingPattern;
import org.loadprofiler.memory.GcEventMonitor;
import org.loadprofiler.memory.JvmMemoryReader;
import org.loadprofiler.memory.MemoryAnalysis;
import org.loadprofiler.memory.MemoryReader;
import org.loadprofiler.memory.ResourceSampler;
import org.loadprofiler.memory.SamplerSettings;
import org.loadprofiler.metrics.RunMetrics;
import org.loadprofiler.report.BaselineRegistry;
import org.loadprofiler.report.MetricsSnapshot;
import org.loadprofiler.report.PerformanceReport;
import org.loadprofiler.report.ReportAssembler;
import org.loadprofiler.report.ReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs benchmarks end to end: optional warmup, the shaped main phase with resource sampling and
 * query instrumentation, optional cooldown, then report assembly and the baseline update.
 *
 * <p>One orchestrator runs one benchmark at a time. Operational failures never abort a run; only
 * an invalid configuration is rejected, before any phase starts. {@link #cancel()} stops issuing
 * new invocations and the run still produces a report.
 *
 * <p>Thread pools are created per run by a {@link ResourceManager} and shut down when the run ends.
 */
public class BenchmarkOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(BenchmarkOrchestrator.class);
  static final int WARMUP_INVOCATIONS = 10;
  private static final long SLEEP_CHUNK_MS = 100;

  private final BaselineRegistry registry;
  private final InstrumentedQueryExecutor database;
  private final MemoryReader memoryReader;
  private final CompositeBenchmarkListener listener;
  private final BenchmarkPhaseManager phaseManager;
  private final AtomicBoolean cancelled = new AtomicBoolean(false);
  private final ThreadFactory runnerThreads =
      new ThreadFactoryBuilder().setNameFormat("benchmark-runner-%d").setDaemon(true).build();

  public BenchmarkOrchestrator(BaselineRegistry registry) {
    this(registry, null, List.of(new LoggingBenchmarkListener()));
  }

  /**
   * @param database instrumented handle whose statistics become the report's database section;
   *     {@code null} when the operations do not touch a database
   */
  public BenchmarkOrchestrator(
      BaselineRegistry registry, InstrumentedQueryExecutor database, List<BenchmarkListener> listeners) {
    this(registry, database, listeners, new JvmMemoryReader());
  }

  @VisibleForTesting
  BenchmarkOrchestrator(
      BaselineRegistry registry,
      InstrumentedQueryExecutor database,
      List<BenchmarkListener> listeners,
      MemoryReader memoryReader) {
    this.registry = registry;
    this.database = database;
    this.memoryReader = memoryReader;
    this.listener = new CompositeBenchmarkListener(listeners);
    this.phaseManager = new BenchmarkPhaseManager(listener);
  }

  /** Runs the benchmark on a dedicated thread. */
  public CompletableFuture<PerformanceReport> execute(BenchmarkConfig config) {
    Executor runner = command -> runnerThreads.newThread(command).start();
    return CompletableFuture.supplyAsync(() -> run(config), runner);
  }

  /**
   * Runs the benchmark on the calling thread and returns its report.
   *
   * @throws org.loadprofiler.exception.BenchmarkConfigurationException if the configuration is
   *     invalid
   * @throws IllegalStateException if this orchestrator is already running a benchmark
   */
  public PerformanceReport run(BenchmarkConfig config) {
    BenchmarkConfigValidator.validate(config);

    String runId = UUID.randomUUID().toString();
    phaseManager.startRun(runId);
    cancelled.set(false);

    ResourceManager resources = null;
    ResourceSampler sampler = null;
    RunMetrics metrics = null;
    Instant startTime = Instant.now();

    try {
      registry.beginRun(runId, config);
      resources = new ResourceManager();
      listener.onRunStarted(runId, config);
      log.info(
          "Starting benchmark '{}' ({}): duration {}, max {} concurrent, patterns {}",
          config.getName(),
          runId,
          config.getDuration(),
          config.getMaxConcurrency(),
          config.effectivePatterns());

      Optional<MetricsSnapshot> baseline = registry.getBaseline(config.getName());
      List<Operation> operations = config.getOperations().list();
      WeightedSelector<Operation> selector =
          new WeightedSelector<>(operations, Operation::getWeight);
      ConcurrencyGate gate = new ConcurrencyGate(config.getMaxConcurrency());

      // Phase 1: Warmup
      Duration warmupDuration = config.parsedWarmupDuration();
      if (!warmupDuration.isZero()) {
        phaseManager.transitionTo(BenchmarkPhase.WARMUP);
        executeWarmup(
            warmupDuration, selector, new OperationExecutor(resources.getWorkerExecutor(), gate, null));
      }

      // Phase 2: Main
      phaseManager.transitionTo(BenchmarkPhase.MAIN);
      metrics = new RunMetrics(resources.getSchedulerService(), config.getWindowSizeSeconds());
      sampler =
          new ResourceSampler(
              memoryReader,
              new GcEventMonitor(memoryReader),
              resources.getSchedulerService(),
              SamplerSettings.builder().interval(config.parsedSampleInterval()).build());
      sampler.setListener(listener);
      if (database != null) {
        database.setListener(listener);
        database.getStatistics().reset();
      }

      Stopwatch mainPhase = Stopwatch.createStarted();
      sampler.start();
      executeMainPhase(
          config, selector, new OperationExecutor(resources.getWorkerExecutor(), gate, metrics), resources);
      Duration mainDuration = mainPhase.elapsed();
      metrics.shutdown();
      QueryMetrics queries = database != null ? database.getStatistics().snapshot() : null;

      // Phase 3: Cooldown
      Duration cooldownDuration = config.parsedCooldownDuration();
      if (!cooldownDuration.isZero() && !cancelled.get()) {
        phaseManager.transitionTo(BenchmarkPhase.COOLDOWN);
        executeCooldown(cooldownDuration, sampler);
      }
      MemoryAnalysis memory = sampler.stop();

      // Phase 4: Reporting
      phaseManager.transitionTo(BenchmarkPhase.REPORTING);
      PerformanceReport report =
          new ReportAssembler(runId, config)
              .period(startTime, Instant.now())
              .terminationReason(
                  cancelled.get()
                      ? PerformanceReport.TERMINATION_CANCELLED
                      : PerformanceReport.TERMINATION_DURATION_COMPLETED)
              .execution(metrics.summarize(mainDuration), metrics.summarizeWindows())
              .memory(memory)
              .database(queries)
              .baseline(baseline)
              .assemble();

      registry.completeRun(report);
      if (config.getReportsDirectory() != null && !config.getReportsDirectory().isBlank()) {
        new ReportWriter(Path.of(config.getReportsDirectory())).write(report);
      }
      logReportSummary(report);
      listener.onRunCompleted(report);
      return report;

    } catch (RuntimeException e) {
      log.error("Benchmark '{}' failed", config.getName(), e);
      abandon(runId);
      if (e instanceof BenchmarkException) {
        throw e;
      }
      throw new BenchmarkException("Benchmark execution failed: " + config.getName(), e);

    } finally {
      if (sampler != null && sampler.isRunning()) {
        sampler.stop();
      }
      if (resources != null) {
        resources.cleanup();
      }
      phaseManager.finishRun();
    }
  }

  private void abandon(String runId) {
    try {
      registry.abandonRun(runId);
    } catch (IllegalStateException e) {
      log.warn("Could not abandon run {} in the baseline registry: {}", runId, e.getMessage());
    }
  }

  /** Stops issuing new invocations. In-flight invocations complete and the run still reports. */
  public void cancel() {
    if (cancelled.compareAndSet(false, true)) {
      log.info("Benchmark cancellation requested in phase {}", phaseManager.getCurrentPhase());
    }
  }

  public BenchmarkPhase getCurrentPhase() {
    return phaseManager.getCurrentPhase();
  }

  public boolean isRunning() {
    return phaseManager.isRunning();
  }

  private void executeWarmup(
      Duration warmupDuration, WeightedSelector<Operation> selector, OperationExecutor executor) {
    log.info("Starting warmup phase for {}ms", warmupDuration.toMillis());
    Stopwatch stopwatch = Stopwatch.createStarted();

    List<CompletableFuture<?>> warmup = new ArrayList<>();
    try {
      for (int i = 0; i < WARMUP_INVOCATIONS && !cancelled.get(); i++) {
        warmup.add(executor.submit(selector.select()));
      }
      CompletableFuture.allOf(warmup.toArray(new CompletableFuture<?>[0])).join();
      sleepUnlessCancelled(warmupDuration.minus(stopwatch.elapsed()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cancel();
    }

    log.info("Warmup phase completed: {} invocations discarded", warmup.size());
  }

  private void executeMainPhase(
      BenchmarkConfig config,
      WeightedSelector<Operation> selector,
      OperationExecutor executor,
      ResourceManager resources) {
    List<CompletableFuture<Void>> shapers = new ArrayList<>();
    for (ShapingPattern pattern : config.effectivePatterns()) {
      TrafficShaper shaper =
          new TrafficShaper(
              pattern,
              selector,
              executor,
              config.getMaxConcurrency(),
              config.parsedDuration(),
              config.parsedRampUpTime(),
              cancelled);
      shapers.add(CompletableFuture.runAsync(shaper::run, resources.getShaperExecutor()));
    }
    CompletableFuture.allOf(shapers.toArray(new CompletableFuture<?>[0])).join();

    if (executor.activeInvocations() > 0) {
      log.warn("{} invocations still active after main phase", executor.activeInvocations());
    }
  }

  private void executeCooldown(Duration cooldownDuration, ResourceSampler sampler) {
    log.info("Starting cooldown phase for {}ms", cooldownDuration.toMillis());
    Stopwatch stopwatch = Stopwatch.createStarted();
    sampler
        .getGcMonitor()
        .forceCollection()
        .ifPresent(
            event ->
                log.info(
                    "Forced collection freed {}KB in {}ms", event.freed() / 1024, event.durationMs()));
    try {
      sleepUnlessCancelled(cooldownDuration.minus(stopwatch.elapsed()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cancel();
    }
  }

  private void sleepUnlessCancelled(Duration duration) throws InterruptedException {
    long remaining = duration.toMillis();
    while (remaining > 0 && !cancelled.get()) {
      long chunk = Math.min(remaining, SLEEP_CHUNK_MS);
      Thread.sleep(chunk);
      remaining -= chunk;
    }
  }

  private void logReportSummary(PerformanceReport report) {
    var execution = report.getExecution();
    var summary = report.getSummary();
    String text =
        String.format(
            "=== BENCHMARK %s (%s) ===\n", report.getTestName(), report.getTerminationReason())
            + String.format(
                "Invocations: %d (Success: %d, Failed: %d), Error Rate: %.2f%%\n",
                execution.getTotalInvocations(),
                execution.getSuccessfulInvocations(),
                execution.getFailedInvocations(),
                execution.getErrorRatePct())
            + String.format(
                "Response Times: Avg=%.1fms, P50=%dms, P95=%dms, P99=%dms (Min=%dms, Max=%dms)\n",
                execution.getAverageResponseTimeMs(),
                execution.getP50ResponseTimeMs(),
                execution.getP95ResponseTimeMs(),
                execution.getP99ResponseTimeMs(),
                execution.getMinResponseTimeMs(),
                execution.getMaxResponseTimeMs())
            + String.format(
                "Throughput: %.2f ops/sec (peak window %.2f), Peak Heap: %.1fMB, CPU: %.1f%%\n",
                execution.getThroughput(),
                execution.getPeakWindowThroughput(),
                report.getKeyMetrics().peakHeapMb(),
                report.getCpuUtilizationPct())
            + String.format(
                "Score: %.1f, Bottlenecks: %d, Regressions: %d, Success: %s",
                summary.getOverallScore(),
                report.getBottlenecks().size(),
                report.getRegressions().size(),
                report.isSuccess());
    log.info("\n{}", text);
  }
}
