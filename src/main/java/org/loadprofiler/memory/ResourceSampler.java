package org.loadprofiler.memory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.EvictingQueue;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.loadprofiler.event.BenchmarkListener;
import org.loadprofiler.exception.SamplerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Samples process memory on a fixed schedule, independent of load generation, and runs leak and
 * pressure detection after every sample.
 *
 * <p>Snapshots go into a bounded ring. After a leak or a pressure point of a given type is
 * reported, the same detection stays quiet for one leak window of samples.
 */
public class ResourceSampler {

  private static final Logger log = LoggerFactory.getLogger(ResourceSampler.class);

  private final MemoryReader reader;
  private final GcEventMonitor gcMonitor;
  private final ScheduledExecutorService scheduler;
  private final SamplerSettings settings;
  private final LeakDetector leakDetector;
  private final PressureDetector pressureDetector = new PressureDetector();
  private final MemoryAnalyzer analyzer;

  private final EvictingQueue<ResourceSnapshot> snapshots;
  private final List<MemoryLeak> leaks = new CopyOnWriteArrayList<>();
  private final List<PressurePoint> pressurePoints = new CopyOnWriteArrayList<>();
  private final Map<PressureType, Long> lastPressureSample = new EnumMap<>(PressureType.class);
  private final AtomicBoolean running = new AtomicBoolean(false);

  private long sampleCount;
  private long lastLeakSample = Long.MIN_VALUE / 2;
  private volatile BenchmarkListener listener = BenchmarkListener.NOOP;
  private volatile Instant startedAt;
  private ScheduledFuture<?> samplingTask;

  public ResourceSampler(
      MemoryReader reader,
      GcEventMonitor gcMonitor,
      ScheduledExecutorService scheduler,
      SamplerSettings settings) {
    this.reader = reader;
    this.gcMonitor = gcMonitor;
    this.scheduler = scheduler;
    this.settings = settings;
    this.snapshots = EvictingQueue.create(settings.getCapacity());
    this.leakDetector = new LeakDetector(settings.getLeakWindow(), settings.getLeakThresholdBytes());
    this.analyzer =
        new MemoryAnalyzer(
            new TrendAnalyzer(settings.getTrendMinSamples(), settings.getTrendDeadZoneBytesPerSec()));
  }

  public void setListener(BenchmarkListener listener) {
    this.listener = listener == null ? BenchmarkListener.NOOP : listener;
    gcMonitor.onEvent(this.listener::onGcEvent);
  }

  public void start() {
    if (!running.compareAndSet(false, true)) {
      log.warn("Resource sampler already running");
      return;
    }
    startedAt = Instant.now();
    gcMonitor.start();
    samplingTask =
        scheduler.scheduleAtFixedRate(
            this::sample, 0, settings.getInterval().toMillis(), TimeUnit.MILLISECONDS);
    log.info("Resource sampling started every {}ms", settings.getInterval().toMillis());
  }

  /** Stops sampling and returns the analysis of everything collected since {@link #start()}. */
  public MemoryAnalysis stop() {
    if (running.compareAndSet(true, false)) {
      if (samplingTask != null) {
        samplingTask.cancel(false);
      }
      gcMonitor.stop();
      log.info("Resource sampling stopped after {} samples", getSampleCount());
    }
    return analyze();
  }

  public boolean isRunning() {
    return running.get();
  }

  public GcEventMonitor getGcMonitor() {
    return gcMonitor;
  }

  @VisibleForTesting
  synchronized void sample() {
    try {
      ResourceSnapshot snapshot = reader.read();
      List<ResourceSnapshot> history;
      synchronized (snapshots) {
        snapshots.add(snapshot);
        history = new ArrayList<>(snapshots);
      }
      long index = ++sampleCount;
      listener.onSample(snapshot);

      if (index - lastLeakSample >= leakDetector.getWindow()) {
        leakDetector
            .detect(history)
            .ifPresent(
                leak -> {
                  lastLeakSample = index;
                  leaks.add(leak);
                  listener.onLeakDetected(leak);
                });
      }

      for (PressurePoint point : pressureDetector.detect(history, gcMonitor.getEvents())) {
        Long last = lastPressureSample.get(point.getType());
        if (last == null || index - last >= leakDetector.getWindow()) {
          lastPressureSample.put(point.getType(), index);
          pressurePoints.add(point);
          listener.onPressureDetected(point);
        }
      }
    } catch (SamplerException e) {
      log.warn("Resource sample skipped: {}", e.getMessage());
    } catch (RuntimeException e) {
      log.warn("Resource sampling failed, continuing on schedule", e);
    }
  }

  public List<ResourceSnapshot> getSnapshots() {
    synchronized (snapshots) {
      return new ArrayList<>(snapshots);
    }
  }

  public synchronized long getSampleCount() {
    return sampleCount;
  }

  public List<MemoryLeak> getLeaks() {
    return List.copyOf(leaks);
  }

  public List<PressurePoint> getPressurePoints() {
    return List.copyOf(pressurePoints);
  }

  public MemoryAnalysis analyze() {
    List<ResourceSnapshot> series = getSnapshots();
    Instant start =
        startedAt != null ? startedAt : series.isEmpty() ? Instant.now() : series.get(0).timestamp();
    Instant end = series.isEmpty() ? Instant.now() : series.get(series.size() - 1).timestamp();
    if (end.isBefore(start)) {
      end = start;
    }
    return analyzer.analyze(
        start, end, series, gcMonitor.getEvents(), getLeaks(), getPressurePoints());
  }
}
