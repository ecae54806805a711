package org.loadprofiler.metrics;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects invocation records for one run and rolls them into fixed-length windows that are logged
 * as they close.
 *
 * <p>Records are appended from many worker threads in completion order; every buffer here is a
 * lock-free queue or atomic counter.
 */
public class RunMetrics {

  private static final Logger log = LoggerFactory.getLogger(RunMetrics.class);
  private static final int MAX_ERRORS = 1000;
  private static final int MAX_WINDOWS = 720;

  private final AtomicLong totalInvocations = new AtomicLong(0);
  private final AtomicLong successfulInvocations = new AtomicLong(0);
  private final AtomicLong failedInvocations = new AtomicLong(0);
  private final AtomicLong totalResponseTime = new AtomicLong(0);

  private final Instant startTime;
  private final Queue<InvocationRecord> records = new ConcurrentLinkedQueue<>();
  private final Map<String, AtomicLong> invocationsByOperation = new ConcurrentHashMap<>();
  private final Queue<ErrorInfo> errors = new ConcurrentLinkedQueue<>();

  private final int windowSizeSeconds;
  private final AtomicInteger windowCounter = new AtomicInteger(0);
  private final Queue<MetricsWindow> metricsWindows = new ConcurrentLinkedQueue<>();
  private volatile MetricsWindow currentWindow;
  private final ScheduledFuture<?> windowTask;

  public RunMetrics(ScheduledExecutorService scheduler, int windowSizeSeconds) {
    this.windowSizeSeconds = windowSizeSeconds;
    this.startTime = Instant.now();
    this.currentWindow =
        new MetricsWindow(windowCounter.incrementAndGet(), startTime, windowSizeSeconds);
    this.windowTask =
        scheduler.scheduleAtFixedRate(
            this::rotateWindow, windowSizeSeconds, windowSizeSeconds, TimeUnit.SECONDS);
  }

  public void recordInvocation(InvocationRecord record) {
    records.offer(record);
    totalInvocations.incrementAndGet();
    totalResponseTime.addAndGet(record.durationMs());
    invocationsByOperation
        .computeIfAbsent(record.operationName(), k -> new AtomicLong(0))
        .incrementAndGet();

    if (record.succeeded()) {
      successfulInvocations.incrementAndGet();
    } else {
      failedInvocations.incrementAndGet();
      errors.offer(
          ErrorInfo.builder()
              .timestamp(record.startTime().plusMillis(record.durationMs()))
              .operationName(record.operationName())
              .kind(record.errorKind())
              .message(record.error() != null ? record.error() : "Unknown")
              .build());
      while (errors.size() > MAX_ERRORS) {
        errors.poll();
      }
    }

    MetricsWindow window = currentWindow;
    if (window != null) {
      window.record(record);
    }

    log.debug(
        "Invocation recorded: {} {}ms, success: {}",
        record.operationName(),
        record.durationMs(),
        record.succeeded());
  }

  public long getTotalInvocations() {
    return totalInvocations.get();
  }

  public long getSuccessfulInvocations() {
    return successfulInvocations.get();
  }

  public long getFailedInvocations() {
    return failedInvocations.get();
  }

  public double getErrorRate() {
    long total = totalInvocations.get();
    return total > 0 ? (double) failedInvocations.get() / total * 100.0 : 0.0;
  }

  public double getAverageResponseTime() {
    long total = totalInvocations.get();
    return total > 0 ? (double) totalResponseTime.get() / total : 0.0;
  }

  public long getPercentileResponseTime(double percentile) {
    List<Long> durations = new ArrayList<>();
    for (InvocationRecord record : records) {
      durations.add(record.durationMs());
    }
    return Percentiles.of(durations, percentile);
  }

  /** Records in completion order. */
  public List<InvocationRecord> getRecords() {
    return List.copyOf(records);
  }

  public List<MetricsWindow> getMetricsWindows() {
    return List.copyOf(metricsWindows);
  }

  public Instant getStartTime() {
    return startTime;
  }

  private synchronized void rotateWindow() {
    Instant now = Instant.now();

    if (currentWindow != null) {
      currentWindow.close(now);
      metricsWindows.offer(currentWindow);

      if (currentWindow.getInvocationCount().get() > 0) {
        logWindowSummary(currentWindow);
      } else {
        log.debug("Window {} had no invocations", currentWindow.getWindowNumber());
      }
    }

    currentWindow = new MetricsWindow(windowCounter.incrementAndGet(), now, windowSizeSeconds);

    while (metricsWindows.size() > MAX_WINDOWS) {
      metricsWindows.poll();
    }
  }

  private void logWindowSummary(MetricsWindow window) {
    WindowSummary summary = window.summarize();
    log.info(
        "Window {} closed: {} invocations ({} failed, {}%), {} ops/s, avg {}ms,"
            + " p50/p95/p99 {}/{}/{}ms, min/max {}/{}ms",
        summary.getWindowNumber(),
        summary.getInvocations(),
        summary.getFailures(),
        String.format("%.2f", summary.getErrorRatePct()),
        String.format("%.2f", summary.getThroughput()),
        String.format("%.1f", summary.getAverageResponseTimeMs()),
        summary.getP50ResponseTimeMs(),
        summary.getP95ResponseTimeMs(),
        summary.getP99ResponseTimeMs(),
        summary.getMinResponseTimeMs(),
        summary.getMaxResponseTimeMs());
  }

  /** Stops window rotation and closes the open window. */
  public void shutdown() {
    windowTask.cancel(false);
    rotateWindow();
    log.debug("Run metrics shut down after {} windows", metricsWindows.size());
  }

  public ExecutionMetrics summarize(Duration mainPhaseDuration) {
    long durationMs = Math.max(1, mainPhaseDuration.toMillis());
    List<Long> durations = new ArrayList<>();
    for (InvocationRecord record : records) {
      durations.add(record.durationMs());
    }
    durations.sort(null);

    return ExecutionMetrics.builder()
        .durationMs(mainPhaseDuration.toMillis())
        .totalInvocations(totalInvocations.get())
        .successfulInvocations(successfulInvocations.get())
        .failedInvocations(failedInvocations.get())
        .errorRatePct(getErrorRate())
        .averageResponseTimeMs(getAverageResponseTime())
        .p50ResponseTimeMs(Percentiles.of(durations, 50.0))
        .p95ResponseTimeMs(Percentiles.of(durations, 95.0))
        .p99ResponseTimeMs(Percentiles.of(durations, 99.0))
        .minResponseTimeMs(durations.isEmpty() ? 0 : durations.get(0))
        .maxResponseTimeMs(durations.isEmpty() ? 0 : durations.get(durations.size() - 1))
        .throughput(totalInvocations.get() / (durationMs / 1000.0))
        .peakWindowThroughput(calculatePeakThroughput())
        .invocationsByOperation(
            invocationsByOperation.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, entry -> entry.getValue().get())))
        .errorSummary(generateErrorSummary())
        .recentErrors(getRecentErrors(10))
        .build();
  }

  public List<WindowSummary> summarizeWindows() {
    return metricsWindows.stream().map(MetricsWindow::summarize).collect(Collectors.toList());
  }

  private double calculatePeakThroughput() {
    return metricsWindows.stream()
        .filter(window -> window.getInvocationCount().get() > 0)
        .mapToDouble(MetricsWindow::getThroughput)
        .max()
        .orElse(0.0);
  }

  private ErrorSummary generateErrorSummary() {
    Map<ErrorKind, Long> byKind = new EnumMap<>(ErrorKind.class);
    byKind.putAll(
        errors.stream()
            .filter(error -> error.getKind() != null)
            .collect(Collectors.groupingBy(ErrorInfo::getKind, Collectors.counting())));

    return ErrorSummary.builder()
        .totalErrors(failedInvocations.get())
        .errorsByKind(byKind)
        .errorsByOperation(
            errors.stream()
                .collect(Collectors.groupingBy(ErrorInfo::getOperationName, Collectors.counting())))
        .errorsByMessage(
            errors.stream()
                .collect(Collectors.groupingBy(ErrorInfo::getMessage, Collectors.counting())))
        .build();
  }

  private List<ErrorInfo> getRecentErrors(int limit) {
    return errors.stream()
        .sorted(Comparator.comparing(ErrorInfo::getTimestamp).reversed())
        .limit(limit)
        .collect(Collectors.toList());
  }
}
