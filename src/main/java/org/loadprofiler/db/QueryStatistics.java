package org.loadprofiler.db;

import com.google.common.collect.EvictingQueue;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/** Running query counters shared by every caller of one instrumented executor. */
public class QueryStatistics {

  public static final int DEFAULT_SLOW_QUERY_CAPACITY = 1000;

  private final AtomicLong totalQueries = new AtomicLong(0);
  private final AtomicLong failedQueries = new AtomicLong(0);
  private final AtomicLong totalTimeMs = new AtomicLong(0);
  private final AtomicLong maxQueryTimeMs = new AtomicLong(0);
  private final AtomicLong slowQueryCount = new AtomicLong(0);
  private final Map<StatementKind, AtomicLong> distribution = new ConcurrentHashMap<>();
  private final EvictingQueue<SlowQueryRecord> slowQueries;

  public QueryStatistics() {
    this(DEFAULT_SLOW_QUERY_CAPACITY);
  }

  public QueryStatistics(int slowQueryCapacity) {
    this.slowQueries = EvictingQueue.create(slowQueryCapacity);
  }

  public void record(StatementKind kind, long durationMs, boolean failed) {
    totalQueries.incrementAndGet();
    totalTimeMs.addAndGet(durationMs);
    maxQueryTimeMs.accumulateAndGet(durationMs, Math::max);
    distribution.computeIfAbsent(kind, k -> new AtomicLong(0)).incrementAndGet();
    if (failed) {
      failedQueries.incrementAndGet();
    }
  }

  public void recordSlowQuery(SlowQueryRecord record) {
    slowQueryCount.incrementAndGet();
    synchronized (slowQueries) {
      slowQueries.add(record);
    }
  }

  public double getAverageQueryTimeMs() {
    long total = totalQueries.get();
    return total > 0 ? (double) totalTimeMs.get() / total : 0.0;
  }

  public long getTotalQueries() {
    return totalQueries.get();
  }

  public List<SlowQueryRecord> getSlowQueries() {
    synchronized (slowQueries) {
      return new ArrayList<>(slowQueries);
    }
  }

  public QueryMetrics snapshot() {
    Map<StatementKind, Long> counts = new EnumMap<>(StatementKind.class);
    for (StatementKind kind : StatementKind.values()) {
      AtomicLong count = distribution.get(kind);
      counts.put(kind, count == null ? 0L : count.get());
    }
    return QueryMetrics.builder()
        .totalQueries(totalQueries.get())
        .failedQueries(failedQueries.get())
        .totalTimeMs(totalTimeMs.get())
        .averageQueryTimeMs(getAverageQueryTimeMs())
        .maxQueryTimeMs(maxQueryTimeMs.get())
        .distribution(counts)
        .slowQueryCount(slowQueryCount.get())
        .slowQueries(getSlowQueries())
        .build();
  }

  public void reset() {
    totalQueries.set(0);
    failedQueries.set(0);
    totalTimeMs.set(0);
    maxQueryTimeMs.set(0);
    slowQueryCount.set(0);
    distribution.clear();
    synchronized (slowQueries) {
      slowQueries.clear();
    }
  }
}
