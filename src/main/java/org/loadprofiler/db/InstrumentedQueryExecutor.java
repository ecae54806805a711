package org.loadprofiler.db;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.loadprofiler.event.BenchmarkListener;
import org.loadprofiler.exception.InstrumentationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decorates a {@link QueryExecutor} with timing. Every call reaches the delegate unchanged; calls
 * slower than the threshold are kept as {@link SlowQueryRecord}s. Instrumentation failures are
 * logged and the delegate's result is returned as if the executor were not wrapped.
 */
public class InstrumentedQueryExecutor implements QueryExecutor {

  private static final Logger log = LoggerFactory.getLogger(InstrumentedQueryExecutor.class);
  public static final long DEFAULT_SLOW_QUERY_THRESHOLD_MS = 100;

  private final QueryExecutor delegate;
  private final QueryStatistics statistics;
  private final long slowQueryThresholdMs;
  private final Ticker ticker;
  private volatile BenchmarkListener listener = BenchmarkListener.NOOP;

  public InstrumentedQueryExecutor(QueryExecutor delegate) {
    this(delegate, new QueryStatistics(), DEFAULT_SLOW_QUERY_THRESHOLD_MS, Ticker.systemTicker());
  }

  public InstrumentedQueryExecutor(
      QueryExecutor delegate, QueryStatistics statistics, long slowQueryThresholdMs) {
    this(delegate, statistics, slowQueryThresholdMs, Ticker.systemTicker());
  }

  @VisibleForTesting
  InstrumentedQueryExecutor(
      QueryExecutor delegate, QueryStatistics statistics, long slowQueryThresholdMs, Ticker ticker) {
    this.delegate = delegate;
    this.statistics = statistics;
    this.slowQueryThresholdMs = slowQueryThresholdMs;
    this.ticker = ticker;
  }

  public void setListener(BenchmarkListener listener) {
    this.listener = listener == null ? BenchmarkListener.NOOP : listener;
  }

  @Override
  public List<Map<String, Object>> query(String sql, Object... params) throws SQLException {
    Stopwatch stopwatch = Stopwatch.createStarted(ticker);
    try {
      List<Map<String, Object>> rows = delegate.query(sql, params);
      record(sql, stopwatch, rows.size(), false);
      return rows;
    } catch (SQLException | RuntimeException e) {
      record(sql, stopwatch, 0, true);
      throw e;
    }
  }

  @Override
  public int update(String sql, Object... params) throws SQLException {
    Stopwatch stopwatch = Stopwatch.createStarted(ticker);
    try {
      int affected = delegate.update(sql, params);
      record(sql, stopwatch, affected, false);
      return affected;
    } catch (SQLException | RuntimeException e) {
      record(sql, stopwatch, 0, true);
      throw e;
    }
  }

  public QueryStatistics getStatistics() {
    return statistics;
  }

  public long getSlowQueryThresholdMs() {
    return slowQueryThresholdMs;
  }

  private void record(String sql, Stopwatch stopwatch, int rows, boolean failed) {
    try {
      long durationMs = stopwatch.elapsed(TimeUnit.MILLISECONDS);
      statistics.record(StatementKind.of(sql), durationMs, failed);

      if (durationMs > slowQueryThresholdMs) {
        SlowQueryRecord slowQuery =
            SlowQueryRecord.builder()
                .sql(sql)
                .durationMs(durationMs)
                .timestamp(Instant.now())
                .tablesTouched(TableNameExtractor.extract(sql))
                .rowsReturned(rows)
                .build();
        statistics.recordSlowQuery(slowQuery);
        listener.onSlowQuery(slowQuery);
      }
    } catch (RuntimeException e) {
      log.warn(
          "Query instrumentation failed, returning uninstrumented result",
          new InstrumentationException("Failed to record timing for query: " + sql, e));
    }
  }
}
