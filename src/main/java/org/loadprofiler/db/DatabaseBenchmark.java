package org.loadprofiler.db;

import com.google.common.base.Stopwatch;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.loadprofiler.exception.BenchmarkConfigurationException;
import org.loadprofiler.exception.BenchmarkException;
import org.loadprofiler.load.ConcurrencyGate;
import org.loadprofiler.load.WeightedSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a fixed number of weighted statements against a database, at most {@code concurrency} at a
 * time, then inspects storage and indexes and derives tuning advice.
 */
public class DatabaseBenchmark {

  private static final Logger log = LoggerFactory.getLogger(DatabaseBenchmark.class);

  private final QueryExecutor delegate;
  private final StorageInspector inspector;
  private final ExecutorService workers;
  private final Random random;

  /**
   * @param inspector may be {@code null}; storage and index checks are skipped then
   */
  public DatabaseBenchmark(QueryExecutor delegate, StorageInspector inspector, ExecutorService workers) {
    this(delegate, inspector, workers, new Random());
  }

  public DatabaseBenchmark(
      QueryExecutor delegate, StorageInspector inspector, ExecutorService workers, Random random) {
    this.delegate = delegate;
    this.inspector = inspector;
    this.workers = workers;
    this.random = random;
  }

  public DatabaseMetrics run(DatabaseBenchmarkConfig config) {
    validate(config);
    log.info(
        "Starting database benchmark '{}': {} iterations, concurrency {}",
        config.getName(),
        config.getIterations(),
        config.getConcurrency());

    QueryStatistics statistics = new QueryStatistics();
    InstrumentedQueryExecutor executor =
        new InstrumentedQueryExecutor(delegate, statistics, config.getSlowQueryThresholdMs());
    WeightedSelector<DatabaseOperation> selector =
        new WeightedSelector<>(config.getOperations(), DatabaseOperation::getWeight);
    ConcurrencyGate gate = new ConcurrencyGate(config.getConcurrency());
    CountDownLatch done = new CountDownLatch(config.getIterations());

    AtomicLong executed = new AtomicLong(0);
    AtomicLong failed = new AtomicLong(0);
    AtomicLong validationFailures = new AtomicLong(0);

    Stopwatch stopwatch = Stopwatch.createStarted();
    try {
      for (int i = 0; i < config.getIterations(); i++) {
        DatabaseOperation operation = selector.select();
        String sql;
        Object[] params;
        synchronized (random) {
          sql = Placeholders.substitute(operation.getSql(), i, random);
          params = Placeholders.substitute(operation.getParameters(), i, random);
        }

        gate.acquire();
        try {
          workers.execute(
              () -> {
                try {
                  int rows = execute(executor, sql, params);
                  executed.incrementAndGet();
                  if (operation.getExpectedRows() != null && operation.getExpectedRows() != rows) {
                    validationFailures.incrementAndGet();
                    log.debug(
                        "Operation '{}' returned {} rows, expected {}",
                        operation.getName(),
                        rows,
                        operation.getExpectedRows());
                  }
                } catch (SQLException | RuntimeException e) {
                  failed.incrementAndGet();
                  log.debug("Operation '{}' failed: {}", operation.getName(), e.getMessage());
                } finally {
                  gate.release();
                  done.countDown();
                }
              });
        } catch (RejectedExecutionException e) {
          gate.release();
          throw new BenchmarkException("Database benchmark worker pool rejected work", e);
        }
      }
      done.await();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new BenchmarkException("Database benchmark interrupted", e);
    }
    long durationMs = stopwatch.elapsed(TimeUnit.MILLISECONDS);

    QueryMetrics queries = statistics.snapshot();
    StorageMetrics storage = null;
    List<String> existingIndexes = List.of();
    List<MissingIndex> missingIndexes = List.of();
    if (inspector != null) {
      try {
        storage = inspector.inspectStorage();
        existingIndexes = inspector.listIndexes();
        missingIndexes = inspector.findMissingIndexes(config.getIndexChecks());
      } catch (SQLException e) {
        log.warn("Storage inspection failed for '{}': {}", config.getName(), e.getMessage());
      }
    }

    DatabaseMetrics metrics =
        DatabaseMetrics.builder()
            .benchmarkName(config.getName())
            .iterations(config.getIterations())
            .concurrency(config.getConcurrency())
            .durationMs(durationMs)
            .executedStatements(executed.get())
            .failedStatements(failed.get())
            .validationFailures(validationFailures.get())
            .statementsPerSecond(durationMs > 0 ? executed.get() * 1000.0 / durationMs : 0)
            .queries(queries)
            .storage(storage)
            .existingIndexes(existingIndexes)
            .missingIndexes(missingIndexes)
            .insights(DatabaseAdvisor.insights(queries, storage, missingIndexes))
            .recommendations(DatabaseAdvisor.recommendations(queries, storage, missingIndexes))
            .build();

    log.info(
        "Database benchmark '{}' completed in {}ms: {} executed, {} failed, avg {}ms",
        config.getName(),
        durationMs,
        executed.get(),
        failed.get(),
        String.format("%.2f", queries.getAverageQueryTimeMs()));
    return metrics;
  }

  private static int execute(QueryExecutor executor, String sql, Object[] params)
      throws SQLException {
    if (StatementKind.of(sql) == StatementKind.SELECT) {
      return executor.query(sql, params).size();
    }
    return executor.update(sql, params);
  }

  private static void validate(DatabaseBenchmarkConfig config) {
    List<String> problems = new ArrayList<>();
    if (config.getName() == null || config.getName().isBlank()) {
      problems.add("Benchmark name is required");
    }
    if (config.getIterations() <= 0) {
      problems.add("Iterations must be positive: " + config.getIterations());
    }
    if (config.getConcurrency() <= 0) {
      problems.add("Concurrency must be positive: " + config.getConcurrency());
    }
    if (config.getOperations() == null || config.getOperations().isEmpty()) {
      problems.add("At least one database operation is required");
    } else {
      double totalWeight = 0;
      for (DatabaseOperation operation : config.getOperations()) {
        if (operation.getSql() == null || operation.getSql().isBlank()) {
          problems.add("Operation '" + operation.getName() + "' has no SQL");
        }
        if (operation.getWeight() <= 0) {
          problems.add("Operation '" + operation.getName() + "' weight must be positive");
        }
        totalWeight += Math.max(0, operation.getWeight());
      }
      if (totalWeight <= 0) {
        problems.add("Total operation weight must be positive");
      }
    }
    if (!problems.isEmpty()) {
      throw new BenchmarkConfigurationException(problems);
    }
  }
}
