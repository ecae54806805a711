package org.loadprofiler.cli;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import org.loadprofiler.db.DatabaseBenchmark;
import org.loadprofiler.db.DatabaseBenchmarkConfig;
import org.loadprofiler.db.DatabaseInsight;
import org.loadprofiler.db.DatabaseMetrics;
import org.loadprofiler.db.DatabaseOperation;
import org.loadprofiler.db.InstrumentedQueryExecutor;
import org.loadprofiler.db.JdbcQueryExecutor;
import org.loadprofiler.db.QueryStatistics;
import org.loadprofiler.db.SqliteStorageInspector;
import org.loadprofiler.dto.BenchmarkConfig;
import org.loadprofiler.event.LoggingBenchmarkListener;
import org.loadprofiler.load.BenchmarkOrchestrator;
import org.loadprofiler.report.BaselineRegistry;
import org.loadprofiler.report.Bottleneck;
import org.loadprofiler.report.PerformanceReport;
import org.loadprofiler.report.Regression;
import org.loadprofiler.util.JsonUtil;

/**
 * Runs a benchmark plan against demonstration operations: in-process CPU and allocation work plus
 * instrumented queries on an in-memory SQLite database.
 *
 * <p>Usage: {@code Main [plan.json]}. Without an argument the bundled {@code benchmark-sample.json}
 * is used.
 */
public class Main {

  private static final String SAMPLE_PLAN = "/benchmark-sample.json";

  public static void main(String[] args) throws IOException, SQLException {
    BenchmarkConfig config = loadPlan(args);

    try (Connection connection = DriverManager.getConnection("jdbc:sqlite::memory:");
        JdbcQueryExecutor jdbc = new JdbcQueryExecutor(connection)) {
      createSchema(jdbc);

      InstrumentedQueryExecutor database =
          new InstrumentedQueryExecutor(
              jdbc, new QueryStatistics(), InstrumentedQueryExecutor.DEFAULT_SLOW_QUERY_THRESHOLD_MS);
      registerOperations(config, database);

      System.out.println("Starting benchmark execution...");
      System.out.println("Configuration:");
      System.out.println("  - Name: " + config.getName());
      System.out.println("  - Duration: " + config.getDuration());
      System.out.println("  - Max concurrency: " + config.getMaxConcurrency());
      System.out.println("  - Patterns: " + config.effectivePatterns());
      System.out.println("  - Operations: " + config.getOperations().list());
      System.out.println();

      BaselineRegistry registry = new BaselineRegistry().init();
      try {
        BenchmarkOrchestrator orchestrator =
            new BenchmarkOrchestrator(registry, database, List.of(new LoggingBenchmarkListener()));
        PerformanceReport report = orchestrator.execute(config).join();
        printReport(report);
      } finally {
        registry.dispose();
      }

      runDatabaseBenchmark(jdbc);
    }
    System.out.println("Main method completed.");
  }

  private static BenchmarkConfig loadPlan(String[] args) throws IOException {
    if (args.length > 0) {
      try (InputStream in = Files.newInputStream(Path.of(args[0]))) {
        return JsonUtil.read(in, BenchmarkConfig.class);
      }
    }
    try (InputStream in = Main.class.getResourceAsStream(SAMPLE_PLAN)) {
      if (in == null) {
        throw new IOException("Bundled plan not found: " + SAMPLE_PLAN);
      }
      return JsonUtil.read(in, BenchmarkConfig.class);
    }
  }

  private static void createSchema(JdbcQueryExecutor jdbc) throws SQLException {
    jdbc.update(
        "CREATE TABLE test_documents (id INTEGER PRIMARY KEY AUTOINCREMENT, title TEXT, "
            + "category TEXT, created_at TEXT)");
    jdbc.update(
        "CREATE TABLE test_history (id INTEGER PRIMARY KEY AUTOINCREMENT, document_id INTEGER, "
            + "action TEXT, timestamp TEXT)");
  }

  private static void registerOperations(BenchmarkConfig config, InstrumentedQueryExecutor database) {
    AtomicInteger documents = new AtomicInteger(0);

    config
        .getOperations()
        .register("compute", 3, Main::compute, 2_000, result -> (Long) result > 0)
        .register("allocate", 2, Main::allocate, 2_000)
        .register(
            "insert-document",
            2,
            () ->
                database.update(
                    "INSERT INTO test_documents (title, category, created_at) VALUES (?, ?, datetime('now'))",
                    "Document " + documents.incrementAndGet(),
                    "service"),
            2_000,
            affected -> Integer.valueOf(1).equals(affected))
        .register(
            "query-documents",
            3,
            () ->
                database.query(
                    "SELECT id, title FROM test_documents WHERE category = ? ORDER BY id DESC LIMIT 10",
                    "service"),
            2_000);
  }

  private static Long compute() {
    long n = 20 + ThreadLocalRandom.current().nextInt(5);
    long a = 0;
    long b = 1;
    for (long i = 0; i < n * 1_000; i++) {
      long next = (a + b) % 1_000_000_007L;
      a = b;
      b = next;
    }
    return b + 1;
  }

  private static Integer allocate() {
    List<byte[]> chunks = new ArrayList<>();
    for (int i = 0; i < 64; i++) {
      chunks.add(new byte[16 * 1024]);
    }
    return chunks.size();
  }

  private static void runDatabaseBenchmark(JdbcQueryExecutor jdbc) {
    DatabaseBenchmarkConfig dbConfig =
        DatabaseBenchmarkConfig.builder()
            .name("sqlite-mixed")
            .iterations(200)
            .concurrency(4)
            .operations(
                List.of(
                    DatabaseOperation.builder()
                        .name("insert")
                        .weight(1)
                        .sql(
                            "INSERT INTO test_history (document_id, action, timestamp) VALUES (?, ?, ?)")
                        .parameters(List.of("{random_id}", "update-{iteration}", "{timestamp}"))
                        .expectedRows(1)
                        .build(),
                    DatabaseOperation.builder()
                        .name("history-lookup")
                        .weight(3)
                        .sql("SELECT * FROM test_history WHERE document_id = ? ORDER BY timestamp")
                        .parameters(List.of("{random_id}"))
                        .build(),
                    DatabaseOperation.builder()
                        .name("category-scan")
                        .weight(2)
                        .sql("SELECT COUNT(*) AS total FROM test_documents WHERE category = ?")
                        .parameters(List.of("{random_category}"))
                        .expectedRows(1)
                        .build()))
            .build();

    ExecutorService workers = Executors.newFixedThreadPool(dbConfig.getConcurrency());
    try {
      DatabaseMetrics metrics =
          new DatabaseBenchmark(jdbc, new SqliteStorageInspector(jdbc), workers).run(dbConfig);
      System.out.println("=================================");
      System.out.println("Database benchmark: " + metrics.getBenchmarkName());
      System.out.printf(
          "  - Statements: %d executed, %d failed, %.1f/s%n",
          metrics.getExecutedStatements(),
          metrics.getFailedStatements(),
          metrics.getStatementsPerSecond());
      System.out.println("  - Distribution: " + metrics.getQueries().getDistribution());
      for (DatabaseInsight insight : metrics.getInsights()) {
        System.out.println("  - [" + insight.getSeverity() + "] " + insight.getTitle());
      }
      metrics
          .getMissingIndexes()
          .forEach(index -> System.out.println("  - Suggested: " + index.getCreateStatement()));
    } finally {
      workers.shutdownNow();
    }
  }

  private static void printReport(PerformanceReport report) {
    var summary = report.getSummary();
    System.out.println("=================================");
    System.out.println("Benchmark " + (report.isSuccess() ? "passed" : "failed") + ": " + report.getTestName());
    System.out.println("=================================");
    System.out.printf(
        "  - Invocations: %d (failed %d), error rate %.2f%%%n",
        summary.getTotalOperations(), summary.getFailedOperations(), summary.getErrorRatePct());
    System.out.printf(
        "  - Throughput: %.2f ops/s, avg response %.1fms%n",
        summary.getThroughput(), summary.getAverageResponseTimeMs());
    System.out.printf("  - Score: %.1f%n", summary.getOverallScore());
    for (Bottleneck bottleneck : report.getBottlenecks()) {
      System.out.println("  - Bottleneck [" + bottleneck.getType() + "] " + bottleneck.getDescription());
    }
    for (Regression regression : report.getRegressions()) {
      System.out.printf(
          "  - Regression %s: %.1f%% (%s)%n",
          regression.getMetric(), regression.getChangePercent(), regression.getLevel());
    }
    if (report.getDatabase() != null) {
      Map<?, ?> distribution = report.getDatabase().getDistribution();
      System.out.println("  - Queries: " + distribution);
    }
  }
}
