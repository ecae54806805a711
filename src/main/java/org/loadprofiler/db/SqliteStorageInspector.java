package org.loadprofiler.db;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Storage and index inspection for SQLite through its PRAGMAs and {@code sqlite_master}. Runs on an
 * uninstrumented executor so inspection does not show up in query statistics.
 */
public class SqliteStorageInspector implements StorageInspector {

  static final double VACUUM_FREE_RATIO = 0.10;

  private final QueryExecutor executor;

  public SqliteStorageInspector(QueryExecutor executor) {
    this.executor = executor;
  }

  @Override
  public StorageMetrics inspectStorage() throws SQLException {
    long pageSize = pragma("page_size");
    long pageCount = pragma("page_count");
    long freePages = pragma("freelist_count");

    return StorageMetrics.builder()
        .pageSize(pageSize)
        .pageCount(pageCount)
        .freePages(freePages)
        .databaseSizeBytes(pageSize * pageCount)
        .fragmentationPct(pageCount > 0 ? (double) freePages / pageCount * 100 : 0)
        .vacuumRecommended(freePages > pageCount * VACUUM_FREE_RATIO)
        .build();
  }

  @Override
  public List<MissingIndex> findMissingIndexes(List<IndexCheck> checks) throws SQLException {
    List<MissingIndex> missing = new ArrayList<>();
    for (IndexCheck check : checks) {
      String columnPattern = "%" + String.join("%", check.getColumns()) + "%";
      List<Map<String, Object>> existing =
          executor.query(
              "SELECT name FROM sqlite_master WHERE type = 'index' AND tbl_name = ? AND sql LIKE ?",
              check.getTable(),
              columnPattern);
      if (existing.isEmpty()) {
        missing.add(
            MissingIndex.builder()
                .table(check.getTable())
                .columns(check.getColumns())
                .queryPatterns(check.getQueryPatterns())
                .recommendation(check.getRecommendation())
                .createStatement(
                    String.format(
                        "CREATE INDEX idx_%s_%s ON %s(%s)",
                        check.getTable(),
                        String.join("_", check.getColumns()),
                        check.getTable(),
                        String.join(", ", check.getColumns())))
                .build());
      }
    }
    return missing;
  }

  @Override
  public List<String> listIndexes() throws SQLException {
    List<String> names = new ArrayList<>();
    for (Map<String, Object> row :
        executor.query(
            "SELECT name FROM sqlite_master WHERE type = 'index' AND name NOT LIKE 'sqlite_%'")) {
      names.add(String.valueOf(row.get("name")));
    }
    return names;
  }

  private long pragma(String name) throws SQLException {
    List<Map<String, Object>> rows = executor.query("PRAGMA " + name);
    if (rows.isEmpty() || rows.get(0).isEmpty()) {
      return 0;
    }
    Object value = rows.get(0).values().iterator().next();
    return value instanceof Number number ? number.longValue() : Long.parseLong(String.valueOf(value));
  }
}
