package org.loadprofiler.db;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/** The database calls an operation makes. Rows are column-label to value maps in result order. */
public interface QueryExecutor {

  List<Map<String, Object>> query(String sql, Object... params) throws SQLException;

  /** @return the affected row count */
  int update(String sql, Object... params) throws SQLException;
}
