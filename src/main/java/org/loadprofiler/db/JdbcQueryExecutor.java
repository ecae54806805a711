package org.loadprofiler.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link QueryExecutor} over a single JDBC connection. Calls are serialized on the connection, which
 * matches SQLite's one-writer model.
 */
public class JdbcQueryExecutor implements QueryExecutor, AutoCloseable {

  private final Connection connection;

  public JdbcQueryExecutor(Connection connection) {
    this.connection = connection;
  }

  @Override
  public synchronized List<Map<String, Object>> query(String sql, Object... params)
      throws SQLException {
    try (PreparedStatement statement = prepare(sql, params);
        ResultSet resultSet = statement.executeQuery()) {
      ResultSetMetaData metaData = resultSet.getMetaData();
      int columns = metaData.getColumnCount();
      List<Map<String, Object>> rows = new ArrayList<>();
      while (resultSet.next()) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 1; i <= columns; i++) {
          row.put(metaData.getColumnLabel(i), resultSet.getObject(i));
        }
        rows.add(row);
      }
      return rows;
    }
  }

  @Override
  public synchronized int update(String sql, Object... params) throws SQLException {
    try (PreparedStatement statement = prepare(sql, params)) {
      return statement.executeUpdate();
    }
  }

  public Connection getConnection() {
    return connection;
  }

  private PreparedStatement prepare(String sql, Object... params) throws SQLException {
    PreparedStatement statement = connection.prepareStatement(sql);
    try {
      for (int i = 0; params != null && i < params.length; i++) {
        statement.setObject(i + 1, params[i]);
      }
      return statement;
    } catch (SQLException e) {
      statement.close();
      throw e;
    }
  }

  @Override
  public void close() throws SQLException {
    connection.close();
  }
}
