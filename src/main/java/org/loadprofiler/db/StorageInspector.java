package org.loadprofiler.db;

import java.sql.SQLException;
import java.util.List;

/** Engine-specific view of on-disk storage and indexes. */
public interface StorageInspector {

  StorageMetrics inspectStorage() throws SQLException;

  List<MissingIndex> findMissingIndexes(List<IndexCheck> checks) throws SQLException;

  List<String> listIndexes() throws SQLException;
}
