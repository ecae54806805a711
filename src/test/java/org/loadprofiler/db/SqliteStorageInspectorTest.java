package org.loadprofiler.db;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteStorageInspectorTest {

  @TempDir Path tempDir;

  private JdbcQueryExecutor database;
  private SqliteStorageInspector inspector;

  @BeforeEach
  void setUp() throws SQLException {
    database =
        new JdbcQueryExecutor(
            DriverManager.getConnection("jdbc:sqlite:" + tempDir.resolve("storage.db")));
    database.update("CREATE TABLE blobs (id INTEGER PRIMARY KEY, payload TEXT UNIQUE)");
    inspector = new SqliteStorageInspector(database);
  }

  @AfterEach
  void tearDown() throws SQLException {
    database.close();
  }

  @Test
  void shouldReportPageLayout() throws SQLException {
    StorageMetrics storage = inspector.inspectStorage();

    assertTrue(storage.getPageSize() > 0);
    assertTrue(storage.getPageCount() >= 1);
    assertEquals(storage.getPageSize() * storage.getPageCount(), storage.getDatabaseSizeBytes());
    assertFalse(storage.isVacuumRecommended());
  }

  @Test
  @DisplayName("Deleted rows leave free pages until vacuumed")
  void shouldRecommendVacuumAfterMassDelete() throws SQLException {
    // Given
    String payload = "x".repeat(2_000);
    for (int i = 0; i < 500; i++) {
      database.update("INSERT INTO blobs (payload) VALUES (?)", i + payload);
    }
    database.update("DELETE FROM blobs");

    // When
    StorageMetrics fragmented = inspector.inspectStorage();
    database.update("VACUUM");
    StorageMetrics compacted = inspector.inspectStorage();

    // Then
    assertTrue(fragmented.getFreePages() > 0);
    assertTrue(fragmented.getFragmentationPct() > 10);
    assertTrue(fragmented.isVacuumRecommended());
    assertEquals(0, compacted.getFreePages());
    assertFalse(compacted.isVacuumRecommended());
  }

  @Test
  void shouldListUserIndexesOnly() throws SQLException {
    database.update("CREATE INDEX idx_blobs_id_payload ON blobs(id, payload)");

    List<String> indexes = inspector.listIndexes();

    assertEquals(List.of("idx_blobs_id_payload"), indexes);
  }

  @Test
  void shouldBuildCreateStatementForMissingIndex() throws SQLException {
    IndexCheck check =
        IndexCheck.builder()
            .table("blobs")
            .columns(List.of("payload", "id"))
            .recommendation("Lookup by payload")
            .build();

    List<MissingIndex> missing = inspector.findMissingIndexes(List.of(check));

    assertEquals(1, missing.size());
    assertEquals("CREATE INDEX idx_blobs_payload_id ON blobs(payload, id)", missing.get(0).getCreateStatement());
    assertEquals("Lookup by payload", missing.get(0).getRecommendation());

    database.update(missing.get(0).getCreateStatement());
    assertTrue(inspector.findMissingIndexes(List.of(check)).isEmpty());
  }
}
