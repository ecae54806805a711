package org.loadprofiler.db;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class StatementKindTest {

  @ParameterizedTest(name = "{0} -> {1}")
  @CsvSource(
      delimiter = '|',
      value = {
        "SELECT * FROM t | SELECT",
        "  select id from t | SELECT",
        "WITH recent AS (SELECT 1) SELECT * FROM recent | SELECT",
        "INSERT INTO t VALUES (1) | INSERT",
        "REPLACE INTO t VALUES (1) | INSERT",
        "update t set a = 1 | UPDATE",
        "DELETE FROM t | DELETE",
        "PRAGMA page_size | OTHER",
        "CREATE INDEX idx ON t(a) | OTHER"
      })
  void shouldClassifyByLeadingKeyword(String sql, StatementKind expected) {
    assertEquals(expected, StatementKind.of(sql));
  }

  @Test
  void shouldTreatNullAsOther() {
    assertEquals(StatementKind.OTHER, StatementKind.of(null));
  }
}
