package org.loadprofiler.db;

import java.util.Locale;

public enum StatementKind {
  SELECT,
  INSERT,
  UPDATE,
  DELETE,
  OTHER;

  /** Classifies by the leading keyword; a {@code WITH} prefix counts as a select. */
  public static StatementKind of(String sql) {
    if (sql == null) {
      return OTHER;
    }
    String trimmed = sql.stripLeading().toLowerCase(Locale.ROOT);
    if (trimmed.startsWith("select") || trimmed.startsWith("with")) {
      return SELECT;
    }
    if (trimmed.startsWith("insert") || trimmed.startsWith("replace")) {
      return INSERT;
    }
    if (trimmed.startsWith("update")) {
      return UPDATE;
    }
    if (trimmed.startsWith("delete")) {
      return DELETE;
    }
    return OTHER;
  }
}
