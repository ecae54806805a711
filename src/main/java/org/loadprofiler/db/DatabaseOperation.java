package org.loadprofiler.db;

import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

/**
 * A weighted, parameterized statement for database benchmarks. String parameters and the SQL may
 * contain {@code {iteration}}, {@code {random_id}}, {@code {random_category}} and {@code
 * {timestamp}} placeholders.
 */
@Getter
@Builder
@Jacksonized
@ToString
public class DatabaseOperation {
  private final String name;
  @Builder.Default private final double weight = 1;
  private final String sql;
  @Builder.Default private final List<Object> parameters = List.of();

  /** Rows returned (queries) or affected (updates) that count as a valid result; {@code null} accepts any. */
  private final Integer expectedRows;
}
