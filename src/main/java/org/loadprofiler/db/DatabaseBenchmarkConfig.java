package org.loadprofiler.db;

import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

@Getter
@Builder
@Jacksonized
@ToString
public class DatabaseBenchmarkConfig {
  private final String name;
  @Builder.Default private final List<DatabaseOperation> operations = List.of();
  @Builder.Default private final int iterations = 100;
  @Builder.Default private final int concurrency = 1;
  @Builder.Default private final long slowQueryThresholdMs = InstrumentedQueryExecutor.DEFAULT_SLOW_QUERY_THRESHOLD_MS;
  @Builder.Default private final List<IndexCheck> indexChecks = IndexCheck.defaultChecklist();
}
