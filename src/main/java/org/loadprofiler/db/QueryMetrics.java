package org.loadprofiler.db;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/** Point-in-time copy of {@link QueryStatistics}. */
@Data
@Builder
public class QueryMetrics {
  private final long totalQueries;
  private final long failedQueries;
  private final long totalTimeMs;
  private final double averageQueryTimeMs;
  private final long maxQueryTimeMs;
  private final Map<StatementKind, Long> distribution;
  private final long slowQueryCount;
  private final List<SlowQueryRecord> slowQueries;
}
