package org.loadprofiler.db;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SlowQueryRecord {
  private final String sql;
  private final long durationMs;
  private final Instant timestamp;
  private final List<String> tablesTouched;
  private final int rowsReturned;
}
