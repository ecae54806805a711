package org.loadprofiler.db;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class StorageMetrics {
  private final long pageSize;
  private final long pageCount;
  private final long freePages;
  private final long databaseSizeBytes;

  /** Free pages as a percentage of all pages. */
  private final double fragmentationPct;

  private final boolean vacuumRecommended;
}
