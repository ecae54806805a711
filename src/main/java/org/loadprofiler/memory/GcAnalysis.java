package org.loadprofiler.memory;

import java.util.List;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class GcAnalysis {
  private final int totalCollections;
  private final long totalPauseMs;
  private final double averagePauseMs;
  private final long maxPauseMs;
  private final long totalFreedBytes;

  /** Bytes freed per millisecond of pause. */
  private final double efficiency;

  private final double collectionsPerMinute;
  private final List<String> recommendations;
}
