package org.loadprofiler.report;

import java.util.List;
import lombok.Builder;
import lombok.Data;
import org.loadprofiler.metrics.Severity;

/** A threshold breach attributed to one resource category. */
@Data
@Builder
public class Bottleneck {

  public enum Type {
    MEMORY,
    CPU,
    DATABASE,
    IO,
    NETWORK
  }

  private final Type type;
  private final Severity severity;
  private final String description;
  private final String impact;
  private final String location;
  private final List<String> recommendations;
}
