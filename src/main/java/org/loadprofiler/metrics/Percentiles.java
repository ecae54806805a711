package org.loadprofiler.metrics;

import java.util.List;

final class Percentiles {

  private Percentiles() {}

  /** Nearest-rank percentile; sorts {@code values} in place. */
  static long of(List<Long> values, double percentile) {
    if (values.isEmpty()) return 0;

    values.sort(null);
    int index = (int) Math.ceil(values.size() * percentile / 100.0) - 1;
    return values.get(Math.max(0, Math.min(index, values.size() - 1)));
  }
}
