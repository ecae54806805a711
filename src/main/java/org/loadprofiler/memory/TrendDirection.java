package org.loadprofiler.memory;

public enum TrendDirection {
  INCREASING,
  DECREASING,
  STABLE
}
