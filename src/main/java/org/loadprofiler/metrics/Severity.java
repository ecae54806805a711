package org.loadprofiler.metrics;

public enum Severity {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL
}
