package org.loadprofiler.metrics;

public enum ErrorKind {
  OPERATION_FAILURE,
  OPERATION_TIMEOUT,
  VALIDATION_FAILURE
}
