package org.loadprofiler.metrics;

import java.time.Instant;

/**
 * Outcome of one completed invocation. {@code errorKind} and {@code error} are {@code null} for
 * successful invocations.
 */
public record InvocationRecord(
    String operationName,
    Instant startTime,
    long durationMs,
    boolean succeeded,
    ErrorKind errorKind,
    String error) {

  public static InvocationRecord success(String operationName, Instant startTime, long durationMs) {
    return new InvocationRecord(operationName, startTime, durationMs, true, null, null);
  }

  public static InvocationRecord failure(
      String operationName, Instant startTime, long durationMs, ErrorKind kind, String error) {
    return new InvocationRecord(operationName, startTime, durationMs, false, kind, error);
  }
}
