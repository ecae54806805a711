package org.loadprofiler.exception;

public class OperationTimeoutException extends BenchmarkException {

  private final long timeoutMs;

  public OperationTimeoutException(String operationName, long timeoutMs) {
    super("Operation timeout: " + operationName + " did not complete within " + timeoutMs + "ms");
    this.timeoutMs = timeoutMs;
  }

  public long getTimeoutMs() {
    return timeoutMs;
  }
}
