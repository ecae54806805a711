package org.loadprofiler.exception;

public class ValidationFailureException extends BenchmarkException {

  public ValidationFailureException(String operationName) {
    super("Operation validation failed: " + operationName);
  }
}
