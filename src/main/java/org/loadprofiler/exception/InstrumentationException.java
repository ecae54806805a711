package org.loadprofiler.exception;

/** Query statistics could not be recorded. Never surfaces to the caller of the instrumented query. */
public class InstrumentationException extends BenchmarkException {

  public InstrumentationException(String message, Throwable cause) {
    super(message, cause);
  }
}
