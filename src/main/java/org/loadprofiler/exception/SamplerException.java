package org.loadprofiler.exception;

/** A single resource sample could not be taken. The sampler logs it and keeps its schedule. */
public class SamplerException extends BenchmarkException {

  public SamplerException(String message) {
    super(message);
  }

  public SamplerException(String message, Throwable cause) {
    super(message, cause);
  }
}
