package org.loadprofiler.exception;

import java.util.List;

/**
 * Thrown before a run starts when the benchmark configuration cannot be executed: invalid pattern
 * parameters, an empty or zero-weight operation set, non-positive limits.
 */
public class BenchmarkConfigurationException extends BenchmarkException {

  private final List<String> problems;

  public BenchmarkConfigurationException(String message) {
    super(message);
    this.problems = List.of(message);
  }

  public BenchmarkConfigurationException(List<String> problems) {
    super("Benchmark configuration is invalid: " + String.join("; ", problems));
    this.problems = List.copyOf(problems);
  }

  public List<String> getProblems() {
    return problems;
  }
}
