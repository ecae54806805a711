package org.loadprofiler.dto;

import java.util.concurrent.Callable;
import java.util.function.Predicate;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A unit of work the benchmark invokes, times and optionally validates. The callable is opaque to
 * the harness; anything it throws counts as an operation failure.
 */
@Getter
@Builder
@ToString(onlyExplicitlyIncluded = true)
public class Operation {

  public static final long DEFAULT_TIMEOUT_MS = 30_000;

  @ToString.Include private final String name;
  @ToString.Include private final double weight;
  private final Callable<?> invoke;
  @ToString.Include @Builder.Default private final long timeoutMs = DEFAULT_TIMEOUT_MS;

  /** Optional result check; {@code null} accepts every result. */
  private final Predicate<Object> validator;

  public boolean accepts(Object result) {
    return validator == null || validator.test(result);
  }
}
