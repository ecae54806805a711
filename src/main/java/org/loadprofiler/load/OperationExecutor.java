package org.loadprofiler.load;

import com.google.common.base.Stopwatch;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.loadprofiler.dto.Operation;
import org.loadprofiler.exception.OperationTimeoutException;
import org.loadprofiler.exception.ValidationFailureException;
import org.loadprofiler.metrics.ErrorKind;
import org.loadprofiler.metrics.InvocationRecord;
import org.loadprofiler.metrics.RunMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs single operation invocations through the concurrency gate. The caller blocks until a slot is
 * free; the invocation itself runs on the worker pool and races its timeout. The slot is released
 * once the outcome is known, whether the operation succeeded, failed or timed out.
 */
public class OperationExecutor {

  private static final Logger log = LoggerFactory.getLogger(OperationExecutor.class);

  private final ExecutorService workers;
  private final ConcurrencyGate gate;
  private final RunMetrics metrics;
  private final AtomicInteger activeInvocations = new AtomicInteger(0);

  /** @param metrics where outcomes are recorded; {@code null} discards them, as during warmup */
  public OperationExecutor(ExecutorService workers, ConcurrencyGate gate, RunMetrics metrics) {
    this.workers = workers;
    this.gate = gate;
    this.metrics = metrics;
  }

  /**
   * Acquires a gate slot and starts the invocation.
   *
   * @return completes with the invocation's record; never completes exceptionally for operation
   *     failures
   */
  public CompletableFuture<InvocationRecord> submit(Operation operation)
      throws InterruptedException {
    gate.acquire();
    activeInvocations.incrementAndGet();

    Instant startTime = Instant.now();
    Stopwatch stopwatch = Stopwatch.createStarted();

    CompletableFuture<Object> invocation;
    try {
      invocation = CompletableFuture.supplyAsync(() -> call(operation), workers);
    } catch (RejectedExecutionException e) {
      invocation = CompletableFuture.failedFuture(e);
    }

    return invocation
        .orTimeout(operation.getTimeoutMs(), TimeUnit.MILLISECONDS)
        .handle(
            (result, throwable) -> {
              long durationMs = stopwatch.elapsed(TimeUnit.MILLISECONDS);
              InvocationRecord record = toRecord(operation, startTime, durationMs, throwable);
              if (metrics != null) {
                try {
                  metrics.recordInvocation(record);
                } catch (RuntimeException e) {
                  log.error("Failed to record invocation of {}", operation.getName(), e);
                }
              } else {
                log.debug("Unrecorded invocation of {}: {}ms", operation.getName(), durationMs);
              }
              return record;
            })
        .whenComplete(
            (record, throwable) -> {
              activeInvocations.decrementAndGet();
              gate.release();
            });
  }

  public int activeInvocations() {
    return activeInvocations.get();
  }

  private static Object call(Operation operation) {
    Object result;
    try {
      result = operation.getInvoke().call();
    } catch (Exception e) {
      throw new CompletionException(e);
    }
    if (!operation.accepts(result)) {
      throw new ValidationFailureException(operation.getName());
    }
    return result;
  }

  private static InvocationRecord toRecord(
      Operation operation, Instant startTime, long durationMs, Throwable throwable) {
    if (throwable == null) {
      return InvocationRecord.success(operation.getName(), startTime, durationMs);
    }

    Throwable cause = unwrap(throwable);
    if (cause instanceof TimeoutException) {
      return InvocationRecord.failure(
          operation.getName(),
          startTime,
          durationMs,
          ErrorKind.OPERATION_TIMEOUT,
          new OperationTimeoutException(operation.getName(), operation.getTimeoutMs()).getMessage());
    }
    if (cause instanceof ValidationFailureException) {
      return InvocationRecord.failure(
          operation.getName(),
          startTime,
          durationMs,
          ErrorKind.VALIDATION_FAILURE,
          cause.getMessage());
    }
    String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
    return InvocationRecord.failure(
        operation.getName(), startTime, durationMs, ErrorKind.OPERATION_FAILURE, message);
  }

  private static Throwable unwrap(Throwable throwable) {
    Throwable current = throwable;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}
