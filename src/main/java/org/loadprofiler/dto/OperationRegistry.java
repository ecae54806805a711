package org.loadprofiler.dto;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Predicate;
import org.loadprofiler.exception.BenchmarkConfigurationException;

/** Operations available to a benchmark, kept in registration order. */
public class OperationRegistry {

  private final Map<String, Operation> operations = new LinkedHashMap<>();

  public OperationRegistry register(
      String name, double weight, Callable<?> invoke, long timeoutMs) {
    return register(name, weight, invoke, timeoutMs, null);
  }

  /** @param validator checks each result; {@code null} accepts everything */
  public OperationRegistry register(
      String name,
      double weight,
      Callable<?> invoke,
      long timeoutMs,
      Predicate<Object> validator) {
    return register(
        Operation.builder()
            .name(name)
            .weight(weight)
            .invoke(invoke)
            .timeoutMs(timeoutMs)
            .validator(validator)
            .build());
  }

  public synchronized OperationRegistry register(Operation operation) {
    if (operation.getName() == null || operation.getName().isBlank()) {
      throw new BenchmarkConfigurationException("Operation name must not be blank");
    }
    if (operation.getInvoke() == null) {
      throw new BenchmarkConfigurationException(
          "Operation " + operation.getName() + " has nothing to invoke");
    }
    if (operations.putIfAbsent(operation.getName(), operation) != null) {
      throw new BenchmarkConfigurationException(
          "Operation already registered: " + operation.getName());
    }
    return this;
  }

  /** Snapshot of the registered operations; later registrations do not affect it. */
  public synchronized List<Operation> list() {
    return List.copyOf(operations.values());
  }

  public synchronized double totalWeight() {
    return operations.values().stream().mapToDouble(Operation::getWeight).sum();
  }

  public synchronized boolean isEmpty() {
    return operations.isEmpty();
  }

  public synchronized int size() {
    return operations.size();
  }
}
