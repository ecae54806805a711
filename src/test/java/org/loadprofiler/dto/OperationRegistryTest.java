package org.loadprofiler.dto;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.loadprofiler.exception.BenchmarkConfigurationException;

class OperationRegistryTest {

  @Test
  @DisplayName("A registered validator decides which results are accepted")
  void shouldApplyValidatorToResults() {
    // Given
    OperationRegistry registry =
        new OperationRegistry()
            .register("positive", 1, () -> 5L, 1_000, result -> (Long) result > 0)
            .register("anything", 1, () -> "ok", 1_000);

    // When
    Operation positive = registry.list().get(0);
    Operation anything = registry.list().get(1);

    // Then
    assertTrue(positive.accepts(5L));
    assertFalse(positive.accepts(-1L));
    assertNull(anything.getValidator());
    assertTrue(anything.accepts(null));
  }

  @Test
  void shouldKeepRegistrationOrderAndTotalWeight() {
    OperationRegistry registry =
        new OperationRegistry()
            .register("b", 2, () -> 1, 100)
            .register("a", 0.5, () -> 1, 100);

    assertEquals(List.of("b", "a"), registry.list().stream().map(Operation::getName).collect(Collectors.toList()));
    assertEquals(2.5, registry.totalWeight());
    assertEquals(2, registry.size());
  }

  @Test
  void shouldRejectOperationWithoutCallable() {
    Operation noop = Operation.builder().name("noop").weight(1).build();

    assertThrows(BenchmarkConfigurationException.class, () -> new OperationRegistry().register(noop));
  }
}
