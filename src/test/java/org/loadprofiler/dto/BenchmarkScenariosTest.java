package org.loadprofiler.dto;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.loadprofiler.exception.BenchmarkConfigurationException;
import org.loadprofiler.load.pattern.PatternType;

class BenchmarkScenariosTest {

  static Stream<BenchmarkConfig> scenarios() {
    return BenchmarkScenarios.all().stream();
  }

  @ParameterizedTest(name = "{index}: {0}")
  @MethodSource("scenarios")
  void shouldValidateOnceOperationsAreRegistered(BenchmarkConfig scenario) {
    assertThrows(
        BenchmarkConfigurationException.class, () -> BenchmarkConfigValidator.validate(scenario));

    scenario.getOperations().register("probe", 1, () -> Boolean.TRUE, 5000);

    assertDoesNotThrow(() -> BenchmarkConfigValidator.validate(scenario));
  }

  @Test
  void shouldCoverEveryPatternType() {
    Set<PatternType> types =
        scenarios()
            .flatMap(config -> config.getPatterns().stream())
            .map(pattern -> pattern.type())
            .collect(Collectors.toSet());

    assertEquals(Set.of(PatternType.values()), types);
  }

  @Test
  void shouldReturnFreshConfigs() {
    BenchmarkScenarios.stress().getOperations().register("x", 1, () -> 1, 100);

    assertTrue(BenchmarkScenarios.stress().getOperations().isEmpty());
  }
}
