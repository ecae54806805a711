package org.loadprofiler.dto;

import static org.junit.jupiter.api.Assertions.*;

import java.io.InputStream;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.loadprofiler.exception.BenchmarkConfigurationException;
import org.loadprofiler.load.pattern.ShapingPattern;
import org.loadprofiler.util.JsonUtil;

class BenchmarkConfigValidatorTest {

  private static BenchmarkConfig.BenchmarkConfigBuilder valid() {
    OperationRegistry operations = new OperationRegistry().register("noop", 1, () -> "ok", 1000);
    return BenchmarkConfig.builder().name("valid").duration("2s").operations(operations);
  }

  @Test
  void shouldAcceptValidConfig() {
    assertDoesNotThrow(() -> BenchmarkConfigValidator.validate(valid().build()));
  }

  @Test
  @DisplayName("All problems are reported together")
  void shouldCollectEveryProblem() {
    // Given
    BenchmarkConfig config =
        BenchmarkConfig.builder()
            .name(" ")
            .duration("0s")
            .rampUpTime("soon")
            .maxConcurrency(0)
            .targetRps(0)
            .windowSizeSeconds(0)
            .build();

    // When
    BenchmarkConfigurationException e =
        assertThrows(
            BenchmarkConfigurationException.class, () -> BenchmarkConfigValidator.validate(config));

    // Then
    List<String> problems = e.getProblems();
    assertTrue(problems.contains("name must not be blank"));
    assertTrue(problems.contains("duration must be > 0"));
    assertTrue(problems.stream().anyMatch(p -> p.startsWith("rampUpTime: Unparseable duration")));
    assertTrue(problems.contains("maxConcurrency must be > 0 but was 0"));
    assertTrue(problems.contains("windowSizeSeconds must be > 0 but was 0"));
    assertTrue(problems.contains("at least one operation must be registered"));
    assertTrue(problems.stream().anyMatch(p -> p.startsWith("constant pattern requires rps > 0")));
    assertTrue(e.getMessage().startsWith("Benchmark configuration is invalid: "));
  }

  @Nested
  @DisplayName("Operations")
  class Operations {

    @Test
    void shouldRejectZeroWeightAndTimeout() {
      OperationRegistry operations =
          new OperationRegistry()
              .register(Operation.builder().name("free").weight(0).invoke(() -> 1).build())
              .register(
                  Operation.builder().name("instant").weight(1).invoke(() -> 1).timeoutMs(0).build());
      BenchmarkConfig config = valid().operations(operations).build();

      BenchmarkConfigurationException e =
          assertThrows(
              BenchmarkConfigurationException.class,
              () -> BenchmarkConfigValidator.validate(config));

      assertEquals(
          List.of("operation free must have weight > 0", "operation instant must have timeoutMs > 0"),
          e.getProblems());
    }

    @Test
    void shouldRejectDuplicateRegistration() {
      OperationRegistry operations = new OperationRegistry().register("a", 1, () -> 1, 100);

      assertThrows(
          BenchmarkConfigurationException.class,
          () -> operations.register("a", 2, () -> 2, 100));
      assertEquals(1, operations.size());
    }
  }

  @Test
  void shouldReportPatternProblems() {
    BenchmarkConfig config =
        valid().patterns(List.of(new ShapingPattern.Ramp(10, 50, 0))).build();

    BenchmarkConfigurationException e =
        assertThrows(
            BenchmarkConfigurationException.class, () -> BenchmarkConfigValidator.validate(config));

    assertEquals(1, e.getProblems().size());
  }

  @Test
  void shouldDefaultToConstantPatternAtTargetRate() {
    BenchmarkConfig config = valid().targetRps(25).build();

    assertEquals(List.of(new ShapingPattern.Constant(25)), config.effectivePatterns());
  }

  private BenchmarkConfig loadSample() throws Exception {
    try (InputStream json = getClass().getResourceAsStream("/benchmark-sample.json")) {
      return JsonUtil.read(json, BenchmarkConfig.class);
    }
  }

  @Test
  @DisplayName("The bundled sample plan loads and validates once operations are registered")
  void shouldLoadSamplePlan() throws Exception {
    // Given
    BenchmarkConfig loaded = loadSample();

    // When
    loaded.getOperations().register("noop", 1, () -> "ok", 1000);

    // Then
    assertDoesNotThrow(() -> BenchmarkConfigValidator.validate(loaded));
    assertEquals("sample-mixed-workload", loaded.getName());
    assertEquals(Duration.ofSeconds(30), loaded.parsedDuration());
    assertEquals(Duration.ofSeconds(5), loaded.parsedRampUpTime());
    assertEquals(20, loaded.getMaxConcurrency());
    assertEquals(2, loaded.getPatterns().size());
    assertEquals(new ShapingPattern.Ramp(10, 60, 5), loaded.getPatterns().get(0));
    assertEquals(50, loaded.getThresholds().getMaxDatabaseLatencyMs());
    assertEquals("performance-reports", loaded.getReportsDirectory());
  }
}
