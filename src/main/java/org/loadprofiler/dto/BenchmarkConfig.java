package org.loadprofiler.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Duration;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;
import org.loadprofiler.load.pattern.ShapingPattern;
import org.loadprofiler.util.DurationParser;

/**
 * Benchmark plan. Everything except the operations can be loaded from JSON; durations use the
 * {@code "500ms"}, {@code "30s"}, {@code "5m"} notation understood by {@link DurationParser}.
 */
@Getter
@Builder(toBuilder = true)
@Jacksonized
@ToString(exclude = "operations")
public class BenchmarkConfig {

  private final String name;
  private final String description;

  @Builder.Default private final String duration = "60s";
  private final String rampUpTime;
  private final String warmupDuration;
  private final String cooldownDuration;

  @Builder.Default private final int maxConcurrency = 10;
  @Builder.Default private final double targetRps = 10;

  /** Shapes driven concurrently against one shared gate. Empty means constant at {@code targetRps}. */
  @Builder.Default private final List<ShapingPattern> patterns = List.of();

  @Builder.Default
  private final PerformanceThresholds thresholds = PerformanceThresholds.builder().build();

  @Builder.Default private final String sampleInterval = "1s";
  @Builder.Default private final int windowSizeSeconds = 5;

  /** Directory the JSON report is written to; {@code null} keeps the report in memory only. */
  private final String reportsDirectory;

  @JsonIgnore @Builder.Default private final OperationRegistry operations = new OperationRegistry();

  public Duration parsedDuration() {
    return DurationParser.parse(duration);
  }

  public Duration parsedRampUpTime() {
    return DurationParser.parse(rampUpTime);
  }

  public Duration parsedWarmupDuration() {
    return DurationParser.parse(warmupDuration);
  }

  public Duration parsedCooldownDuration() {
    return DurationParser.parse(cooldownDuration);
  }

  public Duration parsedSampleInterval() {
    return DurationParser.parse(sampleInterval);
  }

  public List<ShapingPattern> effectivePatterns() {
    if (patterns == null || patterns.isEmpty()) {
      return List.of(new ShapingPattern.Constant(targetRps));
    }
    return patterns;
  }
}
