package org.loadprofiler.dto;

import java.util.List;
import org.loadprofiler.load.pattern.ShapingPattern;

/**
 * Ready-made plans for the classic load-test scenarios. Callers register their operations on the
 * returned config before running it.
 */
public final class BenchmarkScenarios {

  private BenchmarkScenarios() {}

  /** Ramp from 10 to 200 rps in 20 steps to find the breaking point. */
  public static BenchmarkConfig stress() {
    return BenchmarkConfig.builder()
        .name("stress-test")
        .description("Gradually increase load until the system breaks to find maximum capacity")
        .patterns(List.of(new ShapingPattern.Ramp(10, 200, 20)))
        .duration("5m")
        .rampUpTime("1m")
        .maxConcurrency(100)
        .targetRps(150)
        .warmupDuration("30s")
        .cooldownDuration("30s")
        .thresholds(
            PerformanceThresholds.builder()
                .maxResponseTimeMs(2000)
                .maxMemoryMb(512)
                .minThroughput(100)
                .maxErrorRatePct(5)
                .maxCpuUtilizationPct(90)
                .maxDatabaseLatencyMs(500)
                .build())
        .build();
  }

  /** Steady 50 rps over a long window for large-payload processing. */
  public static BenchmarkConfig volume() {
    return BenchmarkConfig.builder()
        .name("volume-test")
        .description("Sustained constant load with large data sets")
        .patterns(List.of(new ShapingPattern.Constant(50)))
        .duration("10m")
        .maxConcurrency(50)
        .targetRps(50)
        .warmupDuration("15s")
        .cooldownDuration("30s")
        .thresholds(
            PerformanceThresholds.builder()
                .maxResponseTimeMs(5000)
                .maxMemoryMb(1024)
                .minThroughput(25)
                .maxErrorRatePct(2)
                .maxCpuUtilizationPct(85)
                .maxDatabaseLatencyMs(1000)
                .build())
        .build();
  }

  /** Waves between 20 and 80 rps with a two minute period, held for half an hour. */
  public static BenchmarkConfig endurance() {
    return BenchmarkConfig.builder()
        .name("endurance-test")
        .description("Long-running stability under oscillating load")
        .patterns(List.of(new ShapingPattern.Wave(20, 80, 120_000)))
        .duration("30m")
        .maxConcurrency(30)
        .targetRps(50)
        .warmupDuration("30s")
        .cooldownDuration("1m")
        .thresholds(
            PerformanceThresholds.builder()
                .maxResponseTimeMs(3000)
                .maxMemoryMb(768)
                .minThroughput(30)
                .maxErrorRatePct(1)
                .maxCpuUtilizationPct(75)
                .maxDatabaseLatencyMs(750)
                .build())
        .build();
  }

  /** 20 rps base load with 10 second spikes to 150 rps every minute. */
  public static BenchmarkConfig spike() {
    return BenchmarkConfig.builder()
        .name("spike-test")
        .description("System behaviour under sudden traffic spikes")
        .patterns(List.of(new ShapingPattern.Spike(20, 150, 10_000, 60_000)))
        .duration("7m")
        .maxConcurrency(150)
        .targetRps(50)
        .warmupDuration("15s")
        .cooldownDuration("30s")
        .thresholds(
            PerformanceThresholds.builder()
                .maxResponseTimeMs(8000)
                .maxMemoryMb(640)
                .minThroughput(15)
                .maxErrorRatePct(8)
                .maxCpuUtilizationPct(95)
                .maxDatabaseLatencyMs(2000)
                .build())
        .build();
  }

  /** Bursts of 75 simultaneous operations every 15 seconds to shake out races and deadlocks. */
  public static BenchmarkConfig concurrency() {
    return BenchmarkConfig.builder()
        .name("concurrency-test")
        .description("Simultaneous bursts probing race conditions and deadlocks")
        .patterns(List.of(new ShapingPattern.Burst(75, 15_000, 5_000)))
        .duration("8m")
        .maxConcurrency(75)
        .targetRps(40)
        .warmupDuration("20s")
        .cooldownDuration("30s")
        .thresholds(
            PerformanceThresholds.builder()
                .maxResponseTimeMs(4000)
                .maxMemoryMb(512)
                .minThroughput(20)
                .maxErrorRatePct(3)
                .maxCpuUtilizationPct(80)
                .maxDatabaseLatencyMs(1500)
                .build())
        .build();
  }

  public static List<BenchmarkConfig> all() {
    return List.of(stress(), volume(), endurance(), spike(), concurrency());
  }
}
