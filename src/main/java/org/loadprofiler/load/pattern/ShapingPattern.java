package org.loadprofiler.load.pattern;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.ArrayList;
import java.util.List;

/**
 * Temporal traffic shape. Implementations are pure configuration: they answer which rate applies at
 * a given point of the run and hold no state of their own.
 *
 * <p>Plans declare patterns as JSON objects tagged with a {@code type} property, e.g. {@code
 * {"type": "ramp", "startRps": 10, "endRps": 100, "steps": 10}}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = ShapingPattern.Constant.class, name = "constant"),
  @JsonSubTypes.Type(value = ShapingPattern.Ramp.class, name = "ramp"),
  @JsonSubTypes.Type(value = ShapingPattern.Spike.class, name = "spike"),
  @JsonSubTypes.Type(value = ShapingPattern.Wave.class, name = "wave"),
  @JsonSubTypes.Type(value = ShapingPattern.Burst.class, name = "burst")
})
public sealed interface ShapingPattern {

  PatternType type();

  /**
   * Target invocations per second at {@code elapsedMs} into a run lasting {@code durationMs}.
   */
  double rateAt(long elapsedMs, long durationMs);

  /** @return human-readable problems with the parameters, empty when the pattern is usable */
  List<String> validate();

  record Constant(double rps) implements ShapingPattern {

    @Override
    public PatternType type() {
      return PatternType.CONSTANT;
    }

    @Override
    public double rateAt(long elapsedMs, long durationMs) {
      return rps;
    }

    @Override
    public List<String> validate() {
      List<String> problems = new ArrayList<>();
      if (!(rps > 0)) {
        problems.add("constant pattern requires rps > 0 but was " + rps);
      }
      return problems;
    }
  }

  /** Linear staircase from {@code startRps} towards {@code endRps} over {@code steps} equal sub-intervals. */
  record Ramp(double startRps, double endRps, int steps) implements ShapingPattern {

    @Override
    public PatternType type() {
      return PatternType.RAMP;
    }

    @Override
    public double rateAt(long elapsedMs, long durationMs) {
      return startRps + stepAt(elapsedMs, durationMs) * (endRps - startRps) / steps;
    }

    public int stepAt(long elapsedMs, long durationMs) {
      double stepDuration = (double) durationMs / steps;
      if (stepDuration <= 0) {
        return 0;
      }
      int step = (int) Math.floor(Math.max(0, elapsedMs) / stepDuration);
      return Math.min(steps - 1, step);
    }

    @Override
    public List<String> validate() {
      List<String> problems = new ArrayList<>();
      if (steps <= 0) {
        problems.add("ramp pattern requires steps > 0 but was " + steps);
      }
      if (startRps < 0 || endRps < 0) {
        problems.add("ramp pattern rates must not be negative");
      }
      if (startRps <= 0 && endRps <= 0) {
        problems.add("ramp pattern requires a positive start or end rate");
      }
      return problems;
    }
  }

  /**
   * {@code baseRps}, raised to {@code spikeRps} for {@code spikeDurationMs} at every multiple of
   * {@code spikeIntervalMs}. The first spike starts one interval into the run.
   */
  record Spike(double baseRps, double spikeRps, long spikeDurationMs, long spikeIntervalMs)
      implements ShapingPattern {

    @Override
    public PatternType type() {
      return PatternType.SPIKE;
    }

    @Override
    public double rateAt(long elapsedMs, long durationMs) {
      return inSpike(elapsedMs) ? spikeRps : baseRps;
    }

    public boolean inSpike(long elapsedMs) {
      return elapsedMs >= spikeIntervalMs && elapsedMs % spikeIntervalMs < spikeDurationMs;
    }

    @Override
    public List<String> validate() {
      List<String> problems = new ArrayList<>();
      if (!(baseRps > 0)) {
        problems.add("spike pattern requires baseRps > 0 but was " + baseRps);
      }
      if (spikeRps < baseRps) {
        problems.add("spike pattern requires spikeRps >= baseRps");
      }
      if (spikeIntervalMs <= 0) {
        problems.add("spike pattern requires spikeIntervalMs > 0");
      }
      if (spikeDurationMs <= 0 || spikeDurationMs > spikeIntervalMs) {
        problems.add("spike pattern requires 0 < spikeDurationMs <= spikeIntervalMs");
      }
      return problems;
    }
  }

  /** Sinusoid between {@code minRps} and {@code maxRps}, starting at the midpoint and rising. */
  record Wave(double minRps, double maxRps, long wavelengthMs) implements ShapingPattern {

    @Override
    public PatternType type() {
      return PatternType.WAVE;
    }

    @Override
    public double rateAt(long elapsedMs, long durationMs) {
      double phase = (double) (elapsedMs % wavelengthMs) / wavelengthMs;
      return minRps + ((Math.sin(2 * Math.PI * phase) + 1) / 2) * (maxRps - minRps);
    }

    @Override
    public List<String> validate() {
      List<String> problems = new ArrayList<>();
      if (minRps < 0) {
        problems.add("wave pattern requires minRps >= 0 but was " + minRps);
      }
      if (!(maxRps > minRps)) {
        problems.add("wave pattern requires maxRps > minRps");
      }
      if (wavelengthMs <= 0) {
        problems.add("wave pattern requires wavelengthMs > 0");
      }
      return problems;
    }
  }

  /**
   * {@code burstSize} simultaneous invocations, a rest of {@code restMs}, then whatever is left of
   * {@code burstIntervalMs}. A rest longer than the interval leaves nothing to wait out.
   */
  record Burst(int burstSize, long burstIntervalMs, long restMs) implements ShapingPattern {

    @Override
    public PatternType type() {
      return PatternType.BURST;
    }

    /** Average rate over a full burst cycle. */
    @Override
    public double rateAt(long elapsedMs, long durationMs) {
      long cycle = Math.max(burstIntervalMs, restMs);
      return cycle > 0 ? burstSize * 1000.0 / cycle : burstSize;
    }

    public long remainderAfterRest() {
      return Math.max(0, burstIntervalMs - restMs);
    }

    @Override
    public List<String> validate() {
      List<String> problems = new ArrayList<>();
      if (burstSize <= 0) {
        problems.add("burst pattern requires burstSize > 0 but was " + burstSize);
      }
      if (burstIntervalMs <= 0) {
        problems.add("burst pattern requires burstIntervalMs > 0");
      }
      if (restMs < 0) {
        problems.add("burst pattern requires restMs >= 0");
      }
      return problems;
    }
  }
}
