package org.loadprofiler.load;

import org.loadprofiler.load.pattern.ShapingPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tick loop for rate-based patterns. Each tick issues {@code ceil(min(maxConcurrency, rate))}
 * invocations, waits for all of them, then pauses {@code 1000 / rate} ms.
 */
class RateShapingStrategy implements ShapingStrategy {

  private static final Logger log = LoggerFactory.getLogger(RateShapingStrategy.class);
  static final long IDLE_PAUSE_MS = 100;
  static final double MIN_RAMP_UP_FACTOR = 0.1;

  private final ShapingPattern pattern;

  RateShapingStrategy(ShapingPattern pattern) {
    this.pattern = pattern;
  }

  @Override
  public void execute(TrafficShaper shaper) throws InterruptedException {
    long durationMs = shaper.getDuration().toMillis();
    long rampUpMs = shaper.getRampUp().toMillis();

    while (shaper.isActive()) {
      long elapsedMs = shaper.elapsedMs();
      double rate = pattern.rateAt(elapsedMs, durationMs) * rampUpFactor(elapsedMs, rampUpMs);
      if (rate <= 0) {
        shaper.pause(IDLE_PAUSE_MS);
        continue;
      }

      int batch = (int) Math.ceil(Math.min(shaper.getMaxConcurrency(), rate));
      log.trace("{} tick at {}ms: rate {}, batch {}", pattern.type(), elapsedMs, rate, batch);
      shaper.issueBatch(batch);
      shaper.pause((long) (1000 / rate));
    }
  }

  static double rampUpFactor(long elapsedMs, long rampUpMs) {
    if (rampUpMs <= 0 || elapsedMs >= rampUpMs) {
      return 1.0;
    }
    return Math.max(MIN_RAMP_UP_FACTOR, (double) elapsedMs / rampUpMs);
  }
}
