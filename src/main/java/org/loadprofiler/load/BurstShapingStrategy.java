package org.loadprofiler.load;

import org.loadprofiler.load.pattern.ShapingPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class BurstShapingStrategy implements ShapingStrategy {

  private static final Logger log = LoggerFactory.getLogger(BurstShapingStrategy.class);

  private final ShapingPattern.Burst pattern;

  BurstShapingStrategy(ShapingPattern.Burst pattern) {
    this.pattern = pattern;
  }

  @Override
  public void execute(TrafficShaper shaper) throws InterruptedException {
    int burstNumber = 0;
    while (shaper.isActive()) {
      burstNumber++;
      log.debug("Burst {} of {} invocations", burstNumber, pattern.burstSize());
      shaper.issueBatch(pattern.burstSize());
      shaper.pause(pattern.restMs());
      shaper.pause(pattern.remainderAfterRest());
    }
  }
}
