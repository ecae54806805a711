package org.loadprofiler.load;

import org.loadprofiler.load.pattern.ShapingPattern;

public class ShapingStrategyFactory {

  public ShapingStrategy createStrategy(ShapingPattern pattern) {
    return switch (pattern.type()) {
      case CONSTANT, RAMP, SPIKE, WAVE -> new RateShapingStrategy(pattern);
      case BURST -> new BurstShapingStrategy((ShapingPattern.Burst) pattern);
    };
  }
}
