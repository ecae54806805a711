package org.loadprofiler.load;

/** Drives invocations for one shaping pattern until the shaper stops. */
public interface ShapingStrategy {

  void execute(TrafficShaper shaper) throws InterruptedException;
}
