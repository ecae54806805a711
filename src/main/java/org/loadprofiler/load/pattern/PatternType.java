package org.loadprofiler.load.pattern;

public enum PatternType {
  CONSTANT,
  RAMP,
  SPIKE,
  WAVE,
  BURST
}
