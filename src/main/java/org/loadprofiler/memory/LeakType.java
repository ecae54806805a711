package org.loadprofiler.memory;

public enum LeakType {
  GRADUAL,
  SUDDEN,
  EVENT_BASED
}
