package org.loadprofiler.memory;

public enum PressureType {
  ALLOCATION_SPIKE,
  GC_PRESSURE,
  HEAP_EXHAUSTION
}
