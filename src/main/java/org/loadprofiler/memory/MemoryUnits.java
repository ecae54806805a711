package org.loadprofiler.memory;

public final class MemoryUnits {

  public static final long KB = 1024;
  public static final long MB = 1024 * KB;
  public static final long GB = 1024 * MB;

  private MemoryUnits() {}

  public static double toMb(long bytes) {
    return (double) bytes / MB;
  }
}
