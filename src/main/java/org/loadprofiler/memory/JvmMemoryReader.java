package org.loadprofiler.memory;

import java.io.IOException;
import java.lang.management.BufferPoolMXBean;
import java.lang.management.GarbageCollectorMXBean;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.lang.management.OperatingSystemMXBean;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.loadprofiler.exception.SamplerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reads memory, GC and CPU counters from the platform MXBeans of the running JVM. */
public class JvmMemoryReader implements MemoryReader {

  private static final Logger log = LoggerFactory.getLogger(JvmMemoryReader.class);
  private static final Path PROC_STATUS = Path.of("/proc/self/status");

  private final MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();
  private final List<GarbageCollectorMXBean> collectors =
      ManagementFactory.getGarbageCollectorMXBeans();
  private final List<BufferPoolMXBean> bufferPools =
      ManagementFactory.getPlatformMXBeans(BufferPoolMXBean.class);
  private final OperatingSystemMXBean osBean = ManagementFactory.getOperatingSystemMXBean();
  private volatile boolean procStatusReadable = Files.isReadable(PROC_STATUS);

  @Override
  public ResourceSnapshot read() {
    try {
      MemoryUsage heap = memoryBean.getHeapMemoryUsage();
      MemoryUsage nonHeap = memoryBean.getNonHeapMemoryUsage();

      long bufferBytes = 0;
      for (BufferPoolMXBean pool : bufferPools) {
        bufferBytes += Math.max(0, pool.getMemoryUsed());
      }

      long gcCount = 0;
      long gcTime = 0;
      for (GarbageCollectorMXBean collector : collectors) {
        gcCount += Math.max(0, collector.getCollectionCount());
        gcTime += Math.max(0, collector.getCollectionTime());
      }

      long external = nonHeap.getUsed() + bufferBytes;
      return new ResourceSnapshot(
          Instant.now(),
          heap.getUsed(),
          heap.getCommitted(),
          heap.getMax(),
          external,
          residentSetSize(heap.getCommitted() + nonHeap.getCommitted() + bufferBytes),
          gcCount,
          gcTime,
          processCpuLoad());
    } catch (RuntimeException e) {
      throw new SamplerException("Failed to read JVM memory counters", e);
    }
  }

  @Override
  public long heapUsed() {
    try {
      return memoryBean.getHeapMemoryUsage().getUsed();
    } catch (RuntimeException e) {
      throw new SamplerException("Failed to read heap usage", e);
    }
  }

  private double processCpuLoad() {
    if (osBean instanceof com.sun.management.OperatingSystemMXBean sunOsBean) {
      return sunOsBean.getProcessCpuLoad();
    }
    return -1;
  }

  /** VmRSS from procfs where available, otherwise the committed total as an approximation. */
  private long residentSetSize(long committedFallback) {
    if (!procStatusReadable) {
      return committedFallback;
    }
    try {
      for (String line : Files.readAllLines(PROC_STATUS)) {
        if (line.startsWith("VmRSS:")) {
          String kilobytes = line.substring("VmRSS:".length()).replace("kB", "").trim();
          return Long.parseLong(kilobytes) * 1024;
        }
      }
    } catch (IOException | NumberFormatException e) {
      log.debug("Could not read resident set size from {}: {}", PROC_STATUS, e.getMessage());
      procStatusReadable = false;
    }
    return committedFallback;
  }
}
