package org.loadprofiler.load;

import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread pools of a single benchmark run. Created when the run starts and released by {@link
 * #cleanup()} in its {@code finally} block: timers first, so no sample or window rotation fires
 * against a stopped worker pool, then shapers, then workers.
 */
public class ResourceManager {

  private static final Logger log = LoggerFactory.getLogger(ResourceManager.class);
  private static final Duration FORCED_SHUTDOWN_GRACE = Duration.ofSeconds(2);

  private final ScheduledExecutorService schedulerService;
  private final ExecutorService shaperExecutor;
  private final ExecutorService workerExecutor;

  /** Pool name to drain timeout, in shutdown order. */
  private final Map<String, Duration> drainTimeouts = new LinkedHashMap<>();
  private final Map<String, ExecutorService> pools = new LinkedHashMap<>();

  public ResourceManager() {
    int schedulerThreads = Math.max(3, Runtime.getRuntime().availableProcessors() / 2);
    this.schedulerService =
        Executors.newScheduledThreadPool(schedulerThreads, daemonThreads("benchmark-scheduler-%d"));
    this.shaperExecutor = Executors.newCachedThreadPool(daemonThreads("traffic-shaper-%d"));
    this.workerExecutor = Executors.newCachedThreadPool(daemonThreads("benchmark-worker-%d"));

    register("scheduler", schedulerService, Duration.ofSeconds(5));
    register("shaper", shaperExecutor, Duration.ofSeconds(5));
    register("worker", workerExecutor, Duration.ofSeconds(10));
  }

  private void register(String name, ExecutorService pool, Duration drainTimeout) {
    pools.put(name, pool);
    drainTimeouts.put(name, drainTimeout);
  }

  private static ThreadFactory daemonThreads(String nameFormat) {
    return new ThreadFactoryBuilder().setNameFormat(nameFormat).setDaemon(true).build();
  }

  /** Runs operation invocations. */
  public ExecutorService getWorkerExecutor() {
    return workerExecutor;
  }

  /** Runs one loop per shaping pattern. */
  public ExecutorService getShaperExecutor() {
    return shaperExecutor;
  }

  /** Resource sampling and window rotation. */
  public ScheduledExecutorService getSchedulerService() {
    return schedulerService;
  }

  public void cleanup() {
    Stopwatch stopwatch = Stopwatch.createStarted();
    boolean interrupted = false;
    for (Map.Entry<String, ExecutorService> pool : pools.entrySet()) {
      if (interrupted) {
        pool.getValue().shutdownNow();
        continue;
      }
      interrupted = !drain(pool.getKey(), pool.getValue(), drainTimeouts.get(pool.getKey()));
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
    log.debug("Benchmark thread pools released in {}", stopwatch);
  }

  /** @return {@code false} if the calling thread was interrupted while waiting */
  private boolean drain(String name, ExecutorService pool, Duration timeout) {
    pool.shutdown();
    try {
      if (pool.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        return true;
      }
      int abandoned = pool.shutdownNow().size();
      log.warn(
          "{} pool still busy after {}s, forcing shutdown ({} queued tasks dropped)",
          name,
          timeout.toSeconds(),
          abandoned);
      if (!pool.awaitTermination(FORCED_SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("{} pool did not terminate after forced shutdown", name);
      }
      return true;
    } catch (InterruptedException e) {
      log.warn("Interrupted while draining the {} pool, forcing shutdown", name);
      pool.shutdownNow();
      return false;
    }
  }
}
