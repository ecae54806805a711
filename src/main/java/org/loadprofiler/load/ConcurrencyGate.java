package org.loadprofiler.load;

import com.google.common.base.Preconditions;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounds the number of in-flight invocations. Waiters are admitted in arrival order. Every
 * successful acquire must be paired with exactly one {@link #release()}, normally in a finally block
 * or a completion callback that runs on both success and failure.
 */
public class ConcurrencyGate {

  private final int limit;
  private final Semaphore permits;
  private final AtomicInteger active = new AtomicInteger(0);
  private final AtomicInteger peakActive = new AtomicInteger(0);

  public ConcurrencyGate(int limit) {
    Preconditions.checkArgument(limit > 0, "Concurrency limit must be positive: %s", limit);
    this.limit = limit;
    this.permits = new Semaphore(limit, true);
  }

  public void acquire() throws InterruptedException {
    permits.acquire();
    onAcquired();
  }

  public boolean tryAcquire(long timeout, TimeUnit unit) throws InterruptedException {
    if (permits.tryAcquire(timeout, unit)) {
      onAcquired();
      return true;
    }
    return false;
  }

  private void onAcquired() {
    int now = active.incrementAndGet();
    peakActive.accumulateAndGet(now, Math::max);
  }

  public void release() {
    int before = active.getAndUpdate(current -> current > 0 ? current - 1 : current);
    if (before <= 0) {
      throw new IllegalStateException("Concurrency gate released more times than acquired");
    }
    permits.release();
  }

  public int getLimit() {
    return limit;
  }

  public int activeCount() {
    return active.get();
  }

  public int peakActiveCount() {
    return peakActive.get();
  }

  public int queueLength() {
    return permits.getQueueLength();
  }
}
