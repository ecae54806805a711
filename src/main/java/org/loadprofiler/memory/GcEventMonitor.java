package org.loadprofiler.memory;

import com.google.common.collect.EvictingQueue;
import com.sun.management.GarbageCollectionNotificationInfo;
import com.sun.management.GcInfo;
import java.lang.management.GarbageCollectorMXBean;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryPoolMXBean;
import java.lang.management.MemoryType;
import java.lang.management.MemoryUsage;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import javax.management.ListenerNotFoundException;
import javax.management.Notification;
import javax.management.NotificationEmitter;
import javax.management.NotificationListener;
import javax.management.openmbean.CompositeData;
import org.loadprofiler.exception.SamplerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records a {@link GcEvent} for every collection the JVM reports, plus explicitly timed forced
 * collections. Events are kept in a bounded ring, oldest evicted first.
 */
public class GcEventMonitor {

  private static final Logger log = LoggerFactory.getLogger(GcEventMonitor.class);
  private static final int DEFAULT_CAPACITY = 1000;
  private static final String FORCED_CAUSE = "forced";

  private final MemoryReader reader;
  private final EvictingQueue<GcEvent> events;
  private final Map<NotificationEmitter, NotificationListener> registrations =
      new ConcurrentHashMap<>();
  private final Set<String> heapPools;
  private final AtomicBoolean forcing = new AtomicBoolean(false);
  private volatile Consumer<GcEvent> eventConsumer = event -> {};

  public GcEventMonitor(MemoryReader reader) {
    this(reader, DEFAULT_CAPACITY);
  }

  public GcEventMonitor(MemoryReader reader, int capacity) {
    this.reader = reader;
    this.events = EvictingQueue.create(capacity);
    this.heapPools =
        ManagementFactory.getMemoryPoolMXBeans().stream()
            .filter(pool -> pool.getType() == MemoryType.HEAP)
            .map(MemoryPoolMXBean::getName)
            .collect(Collectors.toSet());
  }

  public void onEvent(Consumer<GcEvent> consumer) {
    this.eventConsumer = consumer;
  }

  /** Subscribes to the collectors' notifications. Collectors that do not emit them are skipped. */
  public void start() {
    for (GarbageCollectorMXBean collector : ManagementFactory.getGarbageCollectorMXBeans()) {
      if (collector instanceof NotificationEmitter emitter) {
        NotificationListener listener = (notification, handback) -> handle(notification);
        emitter.addNotificationListener(listener, null, null);
        registrations.put(emitter, listener);
      }
    }
    log.debug("GC monitor subscribed to {} collectors", registrations.size());
  }

  public void stop() {
    registrations.forEach(
        (emitter, listener) -> {
          try {
            emitter.removeNotificationListener(listener);
          } catch (ListenerNotFoundException e) {
            log.debug("GC listener already removed: {}", e.getMessage());
          }
        });
    registrations.clear();
  }

  /**
   * Requests a full collection and times it. The JVM may treat the request as a hint, in which case
   * the event reports little or nothing freed.
   */
  public Optional<GcEvent> forceCollection() {
    forcing.set(true);
    try {
      long before = reader.heapUsed();
      long startNanos = System.nanoTime();
      System.gc();
      long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
      long after = reader.heapUsed();

      GcEvent event = new GcEvent(Instant.now(), durationMs, before, after, "System.gc", FORCED_CAUSE);
      record(event);
      log.debug("Forced collection freed {} bytes in {}ms", event.freed(), durationMs);
      return Optional.of(event);
    } catch (SamplerException e) {
      log.warn("Forced collection could not be measured: {}", e.getMessage());
      return Optional.empty();
    } finally {
      forcing.set(false);
    }
  }

  public List<GcEvent> getEvents() {
    synchronized (events) {
      return new ArrayList<>(events);
    }
  }

  void record(GcEvent event) {
    synchronized (events) {
      events.add(event);
    }
    try {
      eventConsumer.accept(event);
    } catch (RuntimeException e) {
      log.warn("GC event consumer failed: {}", e.getMessage());
    }
  }

  private void handle(Notification notification) {
    if (!GarbageCollectionNotificationInfo.GARBAGE_COLLECTION_NOTIFICATION.equals(
        notification.getType())) {
      return;
    }
    try {
      var info = GarbageCollectionNotificationInfo.from((CompositeData) notification.getUserData());
      if (forcing.get() && "System.gc()".equals(info.getGcCause())) {
        // timed by forceCollection
        return;
      }
      GcInfo gcInfo = info.getGcInfo();
      record(
          new GcEvent(
              Instant.now(),
              gcInfo.getDuration(),
              heapBytes(gcInfo.getMemoryUsageBeforeGc()),
              heapBytes(gcInfo.getMemoryUsageAfterGc()),
              info.getGcName(),
              info.getGcCause()));
    } catch (RuntimeException e) {
      log.warn("Ignoring unreadable GC notification: {}", e.getMessage());
    }
  }

  private long heapBytes(Map<String, MemoryUsage> usageByPool) {
    long total = 0;
    for (Map.Entry<String, MemoryUsage> entry : usageByPool.entrySet()) {
      if (heapPools.isEmpty() || heapPools.contains(entry.getKey())) {
        total += entry.getValue().getUsed();
      }
    }
    return total;
  }
}
