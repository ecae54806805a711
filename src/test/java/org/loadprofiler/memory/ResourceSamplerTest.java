package org.loadprofiler.memory;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.loadprofiler.memory.MemoryUnits.MB;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.loadprofiler.event.BenchmarkListener;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.slf4j.LoggerFactory;

class ResourceSamplerTest {

  private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

  @Mock private BenchmarkListener listener;

  private AutoCloseable mocks;
  private ScheduledExecutorService scheduler;
  private ScriptedMemoryReader reader;

  @BeforeEach
  void setUp() {
    mocks = MockitoAnnotations.openMocks(this);
    scheduler = Executors.newSingleThreadScheduledExecutor();
    reader = new ScriptedMemoryReader();
  }

  @AfterEach
  void tearDown() throws Exception {
    scheduler.shutdownNow();
    scheduler.awaitTermination(1, TimeUnit.SECONDS);
    mocks.close();
  }

  private ResourceSampler sampler(SamplerSettings settings) {
    ResourceSampler sampler =
        new ResourceSampler(reader, new GcEventMonitor(reader), scheduler, settings);
    sampler.setListener(listener);
    return sampler;
  }

  @Test
  @DisplayName("Should keep only the most recent snapshots up to capacity")
  void shouldEvictOldestSnapshots() {
    // Given
    for (int i = 0; i < 8; i++) {
      reader.then(ScriptedMemoryReader.snapshot(START.plusSeconds(i), (100 + i) * MB));
    }
    ResourceSampler sampler = sampler(SamplerSettings.builder().capacity(5).build());

    // When
    for (int i = 0; i < 8; i++) {
      sampler.sample();
    }

    // Then
    assertEquals(8, sampler.getSampleCount());
    assertEquals(5, sampler.getSnapshots().size());
    assertEquals(103 * MB, sampler.getSnapshots().get(0).heapUsed());
    verify(listener, times(8)).onSample(any());
  }

  @Nested
  @DisplayName("Leak detection")
  class LeakDetection {

    @Test
    @DisplayName("Stays quiet for one window after reporting a leak")
    void shouldCoolDownAfterLeak() {
      // Given
      for (int i = 0; i < 6; i++) {
        reader.then(ScriptedMemoryReader.snapshot(START.plusSeconds(i), (100 + 2 * i) * MB));
      }
      ResourceSampler sampler =
          sampler(SamplerSettings.builder().leakWindow(3).leakThresholdBytes(MB).build());

      // When
      for (int i = 0; i < 5; i++) {
        sampler.sample();
      }
      int leaksAfterFive = sampler.getLeaks().size();
      sampler.sample();

      // Then
      assertEquals(1, leaksAfterFive);
      assertEquals(2, sampler.getLeaks().size());
      verify(listener, times(2)).onLeakDetected(any());
    }

    @Test
    void shouldReportLeakInFinalAnalysis() {
      for (int i = 0; i < 10; i++) {
        reader.then(ScriptedMemoryReader.snapshot(START.plusSeconds(i), (100 + 2 * i) * MB));
      }
      ResourceSampler sampler = sampler(SamplerSettings.builder().build());

      for (int i = 0; i < 10; i++) {
        sampler.sample();
      }
      MemoryAnalysis analysis = sampler.analyze();

      assertEquals(1, analysis.getLeaks().size());
      assertEquals(118 * MB, analysis.getPeakHeapUsedBytes());
      assertEquals(18 * MB, analysis.getHeapGrowthBytes());
      assertEquals(25.0, analysis.getAverageCpuLoadPct(), 1e-9);
      assertTrue(
          analysis.getRecommendations().stream()
              .anyMatch(r -> r.getCategory() == MemoryRecommendation.Category.LEAK_FIX));
    }
  }

  @Test
  @DisplayName("A failed read skips the sample and sampling continues")
  void shouldSkipFailedRead() {
    // Given
    Logger logger = (Logger) LoggerFactory.getLogger(ResourceSampler.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    reader
        .then(ScriptedMemoryReader.snapshot(START, 100 * MB))
        .thenFail("pool unavailable")
        .then(ScriptedMemoryReader.snapshot(START.plusSeconds(2), 100 * MB));
    ResourceSampler sampler = sampler(SamplerSettings.builder().build());

    try {
      // When
      sampler.sample();
      sampler.sample();
      sampler.sample();

      // Then
      assertEquals(2, sampler.getSampleCount());
      assertEquals(1, appender.list.size());
      assertEquals(Level.WARN, appender.list.get(0).getLevel());
      assertTrue(appender.list.get(0).getFormattedMessage().contains("pool unavailable"));
    } finally {
      logger.detachAppender(appender);
    }
  }

  @Test
  void shouldReportPressureOncePerWindow() {
    for (int i = 0; i < 5; i++) {
      reader.then(ScriptedMemoryReader.snapshot(START.plusSeconds(i), 100 * MB));
    }
    reader.then(
        new ResourceSnapshot(START.plusSeconds(5), 95 * MB, 100 * MB, 100 * MB, 0, 0, 0, 0, -1));
    reader.then(
        new ResourceSnapshot(START.plusSeconds(6), 96 * MB, 100 * MB, 100 * MB, 0, 0, 0, 0, -1));
    ResourceSampler sampler = sampler(SamplerSettings.builder().build());

    for (int i = 0; i < 7; i++) {
      sampler.sample();
    }

    assertEquals(1, sampler.getPressurePoints().size());
    assertEquals(PressureType.HEAP_EXHAUSTION, sampler.getPressurePoints().get(0).getType());
  }

  @Test
  @DisplayName("Samples on schedule between start and stop")
  void shouldSampleOnSchedule() {
    ResourceSampler sampler =
        sampler(SamplerSettings.builder().interval(Duration.ofMillis(20)).build());

    sampler.start();
    assertTrue(sampler.isRunning());
    await().atMost(Duration.ofSeconds(3)).until(() -> sampler.getSampleCount() >= 3);
    MemoryAnalysis analysis = sampler.stop();

    assertFalse(sampler.isRunning());
    assertTrue(analysis.getSampleCount() >= 3);
    long countAfterStop = sampler.getSampleCount();
    assertEquals(countAfterStop, sampler.stop().getSampleCount());
  }
}
