package org.loadprofiler.load;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.loadprofiler.event.BenchmarkListener;
import org.loadprofiler.load.BenchmarkPhaseManager.BenchmarkPhase;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class BenchmarkPhaseManagerTest {

  @Mock private BenchmarkListener listener;

  private AutoCloseable mocks;
  private BenchmarkPhaseManager phaseManager;

  @BeforeEach
  void setUp() {
    mocks = MockitoAnnotations.openMocks(this);
    phaseManager = new BenchmarkPhaseManager(listener);
  }

  @AfterEach
  void tearDown() throws Exception {
    mocks.close();
  }

  @Test
  @DisplayName("Should walk the full phase sequence and notify each change")
  void shouldWalkFullSequence() {
    // Given
    phaseManager.startRun("run-1");

    // When
    phaseManager.transitionTo(BenchmarkPhase.WARMUP);
    phaseManager.transitionTo(BenchmarkPhase.MAIN);
    phaseManager.transitionTo(BenchmarkPhase.COOLDOWN);
    phaseManager.transitionTo(BenchmarkPhase.REPORTING);
    phaseManager.finishRun();

    // Then
    InOrder order = inOrder(listener);
    order.verify(listener).onPhaseChanged("run-1", BenchmarkPhase.IDLE, BenchmarkPhase.WARMUP);
    order.verify(listener).onPhaseChanged("run-1", BenchmarkPhase.WARMUP, BenchmarkPhase.MAIN);
    order.verify(listener).onPhaseChanged("run-1", BenchmarkPhase.MAIN, BenchmarkPhase.COOLDOWN);
    order.verify(listener)
        .onPhaseChanged("run-1", BenchmarkPhase.COOLDOWN, BenchmarkPhase.REPORTING);
    order.verify(listener).onPhaseChanged("run-1", BenchmarkPhase.REPORTING, BenchmarkPhase.IDLE);
    assertEquals(BenchmarkPhase.IDLE, phaseManager.getCurrentPhase());
    assertFalse(phaseManager.isRunning());
  }

  @Test
  void shouldAllowSkippingWarmupAndCooldown() {
    phaseManager.startRun("run-2");

    phaseManager.transitionTo(BenchmarkPhase.MAIN);
    phaseManager.transitionTo(BenchmarkPhase.REPORTING);

    assertEquals(BenchmarkPhase.REPORTING, phaseManager.getCurrentPhase());
  }

  @ParameterizedTest
  @EnumSource(
      value = BenchmarkPhase.class,
      names = {"COOLDOWN", "REPORTING"})
  void shouldRejectSkippingMainPhase(BenchmarkPhase target) {
    phaseManager.startRun("run-3");

    assertThrows(IllegalStateException.class, () -> phaseManager.transitionTo(target));
    assertEquals(BenchmarkPhase.IDLE, phaseManager.getCurrentPhase());
    verifyNoInteractions(listener);
  }

  @Test
  @DisplayName("Should refuse a second run while one is in progress")
  void shouldRejectConcurrentRun() {
    phaseManager.startRun("first");

    IllegalStateException error =
        assertThrows(IllegalStateException.class, () -> phaseManager.startRun("second"));

    assertTrue(error.getMessage().contains("first"));
    assertTrue(phaseManager.isRunning());
  }

  @Test
  @DisplayName("An aborted run falls back to IDLE and frees the manager")
  void shouldReturnToIdleFromMainOnAbort() {
    phaseManager.startRun("aborted");
    phaseManager.transitionTo(BenchmarkPhase.MAIN);

    phaseManager.finishRun();

    verify(listener).onPhaseChanged("aborted", BenchmarkPhase.MAIN, BenchmarkPhase.IDLE);
    phaseManager.startRun("next");
    assertTrue(phaseManager.isRunning());
  }
}
