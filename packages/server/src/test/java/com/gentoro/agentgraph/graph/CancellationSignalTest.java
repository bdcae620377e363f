package com.gentoro.agentgraph.graph;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CancellationSignal")
class CancellationSignalTest {

  @Test
  void firstReasonWins() {
    CancellationSignal signal = new CancellationSignal();
    signal.cancel("client disconnected");
    signal.cancel("later");

    assertTrue(signal.isCancelled());
    assertEquals("client disconnected", signal.reason());
  }

  @Test
  @DisplayName("An expired deadline cancels on the next check")
  void deadlineCancels() throws InterruptedException {
    CancellationSignal signal = new CancellationSignal().cancelAfter(Duration.ofMillis(50));
    Thread.sleep(120);

    assertTrue(signal.isCancelled());
    assertEquals("request timed out after PT0.05S", signal.reason());
  }

  @Test
  void deadlineInTheFutureDoesNotCancel() {
    CancellationSignal signal = new CancellationSignal().cancelAfter(Duration.ofMinutes(1));

    assertFalse(signal.isCancelled());
    assertNull(signal.reason());
  }

  @Test
  void rejectsNonPositiveBudget() {
    assertThrows(
        IllegalArgumentException.class, () -> new CancellationSignal().cancelAfter(Duration.ZERO));
  }
}
