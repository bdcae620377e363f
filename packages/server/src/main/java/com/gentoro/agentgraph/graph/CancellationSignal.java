package com.gentoro.agentgraph.graph;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation flag for one graph run. Safe to cancel from any thread. An optional
 * deadline cancels the signal the first time it is checked after the deadline has passed.
 */
public final class CancellationSignal {
  private final AtomicReference<String> reason = new AtomicReference<>();
  private volatile long deadlineNanos;
  private volatile Duration deadlineBudget;

  /** First caller wins; later reasons are ignored. */
  public void cancel(String why) {
    reason.compareAndSet(null, why == null || why.isBlank() ? "cancelled" : why);
  }

  /** Cancel once {@code budget} has elapsed from now. */
  public CancellationSignal cancelAfter(Duration budget) {
    if (budget == null || budget.isZero() || budget.isNegative()) {
      throw new IllegalArgumentException("budget must be positive: " + budget);
    }
    this.deadlineNanos = System.nanoTime() + budget.toNanos();
    this.deadlineBudget = budget;
    return this;
  }

  public boolean isCancelled() {
    Duration budget = deadlineBudget;
    if (reason.get() == null && budget != null && System.nanoTime() - deadlineNanos >= 0) {
      cancel("request timed out after " + budget);
    }
    return reason.get() != null;
  }

  public String reason() {
    isCancelled();
    return reason.get();
  }
}
