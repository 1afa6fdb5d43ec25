package com.mk.fx.qa.echo.bench.worker;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * One-shot broadcast flag telling workers to stop issuing round trips.
 *
 * <p>Single writer (the driver), many readers (the workers). The flag moves from {@code false} to
 * {@code true} once and never resets. Workers only ever see it through {@link #asCondition()}.
 */
public final class StopSignal {

  private final AtomicBoolean triggered = new AtomicBoolean(false);

  public boolean isTriggered() {
    return triggered.get();
  }

  /**
   * Raises the flag.
   *
   * @return {@code true} if this call performed the transition, {@code false} if already raised
   */
  public boolean trigger() {
    return triggered.compareAndSet(false, true);
  }

  /** Read-only view handed to workers. */
  public BooleanSupplier asCondition() {
    return this::isTriggered;
  }
}
