package com.mk.fx.qa.echo.bench.driver;

/**
 * Lifecycle of a single benchmark run.
 *
 * <p>IDLE → RUNNING → STOPPING → DONE on the normal path. ABORTED replaces whichever step a fatal
 * condition interrupted.
 */
public enum DriverState {
  IDLE,
  RUNNING,
  STOPPING,
  DONE,
  ABORTED
}
