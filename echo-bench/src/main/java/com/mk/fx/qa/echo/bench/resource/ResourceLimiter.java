package com.mk.fx.qa.echo.bench.resource;

import com.mk.fx.qa.echo.bench.exception.ResourceLimitException;

/** Checks that the process can hold the sockets a run is about to open. */
@FunctionalInterface
public interface ResourceLimiter {

  /**
   * Called once by the driver before any worker is spawned.
   *
   * @param connections number of sockets the run will hold open simultaneously
   * @throws ResourceLimitException if the process cannot hold that many descriptors
   */
  void ensureCapacity(int connections);
}
