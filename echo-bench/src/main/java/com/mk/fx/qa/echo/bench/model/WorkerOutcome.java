package com.mk.fx.qa.echo.bench.model;

/**
 * What a single connection worker achieved before it terminated.
 *
 * @param workerId zero-based worker identifier, used for diagnostics only
 * @param requestsCompleted round trips completed successfully
 * @param failed whether the worker stopped because of an I/O error rather than the stop signal
 */
public record WorkerOutcome(int workerId, long requestsCompleted, boolean failed) {

  public WorkerOutcome {
    if (requestsCompleted < 0) {
      throw new IllegalArgumentException("requestsCompleted must be >= 0");
    }
  }

  public static WorkerOutcome stopped(int workerId, long requestsCompleted) {
    return new WorkerOutcome(workerId, requestsCompleted, false);
  }

  public static WorkerOutcome failed(int workerId, long requestsCompleted) {
    return new WorkerOutcome(workerId, requestsCompleted, true);
  }
}
