package com.mk.fx.qa.echo.bench.model;

import java.util.Collection;
import java.util.Objects;

/**
 * Run-wide totals folded from every {@link WorkerOutcome}.
 *
 * @param totalRequests sum of completed round trips across workers
 * @param totalErrors number of workers that ended on an I/O error
 * @param requestsPerSecond {@code totalRequests} divided by the configured duration
 */
public record AggregateResult(long totalRequests, long totalErrors, double requestsPerSecond) {

  /**
   * Reduces worker outcomes into one result. Summation makes the result independent of the order
   * in which outcomes are supplied.
   *
   * @param outcomes one outcome per worker
   * @param durationSeconds configured run duration, not the measured elapsed time
   * @throws IllegalArgumentException if {@code durationSeconds} is not positive
   */
  public static AggregateResult reduce(Collection<WorkerOutcome> outcomes, long durationSeconds) {
    Objects.requireNonNull(outcomes, "outcomes");
    if (durationSeconds < 1) {
      throw new IllegalArgumentException("durationSeconds must be >= 1, was " + durationSeconds);
    }
    long requests = 0;
    long errors = 0;
    for (WorkerOutcome outcome : outcomes) {
      requests += outcome.requestsCompleted();
      errors += outcome.failed() ? 1 : 0;
    }
    return new AggregateResult(requests, errors, requests / (double) durationSeconds);
  }
}
