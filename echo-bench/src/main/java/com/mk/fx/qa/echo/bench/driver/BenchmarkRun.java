package com.mk.fx.qa.echo.bench.driver;

import static java.util.concurrent.Executors.newFixedThreadPool;

import com.mk.fx.qa.echo.bench.exception.BenchmarkAbortedException;
import com.mk.fx.qa.echo.bench.exception.ConnectionSetupException;
import com.mk.fx.qa.echo.bench.exception.ResourceLimitException;
import com.mk.fx.qa.echo.bench.model.AggregateResult;
import com.mk.fx.qa.echo.bench.model.BenchConfig;
import com.mk.fx.qa.echo.bench.model.WorkerOutcome;
import com.mk.fx.qa.echo.bench.resource.ResourceLimiter;
import com.mk.fx.qa.echo.bench.worker.ConnectionWorker;
import com.mk.fx.qa.echo.bench.worker.StopSignal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * One execution of the benchmark: fan out one worker per connection, wait for the configured
 * duration, raise the stop signal, fan the outcomes back in.
 *
 * <p>Threading: a fixed pool sized to the connection count, so every worker gets its own thread
 * for the whole run. The only state shared with workers is the {@link StopSignal}; outcomes are
 * collected through their futures once every worker has finished.
 */
@Slf4j
final class BenchmarkRun {

  private static final long MIN_POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(1);

  private final UUID runId = UUID.randomUUID();
  private final BenchConfig config;
  private final ResourceLimiter resourceLimiter;
  private final Duration connectTimeout;
  private final long pollNanos;
  private final StopSignal stopSignal = new StopSignal();

  private volatile DriverState state = DriverState.IDLE;

  BenchmarkRun(
      BenchConfig config,
      ResourceLimiter resourceLimiter,
      Duration connectTimeout,
      Duration pollInterval) {
    this.config = config;
    this.resourceLimiter = resourceLimiter;
    this.connectTimeout = connectTimeout;
    this.pollNanos = Math.max(MIN_POLL_NANOS, pollInterval.toNanos());
  }

  DriverState state() {
    return state;
  }

  StopSignal stopSignal() {
    return stopSignal;
  }

  AggregateResult execute() {
    if (state != DriverState.IDLE) {
      throw new IllegalStateException("Run " + runId + " already started, state " + state);
    }
    try {
      resourceLimiter.ensureCapacity(config.connectionCount());
    } catch (ResourceLimitException ex) {
      transition(DriverState.ABORTED);
      throw ex;
    }

    var connections = config.connectionCount();
    var executor = newFixedThreadPool(connections, threadFactory());
    List<Future<WorkerOutcome>> futures = new ArrayList<>(connections);

    try {
      transition(DriverState.RUNNING);
      log.info(
          "Run {} benchmarking {} with {} connections, {} bytes, {} sec",
          runId,
          config.address(),
          connections,
          config.payloadLength(),
          config.durationSeconds());

      var target = config.socketAddress();
      var payload = config.newPayload();
      for (int id = 0; id < connections; id++) {
        futures.add(
            executor.submit(
                new ConnectionWorker(
                    id, target, payload, connectTimeout, stopSignal.asCondition())));
      }

      awaitDuration(futures);

      transition(DriverState.STOPPING);
      stopSignal.trigger();

      var outcomes = joinWorkers(futures);
      var result = AggregateResult.reduce(outcomes, config.durationSeconds());
      transition(DriverState.DONE);
      log.info(
          "Run {} finished: requests={}, errors={}",
          runId,
          result.totalRequests(),
          result.totalErrors());
      return result;
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      stopSignal.trigger();
      transition(DriverState.ABORTED);
      throw new BenchmarkAbortedException("Run " + runId + " interrupted", interrupted);
    } finally {
      executor.shutdown();
    }
  }

  /**
   * Sleeps for the configured duration in chunks. Returns early once any worker has failed to
   * connect, since that run can no longer produce a result.
   */
  private void awaitDuration(List<Future<WorkerOutcome>> futures) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(config.durationSeconds());
    long remaining;
    while ((remaining = deadline - System.nanoTime()) > 0) {
      if (anySetupFailed(futures)) {
        log.warn("Run {} stopping early: a worker failed to connect", runId);
        return;
      }
      TimeUnit.NANOSECONDS.sleep(Math.min(remaining, pollNanos));
    }
  }

  private static boolean anySetupFailed(List<Future<WorkerOutcome>> futures)
      throws InterruptedException {
    for (Future<WorkerOutcome> future : futures) {
      if (!future.isDone()) {
        continue;
      }
      try {
        future.get();
      } catch (ExecutionException ex) {
        return true;
      }
    }
    return false;
  }

  /** Waits for every worker. Setup failures are rethrown only after all workers have ended. */
  private List<WorkerOutcome> joinWorkers(List<Future<WorkerOutcome>> futures)
      throws InterruptedException {
    List<WorkerOutcome> outcomes = new ArrayList<>(futures.size());
    Throwable failure = null;
    for (Future<WorkerOutcome> future : futures) {
      try {
        outcomes.add(future.get());
      } catch (ExecutionException ex) {
        var cause = ex.getCause();
        if (cause instanceof ConnectionSetupException setup) {
          log.warn(
              "Run {} worker {} setup failed: {}", runId, setup.getWorkerId(), setup.getMessage());
        } else {
          log.error("Run {} worker terminated unexpectedly", runId, cause);
        }
        if (failure == null) {
          failure = cause;
        }
      }
    }
    if (failure != null) {
      transition(DriverState.ABORTED);
      throw new BenchmarkAbortedException(
          "Run " + runId + " aborted: " + failure.getMessage(), failure);
    }
    return outcomes;
  }

  private ThreadFactory threadFactory() {
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName("echo-worker-" + runId + "-" + thread.getId());
      thread.setDaemon(true);
      return thread;
    };
  }

  private void transition(DriverState next) {
    log.debug("Run {} {} -> {}", runId, state, next);
    state = next;
  }
}
