package com.mk.fx.qa.echo.bench.driver;

import com.mk.fx.qa.echo.bench.cfg.EchoBenchCfg;
import com.mk.fx.qa.echo.bench.model.AggregateResult;
import com.mk.fx.qa.echo.bench.model.BenchConfig;
import com.mk.fx.qa.echo.bench.resource.ResourceLimiter;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Entry point of the benchmarking core: turns a {@link BenchConfig} into an {@link
 * AggregateResult}.
 *
 * <p>Every call to {@link #run(BenchConfig)} uses a fresh {@link BenchmarkRun} with its own stop
 * signal and worker pool, so the driver itself holds no per-run state.
 */
@Component
public class BenchmarkDriver {

  private final ResourceLimiter resourceLimiter;
  private final EchoBenchCfg cfg;

  public BenchmarkDriver(ResourceLimiter resourceLimiter, EchoBenchCfg cfg) {
    this.resourceLimiter = Objects.requireNonNull(resourceLimiter, "resourceLimiter");
    this.cfg = Objects.requireNonNull(cfg, "cfg");
  }

  /**
   * Runs one benchmark to completion.
   *
   * @param config resolved run parameters
   * @return totals over all workers
   * @throws com.mk.fx.qa.echo.bench.exception.ResourceLimitException if the process cannot hold
   *     the requested number of connections; no worker is spawned in that case
   * @throws com.mk.fx.qa.echo.bench.exception.BenchmarkAbortedException if a worker fails to
   *     connect or the calling thread is interrupted
   */
  public AggregateResult run(BenchConfig config) {
    return newRun(config).execute();
  }

  BenchmarkRun newRun(BenchConfig config) {
    Objects.requireNonNull(config, "config");
    return new BenchmarkRun(
        config, resourceLimiter, cfg.getConnectTimeout(), cfg.getPollInterval());
  }
}
