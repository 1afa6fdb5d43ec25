package com.mk.fx.qa.echo.bench.cli;

import com.mk.fx.qa.echo.bench.cfg.EchoBenchCfg;
import com.mk.fx.qa.echo.bench.driver.BenchmarkDriver;
import com.mk.fx.qa.echo.bench.exception.BenchmarkException;
import com.mk.fx.qa.echo.bench.model.BenchConfig;
import com.mk.fx.qa.echo.bench.report.ResultReporter;
import java.util.concurrent.Callable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/**
 * Command line surface of the benchmark.
 *
 * <p>Exit codes: {@code 0} after a completed run or help/version output, {@code 1} when a fatal
 * condition aborted the run, {@code 2} for invalid input.
 */
@Slf4j
@Component
@Command(
    name = "echo-bench",
    mixinStandardHelpOptions = true,
    version = "echo-bench 1.0.0",
    sortOptions = false,
    usageHelpWidth = 100,
    description = "Echo benchmark.")
public class EchoBenchCommand implements Callable<Integer> {

  @Option(
      names = {"-a", "--address"},
      paramLabel = "<address>",
      description = "Target echo server address. Default: ${DEFAULT-VALUE}")
  private String address;

  @Option(
      names = {"-l", "--length"},
      paramLabel = "<length>",
      description = "Test message length. Default: ${DEFAULT-VALUE}")
  private int length;

  @Option(
      names = {"-t", "--duration"},
      paramLabel = "<duration>",
      description = "Test duration in seconds. Default: ${DEFAULT-VALUE}")
  private long duration;

  @Option(
      names = {"-c", "--number"},
      paramLabel = "<number>",
      description = "Test connection number. Default: ${DEFAULT-VALUE}")
  private int number;

  @Spec private CommandSpec spec;

  private final BenchmarkDriver driver;
  private final ResultReporter reporter;

  public EchoBenchCommand(BenchmarkDriver driver, ResultReporter reporter) {
    this.driver = driver;
    this.reporter = reporter;
  }

  /** Builds a ready-to-execute command line whose option defaults come from {@code cfg}. */
  public static CommandLine commandLine(EchoBenchCommand command, EchoBenchCfg cfg) {
    return new CommandLine(command).setDefaultValueProvider(new CfgDefaultValueProvider(cfg));
  }

  @Override
  public Integer call() {
    var config = resolveConfig();
    try {
      var result = driver.run(config);
      var out = spec.commandLine().getOut();
      out.print(reporter.render(config, result));
      out.flush();
      return ExitCode.OK;
    } catch (BenchmarkException ex) {
      log.error("Benchmark against {} aborted: {}", config.address(), ex.getMessage(), ex);
      return ExitCode.SOFTWARE;
    }
  }

  private BenchConfig resolveConfig() {
    try {
      return new BenchConfig(address, length, duration, number);
    } catch (IllegalArgumentException ex) {
      throw new ParameterException(spec.commandLine(), ex.getMessage(), ex);
    }
  }
}
