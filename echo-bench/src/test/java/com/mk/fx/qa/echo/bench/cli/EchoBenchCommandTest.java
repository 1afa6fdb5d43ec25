package com.mk.fx.qa.echo.bench.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.mk.fx.qa.echo.bench.cfg.EchoBenchCfg;
import com.mk.fx.qa.echo.bench.driver.BenchmarkDriver;
import com.mk.fx.qa.echo.bench.exception.BenchmarkAbortedException;
import com.mk.fx.qa.echo.bench.exception.ResourceLimitException;
import com.mk.fx.qa.echo.bench.model.AggregateResult;
import com.mk.fx.qa.echo.bench.model.BenchConfig;
import com.mk.fx.qa.echo.bench.report.ResultReporter;
import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import picocli.CommandLine;

class EchoBenchCommandTest {

  private BenchmarkDriver driver;
  private EchoBenchCfg cfg;
  private StringWriter out;
  private StringWriter err;

  @BeforeEach
  void setUp() {
    driver = mock(BenchmarkDriver.class);
    cfg = new EchoBenchCfg();
    out = new StringWriter();
    err = new StringWriter();
  }

  private int execute(String... args) {
    CommandLine commandLine =
        EchoBenchCommand.commandLine(new EchoBenchCommand(driver, new ResultReporter()), cfg);
    commandLine.setOut(new PrintWriter(out, true));
    commandLine.setErr(new PrintWriter(err, true));
    return commandLine.execute(args);
  }

  private BenchConfig capturedConfig() {
    var captor = ArgumentCaptor.forClass(BenchConfig.class);
    verify(driver).run(captor.capture());
    return captor.getValue();
  }

  @Test
  void noArguments_usesConfiguredDefaults_andPrintsSummary() {
    when(driver.run(any())).thenReturn(new AggregateResult(600, 0, 10.0));

    int exitCode = execute();

    assertThat(exitCode).isZero();
    assertThat(capturedConfig()).isEqualTo(new BenchConfig("127.0.0.1:12345", 512, 60, 50));
    assertThat(out.toString())
        .contains("Benchmarking: 127.0.0.1:12345")
        .contains("50 clients, running 512 bytes, 60 sec.")
        .contains("Error: 0")
        .contains("Speed: 10.00 request/sec");
  }

  @Test
  void shortFlags_overrideDefaults() {
    when(driver.run(any())).thenReturn(new AggregateResult(5, 1, 1.0));

    int exitCode = execute("-a", "10.1.2.3:7", "-l", "64", "-t", "5", "-c", "3");

    assertThat(exitCode).isZero();
    assertThat(capturedConfig()).isEqualTo(new BenchConfig("10.1.2.3:7", 64, 5, 3));
    assertThat(out.toString()).contains("Error: 1");
  }

  @Test
  void longFlags_overrideDefaults() {
    when(driver.run(any())).thenReturn(new AggregateResult(0, 0, 0.0));

    execute("--address=localhost:9", "--length", "1", "--duration", "2", "--number", "4");

    assertThat(capturedConfig()).isEqualTo(new BenchConfig("localhost:9", 1, 2, 4));
  }

  @Test
  void configuredDefaults_drivePlainRunAndHelpText() {
    cfg.setAddress("127.0.0.1:8901");
    cfg.setConnections(7);
    when(driver.run(any())).thenReturn(new AggregateResult(0, 0, 0.0));

    execute();
    assertThat(capturedConfig().address()).isEqualTo("127.0.0.1:8901");
    assertThat(capturedConfig().connectionCount()).isEqualTo(7);

    out.getBuffer().setLength(0);
    execute("--help");
    assertThat(out.toString()).contains("Default: 127.0.0.1:8901").contains("Default: 7");
  }

  @Test
  void help_printsUsage_withoutRunning() {
    int exitCode = execute("-h");

    assertThat(exitCode).isZero();
    assertThat(out.toString())
        .contains("Echo benchmark.")
        .contains("--address")
        .contains("--length")
        .contains("--duration")
        .contains("--number")
        .contains("Default: 127.0.0.1:12345")
        .contains("Default: 512");
    verifyNoInteractions(driver);
  }

  @Test
  void version_printsVersion_withoutRunning() {
    int exitCode = execute("--version");

    assertThat(exitCode).isZero();
    assertThat(out.toString()).contains("echo-bench");
    verifyNoInteractions(driver);
  }

  @Test
  void zeroLength_isReportedAsInvalidInput() {
    int exitCode = execute("-l", "0");

    assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
    assertThat(err.toString()).contains("length").contains("Usage:");
    verifyNoInteractions(driver);
  }

  @Test
  void zeroDurationOrNumber_isReportedAsInvalidInput() {
    assertThat(execute("-t", "0")).isEqualTo(CommandLine.ExitCode.USAGE);
    assertThat(execute("-c", "0")).isEqualTo(CommandLine.ExitCode.USAGE);
    verifyNoInteractions(driver);
  }

  @Test
  void nonNumericLength_isNotSilentlyReplacedByDefault() {
    int exitCode = execute("--length", "lots");

    assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
    assertThat(err.toString()).contains("lots");
    verifyNoInteractions(driver);
  }

  @Test
  void malformedAddress_isReportedAsInvalidInput() {
    assertThat(execute("-a", "no-port-here")).isEqualTo(CommandLine.ExitCode.USAGE);
    verifyNoInteractions(driver);
  }

  @Test
  void unknownOption_isReportedAsInvalidInput() {
    assertThat(execute("--bogus")).isEqualTo(CommandLine.ExitCode.USAGE);
    verifyNoInteractions(driver);
  }

  @Test
  void abortedRun_exitsWithFailure_andPrintsNoSummary() {
    when(driver.run(any()))
        .thenThrow(new BenchmarkAbortedException("worker 0 refused", new RuntimeException()));

    int exitCode = execute("-t", "1");

    assertThat(exitCode).isEqualTo(CommandLine.ExitCode.SOFTWARE);
    assertThat(out.toString()).doesNotContain("Benchmarking:");
  }

  @Test
  void resourceLimit_exitsWithFailure() {
    when(driver.run(any())).thenThrow(new ResourceLimitException("limit is only 10"));

    assertThat(execute("-c", "100")).isEqualTo(CommandLine.ExitCode.SOFTWARE);
    assertThat(out.toString()).isEmpty();
  }
}
