package com.mk.fx.qa.echo.bench.report;

import com.mk.fx.qa.echo.bench.model.AggregateResult;
import com.mk.fx.qa.echo.bench.model.BenchConfig;
import java.util.Locale;
import java.util.Objects;
import org.springframework.stereotype.Component;

/** Renders the end-of-run summary printed to standard output. */
@Component
public class ResultReporter {

  public String render(BenchConfig config, AggregateResult result) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(result, "result");
    var sb = new StringBuilder();
    sb.append("Benchmarking: ")
        .append(config.address())
        .append(System.lineSeparator())
        .append(config.connectionCount())
        .append(" clients, running ")
        .append(config.payloadLength())
        .append(" bytes, ")
        .append(config.durationSeconds())
        .append(" sec.")
        .append(System.lineSeparator())
        .append(System.lineSeparator())
        .append("Requests: ")
        .append(result.totalRequests())
        .append(System.lineSeparator())
        .append("Error: ")
        .append(result.totalErrors())
        .append(System.lineSeparator())
        .append("Speed: ")
        .append(String.format(Locale.ROOT, "%.2f", result.requestsPerSecond()))
        .append(" request/sec")
        .append(System.lineSeparator());
    return sb.toString();
  }
}
