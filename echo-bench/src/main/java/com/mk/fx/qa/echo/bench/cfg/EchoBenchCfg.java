package com.mk.fx.qa.echo.bench.cfg;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Externalised defaults for a benchmark run. The first four values are what the command line falls
 * back to when a flag is omitted, and what its help text advertises.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "echo.bench")
public class EchoBenchCfg {

  @NotBlank private String address = "127.0.0.1:12345";

  @Positive private int length = 512;

  @Positive private long duration = 60;

  @Positive private int connections = 50;

  /** Bounds connection establishment only; {@code 0} leaves it to the OS. */
  @NotNull private Duration connectTimeout = Duration.ofSeconds(10);

  /** Granularity of the driver's timed wait. */
  @NotNull private Duration pollInterval = Duration.ofMillis(100);

  @Min(0)
  @Max(64)
  private int descriptorHeadroom = 3;
}
