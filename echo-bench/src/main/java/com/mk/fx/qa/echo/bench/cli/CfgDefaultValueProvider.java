package com.mk.fx.qa.echo.bench.cli;

import com.mk.fx.qa.echo.bench.cfg.EchoBenchCfg;
import java.util.Objects;
import picocli.CommandLine.IDefaultValueProvider;
import picocli.CommandLine.Model.ArgSpec;
import picocli.CommandLine.Model.OptionSpec;

/**
 * Feeds option defaults from the bound {@link EchoBenchCfg}, so the fallback a run uses and the
 * default shown in the usage text come from the same place.
 */
final class CfgDefaultValueProvider implements IDefaultValueProvider {

  private final EchoBenchCfg cfg;

  CfgDefaultValueProvider(EchoBenchCfg cfg) {
    this.cfg = Objects.requireNonNull(cfg, "cfg");
  }

  @Override
  public String defaultValue(ArgSpec argSpec) {
    if (!argSpec.isOption()) {
      return null;
    }
    return switch (((OptionSpec) argSpec).longestName()) {
      case "--address" -> cfg.getAddress();
      case "--length" -> String.valueOf(cfg.getLength());
      case "--duration" -> String.valueOf(cfg.getDuration());
      case "--number" -> String.valueOf(cfg.getConnections());
      default -> null;
    };
  }
}
