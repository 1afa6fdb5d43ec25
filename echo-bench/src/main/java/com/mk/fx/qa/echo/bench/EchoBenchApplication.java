package com.mk.fx.qa.echo.bench;

import com.mk.fx.qa.echo.bench.cfg.EchoBenchCfg;
import com.mk.fx.qa.echo.bench.cli.EchoBenchCommand;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@RequiredArgsConstructor
public class EchoBenchApplication implements CommandLineRunner, ExitCodeGenerator {

  private final EchoBenchCommand command;
  private final EchoBenchCfg cfg;

  private int exitCode;

  @Override
  public void run(String... args) {
    exitCode = EchoBenchCommand.commandLine(command, cfg).execute(args);
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(EchoBenchApplication.class, args)));
  }
}
