package com.mk.fx.qa.echo.bench.exception;

public class ResourceLimitException extends BenchmarkException {

  public ResourceLimitException(String message) {
    super(message);
  }
}
