package com.mk.fx.qa.echo.bench.exception;

public class BenchmarkAbortedException extends BenchmarkException {

  public BenchmarkAbortedException(String message, Throwable cause) {
    super(message, cause);
  }
}
