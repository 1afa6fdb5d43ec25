package com.mk.fx.qa.echo.bench.exception;

/** Base type for conditions that end a benchmark run before a summary can be produced. */
public abstract class BenchmarkException extends RuntimeException {

  protected BenchmarkException(String message) {
    super(message);
  }

  protected BenchmarkException(String message, Throwable cause) {
    super(message, cause);
  }
}
