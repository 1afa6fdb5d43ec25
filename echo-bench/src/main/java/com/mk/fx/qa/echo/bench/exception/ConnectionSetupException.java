package com.mk.fx.qa.echo.bench.exception;

import lombok.Getter;

/** Raised by a worker that could not open its connection. */
@Getter
public class ConnectionSetupException extends BenchmarkException {

  private final int workerId;

  public ConnectionSetupException(int workerId, String message, Throwable cause) {
    super(message, cause);
    this.workerId = workerId;
  }
}
