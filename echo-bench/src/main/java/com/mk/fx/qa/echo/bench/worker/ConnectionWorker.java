package com.mk.fx.qa.echo.bench.worker;

import com.mk.fx.qa.echo.bench.exception.ConnectionSetupException;
import com.mk.fx.qa.echo.bench.model.WorkerOutcome;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Drives one TCP connection with back-to-back echo round trips until told to stop.
 *
 * <p>Each iteration writes the whole payload, then blocks until the same number of bytes has been
 * read back. The stop condition is checked once per iteration, never while a write or read is in
 * flight. The first write or read failure ends the worker; there is no reconnect.
 *
 * <p>Failing to connect is not a runtime error: {@link #call()} throws {@link
 * ConnectionSetupException} and the driver treats the whole run as fatal.
 */
@Slf4j
public final class ConnectionWorker implements Callable<WorkerOutcome> {

  private final int id;
  private final InetSocketAddress target;
  private final byte[] payload;
  private final int connectTimeoutMillis;
  private final BooleanSupplier stopRequested;

  /**
   * @param id worker identifier used in diagnostics
   * @param target echo server address, resolved on connect
   * @param payload bytes sent per round trip; its length is also the expected reply length
   * @param connectTimeout bound on connection establishment, {@link Duration#ZERO} for OS default
   * @param stopRequested read-only view of the shared stop signal
   */
  public ConnectionWorker(
      int id,
      InetSocketAddress target,
      byte[] payload,
      Duration connectTimeout,
      BooleanSupplier stopRequested) {
    this.id = id;
    this.target = Objects.requireNonNull(target, "target");
    this.payload = Objects.requireNonNull(payload, "payload").clone();
    Objects.requireNonNull(connectTimeout, "connectTimeout");
    if (connectTimeout.isNegative()) {
      throw new IllegalArgumentException("connectTimeout must not be negative");
    }
    this.connectTimeoutMillis = Math.toIntExact(connectTimeout.toMillis());
    this.stopRequested = Objects.requireNonNull(stopRequested, "stopRequested");
    if (this.payload.length == 0) {
      throw new IllegalArgumentException("payload must not be empty");
    }
  }

  @Override
  public WorkerOutcome call() {
    var socket = connect();
    try {
      return exchangeUntilStopped(socket);
    } finally {
      close(socket);
    }
  }

  private Socket connect() {
    var resolved = new InetSocketAddress(target.getHostString(), target.getPort());
    if (resolved.isUnresolved()) {
      throw new ConnectionSetupException(
          id, "Worker " + id + " cannot resolve " + target.getHostString(), null);
    }
    var socket = new Socket();
    try {
      socket.connect(resolved, connectTimeoutMillis);
      log.debug("Worker {} connected to {}", id, resolved);
      return socket;
    } catch (IOException ex) {
      close(socket);
      throw new ConnectionSetupException(
          id,
          "Worker " + id + " failed to connect to " + describeTarget() + ": " + ex.getMessage(),
          ex);
    }
  }

  private String describeTarget() {
    return target.getHostString() + ":" + target.getPort();
  }

  private WorkerOutcome exchangeUntilStopped(Socket socket) {
    long completed = 0;
    var reply = new byte[payload.length];
    OutputStream out;
    DataInputStream in;
    try {
      out = socket.getOutputStream();
      in = new DataInputStream(socket.getInputStream());
    } catch (IOException ex) {
      log.info("Worker {} stream error: {}", id, ex.toString());
      return WorkerOutcome.failed(id, completed);
    }

    while (!stopRequested.getAsBoolean()) {
      try {
        out.write(payload);
        out.flush();
      } catch (IOException ex) {
        log.info("Worker {} write error: {}", id, ex.toString());
        return WorkerOutcome.failed(id, completed);
      }

      try {
        // a short reply surfaces as EOFException
        in.readFully(reply);
      } catch (IOException ex) {
        log.info("Worker {} read error: {}", id, ex.toString());
        return WorkerOutcome.failed(id, completed);
      }
      completed++;
    }

    log.debug("Worker {} stopped after {} requests", id, completed);
    return WorkerOutcome.stopped(id, completed);
  }

  private void close(Socket socket) {
    try {
      socket.close();
    } catch (IOException ex) {
      log.debug("Worker {} failed to close its socket: {}", id, ex.getMessage());
    }
  }
}
