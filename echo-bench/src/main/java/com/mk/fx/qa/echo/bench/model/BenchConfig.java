package com.mk.fx.qa.echo.bench.model;

import com.google.common.net.HostAndPort;
import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Resolved parameters of one benchmark run.
 *
 * <p>Instances are validated on construction and never change afterwards, so the driver can hand
 * the same instance to every worker without copying.
 *
 * @param address target echo server as {@code host:port}
 * @param payloadLength bytes written and expected back per round trip, newline terminator included
 * @param durationSeconds wall-clock length of the run
 * @param connectionCount number of concurrent connections, one worker each
 * @throws IllegalArgumentException if any value is out of range or the address is malformed
 */
public record BenchConfig(
    String address, int payloadLength, long durationSeconds, int connectionCount) {

  public BenchConfig {
    Objects.requireNonNull(address, "address");
    parseAddress(address);
    if (payloadLength < 1) {
      throw new IllegalArgumentException(
          "Message length must be at least 1 byte, was " + payloadLength);
    }
    if (durationSeconds < 1) {
      throw new IllegalArgumentException(
          "Duration must be at least 1 second, was " + durationSeconds);
    }
    if (connectionCount < 1) {
      throw new IllegalArgumentException(
          "Connection number must be at least 1, was " + connectionCount);
    }
  }

  /** Returns an unresolved socket address; name resolution happens when a worker connects. */
  public InetSocketAddress socketAddress() {
    var hostAndPort = parseAddress(address);
    return InetSocketAddress.createUnresolved(hostAndPort.getHost(), hostAndPort.getPort());
  }

  /** Builds a fresh outbound payload: zero bytes with a trailing newline. */
  public byte[] newPayload() {
    var payload = new byte[payloadLength];
    payload[payloadLength - 1] = '\n';
    return payload;
  }

  private static HostAndPort parseAddress(String address) {
    HostAndPort hostAndPort;
    try {
      hostAndPort = HostAndPort.fromString(address.trim());
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Invalid address '" + address + "': " + ex.getMessage());
    }
    if (hostAndPort.getHost().isEmpty() || !hostAndPort.hasPort()) {
      throw new IllegalArgumentException(
          "Invalid address '" + address + "': expected <host>:<port>");
    }
    if (hostAndPort.getPort() < 1) {
      throw new IllegalArgumentException("Invalid address '" + address + "': port must be > 0");
    }
    return hostAndPort;
  }
}
