package com.mk.fx.qa.echo.bench.resource;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.echo.bench.cfg.EchoBenchCfg;
import com.mk.fx.qa.echo.bench.exception.ResourceLimitException;
import com.sun.management.UnixOperatingSystemMXBean;
import java.lang.management.ManagementFactory;
import java.util.function.LongSupplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * {@link ResourceLimiter} backed by the process's open-file-descriptor ceiling.
 *
 * <p>On Linux and macOS the JVM already raises its soft {@code RLIMIT_NOFILE} to the hard limit at
 * startup, so the ceiling reported by {@link UnixOperatingSystemMXBean} is the highest value the
 * process can reach. A run needs one descriptor per connection plus a fixed headroom for the
 * standard streams.
 */
@Slf4j
@Component
public class FileDescriptorLimiter implements ResourceLimiter {

  static final long UNKNOWN = -1L;

  private final int headroom;
  private final LongSupplier maxDescriptors;

  @Autowired
  public FileDescriptorLimiter(EchoBenchCfg cfg) {
    this(cfg.getDescriptorHeadroom(), FileDescriptorLimiter::osMaxDescriptors);
  }

  @VisibleForTesting
  FileDescriptorLimiter(int headroom, LongSupplier maxDescriptors) {
    this.headroom = headroom;
    this.maxDescriptors = maxDescriptors;
  }

  @Override
  public void ensureCapacity(int connections) {
    long required = (long) connections + headroom;
    long limit = maxDescriptors.getAsLong();
    if (limit == UNKNOWN) {
      log.warn(
          "Descriptor limit not available on this platform, skipping check for {} connections",
          connections);
      return;
    }
    if (limit < required) {
      throw new ResourceLimitException(
          "The descriptor limit of this process is only "
              + limit
              + ", "
              + required
              + " required for "
              + connections
              + " connections");
    }
    log.debug("Descriptor limit {} covers {} required descriptors", limit, required);
  }

  private static long osMaxDescriptors() {
    var os = ManagementFactory.getOperatingSystemMXBean();
    if (os instanceof UnixOperatingSystemMXBean unix) {
      return unix.getMaxFileDescriptorCount();
    }
    return UNKNOWN;
  }
}
