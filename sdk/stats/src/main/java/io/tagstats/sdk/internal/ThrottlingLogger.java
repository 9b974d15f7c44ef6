/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.internal;

import io.tagstats.sdk.common.Clock;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;

/**
 * Will limit the number of log messages emitted, so as not to spam when problems are happening on
 * the recording path.
 *
 * <p>Up to {@value #FAST_LIMIT} messages are logged per minute. After that the logger switches to
 * one message per minute and stays there.
 *
 * <p>This class is internal and is hence not for public use. Its APIs are unstable and can change
 * at any time.
 */
public class ThrottlingLogger {

  static final int FAST_LIMIT = 5;
  private static final long WINDOW_NANOS = TimeUnit.MINUTES.toNanos(1);

  private final Logger delegate;
  private final Clock clock;
  private final AtomicBoolean throttled = new AtomicBoolean(false);
  private final Object lock = new Object();

  @GuardedBy("lock")
  private long windowStart;

  @GuardedBy("lock")
  private int windowCount;

  /** Create a new logger which will enforce a max number of messages per minute. */
  public ThrottlingLogger(Logger delegate) {
    this(delegate, Clock.getDefault());
  }

  // Visible for testing
  ThrottlingLogger(Logger delegate, Clock clock) {
    this.delegate = delegate;
    this.clock = clock;
    this.windowStart = clock.nanoTime();
  }

  /** Log a message at the given level. */
  public void log(Level level, String message) {
    log(level, message, null);
  }

  /** Log a message at the given level with a throwable. */
  public void log(Level level, String message, @Nullable Throwable throwable) {
    if (!isLoggable(level)) {
      return;
    }
    int limit = throttled.get() ? 1 : FAST_LIMIT;
    boolean allowed;
    boolean limitReached;
    synchronized (lock) {
      long now = clock.nanoTime();
      if (now - windowStart >= WINDOW_NANOS) {
        windowStart = now;
        windowCount = 0;
      }
      allowed = windowCount < limit;
      windowCount++;
      limitReached = !allowed && windowCount == limit + 1;
    }
    if (allowed) {
      doLog(level, message, throwable);
      return;
    }
    if (limitReached && throttled.compareAndSet(false, true)) {
      delegate.log(
          level, "Too many log messages detected. Will only log once per minute from now on.");
    }
  }

  private void doLog(Level level, String message, @Nullable Throwable throwable) {
    if (throwable != null) {
      delegate.log(level, message, throwable);
    } else {
      delegate.log(level, message);
    }
  }

  /**
   * Returns whether the current wrapped logger is set to log at the given level.
   *
   * @return true if the logger set to log at the requested level.
   */
  public boolean isLoggable(Level level) {
    return delegate.isLoggable(level);
  }
}
