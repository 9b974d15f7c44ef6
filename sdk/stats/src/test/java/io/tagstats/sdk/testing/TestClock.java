/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.testing;

import io.tagstats.sdk.common.Clock;
import java.util.concurrent.TimeUnit;
import javax.annotation.concurrent.ThreadSafe;

/** A mutable {@link Clock} that only moves when told to. */
@ThreadSafe
public final class TestClock implements Clock {

  private static final long DEFAULT_EPOCH_NANOS = 1_557_212_400_000_000_000L;

  private long currentEpochNanos;

  private TestClock(long epochNanos) {
    currentEpochNanos = epochNanos;
  }

  public static TestClock create() {
    return new TestClock(DEFAULT_EPOCH_NANOS);
  }

  public static TestClock create(long epochNanos) {
    return new TestClock(epochNanos);
  }

  public synchronized void setTime(long epochNanos) {
    currentEpochNanos = epochNanos;
  }

  public synchronized void advance(long duration, TimeUnit unit) {
    currentEpochNanos += unit.toNanos(duration);
  }

  @Override
  public synchronized long now() {
    return currentEpochNanos;
  }

  @Override
  public synchronized long nanoTime() {
    return currentEpochNanos;
  }
}
