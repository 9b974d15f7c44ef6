/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.stats.data;

import com.google.auto.value.AutoValue;
import io.tagstats.sdk.stats.AggregationType;
import javax.annotation.concurrent.Immutable;

/** The most recent value recorded into a row. */
@AutoValue
@Immutable
public abstract class LastValueData implements AggregationData {

  public static LastValueData create(long startEpochNanos, double value, long epochNanos) {
    return new AutoValue_LastValueData(startEpochNanos, value, epochNanos);
  }

  LastValueData() {}

  @Override
  public abstract long getStartEpochNanos();

  public abstract double getValue();

  /** Returns when {@link #getValue()} was recorded, in epoch nanos. */
  public abstract long getEpochNanos();

  @Override
  public final AggregationType getType() {
    return AggregationType.LAST_VALUE;
  }
}
