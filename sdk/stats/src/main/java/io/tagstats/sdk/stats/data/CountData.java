/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.stats.data;

import com.google.auto.value.AutoValue;
import io.tagstats.sdk.stats.AggregationType;
import javax.annotation.concurrent.Immutable;

/** Number of measurements recorded into a row. */
@AutoValue
@Immutable
public abstract class CountData implements AggregationData {

  public static CountData create(long startEpochNanos, long count) {
    return new AutoValue_CountData(startEpochNanos, count);
  }

  CountData() {}

  @Override
  public abstract long getStartEpochNanos();

  public abstract long getCount();

  @Override
  public final AggregationType getType() {
    return AggregationType.COUNT;
  }
}
