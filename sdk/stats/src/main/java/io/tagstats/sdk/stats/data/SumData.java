/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.stats.data;

import com.google.auto.value.AutoValue;
import io.tagstats.sdk.stats.AggregationType;
import javax.annotation.concurrent.Immutable;

/** Sum of the values recorded into a row. */
@AutoValue
@Immutable
public abstract class SumData implements AggregationData {

  public static SumData create(long startEpochNanos, double sum) {
    return new AutoValue_SumData(startEpochNanos, sum);
  }

  SumData() {}

  @Override
  public abstract long getStartEpochNanos();

  public abstract double getSum();

  @Override
  public final AggregationType getType() {
    return AggregationType.SUM;
  }
}
