/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.stats.internal.aggregator;

import io.tagstats.sdk.stats.Aggregation;
import io.tagstats.sdk.stats.data.AggregationData;
import java.util.Map;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Mutable running statistic of one row.
 *
 * <p>The set of implementations is closed: one per {@link io.tagstats.sdk.stats.AggregationType},
 * chosen in {@link #create(Aggregation, long)}. Instances are not thread safe; the owner of a row
 * serializes {@link #record} and {@link #toAggregationData()}.
 *
 * <p>This class is internal and is hence not for public use. Its APIs are unstable and can change
 * at any time.
 */
@NotThreadSafe
public abstract class Aggregator {

  /**
   * Returns a new, empty aggregator for {@code aggregation}.
   *
   * @param aggregation an aggregation whose bucket boundaries are already normalized.
   * @param startEpochNanos time of the first measurement of the row.
   */
  public static Aggregator create(Aggregation aggregation, long startEpochNanos) {
    switch (aggregation.getType()) {
      case COUNT:
        return new CountAggregator(startEpochNanos);
      case SUM:
        return new SumAggregator(startEpochNanos);
      case LAST_VALUE:
        return new LastValueAggregator(startEpochNanos);
      case DISTRIBUTION:
        return new DistributionAggregator(aggregation.getBucketBoundaries(), startEpochNanos);
    }
    throw new IllegalArgumentException("Unsupported aggregation: " + aggregation);
  }

  private final long startEpochNanos;

  Aggregator(long startEpochNanos) {
    this.startEpochNanos = startEpochNanos;
  }

  /** Returns the time of the first measurement, in epoch nanos. */
  public final long getStartEpochNanos() {
    return startEpochNanos;
  }

  /**
   * Folds one measurement into the statistic.
   *
   * @param attachments extra data kept with exemplars, may be empty.
   */
  public abstract void record(double value, Map<String, String> attachments, long epochNanos);

  /** Returns an immutable copy of the current state. */
  public abstract AggregationData toAggregationData();
}
