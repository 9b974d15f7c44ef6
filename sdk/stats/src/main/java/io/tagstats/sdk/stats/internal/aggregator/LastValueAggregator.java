/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.stats.internal.aggregator;

import io.tagstats.sdk.stats.data.AggregationData;
import io.tagstats.sdk.stats.data.LastValueData;
import java.util.Map;

/** Keeps the most recent value. */
final class LastValueAggregator extends Aggregator {

  private double value;
  private long epochNanos;

  LastValueAggregator(long startEpochNanos) {
    super(startEpochNanos);
    this.epochNanos = startEpochNanos;
  }

  @Override
  public void record(double value, Map<String, String> attachments, long epochNanos) {
    this.value = value;
    this.epochNanos = epochNanos;
  }

  @Override
  public AggregationData toAggregationData() {
    return LastValueData.create(getStartEpochNanos(), value, epochNanos);
  }
}
