/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.stats.internal.aggregator;

import io.tagstats.sdk.stats.data.AggregationData;
import io.tagstats.sdk.stats.data.CountData;
import java.util.Map;

/** Counts measurements. */
final class CountAggregator extends Aggregator {

  private long count;

  CountAggregator(long startEpochNanos) {
    super(startEpochNanos);
  }

  @Override
  public void record(double value, Map<String, String> attachments, long epochNanos) {
    count++;
  }

  @Override
  public AggregationData toAggregationData() {
    return CountData.create(getStartEpochNanos(), count);
  }
}
