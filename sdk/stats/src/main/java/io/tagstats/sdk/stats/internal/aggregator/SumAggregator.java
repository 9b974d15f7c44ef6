/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.stats.internal.aggregator;

import io.tagstats.sdk.stats.data.AggregationData;
import io.tagstats.sdk.stats.data.SumData;
import java.util.Map;

/** Sums recorded values. */
final class SumAggregator extends Aggregator {

  private double sum;

  SumAggregator(long startEpochNanos) {
    super(startEpochNanos);
  }

  @Override
  public void record(double value, Map<String, String> attachments, long epochNanos) {
    sum += value;
  }

  @Override
  public AggregationData toAggregationData() {
    return SumData.create(getStartEpochNanos(), sum);
  }
}
