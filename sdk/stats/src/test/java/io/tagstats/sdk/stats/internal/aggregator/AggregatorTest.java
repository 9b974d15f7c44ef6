/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.stats.internal.aggregator;

import static org.assertj.core.api.Assertions.assertThat;

import io.tagstats.sdk.stats.Aggregation;
import io.tagstats.sdk.stats.AggregationType;
import io.tagstats.sdk.stats.data.CountData;
import io.tagstats.sdk.stats.data.DistributionData;
import io.tagstats.sdk.stats.data.Exemplar;
import io.tagstats.sdk.stats.data.LastValueData;
import io.tagstats.sdk.stats.data.SumData;
import java.util.Collections;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AggregatorTest {

  private static final Map<String, String> NO_ATTACHMENTS = Collections.emptyMap();

  @Test
  void count_ignoresValues() {
    Aggregator aggregator = Aggregator.create(Aggregation.count(), 10);
    aggregator.record(-5, NO_ATTACHMENTS, 11);
    aggregator.record(1e9, NO_ATTACHMENTS, 12);
    aggregator.record(0, NO_ATTACHMENTS, 13);

    CountData data = (CountData) aggregator.toAggregationData();
    assertThat(data.getCount()).isEqualTo(3);
    assertThat(data.getStartEpochNanos()).isEqualTo(10);
    assertThat(data.getType()).isEqualTo(AggregationType.COUNT);
  }

  @Test
  void sum() {
    Aggregator aggregator = Aggregator.create(Aggregation.sum(), 10);
    aggregator.record(1.5, NO_ATTACHMENTS, 11);
    aggregator.record(-0.5, NO_ATTACHMENTS, 12);

    SumData data = (SumData) aggregator.toAggregationData();
    assertThat(data.getSum()).isEqualTo(1.0);
    assertThat(data.getStartEpochNanos()).isEqualTo(10);
  }

  @Test
  void lastValue_overwrites() {
    Aggregator aggregator = Aggregator.create(Aggregation.lastValue(), 10);
    aggregator.record(7, NO_ATTACHMENTS, 11);
    aggregator.record(3, NO_ATTACHMENTS, 12);

    LastValueData data = (LastValueData) aggregator.toAggregationData();
    assertThat(data.getValue()).isEqualTo(3.0);
    assertThat(data.getEpochNanos()).isEqualTo(12);
  }

  @Test
  void distribution_welfordStatistics() {
    Aggregator aggregator = Aggregator.create(Aggregation.distribution(2), 10);
    aggregator.record(1, NO_ATTACHMENTS, 11);
    aggregator.record(5, NO_ATTACHMENTS, 12);

    DistributionData data = (DistributionData) aggregator.toAggregationData();
    assertThat(data.getCount()).isEqualTo(2);
    assertThat(data.getMin()).isEqualTo(1.0);
    assertThat(data.getMax()).isEqualTo(5.0);
    assertThat(data.getMean()).isEqualTo(3.0);
    assertThat(data.getSumOfSquaredDeviation()).isEqualTo(8.0);
    assertThat(data.getSum()).isEqualTo(6.0);
    assertThat(data.getBucketBoundaries()).containsExactly(2.0);
    assertThat(data.getBucketCounts()).containsExactly(1L, 1L);
    assertThat(data.getExemplars()).containsExactly(null, null);
  }

  @Test
  void distribution_valueOnBoundaryFallsInLowerBucket() {
    Aggregator aggregator = Aggregator.create(Aggregation.distribution(1, 5), 0);
    aggregator.record(1, NO_ATTACHMENTS, 1);
    aggregator.record(5, NO_ATTACHMENTS, 2);
    aggregator.record(5.0001, NO_ATTACHMENTS, 3);

    DistributionData data = (DistributionData) aggregator.toAggregationData();
    assertThat(data.getBucketCounts()).containsExactly(1L, 1L, 1L);
  }

  @Test
  void distribution_mostRecentExemplarWins() {
    Aggregator aggregator = Aggregator.create(Aggregation.distribution(10), 0);
    aggregator.record(1, Collections.singletonMap("trace", "a"), 1);
    aggregator.record(2, Collections.singletonMap("trace", "b"), 2);
    aggregator.record(3, NO_ATTACHMENTS, 3);
    aggregator.record(20, Collections.singletonMap("trace", "c"), 4);

    DistributionData data = (DistributionData) aggregator.toAggregationData();
    Exemplar first = data.getExemplar(0);
    assertThat(first).isNotNull();
    assertThat(first.getValue()).isEqualTo(2.0);
    assertThat(first.getAttachments()).containsEntry("trace", "b");
    assertThat(first.getEpochNanos()).isEqualTo(2);
    assertThat(data.getExemplar(1).getValue()).isEqualTo(20.0);
  }

  @Test
  void distribution_snapshotIsIndependent() {
    Aggregator aggregator = Aggregator.create(Aggregation.distribution(2), 0);
    aggregator.record(1, NO_ATTACHMENTS, 1);
    DistributionData before = (DistributionData) aggregator.toAggregationData();

    aggregator.record(3, NO_ATTACHMENTS, 2);

    assertThat(before.getCount()).isEqualTo(1);
    assertThat(before.getBucketCounts()).containsExactly(1L, 0L);
  }

  @Test
  void distribution_withoutBoundariesHasOneBucket() {
    Aggregator aggregator = Aggregator.create(Aggregation.distribution(), 0);
    aggregator.record(-3, NO_ATTACHMENTS, 1);
    aggregator.record(42, NO_ATTACHMENTS, 2);

    DistributionData data = (DistributionData) aggregator.toAggregationData();
    assertThat(data.getBucketCounts()).containsExactly(2L);
    assertThat(data.getMin()).isEqualTo(-3.0);
  }

  @Test
  void findBucketIndex() {
    double[] boundaries = {1, 5, 10};
    assertThat(DistributionAggregator.findBucketIndex(boundaries, -1)).isEqualTo(0);
    assertThat(DistributionAggregator.findBucketIndex(boundaries, 1)).isEqualTo(0);
    assertThat(DistributionAggregator.findBucketIndex(boundaries, 1.5)).isEqualTo(1);
    assertThat(DistributionAggregator.findBucketIndex(boundaries, 5)).isEqualTo(1);
    assertThat(DistributionAggregator.findBucketIndex(boundaries, 10)).isEqualTo(2);
    assertThat(DistributionAggregator.findBucketIndex(boundaries, 11)).isEqualTo(3);
    assertThat(DistributionAggregator.findBucketIndex(new double[0], 11)).isEqualTo(0);
  }
}
