/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.stats.internal.aggregator;

import io.tagstats.sdk.stats.data.AggregationData;
import io.tagstats.sdk.stats.data.DistributionData;
import io.tagstats.sdk.stats.data.Exemplar;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Maintains count, min, max, mean and sum of squared deviations in constant memory using
 * Welford's online algorithm, plus a non-cumulative count per explicit bucket.
 *
 * <p>Each bucket keeps the most recent measurement that carried attachments as its exemplar.
 */
final class DistributionAggregator extends Aggregator {

  private final List<Double> boundaryList;
  private final double[] boundaries;
  private final long[] bucketCounts;
  private final Exemplar[] exemplars;

  private long count;
  private double min = Double.POSITIVE_INFINITY;
  private double max = Double.NEGATIVE_INFINITY;
  private double mean;
  private double sumOfSquaredDeviation;

  DistributionAggregator(List<Double> boundaries, long startEpochNanos) {
    super(startEpochNanos);
    this.boundaryList = Collections.unmodifiableList(new ArrayList<>(boundaries));
    this.boundaries = new double[boundaries.size()];
    for (int i = 0; i < this.boundaries.length; i++) {
      this.boundaries[i] = boundaries.get(i);
    }
    this.bucketCounts = new long[this.boundaries.length + 1];
    this.exemplars = new Exemplar[this.boundaries.length + 1];
  }

  @Override
  public void record(double value, Map<String, String> attachments, long epochNanos) {
    if (value < min) {
      min = value;
    }
    if (value > max) {
      max = value;
    }
    count++;
    double delta = value - mean;
    mean += delta / count;
    sumOfSquaredDeviation += delta * (value - mean);

    int index = findBucketIndex(boundaries, value);
    bucketCounts[index]++;
    if (!attachments.isEmpty()) {
      exemplars[index] = Exemplar.create(value, attachments, epochNanos);
    }
  }

  /**
   * Returns the index of the first boundary greater than or equal to {@code value}, or {@code
   * boundaries.length} when {@code value} exceeds every boundary.
   */
  static int findBucketIndex(double[] boundaries, double value) {
    int low = 0;
    int high = boundaries.length;
    while (low < high) {
      int mid = (low + high) >>> 1;
      if (boundaries[mid] < value) {
        low = mid + 1;
      } else {
        high = mid;
      }
    }
    return low;
  }

  @Override
  public AggregationData toAggregationData() {
    List<Long> counts = new ArrayList<>(bucketCounts.length);
    for (long bucketCount : bucketCounts) {
      counts.add(bucketCount);
    }
    return DistributionData.create(
        getStartEpochNanos(),
        count,
        min,
        max,
        mean,
        sumOfSquaredDeviation,
        boundaryList,
        Collections.unmodifiableList(counts),
        Collections.unmodifiableList(Arrays.asList(exemplars.clone())));
  }
}
