/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.stats.data;

import com.google.auto.value.AutoValue;
import io.tagstats.sdk.stats.AggregationType;
import java.util.List;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * Statistics of the values recorded into a distribution row.
 *
 * <p>{@link #getBucketCounts()} holds one count per bucket, not cumulative, and has one more
 * entry than {@link #getBucketBoundaries()}: bucket {@code i} counts values {@code v} with {@code
 * boundaries[i - 1] < v <= boundaries[i]}, the last bucket counts values above the largest
 * boundary.
 */
@AutoValue
@Immutable
public abstract class DistributionData implements AggregationData {

  /**
   * Creates a {@code DistributionData}.
   *
   * @param exemplars one entry per bucket, {@code null} where the bucket has no exemplar.
   */
  public static DistributionData create(
      long startEpochNanos,
      long count,
      double min,
      double max,
      double mean,
      double sumOfSquaredDeviation,
      List<Double> bucketBoundaries,
      List<Long> bucketCounts,
      List<Exemplar> exemplars) {
    if (bucketCounts.size() != bucketBoundaries.size() + 1) {
      throw new IllegalArgumentException(
          "Expected " + (bucketBoundaries.size() + 1) + " bucket counts, got "
              + bucketCounts.size());
    }
    return new AutoValue_DistributionData(
        startEpochNanos,
        count,
        min,
        max,
        mean,
        sumOfSquaredDeviation,
        bucketBoundaries,
        bucketCounts,
        exemplars);
  }

  DistributionData() {}

  @Override
  public abstract long getStartEpochNanos();

  public abstract long getCount();

  public abstract double getMin();

  public abstract double getMax();

  public abstract double getMean();

  /** Returns the sum of squared deviations from the mean. */
  public abstract double getSumOfSquaredDeviation();

  public abstract List<Double> getBucketBoundaries();

  public abstract List<Long> getBucketCounts();

  /** Returns the latest exemplar of each bucket; entries are {@code null} for empty buckets. */
  public abstract List<Exemplar> getExemplars();

  /** Returns the sum of recorded values, derived from the mean. */
  public final double getSum() {
    return getMean() * getCount();
  }

  @Nullable
  public final Exemplar getExemplar(int bucketIndex) {
    return getExemplars().get(bucketIndex);
  }

  @Override
  public final AggregationType getType() {
    return AggregationType.DISTRIBUTION;
  }
}
