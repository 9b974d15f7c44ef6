/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.stats;

import com.google.auto.value.AutoValue;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.concurrent.Immutable;

/**
 * Configures how recorded values are aggregated by a {@link View}.
 *
 * <p>Bucket boundaries of a distribution are kept as given; they are sorted, stripped of zero and
 * duplicate values and checked for negative values when the view is registered.
 */
@AutoValue
@Immutable
public abstract class Aggregation {

  private static final Aggregation COUNT =
      new AutoValue_Aggregation(AggregationType.COUNT, Collections.emptyList());
  private static final Aggregation SUM =
      new AutoValue_Aggregation(AggregationType.SUM, Collections.emptyList());
  private static final Aggregation LAST_VALUE =
      new AutoValue_Aggregation(AggregationType.LAST_VALUE, Collections.emptyList());

  /** Counts the number of recorded measurements, ignoring their values. */
  public static Aggregation count() {
    return COUNT;
  }

  /** Sums recorded values. */
  public static Aggregation sum() {
    return SUM;
  }

  /** Keeps the last recorded value. */
  public static Aggregation lastValue() {
    return LAST_VALUE;
  }

  /**
   * Aggregates recorded values into a distribution with the given bucket boundaries. Each boundary
   * is the inclusive upper bound of its bucket; values above the largest boundary fall into an
   * extra overflow bucket.
   */
  public static Aggregation distribution(double... bucketBoundaries) {
    List<Double> boundaries = new ArrayList<>(bucketBoundaries.length);
    for (double boundary : bucketBoundaries) {
      boundaries.add(boundary);
    }
    return distribution(boundaries);
  }

  /** See {@link #distribution(double...)}. */
  public static Aggregation distribution(List<Double> bucketBoundaries) {
    return new AutoValue_Aggregation(
        AggregationType.DISTRIBUTION,
        Collections.unmodifiableList(new ArrayList<>(bucketBoundaries)));
  }

  Aggregation() {}

  public abstract AggregationType getType();

  /** Returns the bucket boundaries, empty unless this is a distribution. */
  public abstract List<Double> getBucketBoundaries();
}
