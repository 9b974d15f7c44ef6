/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.stats;

import com.google.auto.value.AutoValue;
import io.tagstats.api.tag.Tag;
import io.tagstats.sdk.stats.data.AggregationData;
import java.util.List;
import javax.annotation.concurrent.Immutable;

/**
 * A snapshot of one {@link View}'s statistic for one combination of tag values.
 *
 * <p>{@link #getTags()} has one tag per view tag key, in key order; keys that were absent from the
 * recording carry an empty value.
 */
@AutoValue
@Immutable
public abstract class Row {

  public static Row create(List<Tag> tags, AggregationData data, long startEpochNanos) {
    return new AutoValue_Row(tags, data, startEpochNanos);
  }

  Row() {}

  public abstract List<Tag> getTags();

  public abstract AggregationData getData();

  /** Returns the time the row was created, in epoch nanos. */
  public abstract long getStartEpochNanos();
}
