/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.stats.internal.state;

import io.tagstats.api.tag.Tag;
import io.tagstats.sdk.stats.Row;
import io.tagstats.sdk.stats.data.AggregationData;
import io.tagstats.sdk.stats.internal.aggregator.Aggregator;
import java.util.List;
import java.util.Map;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

/**
 * The mutable state behind one {@link Row}: its projected tags, creation time and aggregator.
 *
 * <p>Recording and snapshotting lock only this handle, so different rows never contend.
 */
@ThreadSafe
final class RowHandle {

  private final List<Tag> tags;
  private final long startEpochNanos;

  @GuardedBy("this")
  private final Aggregator aggregator;

  RowHandle(List<Tag> tags, Aggregator aggregator) {
    this.tags = tags;
    this.startEpochNanos = aggregator.getStartEpochNanos();
    this.aggregator = aggregator;
  }

  synchronized void record(double value, Map<String, String> attachments, long epochNanos) {
    aggregator.record(value, attachments, epochNanos);
  }

  Row toRow() {
    AggregationData data;
    synchronized (this) {
      data = aggregator.toAggregationData();
    }
    return Row.create(tags, data, startEpochNanos);
  }
}
