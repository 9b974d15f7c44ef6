/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.stats.data;

import io.tagstats.sdk.stats.AggregationType;

/**
 * A point-in-time snapshot of the running statistic of one row.
 *
 * <p>Implementations are immutable and safe to read while recording continues.
 */
public interface AggregationData {

  /** Returns the kind of aggregation this data was produced by. */
  AggregationType getType();

  /** Returns the time of the first measurement aggregated into this data, in epoch nanos. */
  long getStartEpochNanos();
}
