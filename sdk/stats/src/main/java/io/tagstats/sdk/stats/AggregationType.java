/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.stats;

/** The kind of running statistic an {@link Aggregation} maintains. */
public enum AggregationType {
  /** Number of recorded measurements. */
  COUNT,
  /** Sum of recorded values. */
  SUM,
  /** Most recently recorded value. */
  LAST_VALUE,
  /** Count, mean, variance, min, max and an explicit-bucket histogram of recorded values. */
  DISTRIBUTION,
}
