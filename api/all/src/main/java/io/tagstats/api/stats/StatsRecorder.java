/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.api.stats;

import io.tagstats.api.tag.TagMap;
import java.util.Map;

/**
 * Entry point for recording measurements.
 *
 * <p>Recording never fails: measurements that cannot be aggregated are dropped.
 */
public interface StatsRecorder {

  /** Records {@code measurements} under the given tags. */
  void record(TagMap tags, Measurement... measurements);

  /**
   * Records {@code measurements} under the given tags, attaching {@code attachments} to any
   * exemplar the measurements produce.
   */
  void record(TagMap tags, Map<String, String> attachments, Measurement... measurements);
}
