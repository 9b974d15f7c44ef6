/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.stats;

import static java.util.Objects.requireNonNull;

import io.tagstats.api.stats.Measurement;
import io.tagstats.api.stats.StatsRecorder;
import io.tagstats.api.tag.TagMap;
import io.tagstats.sdk.common.Clock;
import java.util.Collections;
import java.util.Map;
import javax.annotation.concurrent.ThreadSafe;

/**
 * {@link StatsRecorder} that timestamps measurements with a {@link Clock} and dispatches them to a
 * {@link ViewManager}.
 */
@ThreadSafe
public final class SdkStatsRecorder implements StatsRecorder {

  private final ViewManager viewManager;
  private final Clock clock;

  private SdkStatsRecorder(ViewManager viewManager, Clock clock) {
    this.viewManager = viewManager;
    this.clock = clock;
  }

  /** Returns a recorder dispatching to {@code viewManager} using the system clock. */
  public static SdkStatsRecorder create(ViewManager viewManager) {
    return create(viewManager, Clock.getDefault());
  }

  public static SdkStatsRecorder create(ViewManager viewManager, Clock clock) {
    return new SdkStatsRecorder(
        requireNonNull(viewManager, "viewManager"), requireNonNull(clock, "clock"));
  }

  @Override
  public void record(TagMap tags, Measurement... measurements) {
    record(tags, Collections.emptyMap(), measurements);
  }

  @Override
  public void record(TagMap tags, Map<String, String> attachments, Measurement... measurements) {
    if (measurements == null) {
      return;
    }
    long now = clock.now();
    for (Measurement measurement : measurements) {
      if (measurement == null) {
        continue;
      }
      viewManager.record(
          tags, measurement.getMeasure(), measurement.getValue(), attachments, now);
    }
  }
}
