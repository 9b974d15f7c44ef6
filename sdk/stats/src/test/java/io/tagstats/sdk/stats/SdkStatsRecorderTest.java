/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.stats;

import static org.assertj.core.api.Assertions.assertThat;

import io.tagstats.api.stats.Measure;
import io.tagstats.api.stats.Measurement;
import io.tagstats.api.tag.TagKey;
import io.tagstats.api.tag.TagMap;
import io.tagstats.sdk.stats.data.DistributionData;
import io.tagstats.sdk.stats.data.Exemplar;
import io.tagstats.sdk.stats.data.LastValueData;
import io.tagstats.sdk.testing.TestClock;
import java.util.Collections;
import org.junit.jupiter.api.Test;

class SdkStatsRecorderTest {

  private static final TagKey METHOD = TagKey.create("method");
  private static final Measure LATENCY = Measure.create("latency", "request latency", "ms");
  private static final Measure SIZE = Measure.create("size", "response size", "By");

  private final TestClock clock = TestClock.create(1_000);
  private final ViewManager viewManager = ViewManager.create();
  private final SdkStatsRecorder recorder = SdkStatsRecorder.create(viewManager, clock);

  @Test
  void recordsSeveralMeasurementsWithOneTimestamp() {
    viewManager.register(
        View.builder()
            .setMeasure(LATENCY)
            .setTagKeys(METHOD)
            .setAggregation(Aggregation.distribution(10, 100))
            .build(),
        View.builder().setMeasure(SIZE).setAggregation(Aggregation.lastValue()).build());

    recorder.record(
        TagMap.builder().put(METHOD, "GET").build(),
        Collections.singletonMap("trace_id", "abc"),
        LATENCY.measurement(42),
        null,
        SIZE.measurement(512));

    DistributionData latency =
        (DistributionData) viewManager.retrieveData("latency").get(0).getData();
    assertThat(latency.getBucketCounts()).containsExactly(0L, 1L, 0L);
    Exemplar exemplar = latency.getExemplar(1);
    assertThat(exemplar.getAttachments()).containsEntry("trace_id", "abc");
    assertThat(exemplar.getEpochNanos()).isEqualTo(1_000);

    LastValueData size = (LastValueData) viewManager.retrieveData("size").get(0).getData();
    assertThat(size.getValue()).isEqualTo(512.0);
    assertThat(size.getEpochNanos()).isEqualTo(1_000);
  }

  @Test
  void recordWithoutAttachmentsKeepsNoExemplar() {
    viewManager.register(
        View.builder().setMeasure(LATENCY).setAggregation(Aggregation.distribution(10)).build());

    recorder.record(TagMap.empty(), LATENCY.measurement(1));

    DistributionData latency =
        (DistributionData) viewManager.retrieveData("latency").get(0).getData();
    assertThat(latency.getExemplar(0)).isNull();
  }

  @Test
  void recordNullMeasurementArrayIsIgnored() {
    viewManager.register(
        View.builder().setMeasure(SIZE).setAggregation(Aggregation.lastValue()).build());

    recorder.record(TagMap.empty(), (Measurement[]) null);
    recorder.record(TagMap.empty(), Collections.emptyMap(), (Measurement[]) null);

    assertThat(viewManager.retrieveData("size")).isEmpty();
  }
}
