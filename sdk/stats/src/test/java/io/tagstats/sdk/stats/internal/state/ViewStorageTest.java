/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.stats.internal.state;

import static org.assertj.core.api.Assertions.assertThat;

import io.tagstats.api.stats.Measure;
import io.tagstats.api.tag.TagKey;
import io.tagstats.api.tag.TagMap;
import io.tagstats.sdk.stats.Aggregation;
import io.tagstats.sdk.stats.Row;
import io.tagstats.sdk.stats.View;
import io.tagstats.sdk.stats.data.CountData;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ViewStorageTest {

  private static final TagKey METHOD = TagKey.create("method");
  private static final Measure REQUESTS = Measure.create("requests", "", "1");

  private static ViewStorage countStorage() {
    return new ViewStorage(
        View.builder()
            .setName("requests")
            .setMeasure(REQUESTS)
            .setTagKeys(METHOD)
            .setAggregation(Aggregation.count())
            .build());
  }

  @Test
  void rowStartIsFirstMeasurement() {
    ViewStorage storage = countStorage();
    TagMap tags = TagMap.builder().put(METHOD, "GET").build();

    storage.record(tags, 1, Collections.emptyMap(), 100);
    storage.record(tags, 1, Collections.emptyMap(), 200);

    List<Row> rows = storage.collect();
    assertThat(rows).hasSize(1);
    assertThat(rows.get(0).getStartEpochNanos()).isEqualTo(100);
    assertThat(rows.get(0).getData().getStartEpochNanos()).isEqualTo(100);
  }

  @Test
  void clear_restartsRows() {
    ViewStorage storage = countStorage();
    TagMap tags = TagMap.builder().put(METHOD, "GET").build();
    storage.record(tags, 1, Collections.emptyMap(), 100);

    storage.clear();
    assertThat(storage.collect()).isEmpty();

    storage.record(tags, 1, Collections.emptyMap(), 300);
    Row row = storage.collect().get(0);
    assertThat(row.getStartEpochNanos()).isEqualTo(300);
    assertThat(((CountData) row.getData()).getCount()).isEqualTo(1);
  }

  @Test
  void concurrentRecordingIntoOneRow() throws Exception {
    ViewStorage storage = countStorage();
    TagMap tags = TagMap.builder().put(METHOD, "GET").build();
    int threads = 8;
    int recordsPerThread = 10_000;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  for (int j = 0; j < recordsPerThread; j++) {
                    storage.record(tags, 1, Collections.emptyMap(), j);
                  }
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    assertThat(storage.getRowCount()).isEqualTo(1);
    CountData data = (CountData) storage.collect().get(0).getData();
    assertThat(data.getCount()).isEqualTo((long) threads * recordsPerThread);
  }
}
