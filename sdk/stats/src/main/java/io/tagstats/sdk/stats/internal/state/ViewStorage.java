/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.stats.internal.state;

import io.tagstats.api.tag.TagMap;
import io.tagstats.sdk.stats.Row;
import io.tagstats.sdk.stats.View;
import io.tagstats.sdk.stats.internal.aggregator.Aggregator;
import io.tagstats.sdk.stats.internal.view.TagProjection;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Stores the rows of one registered {@link View}, keyed by signature.
 *
 * <p>This class is internal and is hence not for public use. Its APIs are unstable and can change
 * at any time.
 */
public final class ViewStorage {

  private final View view;
  private final ConcurrentHashMap<String, RowHandle> rowHandles = new ConcurrentHashMap<>();

  /**
   * Creates storage for {@code view}.
   *
   * @param view a canonical view.
   */
  public ViewStorage(View view) {
    this.view = view;
  }

  public View getView() {
    return view;
  }

  /** Records {@code value} into the row the projection of {@code tags} maps to. */
  public void record(
      TagMap tags, double value, Map<String, String> attachments, long epochNanos) {
    RowHandle handle = getRowHandle(tags, epochNanos);
    handle.record(value, attachments, epochNanos);
  }

  private RowHandle getRowHandle(TagMap tags, long epochNanos) {
    String signature = TagProjection.signature(view.getTagKeys(), tags);
    RowHandle handle = rowHandles.get(signature);
    if (handle != null) {
      return handle;
    }
    RowHandle newHandle =
        new RowHandle(
            TagProjection.project(view.getTagKeys(), tags),
            Aggregator.create(view.getAggregation(), epochNanos));
    // Racing producers agree on whichever handle was inserted first.
    handle = rowHandles.putIfAbsent(signature, newHandle);
    return handle != null ? handle : newHandle;
  }

  /** Returns a snapshot of all rows. */
  public List<Row> collect() {
    List<Row> rows = new ArrayList<>(rowHandles.size());
    for (RowHandle handle : rowHandles.values()) {
      rows.add(handle.toRow());
    }
    return rows;
  }

  /** Discards all rows. */
  public void clear() {
    rowHandles.clear();
  }

  // Visible for testing
  int getRowCount() {
    return rowHandles.size();
  }
}
