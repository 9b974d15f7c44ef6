/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.stats;

import java.util.List;

/** Read surface of aggregated views, consumed by exporters on every collection. */
@FunctionalInterface
public interface ViewDataProducer {

  /**
   * Returns a snapshot of every registered view and its rows. The returned data is not affected
   * by measurements recorded afterwards.
   */
  List<ViewData> collectAll();
}
