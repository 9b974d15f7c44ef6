/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.stats;

import com.google.auto.value.AutoValue;
import java.util.List;
import javax.annotation.concurrent.Immutable;

/** A registered {@link View} together with a snapshot of its rows. */
@AutoValue
@Immutable
public abstract class ViewData {

  public static ViewData create(View view, List<Row> rows) {
    return new AutoValue_ViewData(view, rows);
  }

  ViewData() {}

  public abstract View getView();

  public abstract List<Row> getRows();
}
