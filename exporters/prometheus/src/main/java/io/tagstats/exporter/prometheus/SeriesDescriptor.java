/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.exporter.prometheus;

import com.google.auto.value.AutoValue;
import java.util.List;
import javax.annotation.concurrent.Immutable;

/** Name, help and sorted label names of an exported metric family. */
@AutoValue
@Immutable
abstract class SeriesDescriptor {

  static SeriesDescriptor create(String name, String help, List<String> labelNames) {
    return new AutoValue_SeriesDescriptor(name, help, labelNames);
  }

  SeriesDescriptor() {}

  abstract String getName();

  abstract String getHelp();

  abstract List<String> getLabelNames();
}
