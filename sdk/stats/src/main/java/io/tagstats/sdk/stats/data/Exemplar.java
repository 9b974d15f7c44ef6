/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.stats.data;

import com.google.auto.value.AutoValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.concurrent.Immutable;

/** A single recorded value kept as an example for a histogram bucket. */
@AutoValue
@Immutable
public abstract class Exemplar {

  public static Exemplar create(double value, Map<String, String> attachments, long epochNanos) {
    return new AutoValue_Exemplar(
        value, Collections.unmodifiableMap(new LinkedHashMap<>(attachments)), epochNanos);
  }

  Exemplar() {}

  public abstract double getValue();

  /** Returns the attachments recorded with the value, for example a trace id. */
  public abstract Map<String, String> getAttachments();

  public abstract long getEpochNanos();
}
