/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.api.stats;

import com.google.auto.value.AutoValue;
import javax.annotation.concurrent.Immutable;

/** A value recorded against a {@link Measure}. */
@AutoValue
@Immutable
public abstract class Measurement {

  public static Measurement create(Measure measure, double value) {
    return new AutoValue_Measurement(measure, value);
  }

  Measurement() {}

  public abstract Measure getMeasure();

  public abstract double getValue();
}
