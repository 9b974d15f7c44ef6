/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.api.stats;

import com.google.auto.value.AutoValue;
import io.tagstats.api.internal.StringUtils;
import javax.annotation.concurrent.Immutable;

/**
 * A named quantity being observed, for example request latency.
 *
 * <p>Measures are compared by value: two measures with the same name, description and unit are
 * the same measure.
 */
@AutoValue
@Immutable
public abstract class Measure {

  /** Unit of dimensionless measures. */
  public static final String UNIT_DIMENSIONLESS = "1";

  /**
   * Creates a {@code Measure}.
   *
   * @throws IllegalArgumentException if the name is not valid.
   */
  public static Measure create(String name, String description, String unit) {
    if (!StringUtils.isValidName(name)) {
      throw new IllegalArgumentException("Invalid measure name: " + name);
    }
    return new AutoValue_Measure(name, description, unit);
  }

  Measure() {}

  public abstract String getName();

  public abstract String getDescription();

  public abstract String getUnit();

  /** Associates {@code value} with this measure. */
  public final Measurement measurement(double value) {
    return Measurement.create(this, value);
  }
}
