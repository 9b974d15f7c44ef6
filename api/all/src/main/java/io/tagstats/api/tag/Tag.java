/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.api.tag;

import com.google.auto.value.AutoValue;
import javax.annotation.concurrent.Immutable;

/** A key/value pair attached to a recorded measurement. */
@AutoValue
@Immutable
public abstract class Tag {

  public static Tag create(TagKey key, String value) {
    return new AutoValue_Tag(key, value);
  }

  Tag() {}

  public abstract TagKey getKey();

  public abstract String getValue();
}
