/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.api.tag;

import com.google.auto.value.AutoValue;
import io.tagstats.api.internal.StringUtils;
import javax.annotation.concurrent.Immutable;

/**
 * The key of a {@link Tag}. Keys are compared by name.
 *
 * <p>A valid name is non-empty, printable ASCII and at most {@value
 * StringUtils#NAME_MAX_LENGTH} characters long.
 */
@AutoValue
@Immutable
public abstract class TagKey implements Comparable<TagKey> {

  /**
   * Creates a {@code TagKey}.
   *
   * @throws IllegalArgumentException if the name is not valid.
   */
  public static TagKey create(String name) {
    if (!StringUtils.isValidName(name)) {
      throw new IllegalArgumentException("Invalid tag key name: " + name);
    }
    return new AutoValue_TagKey(name);
  }

  TagKey() {}

  public abstract String getName();

  @Override
  public final int compareTo(TagKey other) {
    return getName().compareTo(other.getName());
  }
}
