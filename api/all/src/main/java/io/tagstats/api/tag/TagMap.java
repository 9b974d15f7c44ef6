/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.api.tag;

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * An immutable set of {@link Tag}s, ordered by key name and free of duplicate keys.
 *
 * <p>A {@code TagMap} is passed explicitly with every recording.
 */
@Immutable
public final class TagMap {

  private static final TagMap EMPTY = new TagMap(Collections.emptyMap());

  // Sorted by key name.
  private final Map<TagKey, String> tags;

  private TagMap(Map<TagKey, String> tags) {
    this.tags = tags;
  }

  /** Returns a {@code TagMap} with no tags. */
  public static TagMap empty() {
    return EMPTY;
  }

  /** Returns a new {@link Builder}. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns the value for the given key, or {@code null} if the key is not present. */
  @Nullable
  public String get(TagKey key) {
    return tags.get(key);
  }

  /** Returns all tags in key order. */
  public List<Tag> getTags() {
    List<Tag> result = new ArrayList<>(tags.size());
    tags.forEach((key, value) -> result.add(Tag.create(key, value)));
    return result;
  }

  public int size() {
    return tags.size();
  }

  public boolean isEmpty() {
    return tags.isEmpty();
  }

  /** Returns a builder initialized with the tags of this map. */
  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.tags.putAll(tags);
    return builder;
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof TagMap)) {
      return false;
    }
    return tags.equals(((TagMap) o).tags);
  }

  @Override
  public int hashCode() {
    return tags.hashCode();
  }

  @Override
  public String toString() {
    return "TagMap" + tags;
  }

  /** Builder of {@link TagMap}. Later puts of the same key replace earlier ones. */
  public static final class Builder {

    private final TreeMap<TagKey, String> tags = new TreeMap<>();

    private Builder() {}

    public Builder put(TagKey key, String value) {
      requireNonNull(key, "key");
      requireNonNull(value, "value");
      tags.put(key, value);
      return this;
    }

    public Builder put(String key, String value) {
      return put(TagKey.create(key), value);
    }

    public Builder remove(TagKey key) {
      tags.remove(requireNonNull(key, "key"));
      return this;
    }

    public TagMap build() {
      if (tags.isEmpty()) {
        return EMPTY;
      }
      return new TagMap(Collections.unmodifiableMap(new TreeMap<>(tags)));
    }
  }
}
