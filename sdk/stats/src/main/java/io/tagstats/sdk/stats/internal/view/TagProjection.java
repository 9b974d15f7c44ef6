/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.stats.internal.view;

import io.tagstats.api.tag.Tag;
import io.tagstats.api.tag.TagKey;
import io.tagstats.api.tag.TagMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Projects recorded tags onto the tag keys of a view, and encodes the projection into a row
 * signature.
 *
 * <p>Signatures are length-prefixed: every key and every value is written as {@code
 * <length>:<chars>}. Since a reader always knows how many characters to consume, no two distinct
 * sequences of pairs produce the same signature, whatever characters the values contain.
 *
 * <p>This class is internal and is hence not for public use. Its APIs are unstable and can change
 * at any time.
 */
public final class TagProjection {

  /**
   * Returns one tag per key of {@code keys}, in order, taking values from {@code tags}. Keys not
   * present in {@code tags} get an empty value.
   */
  public static List<Tag> project(List<TagKey> keys, TagMap tags) {
    List<Tag> projected = new ArrayList<>(keys.size());
    for (TagKey key : keys) {
      projected.add(Tag.create(key, valueOf(key, tags)));
    }
    return Collections.unmodifiableList(projected);
  }

  /** Returns the signature of the projection of {@code tags} onto {@code keys}. */
  public static String signature(List<TagKey> keys, TagMap tags) {
    StringBuilder sb = new StringBuilder();
    for (TagKey key : keys) {
      appendField(sb, key.getName());
      appendField(sb, valueOf(key, tags));
    }
    return sb.toString();
  }

  private static String valueOf(TagKey key, TagMap tags) {
    String value = tags.get(key);
    return value == null ? "" : value;
  }

  private static void appendField(StringBuilder sb, String field) {
    sb.append(field.length()).append(':').append(field);
  }

  private TagProjection() {}
}
