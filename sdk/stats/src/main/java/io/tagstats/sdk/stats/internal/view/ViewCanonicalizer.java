/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.stats.internal.view;

import io.tagstats.api.internal.StringUtils;
import io.tagstats.api.tag.TagKey;
import io.tagstats.sdk.stats.Aggregation;
import io.tagstats.sdk.stats.AggregationType;
import io.tagstats.sdk.stats.View;
import io.tagstats.sdk.stats.ViewRegistrationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.TreeSet;

/**
 * Brings a {@link View} into the form it is registered in.
 *
 * <p>This class is internal and is hence not for public use. Its APIs are unstable and can change
 * at any time.
 */
public final class ViewCanonicalizer {

  /**
   * Returns the canonical form of {@code view}: tag keys sorted by name without duplicates, name
   * and description defaulted from the measure when empty, distribution boundaries normalized.
   *
   * @throws ViewRegistrationException if the view is not valid.
   */
  public static View canonicalize(View view) {
    String name = view.getName();
    if (name.isEmpty()) {
      name = view.getMeasure().getName();
    }
    if (!StringUtils.isValidName(name)) {
      throw new ViewRegistrationException(
          "invalid view name \"" + name + "\": must be printable ASCII of at most "
              + StringUtils.NAME_MAX_LENGTH + " characters");
    }
    String description = view.getDescription();
    if (description.isEmpty()) {
      description = view.getMeasure().getDescription();
    }

    TreeSet<TagKey> sortedKeys = new TreeSet<>();
    for (TagKey key : view.getTagKeys()) {
      if (key == null) {
        throw new ViewRegistrationException("view \"" + name + "\" has a null tag key");
      }
      sortedKeys.add(key);
    }

    Aggregation aggregation = view.getAggregation();
    if (aggregation.getType() == AggregationType.DISTRIBUTION) {
      aggregation = Aggregation.distribution(
          BucketBoundaries.normalize(aggregation.getBucketBoundaries()));
    }

    return view.toBuilder()
        .setName(name)
        .setDescription(description)
        .setTagKeys(Collections.unmodifiableList(new ArrayList<>(sortedKeys)))
        .setAggregation(aggregation)
        .build();
  }

  /**
   * Returns whether two canonical views aggregate the same way. Names and descriptions are not
   * compared.
   */
  public static boolean isSameShape(View a, View b) {
    return a.getMeasure().equals(b.getMeasure())
        && a.getAggregation().equals(b.getAggregation())
        && a.getTagKeys().equals(b.getTagKeys());
  }

  private ViewCanonicalizer() {}
}
