/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.stats;

import com.google.auto.value.AutoValue;
import io.tagstats.api.stats.Measure;
import io.tagstats.api.tag.TagKey;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import javax.annotation.concurrent.Immutable;

/**
 * Aggregates the measurements of one {@link Measure} along a chosen set of tag keys.
 *
 * <p>Views are registered with a {@link ViewManager}, which stores a canonical form: tag keys
 * sorted by name, a blank name or description taken from the measure, distribution boundaries
 * normalized. Use {@link ViewManager#find(String)} to read the canonical form back.
 */
@AutoValue
@Immutable
public abstract class View {

  /** Returns a new {@link Builder} with an empty name, description and tag keys. */
  public static Builder builder() {
    return new AutoValue_View.Builder()
        .setName("")
        .setDescription("")
        .setTagKeys(Collections.emptyList());
  }

  View() {}

  /** Returns the name of the view, used as the exported metric name. */
  public abstract String getName();

  public abstract String getDescription();

  /** Returns the measure whose measurements this view aggregates. */
  public abstract Measure getMeasure();

  /** Returns the tag keys rows are broken down by. */
  public abstract List<TagKey> getTagKeys();

  public abstract Aggregation getAggregation();

  public abstract Builder toBuilder();

  /** Builder of {@link View}. A measure and an aggregation are required. */
  @AutoValue.Builder
  public abstract static class Builder {

    Builder() {}

    public abstract Builder setName(String name);

    public abstract Builder setDescription(String description);

    public abstract Builder setMeasure(Measure measure);

    public abstract Builder setTagKeys(List<TagKey> tagKeys);

    public final Builder setTagKeys(TagKey... tagKeys) {
      return setTagKeys(Arrays.asList(tagKeys));
    }

    public abstract Builder setAggregation(Aggregation aggregation);

    abstract List<TagKey> getTagKeys();

    abstract View autoBuild();

    /**
     * Returns the {@link View}.
     *
     * @throws IllegalStateException if the measure or the aggregation was not set.
     */
    public final View build() {
      setTagKeys(Collections.unmodifiableList(new ArrayList<>(getTagKeys())));
      return autoBuild();
    }
  }
}
