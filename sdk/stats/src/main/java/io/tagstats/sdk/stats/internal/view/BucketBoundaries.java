/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.stats.internal.view;

import io.tagstats.sdk.stats.NegativeBucketBoundsException;
import io.tagstats.sdk.stats.ViewRegistrationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Normalization of distribution bucket boundaries.
 *
 * <p>This class is internal and is hence not for public use. Its APIs are unstable and can change
 * at any time.
 */
public final class BucketBoundaries {

  /**
   * Returns {@code boundaries} sorted ascending, without zero and duplicate values.
   *
   * @throws NegativeBucketBoundsException if any boundary is negative.
   * @throws ViewRegistrationException if any boundary is NaN or infinite.
   */
  public static List<Double> normalize(List<Double> boundaries) {
    for (Double boundary : boundaries) {
      if (boundary == null || boundary.isNaN() || boundary.isInfinite()) {
        throw new ViewRegistrationException("invalid bucket boundary: " + boundary);
      }
      if (boundary < 0) {
        throw new NegativeBucketBoundsException(
            "negative bucket boundaries are not supported: " + boundaries);
      }
    }
    List<Double> sorted = new ArrayList<>(boundaries);
    Collections.sort(sorted);
    List<Double> result = new ArrayList<>(sorted.size());
    double previous = 0;
    for (double boundary : sorted) {
      if (boundary > previous) {
        result.add(boundary);
        previous = boundary;
      }
    }
    return Collections.unmodifiableList(result);
  }

  private BucketBoundaries() {}
}
