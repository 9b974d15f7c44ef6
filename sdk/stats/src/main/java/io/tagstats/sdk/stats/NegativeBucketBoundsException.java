/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.stats;

/** Thrown when a distribution view is registered with a negative bucket boundary. */
public final class NegativeBucketBoundsException extends ViewRegistrationException {

  private static final long serialVersionUID = -2870112386447652117L;

  public NegativeBucketBoundsException(String message) {
    super(message);
  }
}
