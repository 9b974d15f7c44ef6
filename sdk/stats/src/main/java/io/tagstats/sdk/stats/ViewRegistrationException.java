/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.stats;

/** Thrown when a {@link View} cannot be registered. No view is registered when this is thrown. */
public class ViewRegistrationException extends RuntimeException {

  private static final long serialVersionUID = 4120379486745816410L;

  public ViewRegistrationException(String message) {
    super(message);
  }
}
