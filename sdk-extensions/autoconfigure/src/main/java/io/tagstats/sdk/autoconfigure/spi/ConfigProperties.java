/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.autoconfigure.spi;

import java.util.Map;
import javax.annotation.Nullable;

/** Properties used for auto-configuration of the stats SDK components. */
public interface ConfigProperties {

  /**
   * Returns a string-valued configuration property.
   *
   * @return null if the property has not been configured.
   */
  @Nullable
  String getString(String name);

  /**
   * Returns a string-valued configuration property or {@code defaultValue} if a property with
   * {@code name} has not been configured.
   */
  default String getString(String name, String defaultValue) {
    String value = getString(name);
    return value == null ? defaultValue : value;
  }

  /**
   * Returns an integer-valued configuration property.
   *
   * @return null if the property has not been configured.
   * @throws ConfigurationException if the property is not a valid integer.
   */
  @Nullable
  Integer getInt(String name);

  /**
   * Returns an integer-valued configuration property or {@code defaultValue} if a property with
   * {@code name} has not been configured.
   *
   * @throws ConfigurationException if the property is not a valid integer.
   */
  default int getInt(String name, int defaultValue) {
    Integer value = getInt(name);
    return value == null ? defaultValue : value;
  }

  /**
   * Returns a boolean-valued configuration property. Anything other than {@code true}, ignoring
   * case, is {@code false}.
   *
   * @return null if the property has not been configured.
   */
  @Nullable
  Boolean getBoolean(String name);

  /**
   * Returns a boolean-valued configuration property or {@code defaultValue} if a property with
   * {@code name} has not been configured.
   */
  default boolean getBoolean(String name, boolean defaultValue) {
    Boolean value = getBoolean(name);
    return value == null ? defaultValue : value;
  }

  /**
   * Returns a map-valued configuration property, written as comma separated {@code key=value}
   * pairs.
   *
   * @return an empty map if the property has not been configured.
   * @throws ConfigurationException for malformed map strings.
   */
  Map<String, String> getMap(String name);
}
