/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.autoconfigure.spi.internal;

import io.tagstats.sdk.autoconfigure.spi.ConfigProperties;
import io.tagstats.sdk.autoconfigure.spi.ConfigurationException;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Properties read from a map of defaults, the environment and the system properties, in
 * increasing order of precedence. Environment variable names are matched by lower-casing them and
 * replacing underscores with dots, so {@code TAGSTATS_EXPORTER_PROMETHEUS_PORT} configures {@code
 * tagstats.exporter.prometheus.port}.
 *
 * <p>This class is internal and is hence not for public use. Its APIs are unstable and can change
 * at any time.
 */
public final class DefaultConfigProperties implements ConfigProperties {

  private final Map<String, String> config;

  /** Returns properties merged from {@code defaultProperties}, the environment and the JVM. */
  public static DefaultConfigProperties create(Map<String, String> defaultProperties) {
    return new DefaultConfigProperties(System.getProperties(), System.getenv(), defaultProperties);
  }

  /** Returns properties backed only by {@code properties}. */
  public static DefaultConfigProperties createFromMap(Map<String, String> properties) {
    return new DefaultConfigProperties(
        Collections.emptyMap(), Collections.emptyMap(), properties);
  }

  private DefaultConfigProperties(
      Map<?, ?> systemProperties,
      Map<String, String> environmentVariables,
      Map<String, String> defaultProperties) {
    Map<String, String> config = new HashMap<>();
    defaultProperties.forEach(
        (name, value) -> config.put(normalizePropertyKey(name), value));
    environmentVariables.forEach(
        (name, value) -> config.put(normalizeEnvironmentVariableKey(name), value));
    systemProperties.forEach(
        (key, value) -> config.put(normalizePropertyKey(key.toString()), value.toString()));
    this.config = config;
  }

  private DefaultConfigProperties(
      DefaultConfigProperties previousProperties, Map<String, String> overrides) {
    Map<String, String> config = new HashMap<>(previousProperties.config);
    overrides.forEach((name, value) -> config.put(normalizePropertyKey(name), value));
    this.config = config;
  }

  /** Returns a copy of these properties with {@code overrides} applied on top. */
  public DefaultConfigProperties withOverrides(Map<String, String> overrides) {
    return new DefaultConfigProperties(this, overrides);
  }

  @Override
  @Nullable
  public String getString(String name) {
    String value = config.get(normalizePropertyKey(name));
    if (value == null) {
      return null;
    }
    value = value.trim();
    return value.isEmpty() ? null : value;
  }

  @Override
  @Nullable
  public Integer getInt(String name) {
    String value = getString(name);
    if (value == null) {
      return null;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException ex) {
      throw newInvalidPropertyException(name, value, "integer");
    }
  }

  @Override
  @Nullable
  public Boolean getBoolean(String name) {
    String value = getString(name);
    if (value == null) {
      return null;
    }
    return Boolean.parseBoolean(value);
  }

  @Override
  public Map<String, String> getMap(String name) {
    String value = getString(name);
    if (value == null) {
      return Collections.emptyMap();
    }
    Map<String, String> result = new LinkedHashMap<>();
    for (String entry : value.split(",")) {
      String trimmed = entry.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      int separator = trimmed.indexOf('=');
      if (separator <= 0) {
        throw new ConfigurationException(
            "Invalid map property: " + name + "=" + value + ", expected key=value pairs");
      }
      String key = trimmed.substring(0, separator).trim();
      String entryValue = trimmed.substring(separator + 1).trim();
      if (key.isEmpty()) {
        throw new ConfigurationException(
            "Invalid map property: " + name + "=" + value + ", keys must not be empty");
      }
      result.put(key, entryValue);
    }
    return Collections.unmodifiableMap(result);
  }

  private static ConfigurationException newInvalidPropertyException(
      String name, String value, String type) {
    return new ConfigurationException(
        "Invalid value for property " + name + "=" + value + ". Must be a " + type + ".");
  }

  private static String normalizeEnvironmentVariableKey(String key) {
    return key.toLowerCase(Locale.ROOT).replace('_', '.');
  }

  private static String normalizePropertyKey(String key) {
    return key.toLowerCase(Locale.ROOT).replace('-', '.');
  }
}
