/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.autoconfigure;

import static java.util.Objects.requireNonNull;

import io.tagstats.exporter.prometheus.PrometheusExporter;
import io.tagstats.exporter.prometheus.PrometheusHttpServer;
import io.tagstats.sdk.autoconfigure.spi.ConfigProperties;
import io.tagstats.sdk.autoconfigure.spi.ConfigurationException;
import io.tagstats.sdk.autoconfigure.spi.internal.DefaultConfigProperties;
import io.tagstats.sdk.stats.ViewManager;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/** A builder for configuring auto-configuration of the stats SDK. */
public final class AutoConfiguredStatsSdkBuilder {

  private static final Logger logger =
      Logger.getLogger(AutoConfiguredStatsSdkBuilder.class.getName());

  @Nullable private ConfigProperties config;
  private Supplier<Map<String, String>> propertiesSupplier = Collections::emptyMap;
  private final List<Function<ConfigProperties, Map<String, String>>> propertiesCustomizers =
      new ArrayList<>();
  private ViewManager viewManager = ViewManager.getDefault();

  AutoConfiguredStatsSdkBuilder() {}

  /**
   * Sets the {@link ConfigProperties} to use when resolving properties. {@link
   * #addPropertiesSupplier(Supplier)} and {@link #addPropertiesCustomizer(Function)} have no
   * effect if this method is used.
   */
  public AutoConfiguredStatsSdkBuilder setConfig(ConfigProperties config) {
    requireNonNull(config, "config");
    this.config = config;
    return this;
  }

  /**
   * Adds a {@link Supplier} of property names and values to use as defaults. The order of
   * precedence of properties is system properties > environment variables > the suppliers
   * registered with this method.
   *
   * <p>Multiple calls will cause properties to be merged in order, with later ones overwriting
   * duplicate keys in earlier ones.
   */
  public AutoConfiguredStatsSdkBuilder addPropertiesSupplier(
      Supplier<Map<String, String>> propertiesSupplier) {
    requireNonNull(propertiesSupplier, "propertiesSupplier");
    this.propertiesSupplier = mergeProperties(this.propertiesSupplier, propertiesSupplier);
    return this;
  }

  /**
   * Adds a {@link Function} invoked with the resolved {@link ConfigProperties}. The returned
   * properties are merged into the configuration before it is used, overwriting the properties
   * that are already there.
   *
   * <p>Customizers run in the order they were added, each seeing the result of the previous ones.
   */
  public AutoConfiguredStatsSdkBuilder addPropertiesCustomizer(
      Function<ConfigProperties, Map<String, String>> propertiesCustomizer) {
    requireNonNull(propertiesCustomizer, "propertiesCustomizer");
    this.propertiesCustomizers.add(propertiesCustomizer);
    return this;
  }

  /** Sets the view manager to export. Defaults to {@link ViewManager#getDefault()}. */
  public AutoConfiguredStatsSdkBuilder setViewManager(ViewManager viewManager) {
    requireNonNull(viewManager, "viewManager");
    this.viewManager = viewManager;
    return this;
  }

  /**
   * Builds the exporter and, unless {@code tagstats.exporter.prometheus.server.enabled} is
   * {@code false}, starts its HTTP server.
   *
   * @throws ConfigurationException if the properties are invalid or the server cannot start.
   */
  public AutoConfiguredStatsSdk build() {
    ConfigProperties config = getConfig();
    PrometheusExporter exporter = null;
    try {
      exporter = PrometheusExporterConfiguration.configureExporter(config, viewManager);
      PrometheusHttpServer server = null;
      if (config.getBoolean(PrometheusExporterConfiguration.SERVER_ENABLED, true)) {
        server = PrometheusExporterConfiguration.configureServer(config, exporter);
      }
      logger.log(Level.FINE, "Stats SDK configured with server {0}", server);
      return new AutoConfiguredStatsSdk(viewManager, exporter, server, config);
    } catch (RuntimeException e) {
      logger.info(
          "Error encountered during autoconfiguration. Closing partially configured components.");
      if (exporter != null) {
        exporter.unregister();
      }
      if (e instanceof ConfigurationException) {
        throw e;
      }
      throw new ConfigurationException("Unexpected configuration error", e);
    }
  }

  private ConfigProperties getConfig() {
    ConfigProperties config = this.config;
    if (config == null) {
      config = computeConfigProperties();
    }
    return config;
  }

  private ConfigProperties computeConfigProperties() {
    DefaultConfigProperties properties = DefaultConfigProperties.create(propertiesSupplier.get());
    for (Function<ConfigProperties, Map<String, String>> customizer : propertiesCustomizers) {
      Map<String, String> overrides = customizer.apply(properties);
      properties = properties.withOverrides(overrides);
    }
    return properties;
  }

  private static Supplier<Map<String, String>> mergeProperties(
      Supplier<Map<String, String>> first, Supplier<Map<String, String>> second) {
    return () -> {
      Map<String, String> merged = new HashMap<>();
      merged.putAll(first.get());
      merged.putAll(second.get());
      return merged;
    };
  }
}
