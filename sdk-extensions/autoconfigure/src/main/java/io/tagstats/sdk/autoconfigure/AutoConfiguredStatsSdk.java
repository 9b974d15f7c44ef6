/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.autoconfigure;

import io.tagstats.exporter.prometheus.PrometheusExporter;
import io.tagstats.exporter.prometheus.PrometheusHttpServer;
import io.tagstats.sdk.autoconfigure.spi.ConfigProperties;
import io.tagstats.sdk.stats.ViewManager;
import java.io.Closeable;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * The result of property-driven configuration: a {@link ViewManager}, the Prometheus exporter
 * reading it, and, unless disabled, the HTTP server serving the exporter.
 */
public final class AutoConfiguredStatsSdk implements Closeable {

  private final ViewManager viewManager;
  private final PrometheusExporter exporter;
  @Nullable private final PrometheusHttpServer server;
  private final ConfigProperties config;

  /** Returns a new {@link AutoConfiguredStatsSdkBuilder}. */
  public static AutoConfiguredStatsSdkBuilder builder() {
    return new AutoConfiguredStatsSdkBuilder();
  }

  /** Configures a stats SDK from system properties and environment variables. */
  public static AutoConfiguredStatsSdk initialize() {
    return builder().build();
  }

  AutoConfiguredStatsSdk(
      ViewManager viewManager,
      PrometheusExporter exporter,
      @Nullable PrometheusHttpServer server,
      ConfigProperties config) {
    this.viewManager = viewManager;
    this.exporter = exporter;
    this.server = server;
    this.config = config;
  }

  public ViewManager getViewManager() {
    return viewManager;
  }

  public PrometheusExporter getExporter() {
    return exporter;
  }

  /** Returns the HTTP server, empty if it was disabled by configuration. */
  public Optional<PrometheusHttpServer> getServer() {
    return Optional.ofNullable(server);
  }

  /** Returns the properties the SDK was configured with. */
  public ConfigProperties getConfig() {
    return config;
  }

  /** Stops the server and removes the exporter from its registry. */
  @Override
  public void close() {
    if (server != null) {
      server.close();
    }
    exporter.unregister();
  }

  @Override
  public String toString() {
    return "AutoConfiguredStatsSdk{"
        + "viewManager="
        + viewManager
        + ", server="
        + server
        + "}";
  }
}
