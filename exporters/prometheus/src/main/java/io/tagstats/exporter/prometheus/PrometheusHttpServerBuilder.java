/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.exporter.prometheus;

import static java.util.Objects.requireNonNull;

import io.prometheus.client.CollectorRegistry;

/** A builder for {@link PrometheusHttpServer}. */
public final class PrometheusHttpServerBuilder {

  static final String DEFAULT_HOST = "0.0.0.0";
  static final int DEFAULT_PORT = 9464;

  private String host = DEFAULT_HOST;
  private int port = DEFAULT_PORT;
  private CollectorRegistry collectorRegistry = CollectorRegistry.defaultRegistry;

  PrometheusHttpServerBuilder() {}

  /** Sets the host to bind to. Defaults to {@value #DEFAULT_HOST}. */
  public PrometheusHttpServerBuilder setHost(String host) {
    requireNonNull(host, "host");
    if (host.isEmpty()) {
      throw new IllegalArgumentException("host must not be empty");
    }
    this.host = host;
    return this;
  }

  /** Sets the port to bind to, {@code 0} for any free port. Defaults to {@value #DEFAULT_PORT}. */
  public PrometheusHttpServerBuilder setPort(int port) {
    if (port < 0 || port > 65535) {
      throw new IllegalArgumentException("port must be between 0 and 65535: " + port);
    }
    this.port = port;
    return this;
  }

  /** Serves the registry of {@code exporter}. */
  public PrometheusHttpServerBuilder setExporter(PrometheusExporter exporter) {
    requireNonNull(exporter, "exporter");
    this.collectorRegistry = exporter.getCollectorRegistry();
    return this;
  }

  /** Sets the registry to serve. Defaults to {@link CollectorRegistry#defaultRegistry}. */
  public PrometheusHttpServerBuilder setCollectorRegistry(CollectorRegistry collectorRegistry) {
    requireNonNull(collectorRegistry, "collectorRegistry");
    this.collectorRegistry = collectorRegistry;
    return this;
  }

  /** Binds and starts the server. */
  public PrometheusHttpServer build() {
    return new PrometheusHttpServer(host, port, collectorRegistry);
  }
}
