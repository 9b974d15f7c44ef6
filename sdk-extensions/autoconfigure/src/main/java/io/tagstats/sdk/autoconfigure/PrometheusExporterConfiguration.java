/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.sdk.autoconfigure;

import io.tagstats.exporter.prometheus.PrometheusExporter;
import io.tagstats.exporter.prometheus.PrometheusExporterBuilder;
import io.tagstats.exporter.prometheus.PrometheusHttpServer;
import io.tagstats.sdk.autoconfigure.spi.ConfigProperties;
import io.tagstats.sdk.autoconfigure.spi.ConfigurationException;
import io.tagstats.sdk.stats.ViewDataProducer;
import java.io.UncheckedIOException;

final class PrometheusExporterConfiguration {

  static final String HOST = "tagstats.exporter.prometheus.host";
  static final String PORT = "tagstats.exporter.prometheus.port";
  static final String NAMESPACE = "tagstats.exporter.prometheus.namespace";
  static final String CONST_LABELS = "tagstats.exporter.prometheus.const.labels";
  static final String SERVER_ENABLED = "tagstats.exporter.prometheus.server.enabled";
  static final String RESOURCE_LABELS = "tagstats.resource.labels";

  private static final String DEFAULT_HOST = "0.0.0.0";
  private static final int DEFAULT_PORT = 9464;

  static PrometheusExporter configureExporter(
      ConfigProperties config, ViewDataProducer producer) {
    PrometheusExporterBuilder builder =
        PrometheusExporter.builder()
            .setViewDataProducer(producer)
            .setConstLabels(config.getMap(CONST_LABELS))
            .setResourceLabels(config.getMap(RESOURCE_LABELS));
    String namespace = config.getString(NAMESPACE);
    if (namespace != null) {
      builder.setNamespace(namespace);
    }
    return builder.build();
  }

  static PrometheusHttpServer configureServer(
      ConfigProperties config, PrometheusExporter exporter) {
    int port = config.getInt(PORT, DEFAULT_PORT);
    if (port < 0 || port > 65535) {
      throw new ConfigurationException("Invalid value for property " + PORT + "=" + port);
    }
    try {
      return PrometheusHttpServer.builder()
          .setHost(config.getString(HOST, DEFAULT_HOST))
          .setPort(port)
          .setExporter(exporter)
          .build();
    } catch (UncheckedIOException e) {
      throw new ConfigurationException("Unable to start Prometheus HTTP server on port " + port, e);
    }
  }

  private PrometheusExporterConfiguration() {}
}
