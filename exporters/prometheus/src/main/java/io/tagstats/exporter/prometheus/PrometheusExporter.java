/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.exporter.prometheus;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * Exposes the views of a {@link io.tagstats.sdk.stats.ViewDataProducer} to Prometheus through a
 * {@link CollectorRegistry}.
 *
 * <p>Nothing is cached between scrapes: every scrape reads a fresh snapshot of all views.
 */
public final class PrometheusExporter {

  private final CollectorRegistry collectorRegistry;
  private final PrometheusStatsCollector collector;

  PrometheusExporter(CollectorRegistry collectorRegistry, PrometheusStatsCollector collector) {
    this.collectorRegistry = collectorRegistry;
    this.collector = collector;
  }

  /** Returns a new {@link PrometheusExporterBuilder}. */
  public static PrometheusExporterBuilder builder() {
    return new PrometheusExporterBuilder();
  }

  /** Returns the registry the exporter's collector is registered with. */
  public CollectorRegistry getCollectorRegistry() {
    return collectorRegistry;
  }

  /**
   * Writes the whole registry in the Prometheus text format, version 0.0.4.
   *
   * @throws IllegalStateException if views collide on a metric name or series.
   */
  public void write(Writer writer) throws IOException {
    TextFormat.write004(writer, collectorRegistry.metricFamilySamples());
  }

  /** Returns the whole registry in the Prometheus text format, version 0.0.4. */
  public String scrape() {
    StringWriter writer = new StringWriter();
    try {
      write(writer);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    return writer.toString();
  }

  /** Removes the exporter's collector from the registry. */
  public void unregister() {
    collectorRegistry.unregister(collector);
  }

  // Visible for testing
  PrometheusStatsCollector getCollector() {
    return collector;
  }
}
