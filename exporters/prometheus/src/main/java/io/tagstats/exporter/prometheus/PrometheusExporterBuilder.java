/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.exporter.prometheus;

import static java.util.Objects.requireNonNull;

import io.prometheus.client.CollectorRegistry;
import io.tagstats.sdk.stats.ViewDataProducer;
import io.tagstats.sdk.stats.ViewManager;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** A builder for {@link PrometheusExporter}. */
public final class PrometheusExporterBuilder {

  private ViewDataProducer viewDataProducer = ViewManager.getDefault();
  private CollectorRegistry collectorRegistry = new CollectorRegistry();
  private String namespace = "";
  private Map<String, String> constLabels = Collections.emptyMap();
  private Map<String, String> resourceLabels = Collections.emptyMap();

  PrometheusExporterBuilder() {}

  /** Sets the source of view data. Defaults to {@link ViewManager#getDefault()}. */
  public PrometheusExporterBuilder setViewDataProducer(ViewDataProducer viewDataProducer) {
    requireNonNull(viewDataProducer, "viewDataProducer");
    this.viewDataProducer = viewDataProducer;
    return this;
  }

  /**
   * Sets the registry to register with, for example {@link CollectorRegistry#defaultRegistry} to
   * share it with other instrumentation. Defaults to a private registry.
   */
  public PrometheusExporterBuilder setCollectorRegistry(CollectorRegistry collectorRegistry) {
    requireNonNull(collectorRegistry, "collectorRegistry");
    this.collectorRegistry = collectorRegistry;
    return this;
  }

  /** Sets a prefix joined to every metric name with an underscore. Defaults to none. */
  public PrometheusExporterBuilder setNamespace(String namespace) {
    requireNonNull(namespace, "namespace");
    this.namespace = namespace;
    return this;
  }

  /** Sets labels added to every series. They override tags with the same key. */
  public PrometheusExporterBuilder setConstLabels(Map<String, String> constLabels) {
    requireNonNull(constLabels, "constLabels");
    this.constLabels = new LinkedHashMap<>(constLabels);
    return this;
  }

  /**
   * Sets labels describing the monitored resource. They are added to every series and override
   * both tags and constant labels with the same key.
   */
  public PrometheusExporterBuilder setResourceLabels(Map<String, String> resourceLabels) {
    requireNonNull(resourceLabels, "resourceLabels");
    this.resourceLabels = new LinkedHashMap<>(resourceLabels);
    return this;
  }

  /**
   * Builds the exporter and registers its collector with the registry.
   *
   * @throws IllegalArgumentException if the registry rejects the collector.
   */
  public PrometheusExporter build() {
    PrometheusStatsCollector collector =
        new PrometheusStatsCollector(viewDataProducer, namespace, constLabels, resourceLabels);
    collector.register(collectorRegistry);
    return new PrometheusExporter(collectorRegistry, collector);
  }
}
