/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.exporter.prometheus;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Serves a {@link CollectorRegistry} in the Prometheus text format.
 *
 * <p>A failure to gather is answered with status 500 and the error text in the body.
 */
final class PrometheusHttpHandler implements HttpHandler {

  static final String ERROR_PREFIX = "An error has occurred while serving metrics:\n\n";

  private static final Logger logger = Logger.getLogger(PrometheusHttpHandler.class.getName());

  private final CollectorRegistry collectorRegistry;

  PrometheusHttpHandler(CollectorRegistry collectorRegistry) {
    this.collectorRegistry = collectorRegistry;
  }

  @Override
  public void handle(HttpExchange exchange) throws IOException {
    try {
      String method = exchange.getRequestMethod();
      if (!"GET".equals(method) && !"HEAD".equals(method)) {
        exchange.getResponseHeaders().set("Allow", "GET, HEAD");
        exchange.sendResponseHeaders(405, -1);
        return;
      }

      int status = 200;
      String contentType = TextFormat.CONTENT_TYPE_004;
      byte[] body;
      StringWriter writer = new StringWriter();
      try {
        TextFormat.write004(writer, collectorRegistry.metricFamilySamples());
        body = writer.toString().getBytes(UTF_8);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Failed to gather metrics.", e);
        status = 500;
        contentType = "text/plain; charset=utf-8";
        body = (ERROR_PREFIX + e.getMessage()).getBytes(UTF_8);
      }

      exchange.getResponseHeaders().set("Content-Type", contentType);
      if ("HEAD".equals(method) || body.length == 0) {
        exchange.sendResponseHeaders(status, -1);
        return;
      }
      exchange.sendResponseHeaders(status, body.length);
      try (OutputStream out = exchange.getResponseBody()) {
        out.write(body);
      }
    } finally {
      exchange.close();
    }
  }
}
