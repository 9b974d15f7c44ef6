/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.tagstats.exporter.prometheus;

import com.sun.net.httpserver.HttpServer;
import io.prometheus.client.CollectorRegistry;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A minimal HTTP server answering Prometheus scrapes on every path. The server is started on
 * {@link PrometheusHttpServerBuilder#build()} and stopped on {@link #close()}.
 */
public final class PrometheusHttpServer implements Closeable {

  private static final Logger logger = Logger.getLogger(PrometheusHttpServer.class.getName());

  private final HttpServer server;
  private final ExecutorService executor;

  /** Returns a new {@link PrometheusHttpServerBuilder}. */
  public static PrometheusHttpServerBuilder builder() {
    return new PrometheusHttpServerBuilder();
  }

  PrometheusHttpServer(String host, int port, CollectorRegistry collectorRegistry) {
    try {
      server = HttpServer.create(new InetSocketAddress(host, port), 0);
    } catch (IOException e) {
      throw new UncheckedIOException("Could not create Prometheus HTTP server", e);
    }
    executor = Executors.newFixedThreadPool(5, new DaemonThreadFactory("prometheus-http"));
    server.createContext("/", new PrometheusHttpHandler(collectorRegistry));
    server.setExecutor(executor);
    server.start();
    logger.log(Level.INFO, "Serving Prometheus metrics on {0}", server.getAddress());
  }

  /** Returns the address the server is bound to. */
  public InetSocketAddress getAddress() {
    return server.getAddress();
  }

  /** Stops the server and its worker threads. */
  @Override
  public void close() {
    server.stop(0);
    executor.shutdownNow();
  }

  @Override
  public String toString() {
    return "PrometheusHttpServer{address=" + getAddress() + "}";
  }

  private static final class DaemonThreadFactory implements ThreadFactory {
    private final String namePrefix;
    private final AtomicInteger counter = new AtomicInteger();

    private DaemonThreadFactory(String namePrefix) {
      this.namePrefix = namePrefix;
    }

    @Override
    public Thread newThread(Runnable runnable) {
      Thread t = new Thread(runnable, namePrefix + "-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    }
  }
}
