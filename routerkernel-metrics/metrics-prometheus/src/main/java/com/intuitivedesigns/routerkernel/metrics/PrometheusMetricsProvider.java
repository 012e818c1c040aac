/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.metrics;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Exposes decision counters and latency timers on {@code /metrics} in the Prometheus text format.
 */
public final class PrometheusMetricsProvider implements MetricsProvider {

    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsProvider.class);

    static final String PATH = "/metrics";

    @Override
    public String id() {
        return "PROMETHEUS";
    }

    @Override
    public MetricsRuntime create(MetricsSettings s) {
        // SPI contract: return null if not applicable
        if (s == null || !matches(s.providerId)) {
            return null;
        }

        final PrometheusMeterRegistry reg = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        MetricsUtil.applyCommonTags(reg, s);

        final MicrometerMetricsRuntime runtime = new MicrometerMetricsRuntime();
        runtime.addRegistry(reg);

        final ServerHandle handle = start(reg, s.prometheusPort);
        log.info("Prometheus metrics active (port={}, path={})", handle.port(), PATH);

        return new PrometheusRuntime(runtime, reg, handle);
    }

    static ServerHandle start(PrometheusMeterRegistry registry, int port) {
        Objects.requireNonNull(registry, "registry");

        final HttpServer server;
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to start Prometheus metrics server on port " + port, e);
        }

        final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "metrics-http-server");
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);
        server.createContext(PATH, exchange -> serve(exchange, registry));
        server.start();
        return new ServerHandle(server, executor);
    }

    private static void serve(HttpExchange exchange, PrometheusMeterRegistry registry) throws IOException {
        try {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                exchange.sendResponseHeaders(405, -1);
                return;
            }
            final byte[] bytes = registry.scrape().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4; charset=utf-8");
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        } catch (RuntimeException e) {
            log.warn("Metrics scrape failed: {}", e.getMessage());
            exchange.sendResponseHeaders(500, -1);
        } finally {
            exchange.close();
        }
    }

    /**
     * Records through the composite runtime; closing also stops the scrape endpoint.
     */
    private static final class PrometheusRuntime implements MetricsRuntime {
        private final MicrometerMetricsRuntime delegate;
        private final PrometheusMeterRegistry prometheus;
        private final ServerHandle handle;

        private PrometheusRuntime(MicrometerMetricsRuntime delegate, PrometheusMeterRegistry prometheus, ServerHandle handle) {
            this.delegate = delegate;
            this.prometheus = prometheus;
            this.handle = handle;
        }

        @Override public Object registry() { return delegate.registry(); }
        @Override public boolean enabled() { return true; }
        @Override public String type() { return "PROMETHEUS"; }

        @Override public void counter(String name) { delegate.counter(name); }
        @Override public void counter(String name, double increment) { delegate.counter(name, increment); }
        @Override public void timer(String name, long durationMillis) { delegate.timer(name, durationMillis); }
        @Override public void gauge(String name, double value) { delegate.gauge(name, value); }

        @Override
        public void close() {
            handle.close();
            delegate.close();
            prometheus.close();
        }
    }

    static final class ServerHandle implements AutoCloseable {
        private final HttpServer server;
        private final ExecutorService executor;

        private ServerHandle(HttpServer server, ExecutorService executor) {
            this.server = server;
            this.executor = executor;
        }

        int port() {
            return server.getAddress().getPort();
        }

        @Override
        public void close() {
            server.stop(0);
            executor.shutdownNow();
        }
    }
}
