/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.metrics;

import com.intuitivedesigns.routerkernel.config.KernelConfig;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PrometheusMetricsProviderTest {

    @Test
    void testNotSelectedReturnsNull() {
        MetricsSettings s = MetricsSettings.from(KernelConfig.of(Map.of("metrics.provider", "SIMPLE")));
        assertNull(new PrometheusMetricsProvider().create(s));
    }

    @Test
    void testScrapeEndpointServesCounters() throws Exception {
        // Setup
        PrometheusMeterRegistry reg = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        reg.counter("authz_deny_total").increment(3);

        try (PrometheusMetricsProvider.ServerHandle handle = PrometheusMetricsProvider.start(reg, 0)) {
            // Act
            URL url = new URL("http://localhost:" + handle.port() + PrometheusMetricsProvider.PATH);
            HttpURLConnection conn = (HttpURLConnection) url.openConnection();
            String body;
            try (InputStream in = conn.getInputStream()) {
                body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }

            // Assert
            assertEquals(200, conn.getResponseCode());
            assertTrue(body.contains("authz_deny_total"), body);
        } finally {
            reg.close();
        }
    }
}
