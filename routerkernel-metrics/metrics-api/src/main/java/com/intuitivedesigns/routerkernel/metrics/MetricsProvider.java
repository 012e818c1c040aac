/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.metrics;

/**
 * Service Provider Interface (SPI) for Metrics implementations.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}.
 * To add a new metrics backend, implement this interface and register it in
 * {@code META-INF/services/com.intuitivedesigns.routerkernel.metrics.MetricsProvider}.
 */
public interface MetricsProvider {

    /**
     * The unique identifier for this provider (e.g., "PROMETHEUS", "SIMPLE").
     * <p>This ID is used to match against the {@code metrics.provider} configuration.
     */
    String id();

    /**
     * Creates a runtime instance for this provider if the settings select it.
     *
     * @return a runtime, or {@code null} if the provider should be skipped
     */
    MetricsRuntime create(MetricsSettings settings);

    default boolean matches(String configuredId) {
        return configuredId != null && id().equalsIgnoreCase(configuredId.trim());
    }
}
