/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.ServiceLoader;

public final class MetricsFactory {

    private static final Logger log = LoggerFactory.getLogger(MetricsFactory.class);

    private MetricsFactory() {}

    /**
     * Picks the provider named by {@code metrics.provider}. Falls back to {@link MetricsRuntime#NOOP}
     * when the setting is NONE, nothing matches, or the matching provider fails to start.
     */
    public static MetricsRuntime init(MetricsSettings settings) {
        Objects.requireNonNull(settings, "settings");
        if (MetricsSettings.PROVIDER_NONE.equals(settings.providerId)) {
            log.info("Metrics disabled (metrics.provider=NONE).");
            return MetricsRuntime.NOOP;
        }

        final ServiceLoader<MetricsProvider> loader = ServiceLoader.load(MetricsProvider.class, resolveClassLoader());
        for (MetricsProvider p : loader) {
            try {
                final MetricsRuntime rt = p.create(settings);
                if (rt != null) {
                    log.info("Metrics Runtime initialized: {}", p.getClass().getName());
                    return rt;
                }
            } catch (RuntimeException | LinkageError e) {
                // A provider with missing dependencies must not take the kernel down
                log.warn("Failed to initialize metrics provider [{}]: {}", p.getClass().getName(), e.getMessage());
                log.debug("Provider init stack trace:", e);
            }
        }

        log.info("No metrics provider matched '{}' (NOOP active).", settings.providerId);
        return MetricsRuntime.NOOP;
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader threadCl = Thread.currentThread().getContextClassLoader();
        return (threadCl != null) ? threadCl : MetricsFactory.class.getClassLoader();
    }
}
