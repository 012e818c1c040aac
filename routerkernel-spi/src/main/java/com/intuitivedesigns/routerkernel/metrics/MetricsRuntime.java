/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.metrics;

/**
 * The vendor-agnostic contract for observability.
 *
 * The engine and its routers record through this interface only, so the kernel runs with no metrics
 * backend on the classpath (NOOP defaults).
 */
public interface MetricsRuntime extends AutoCloseable {

    MetricsRuntime NOOP = () -> NoopRegistry.INSTANCE;

    /**
     * Returns the underlying registry (e.g., MeterRegistry) for advanced usage.
     * Returns Object to avoid forcing a compile-time dependency on a backend.
     */
    Object registry();

    default boolean enabled() { return false; }

    default String type() { return "NOOP"; }

    // --- Standard instrumentation methods (NOOP defaults) ---

    default void counter(String name) {}

    default void counter(String name, double increment) {}

    default void timer(String name, long durationMillis) {}

    default void gauge(String name, double value) {}

    @Override
    default void close() {
        // no-op by default
    }

    /** Sentinel registry so downstream instanceof checks never see null. */
    enum NoopRegistry { INSTANCE }
}
