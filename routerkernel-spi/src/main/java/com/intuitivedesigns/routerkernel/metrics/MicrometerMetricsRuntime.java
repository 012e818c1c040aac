/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Decision metrics over a Micrometer composite registry.
 *
 * <p>An in-memory registry is always attached so counts can be read back by {@link #counterValue}; exporters
 * such as Prometheus join through {@link #addRegistry}. Meters are resolved once per name and cached, since
 * the engine records on every authorization.</p>
 */
public final class MicrometerMetricsRuntime implements MetricsRuntime {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsRuntime.class);

    private final CompositeMeterRegistry registry = new CompositeMeterRegistry();
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();
    // Gauge values stored as raw double bits; Micrometer polls them
    private final ConcurrentHashMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();

    public MicrometerMetricsRuntime() {
        registry.add(new SimpleMeterRegistry());
    }

    public void addRegistry(MeterRegistry exporter) {
        registry.add(exporter);
        log.debug("Attached meter registry {}", exporter.getClass().getSimpleName());
    }

    @Override
    public MeterRegistry registry() {
        return registry;
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public String type() {
        return "MICROMETER";
    }

    @Override
    public void counter(String name) {
        counters.computeIfAbsent(name, registry::counter).increment();
    }

    @Override
    public void counter(String name, double increment) {
        if (increment > 0) {
            counters.computeIfAbsent(name, registry::counter).increment(increment);
        }
    }

    @Override
    public void timer(String name, long durationMillis) {
        timers.computeIfAbsent(name, registry::timer).record(durationMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public void gauge(String name, double value) {
        gauges.computeIfAbsent(name, key -> {
            final AtomicLong bits = new AtomicLong(Double.doubleToLongBits(value));
            Gauge.builder(key, bits, b -> Double.longBitsToDouble(b.get())).register(registry);
            return bits;
        }).set(Double.doubleToLongBits(value));
    }

    /**
     * Current value of a counter, or 0 when it was never incremented.
     */
    public double counterValue(String name) {
        final Counter c = registry.find(name).counter();
        return c == null ? 0.0 : c.count();
    }

    /** Number of samples recorded by a timer, or 0 when it does not exist. */
    public long timerCount(String name) {
        final Timer t = registry.find(name).timer();
        return t == null ? 0L : t.count();
    }

    @Override
    public void close() {
        registry.close();
        log.info("Decision metrics closed ({} counters, {} timers, {} gauges)",
                counters.size(), timers.size(), gauges.size());
    }
}
