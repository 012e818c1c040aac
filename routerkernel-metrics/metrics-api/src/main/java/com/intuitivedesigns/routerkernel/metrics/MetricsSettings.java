/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.metrics;

import com.intuitivedesigns.routerkernel.config.KernelConfig;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration container for Metrics Runtime.
 */
public final class MetricsSettings {

    // ---- Config keys ----
    private static final String KEY_PROVIDER = "metrics.provider";
    private static final String KEY_STEP_SECONDS = "metrics.step.seconds";
    private static final String KEY_TAG_PREFIX = "metrics.tag.";
    private static final String KEY_PROM_PORT = "metrics.prometheus.port";

    // ---- Defaults ----
    public static final String PROVIDER_NONE = "NONE";
    private static final int DEFAULT_STEP_SECONDS = 10;
    private static final int DEFAULT_PROM_PORT = 9404;

    public final String providerId;
    public final Map<String, String> commonTags;
    public final Duration step;
    public final int prometheusPort;

    private MetricsSettings(String providerId, Map<String, String> commonTags, Duration step, int prometheusPort) {
        this.providerId = providerId;
        this.commonTags = commonTags;
        this.step = step;
        this.prometheusPort = prometheusPort;
    }

    public static MetricsSettings from(KernelConfig config) {
        Objects.requireNonNull(config, "config");

        final String provider = normalizeUpper(config.getString(KEY_PROVIDER, PROVIDER_NONE));
        final int stepSec = clampInt(config.getInt(KEY_STEP_SECONDS, DEFAULT_STEP_SECONDS), 1, 3_600);

        // metrics.tag.<name>=<value>
        final Map<String, String> tags = new HashMap<>();
        for (String k : config.keys()) {
            if (!k.startsWith(KEY_TAG_PREFIX)) continue;
            final String tagKey = k.substring(KEY_TAG_PREFIX.length()).trim();
            final String value = normalize(config.getString(k, null));
            if (tagKey.isEmpty() || value == null) continue;
            tags.put(tagKey, value);
        }

        final int promPort = clampInt(config.getInt(KEY_PROM_PORT, DEFAULT_PROM_PORT), 1, 65_535);

        return new MetricsSettings(
                provider == null ? PROVIDER_NONE : provider,
                Collections.unmodifiableMap(tags),
                Duration.ofSeconds(stepSec),
                promPort
        );
    }

    @Override
    public String toString() {
        return "MetricsSettings{" +
                "providerId='" + providerId + '\'' +
                ", commonTags=" + commonTags +
                ", step=" + step +
                ", prometheusPort=" + prometheusPort +
                '}';
    }

    private static String normalize(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    private static String normalizeUpper(String s) {
        String n = normalize(s);
        return (n != null) ? n.toUpperCase(Locale.ROOT) : null;
    }

    private static int clampInt(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }
}
