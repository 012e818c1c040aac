/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process registry only: decisions are counted but nothing is exported. Handy for local runs and tests.
 */
public final class SimpleMetricsProvider implements MetricsProvider {

    private static final Logger log = LoggerFactory.getLogger(SimpleMetricsProvider.class);

    @Override
    public String id() {
        return "SIMPLE";
    }

    @Override
    public MetricsRuntime create(MetricsSettings settings) {
        if (settings == null || !matches(settings.providerId)) {
            return null;
        }
        final MicrometerMetricsRuntime runtime = new MicrometerMetricsRuntime();
        MetricsUtil.applyCommonTags(runtime.registry(), settings);
        log.info("In-memory metrics active (tags={})", settings.commonTags);
        return runtime;
    }
}
