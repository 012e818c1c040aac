/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.spi;

import com.intuitivedesigns.routerkernel.config.KernelConfig;
import com.intuitivedesigns.routerkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.routerkernel.ratelimit.RateLimiter;

import java.time.Clock;
import java.util.Objects;

/**
 * Collaborators shared by every router the engine builds.
 * The rate limiter outlives configuration snapshots, so a reload never resets quotas.
 */
public record RouterContext(
        Clock clock,
        RateLimiter rateLimiter,
        MetricsRuntime metrics,
        KernelConfig config,
        ClientLabelDirectory labels
) {

    public RouterContext {
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(rateLimiter, "rateLimiter");
        if (metrics == null) metrics = MetricsRuntime.NOOP;
        if (config == null) config = KernelConfig.empty();
        if (labels == null) labels = ClientLabelDirectory.EMPTY;
    }
}
