/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.robot;

import com.fasterxml.jackson.databind.JsonNode;
import com.intuitivedesigns.routerkernel.core.Decision;
import com.intuitivedesigns.routerkernel.ratelimit.ArgumentFingerprint;
import com.intuitivedesigns.routerkernel.ratelimit.RateLimitKey;
import com.intuitivedesigns.routerkernel.ratelimit.RateLimiter;

import java.time.Duration;
import java.util.Set;

/**
 * Per-flow quota: daily cap per client plus duplicate suppression, charged to a fixed action name so that
 * {@code create_flow} and the dedicated endpoint share one budget.
 */
final class FlowQuota {

    // Part of the key already, or rewritten by the router
    private static final Set<String> NOT_FINGERPRINTED = Set.of("client_id", "flow_name");

    private final RateLimiter limiter;
    private final RobotAction chargedTo;
    private final long maxDaily;
    private final Duration minInterval;

    FlowQuota(RateLimiter limiter, RobotAction chargedTo, long maxDaily, Duration minInterval) {
        this.limiter = limiter;
        this.chargedTo = chargedTo;
        this.maxDaily = maxDaily;
        this.minInterval = minInterval;
    }

    Decision admit(String normalizedClientId, JsonNode arguments) {
        if (maxDaily == 0 && minInterval.isZero()) {
            return Decision.allow();
        }
        final String fingerprint = ArgumentFingerprint.of(arguments, NOT_FINGERPRINTED);
        return limiter.admitAndRecord(
                new RateLimitKey(normalizedClientId, chargedTo.wireName(), fingerprint), maxDaily, minInterval);
    }
}
