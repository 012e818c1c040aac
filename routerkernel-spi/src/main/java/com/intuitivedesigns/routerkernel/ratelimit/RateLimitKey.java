/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.ratelimit;

import java.util.Objects;

/**
 * Identity of one rate-limited invocation.
 *
 * @param clientId    target client
 * @param action      action name the quota is charged to
 * @param fingerprint digest of the normalized arguments (see {@link ArgumentFingerprint})
 */
public record RateLimitKey(String clientId, String action, String fingerprint) {

    public RateLimitKey {
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(fingerprint, "fingerprint");
    }

    Scope scope() {
        return new Scope(clientId, action);
    }

    /** Quota bucket: the daily cap is counted per client and action. */
    record Scope(String clientId, String action) {}
}
