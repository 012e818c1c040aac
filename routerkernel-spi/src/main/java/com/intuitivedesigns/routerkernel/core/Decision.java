/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of an authorization check. Denials are values, never exceptions.
 *
 * @param effect             ALLOW or DENY
 * @param reason             populated for DENY only
 * @param message            short human readable detail (no secrets)
 * @param effectiveArguments for ALLOW, arguments the downstream must use instead of the request's own;
 *                           null when the request may be executed unchanged
 */
public record Decision(Effect effect, DenyReason reason, String message, JsonNode effectiveArguments) {

    private static final Decision ALLOW = new Decision(Effect.ALLOW, null, "allowed", null);

    public Decision {
        Objects.requireNonNull(effect, "effect");
        if (effect == Effect.DENY) {
            Objects.requireNonNull(reason, "DENY decision requires a reason");
            effectiveArguments = null;
        } else if (reason != null) {
            throw new IllegalArgumentException("ALLOW decision cannot carry a deny reason");
        }
        if (message == null) message = "";
    }

    public static Decision allow() {
        return ALLOW;
    }

    public static Decision allow(JsonNode effectiveArguments) {
        return effectiveArguments == null ? ALLOW : new Decision(Effect.ALLOW, null, "allowed", effectiveArguments);
    }

    public static Decision deny(DenyReason reason, String message) {
        return new Decision(Effect.DENY, reason, message, null);
    }

    public boolean allowed() {
        return effect == Effect.ALLOW;
    }

    public Optional<DenyReason> denyReason() {
        return Optional.ofNullable(reason);
    }

    public Optional<JsonNode> rewrittenArguments() {
        return Optional.ofNullable(effectiveArguments);
    }

    @Override
    public String toString() {
        return allowed() ? "Allow" : "Deny(" + reason + ": " + message + ")";
    }

    public enum Effect {
        ALLOW,
        DENY
    }
}
