/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.core;

import java.util.Objects;
import java.util.Set;

/**
 * An authenticated caller. Supplied by the transport layer, immutable per request.
 *
 * @param user   username as asserted by the authenticator
 * @param groups group memberships as reported by the identity directory
 */
public record Principal(String user, Set<String> groups) {

    public Principal {
        Objects.requireNonNull(user, "Principal user cannot be null");
        if (user.isBlank()) {
            throw new IllegalArgumentException("Principal user cannot be blank");
        }
        groups = (groups == null) ? Set.of() : Set.copyOf(groups);
    }

    public static Principal of(String user, String... groups) {
        return new Principal(user, Set.of(groups));
    }

    public boolean isMemberOfAny(Set<String> candidates) {
        if (groups.isEmpty() || candidates.isEmpty()) return false;
        for (String g : candidates) {
            if (groups.contains(g)) return true;
        }
        return false;
    }
}
