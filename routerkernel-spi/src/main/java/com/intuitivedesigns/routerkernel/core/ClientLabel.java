/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.core;

import java.util.Objects;

/**
 * A label attached to a client machine, together with the user or system that attached it.
 */
public record ClientLabel(String name, String owner) {

    public ClientLabel {
        Objects.requireNonNull(name, "name");
        owner = owner == null ? "" : owner;
    }
}
