/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.robot;

/**
 * What to do with a file finder request that states no size limit while the router enforces one.
 */
public enum UndeclaredFileSizePolicy {
    /** Allow, and rewrite the effective arguments to carry the configured limit. */
    CAP,
    /** Refuse with FILE_TOO_LARGE. */
    DENY
}
