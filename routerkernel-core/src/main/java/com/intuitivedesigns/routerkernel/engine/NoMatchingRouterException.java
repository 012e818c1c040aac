/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.engine;

import com.intuitivedesigns.routerkernel.core.Principal;

/**
 * No authorization record covers the principal and no default router is configured.
 */
public class NoMatchingRouterException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String user;

    public NoMatchingRouterException(Principal principal) {
        super("No API router configured for user '" + principal.user() + "' (groups " + principal.groups() + ")");
        this.user = principal.user();
    }

    public String user() {
        return user;
    }
}
