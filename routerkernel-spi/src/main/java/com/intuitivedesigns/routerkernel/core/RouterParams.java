/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.core;

/**
 * Marker for the typed parameter block of a router kind.
 * Each router plugin parses its raw {@code router_params} into one of these at load time.
 */
public interface RouterParams {

    /** Parameters of routers that take none. */
    RouterParams NONE = new RouterParams() {
        @Override
        public String toString() {
            return "RouterParams.NONE";
        }
    };
}
