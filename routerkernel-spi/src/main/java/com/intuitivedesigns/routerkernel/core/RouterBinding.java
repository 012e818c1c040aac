/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.core;

import com.intuitivedesigns.routerkernel.spi.ApiCallRouter;

import java.util.Objects;

/**
 * The router resolved for a principal.
 *
 * @param routerName router name as configured
 * @param params     typed router parameters
 * @param router     router instance built for the matching record when the snapshot was loaded
 */
public record RouterBinding(String routerName, RouterParams params, ApiCallRouter router) {

    public RouterBinding {
        Objects.requireNonNull(routerName, "routerName");
        Objects.requireNonNull(params, "params");
        Objects.requireNonNull(router, "router");
    }
}
