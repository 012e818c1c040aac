/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.routers;

import com.fasterxml.jackson.databind.JsonNode;
import com.intuitivedesigns.routerkernel.config.ConfigurationException;
import com.intuitivedesigns.routerkernel.core.RouterParams;

/**
 * Shared params handling of routers that take no {@code router_params}.
 */
final class NoParams {

    private NoParams() {}

    static RouterParams require(String routerId, JsonNode raw) throws ConfigurationException {
        if (raw == null || raw.isNull() || raw.isMissingNode() || (raw.isObject() && raw.isEmpty())) {
            return RouterParams.NONE;
        }
        throw new ConfigurationException("Router " + routerId + " takes no router_params");
    }
}
