/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.spi;

import com.fasterxml.jackson.databind.JsonNode;
import com.intuitivedesigns.routerkernel.config.ConfigurationException;
import com.intuitivedesigns.routerkernel.core.RouterParams;

/**
 * SPI definition for router kinds.
 *
 * Example IDs: "ROBOT", "LABELS_RESTRICTED", "WITHOUT_CHECKS", "DISABLED"
 *
 * @param <P> typed parameter block of this router kind
 */
public interface RouterPlugin<P extends RouterParams> extends ServicePlugin {

    @Override
    String id();

    @Override
    default PluginKind kind() {
        return PluginKind.ROUTER;
    }

    Class<P> paramsType();

    /**
     * Parses and validates the raw {@code router_params} block.
     *
     * @param raw parameter tree from configuration; null or an empty object selects the defaults
     */
    P parseParams(JsonNode raw) throws ConfigurationException;

    /**
     * Builds a router for one authorization record. Called at snapshot-load time, never per request.
     */
    ApiCallRouter create(P params, RouterContext context) throws ConfigurationException;
}
