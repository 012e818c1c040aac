/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.routers;

import com.fasterxml.jackson.databind.JsonNode;
import com.intuitivedesigns.routerkernel.config.ConfigurationException;
import com.intuitivedesigns.routerkernel.core.ApiCall;
import com.intuitivedesigns.routerkernel.core.Decision;
import com.intuitivedesigns.routerkernel.core.DenyReason;
import com.intuitivedesigns.routerkernel.core.RouterParams;
import com.intuitivedesigns.routerkernel.spi.ApiCallRouter;
import com.intuitivedesigns.routerkernel.spi.RouterContext;
import com.intuitivedesigns.routerkernel.spi.RouterPlugin;

import java.util.function.Predicate;

/**
 * Denies every call. Useful as {@code authz.default.router} to make the fallback explicit.
 */
public final class DisabledRouterPlugin implements RouterPlugin<RouterParams> {

    public static final String ID = "DISABLED";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Class<RouterParams> paramsType() {
        return RouterParams.class;
    }

    @Override
    public RouterParams parseParams(JsonNode raw) throws ConfigurationException {
        return NoParams.require(ID, raw);
    }

    @Override
    public ApiCallRouter create(RouterParams params, RouterContext context) {
        return new DenyAllRouter();
    }

    private static final class DenyAllRouter implements ApiCallRouter {

        @Override
        public Decision authorize(ApiCall call) {
            return Decision.deny(DenyReason.ACTION_DISABLED, "API access is disabled for " + call.principal().user());
        }

        @Override
        public Predicate<String> archivePathFilter(String flowName) {
            return path -> false;
        }

        @Override
        public String toString() {
            return ID;
        }
    }
}
