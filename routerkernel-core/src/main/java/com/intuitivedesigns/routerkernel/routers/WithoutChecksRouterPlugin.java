/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.routers;

import com.fasterxml.jackson.databind.JsonNode;
import com.intuitivedesigns.routerkernel.config.ConfigurationException;
import com.intuitivedesigns.routerkernel.core.ApiCall;
import com.intuitivedesigns.routerkernel.core.Decision;
import com.intuitivedesigns.routerkernel.core.RouterParams;
import com.intuitivedesigns.routerkernel.spi.ApiCallRouter;
import com.intuitivedesigns.routerkernel.spi.RouterContext;
import com.intuitivedesigns.routerkernel.spi.RouterPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class WithoutChecksRouterPlugin implements RouterPlugin<RouterParams> {

    public static final String ID = "WITHOUT_CHECKS";
    private static final Logger log = LoggerFactory.getLogger(WithoutChecksRouterPlugin.class);

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
        log.warn("SECURITY WARNING: Using WITHOUT_CHECKS router. All API calls bound to it are allowed.");
        return new AllowAllRouter();
    }

    // -- Implementation --
    private static final class AllowAllRouter implements ApiCallRouter {

        @Override
        public Decision authorize(ApiCall call) {
            return Decision.allow();
        }

        @Override
        public String toString() {
            return ID;
        }
    }
}
