/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.plugins.labels;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.routerkernel.config.ConfigurationException;
import com.intuitivedesigns.routerkernel.spi.ApiCallRouter;
import com.intuitivedesigns.routerkernel.spi.RouterContext;
import com.intuitivedesigns.routerkernel.spi.RouterPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LabelsRestrictedRouterPlugin implements RouterPlugin<LabelsRestrictedRouterParams> {

    public static final String ID = "LABELS_RESTRICTED";
    private static final Logger log = LoggerFactory.getLogger(LabelsRestrictedRouterPlugin.class);

    private static final ObjectMapper PARAMS = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Class<LabelsRestrictedRouterParams> paramsType() {
        return LabelsRestrictedRouterParams.class;
    }

    @Override
    public LabelsRestrictedRouterParams parseParams(JsonNode raw) throws ConfigurationException {
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            return LabelsRestrictedRouterParams.NONE;
        }
        if (!raw.isObject()) {
            throw new ConfigurationException(ID + " router_params must be an object, got " + raw.getNodeType());
        }
        try {
            return PARAMS.treeToValue(raw, LabelsRestrictedRouterParams.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid " + ID + " router_params: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public ApiCallRouter create(LabelsRestrictedRouterParams params, RouterContext context) {
        if (params.labelsWhitelist().isEmpty() || params.labelsOwnersWhitelist().isEmpty()) {
            log.warn("{} router has an empty labels or owners whitelist; no client will be accessible", ID);
        }
        final CachingClientLabelDirectory labels =
                CachingClientLabelDirectory.from(context.labels(), context.config(), context.clock());
        log.info("Building {} router (labels={}, owners={}, flows={}, vfs={})", ID,
                params.labelsWhitelist(), params.labelsOwnersWhitelist(),
                params.allowFlowsAccess(), params.allowVfsAccess());
        return new LabelsRestrictedRouter(params, labels);
    }
}
