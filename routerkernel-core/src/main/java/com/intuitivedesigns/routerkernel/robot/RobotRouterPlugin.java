/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.robot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.intuitivedesigns.routerkernel.config.ConfigurationException;
import com.intuitivedesigns.routerkernel.glob.GlobFilter;
import com.intuitivedesigns.routerkernel.spi.ApiCallRouter;
import com.intuitivedesigns.routerkernel.spi.RouterContext;
import com.intuitivedesigns.routerkernel.spi.RouterPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class RobotRouterPlugin implements RouterPlugin<RobotRouterParams> {

    public static final String ID = "ROBOT";
    public static final String KEY_GLOB_CASE_INSENSITIVE = "glob.case.insensitive";

    private static final Logger log = LoggerFactory.getLogger(RobotRouterPlugin.class);

    // A misspelled field would silently leave a restriction off, so unknown fields fail the load
    private static final ObjectMapper PARAMS = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Class<RobotRouterParams> paramsType() {
        return RobotRouterParams.class;
    }

    @Override
    public RobotRouterParams parseParams(JsonNode raw) throws ConfigurationException {
        if (raw == null || raw.isNull() || raw.isMissingNode()) {
            return RobotRouterParams.NONE;
        }
        if (!raw.isObject()) {
            throw new ConfigurationException("Robot router_params must be a mapping, got " + raw.getNodeType());
        }
        if (raw.has("robot_id")) {
            log.warn("Ignoring deprecated robot router parameter 'robot_id'");
        }
        try {
            return PARAMS.treeToValue(raw, RobotRouterParams.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid robot router_params: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public ApiCallRouter create(RobotRouterParams params, RouterContext context) throws ConfigurationException {
        final boolean caseInsensitive = context.config().getBoolean(KEY_GLOB_CASE_INSENSITIVE, false);

        GlobFilter archiveFilter = GlobFilter.INCLUDE_ALL;
        final GetFlowFilesArchiveParams archive = params.getFlowFilesArchive();
        if (archive != null) {
            try {
                archiveFilter = GlobFilter.compile(archive.pathGlobsBlacklist(), archive.pathGlobsWhitelist(), caseInsensitive);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid get_flow_files_archive path glob: " + e.getMessage(), e);
            }
        }

        final RobotRouterPolicy policy = new RobotRouterPolicy(params, context.rateLimiter(), archiveFilter);
        log.debug("Built {}", policy);
        return policy;
    }
}
