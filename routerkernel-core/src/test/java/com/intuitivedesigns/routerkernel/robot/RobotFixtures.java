/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.robot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.intuitivedesigns.routerkernel.config.ConfigurationException;
import com.intuitivedesigns.routerkernel.config.KernelConfig;
import com.intuitivedesigns.routerkernel.core.ApiCall;
import com.intuitivedesigns.routerkernel.core.Principal;
import com.intuitivedesigns.routerkernel.ratelimit.MutableClock;
import com.intuitivedesigns.routerkernel.ratelimit.RateLimiter;
import com.intuitivedesigns.routerkernel.spi.RouterContext;

import java.io.UncheckedIOException;

/**
 * Shared builders for router tests. JSON snippets use single quotes for readability.
 */
public final class RobotFixtures {

    public static final String CLIENT = "C.1000000000000001";
    public static final String OTHER_CLIENT = "C.2000000000000002";
    public static final Principal ROBOT = Principal.of("robot-svc", "robots");

    private static final ObjectMapper JSON = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .build();

    private RobotFixtures() {}

    public static JsonNode json(String singleQuoted) {
        try {
            return JSON.readTree(singleQuoted);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static RouterContext context(MutableClock clock) {
        return context(clock, KernelConfig.empty());
    }

    public static RouterContext context(MutableClock clock, KernelConfig config) {
        return new RouterContext(clock, new RateLimiter(clock), null, config, null);
    }

    public static RobotRouterParams params(String singleQuoted) throws ConfigurationException {
        return new RobotRouterPlugin().parseParams(json(singleQuoted));
    }

    public static RobotRouterPolicy router(String paramsJson, RouterContext ctx) throws ConfigurationException {
        RobotRouterPlugin plugin = new RobotRouterPlugin();
        return (RobotRouterPolicy) plugin.create(plugin.parseParams(json(paramsJson)), ctx);
    }

    public static ApiCall call(String action, String argsJson) {
        return new ApiCall(ROBOT, action, json(argsJson));
    }
}
