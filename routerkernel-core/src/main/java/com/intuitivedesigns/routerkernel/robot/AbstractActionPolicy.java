/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.robot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.intuitivedesigns.routerkernel.core.ApiCall;
import com.intuitivedesigns.routerkernel.core.Decision;
import com.intuitivedesigns.routerkernel.core.DenyReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Shared skeleton: refuse when disabled, bind the raw arguments to {@code A}, then run {@link #check}.
 *
 * @param <A> typed view of the arguments this action inspects
 */
abstract class AbstractActionPolicy<A> implements ActionPolicy {

    private static final Logger log = LoggerFactory.getLogger(AbstractActionPolicy.class);

    // Requests carry many members the router does not care about
    static final ObjectMapper ARGUMENTS = JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private final RobotAction action;
    private final boolean enabled;
    private final Class<A> argumentsType;

    AbstractActionPolicy(RobotAction action, boolean enabled, Class<A> argumentsType) {
        this.action = Objects.requireNonNull(action, "action");
        this.enabled = enabled;
        this.argumentsType = Objects.requireNonNull(argumentsType, "argumentsType");
    }

    @Override
    public final RobotAction action() {
        return action;
    }

    @Override
    public final boolean enabled() {
        return enabled;
    }

    @Override
    public final Decision validate(ApiCall call) {
        if (!enabled) {
            return Decision.deny(DenyReason.ACTION_DISABLED, action.wireName() + " is disabled for this robot");
        }
        final A args;
        try {
            args = ARGUMENTS.treeToValue(call.arguments(), argumentsType);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("Unreadable {} arguments from {}: {}", action.wireName(), call.principal().user(), e.getMessage());
            return Decision.deny(DenyReason.INVALID_ARGUMENTS, "malformed " + action.wireName() + " arguments");
        }
        return check(call, args);
    }

    protected abstract Decision check(ApiCall call, A args);

    static Decision invalidClientId(String clientId) {
        return Decision.deny(DenyReason.INVALID_ARGUMENTS,
                clientId == null ? "client_id is required" : "invalid client_id: " + clientId);
    }
}
