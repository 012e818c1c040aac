/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.robot;

import com.fasterxml.jackson.databind.JsonNode;
import com.intuitivedesigns.routerkernel.core.ApiCall;
import com.intuitivedesigns.routerkernel.core.Decision;

/**
 * Read-only actions: allowed as soon as they are switched on.
 */
final class EnabledOnlyPolicy extends AbstractActionPolicy<JsonNode> {

    EnabledOnlyPolicy(RobotAction action, EnabledActionParams params) {
        super(action, params != null && params.enabled(), JsonNode.class);
    }

    @Override
    protected Decision check(ApiCall call, JsonNode args) {
        return Decision.allow();
    }
}
