/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.robot;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.routerkernel.core.ApiCall;
import com.intuitivedesigns.routerkernel.core.ClientIds;
import com.intuitivedesigns.routerkernel.core.Decision;
import com.intuitivedesigns.routerkernel.core.DenyReason;
import com.intuitivedesigns.routerkernel.ratelimit.RateLimiter;

import java.util.Set;

/**
 * Artifact collection: every requested artifact must be whitelisted by exact name.
 */
final class ArtifactCollectorPolicy extends AbstractActionPolicy<ArtifactCollectorArguments> {

    private final ArtifactCollectorFlowParams params;
    private final Set<String> whitelist;
    private final FlowQuota quota;

    ArtifactCollectorPolicy(ArtifactCollectorFlowParams params, RateLimiter limiter) {
        super(RobotAction.ARTIFACT_COLLECTOR_FLOW, params != null && params.enabled(), ArtifactCollectorArguments.class);
        this.params = params;
        this.whitelist = params == null ? Set.of() : Set.copyOf(params.artifactsWhitelist());
        this.quota = params == null ? null : new FlowQuota(limiter, RobotAction.ARTIFACT_COLLECTOR_FLOW,
                params.maxFlowsPerClientDaily(), params.minIntervalBetweenDuplicateFlows());
    }

    String flowName() {
        return params.artifactCollectorFlowName();
    }

    @Override
    protected Decision check(ApiCall call, ArtifactCollectorArguments args) {
        final String clientId = ClientIds.normalize(args.clientId()).orElse(null);
        if (clientId == null) {
            return invalidClientId(args.clientId());
        }
        if (args.artifactList().isEmpty()) {
            return Decision.deny(DenyReason.INVALID_ARGUMENTS, "artifact_list must not be empty");
        }
        for (String artifact : args.artifactList()) {
            if (artifact == null || !whitelist.contains(artifact)) {
                return Decision.deny(DenyReason.ARTIFACT_NOT_WHITELISTED, "artifact not whitelisted: " + artifact);
            }
        }

        final Decision admitted = quota.admit(clientId, call.arguments());
        if (!admitted.allowed()) {
            return admitted;
        }
        final ObjectNode effective = ((ObjectNode) call.arguments()).deepCopy();
        effective.put("flow_name", params.artifactCollectorFlowName());
        return Decision.allow(effective);
    }
}
