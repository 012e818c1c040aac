/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.robot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.routerkernel.core.ApiCall;
import com.intuitivedesigns.routerkernel.core.Decision;
import com.intuitivedesigns.routerkernel.core.DenyReason;
import com.intuitivedesigns.routerkernel.glob.GlobFilter;
import com.intuitivedesigns.routerkernel.ratelimit.RateLimiter;
import com.intuitivedesigns.routerkernel.spi.ApiCallRouter;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.function.Predicate;

/**
 * Router for automated service accounts. Each action has its own policy; actions without a configuration
 * block are disabled, and actions the router does not know are refused outright.
 *
 * <p>{@code create_flow} is accepted for the two flows this router can vet, and is validated (and charged)
 * exactly like the dedicated endpoint of that flow.</p>
 */
public final class RobotRouterPolicy implements ApiCallRouter {

    private final Map<RobotAction, ActionPolicy> policies;
    private final FileFinderPolicy fileFinder;
    private final ArtifactCollectorPolicy artifactCollector;
    private final FlowFilesArchivePolicy archive;

    public RobotRouterPolicy(RobotRouterParams params, RateLimiter limiter, GlobFilter archiveFilter) {
        final RobotRouterParams p = params == null ? RobotRouterParams.NONE : params;

        this.fileFinder = new FileFinderPolicy(p.fileFinderFlow(), limiter);
        this.artifactCollector = new ArtifactCollectorPolicy(p.artifactCollectorFlow(), limiter);
        this.archive = new FlowFilesArchivePolicy(p.getFlowFilesArchive(), archiveFilter, p.artifactCollectorFlowName());

        final Map<RobotAction, ActionPolicy> m = new EnumMap<>(RobotAction.class);
        m.put(RobotAction.SEARCH_CLIENTS, new EnabledOnlyPolicy(RobotAction.SEARCH_CLIENTS, p.searchClients()));
        m.put(RobotAction.GET_FLOW, new EnabledOnlyPolicy(RobotAction.GET_FLOW, p.getFlow()));
        m.put(RobotAction.LIST_FLOW_RESULTS, new EnabledOnlyPolicy(RobotAction.LIST_FLOW_RESULTS, p.listFlowResults()));
        m.put(RobotAction.LIST_FLOW_LOGS, new EnabledOnlyPolicy(RobotAction.LIST_FLOW_LOGS, p.listFlowLogs()));
        m.put(RobotAction.FILE_FINDER_FLOW, fileFinder);
        m.put(RobotAction.ARTIFACT_COLLECTOR_FLOW, artifactCollector);
        m.put(RobotAction.GET_FLOW_FILES_ARCHIVE, archive);
        this.policies = m;
    }

    @Override
    public Decision authorize(ApiCall call) {
        final Optional<RobotAction> action = RobotAction.fromWireName(call.action());
        if (action.isEmpty()) {
            return Decision.deny(DenyReason.ACTION_DISABLED, call.action() + " is not available to robots");
        }
        if (action.get() == RobotAction.CREATE_FLOW) {
            return authorizeCreateFlow(call);
        }
        return policies.get(action.get()).validate(call);
    }

    @Override
    public Predicate<String> archivePathFilter(String flowName) {
        return archive.pathFilter(flowName);
    }

    /** Policy of an action, for inspection. */
    public ActionPolicy policy(RobotAction action) {
        return policies.get(action);
    }

    private Decision authorizeCreateFlow(ApiCall call) {
        final JsonNode flow = call.arguments().get("flow");
        if (flow == null || !flow.isObject() || !flow.path("name").isTextual()) {
            return Decision.deny(DenyReason.INVALID_ARGUMENTS, "create_flow requires flow.name");
        }
        final String name = flow.get("name").asText();

        final AbstractActionPolicy<?> target;
        if (fileFinder.enabled() && (FileFinderFlowParams.DEFAULT_FLOW_NAME.equals(name) || fileFinder.flowName().equals(name))) {
            target = fileFinder;
        } else if (artifactCollector.enabled()
                && (ArtifactCollectorFlowParams.DEFAULT_FLOW_NAME.equals(name) || artifactCollector.flowName().equals(name))) {
            target = artifactCollector;
        } else {
            return Decision.deny(DenyReason.ACTION_DISABLED, "robots may not start flow " + name);
        }

        // Validate the flow's own arguments as if they had come through the dedicated endpoint
        final ObjectNode flat = flow.path("args").isObject()
                ? ((ObjectNode) flow.get("args")).deepCopy()
                : AbstractActionPolicy.ARGUMENTS.createObjectNode();
        final JsonNode clientId = call.arguments().get("client_id");
        if (clientId != null) {
            flat.set("client_id", clientId);
        }

        final Decision d = target.validate(call.withArguments(flat));
        if (!d.allowed() || d.effectiveArguments() == null) {
            return d;
        }
        return Decision.allow(rewrap(call.arguments(), d.effectiveArguments()));
    }

    private static JsonNode rewrap(JsonNode original, JsonNode effectiveFlat) {
        final ObjectNode out = ((ObjectNode) original).deepCopy();
        final ObjectNode flowArgs = ((ObjectNode) effectiveFlat).deepCopy();
        final String flowName = flowArgs.path("flow_name").asText();
        flowArgs.remove("client_id");
        flowArgs.remove("flow_name");

        final ObjectNode flow = (ObjectNode) out.get("flow");
        flow.put("name", flowName);
        flow.set("args", flowArgs);
        return out;
    }

    @Override
    public String toString() {
        final StringJoiner enabled = new StringJoiner(",", "RobotRouterPolicy[", "]");
        for (ActionPolicy ap : policies.values()) {
            if (ap.enabled()) enabled.add(ap.action().wireName());
        }
        return enabled.toString();
    }
}
