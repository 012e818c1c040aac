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
import com.intuitivedesigns.routerkernel.glob.GlobPattern;
import com.intuitivedesigns.routerkernel.ratelimit.RateLimiter;

/**
 * File finder rules: path syntax restrictions, download size limit, then quota.
 *
 * <p>On success the effective arguments name the configured flow and, when the request declared no size
 * and the limit is {@link UndeclaredFileSizePolicy#CAP capped}, carry {@code action.max_size}.</p>
 */
final class FileFinderPolicy extends AbstractActionPolicy<FileFinderArguments> {

    private static final String INTERPOLATION_MARKER = "%%";

    private final FileFinderFlowParams params;
    private final FlowQuota quota;

    FileFinderPolicy(FileFinderFlowParams params, RateLimiter limiter) {
        super(RobotAction.FILE_FINDER_FLOW, params != null && params.enabled(), FileFinderArguments.class);
        this.params = params;
        this.quota = params == null ? null : new FlowQuota(limiter, RobotAction.FILE_FINDER_FLOW,
                params.maxFlowsPerClientDaily(), params.minIntervalBetweenDuplicateFlows());
    }

    String flowName() {
        return params.fileFinderFlowName();
    }

    @Override
    protected Decision check(ApiCall call, FileFinderArguments args) {
        final String clientId = ClientIds.normalize(args.clientId()).orElse(null);
        if (clientId == null) {
            return invalidClientId(args.clientId());
        }
        if (args.paths().isEmpty()) {
            return Decision.deny(DenyReason.INVALID_ARGUMENTS, "paths must not be empty");
        }

        for (String path : args.paths()) {
            if (path == null || path.isBlank()) {
                return Decision.deny(DenyReason.INVALID_ARGUMENTS, "paths must not contain blank entries");
            }
            if (!params.globsAllowed() && isGlob(path)) {
                return Decision.deny(DenyReason.GLOBS_NOT_ALLOWED, "globs are not allowed: " + path);
            }
            if (!params.interpolationsAllowed() && path.contains(INTERPOLATION_MARKER)) {
                return Decision.deny(DenyReason.INTERPOLATIONS_NOT_ALLOWED, "interpolations are not allowed: " + path);
            }
        }

        final ObjectNode effective = call.arguments().isObject()
                ? ((ObjectNode) call.arguments()).deepCopy()
                : AbstractActionPolicy.ARGUMENTS.createObjectNode();

        final long limit = params.maxFileSize();
        if (limit > 0) {
            final Long declared = args.declaredMaxSize();
            if (declared == null) {
                if (params.undeclaredFileSize() == UndeclaredFileSizePolicy.DENY) {
                    return Decision.deny(DenyReason.FILE_TOO_LARGE,
                            "request must declare action.max_size of at most " + limit + " bytes");
                }
                capSize(effective, limit);
            } else if (declared > limit) {
                return Decision.deny(DenyReason.FILE_TOO_LARGE,
                        "action.max_size " + declared + " exceeds the limit of " + limit + " bytes");
            }
        }

        final Decision admitted = quota.admit(clientId, call.arguments());
        if (!admitted.allowed()) {
            return admitted;
        }
        effective.put("flow_name", params.fileFinderFlowName());
        return Decision.allow(effective);
    }

    static boolean isGlob(String path) {
        return GlobPattern.hasMetasyntax(path);
    }

    private static void capSize(ObjectNode effective, long limit) {
        final ObjectNode action = effective.get("action") instanceof ObjectNode
                ? (ObjectNode) effective.get("action")
                : effective.putObject("action");
        action.put("max_size", limit);
    }
}
