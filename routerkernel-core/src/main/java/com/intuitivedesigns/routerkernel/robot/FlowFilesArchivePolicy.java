/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.robot;

import com.intuitivedesigns.routerkernel.core.ApiCall;
import com.intuitivedesigns.routerkernel.core.ClientIds;
import com.intuitivedesigns.routerkernel.core.Decision;
import com.intuitivedesigns.routerkernel.core.DenyReason;
import com.intuitivedesigns.routerkernel.glob.GlobFilter;

import java.util.function.Predicate;

/**
 * Archive downloads: each file going into the archive must pass the path blacklist and whitelist.
 */
final class FlowFilesArchivePolicy extends AbstractActionPolicy<FlowFilesArchiveArguments> {

    private final GlobFilter filter;
    private final boolean skipForArtifactCollector;
    private final String artifactCollectorFlowName;

    FlowFilesArchivePolicy(GetFlowFilesArchiveParams params, GlobFilter filter, String artifactCollectorFlowName) {
        super(RobotAction.GET_FLOW_FILES_ARCHIVE, params != null && params.enabled(), FlowFilesArchiveArguments.class);
        this.filter = filter;
        this.skipForArtifactCollector = params != null && params.skipGlobChecksForArtifactCollector();
        this.artifactCollectorFlowName = artifactCollectorFlowName;
    }

    @Override
    protected Decision check(ApiCall call, FlowFilesArchiveArguments args) {
        if (!ClientIds.isValid(args.clientId())) {
            return invalidClientId(args.clientId());
        }
        if (skipsChecks(args.flowName())) {
            return Decision.allow();
        }
        for (String path : args.paths()) {
            if (path == null) {
                return Decision.deny(DenyReason.INVALID_ARGUMENTS, "paths must not contain null entries");
            }
            switch (filter.evaluate(path)) {
                case BLACKLISTED:
                    return Decision.deny(DenyReason.PATH_BLACKLISTED, "path is blacklisted: " + path);
                case NOT_WHITELISTED:
                    return Decision.deny(DenyReason.PATH_NOT_WHITELISTED, "path is not whitelisted: " + path);
                default:
                    break;
            }
        }
        return Decision.allow();
    }

    /**
     * Filter the archive generator applies file by file.
     */
    Predicate<String> pathFilter(String flowName) {
        if (!enabled()) {
            return path -> false;
        }
        if (skipsChecks(flowName)) {
            return path -> true;
        }
        return filter::includes;
    }

    private boolean skipsChecks(String flowName) {
        return skipForArtifactCollector && artifactCollectorFlowName.equals(flowName);
    }
}
