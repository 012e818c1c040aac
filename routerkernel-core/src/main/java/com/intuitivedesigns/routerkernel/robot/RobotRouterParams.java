/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.robot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.intuitivedesigns.routerkernel.core.RouterParams;

/**
 * Typed {@code router_params} of the robot router: one optional block per exposed action.
 * A missing block leaves its action disabled.
 *
 * <p>{@code robot_id} is a retired field; old configurations still carry it, so it is accepted and ignored.
 * Any other unknown field fails the load.</p>
 */
@JsonIgnoreProperties({"robot_id"})
public record RobotRouterParams(
        @JsonProperty("search_clients") EnabledActionParams searchClients,
        @JsonProperty("file_finder_flow") FileFinderFlowParams fileFinderFlow,
        @JsonProperty("artifact_collector_flow") ArtifactCollectorFlowParams artifactCollectorFlow,
        @JsonProperty("get_flow") EnabledActionParams getFlow,
        @JsonProperty("list_flow_results") EnabledActionParams listFlowResults,
        @JsonProperty("list_flow_logs") EnabledActionParams listFlowLogs,
        @JsonProperty("get_flow_files_archive") GetFlowFilesArchiveParams getFlowFilesArchive
) implements RouterParams {

    /** Everything disabled. */
    public static final RobotRouterParams NONE = new RobotRouterParams(null, null, null, null, null, null, null);

    /**
     * Name under which artifact collector flows run, whether or not that action is enabled.
     * The archive rule for collector results keys on it.
     */
    public String artifactCollectorFlowName() {
        return artifactCollectorFlow == null
                ? ArtifactCollectorFlowParams.DEFAULT_FLOW_NAME
                : artifactCollectorFlow.artifactCollectorFlowName();
    }

    public String fileFinderFlowName() {
        return fileFinderFlow == null
                ? FileFinderFlowParams.DEFAULT_FLOW_NAME
                : fileFinderFlow.fileFinderFlowName();
    }
}
