/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.robot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Archive download request. {@code paths} lists the files about to be archived, when the caller knows them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record FlowFilesArchiveArguments(
        @JsonProperty("client_id") String clientId,
        @JsonProperty("flow_id") String flowId,
        @JsonProperty("flow_name") String flowName,
        @JsonProperty("paths") List<String> paths
) {

    FlowFilesArchiveArguments {
        paths = paths == null ? List.of() : paths;
    }
}
