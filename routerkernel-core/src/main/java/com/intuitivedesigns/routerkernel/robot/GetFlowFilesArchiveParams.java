/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.robot;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Settings of flow results archive downloads.
 *
 * @param skipGlobChecksForArtifactCollector archives of the artifact collector flow bypass the path lists
 */
public record GetFlowFilesArchiveParams(
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("path_globs_blacklist") List<String> pathGlobsBlacklist,
        @JsonProperty("path_globs_whitelist") List<String> pathGlobsWhitelist,
        @JsonProperty("skip_glob_checks_for_artifact_collector") boolean skipGlobChecksForArtifactCollector
) {

    public GetFlowFilesArchiveParams {
        pathGlobsBlacklist = pathGlobsBlacklist == null ? List.of() : List.copyOf(pathGlobsBlacklist);
        pathGlobsWhitelist = pathGlobsWhitelist == null ? List.of() : List.copyOf(pathGlobsWhitelist);
    }
}
