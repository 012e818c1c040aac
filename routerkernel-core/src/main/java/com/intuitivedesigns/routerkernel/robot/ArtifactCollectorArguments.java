/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.robot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
record ArtifactCollectorArguments(
        @JsonProperty("client_id") String clientId,
        @JsonProperty("artifact_list") List<String> artifactList
) {

    ArtifactCollectorArguments {
        artifactList = artifactList == null ? List.of() : artifactList;
    }
}
