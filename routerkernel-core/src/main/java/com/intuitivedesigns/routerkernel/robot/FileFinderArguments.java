/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.robot;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The parts of a file finder request the router inspects. Other members pass through untouched.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record FileFinderArguments(
        @JsonProperty("client_id") String clientId,
        @JsonProperty("paths") List<String> paths,
        @JsonProperty("action") Action action
) {

    FileFinderArguments {
        paths = paths == null ? List.of() : paths;
    }

    /** Declared download limit, or null when the request states none. */
    Long declaredMaxSize() {
        return action == null ? null : action.maxSize();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Action(@JsonProperty("action_type") String actionType, @JsonProperty("max_size") Long maxSize) {}
}
