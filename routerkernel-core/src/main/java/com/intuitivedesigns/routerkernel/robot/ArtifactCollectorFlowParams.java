/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.robot;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.time.Duration;
import java.util.List;

/**
 * Settings of the artifact collector flow. An empty whitelist makes every artifact uncollectible.
 */
public record ArtifactCollectorFlowParams(
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("artifacts_whitelist") List<String> artifactsWhitelist,
        @JsonProperty("artifact_collector_flow_name") String artifactCollectorFlowName,
        @JsonProperty("max_flows_per_client_daily") long maxFlowsPerClientDaily,
        @JsonProperty("min_interval_between_duplicate_flows")
        @JsonDeserialize(using = DurationSecondsDeserializer.class) Duration minIntervalBetweenDuplicateFlows
) {

    public static final String DEFAULT_FLOW_NAME = "ArtifactCollectorFlow";

    public ArtifactCollectorFlowParams {
        artifactsWhitelist = artifactsWhitelist == null ? List.of() : List.copyOf(artifactsWhitelist);
        if (artifactCollectorFlowName == null || artifactCollectorFlowName.isBlank()) {
            artifactCollectorFlowName = DEFAULT_FLOW_NAME;
        }
        if (minIntervalBetweenDuplicateFlows == null) {
            minIntervalBetweenDuplicateFlows = Duration.ZERO;
        }
        if (maxFlowsPerClientDaily < 0) {
            throw new IllegalArgumentException("max_flows_per_client_daily must be >= 0");
        }
        if (minIntervalBetweenDuplicateFlows.isNegative()) {
            throw new IllegalArgumentException("min_interval_between_duplicate_flows must be >= 0");
        }
    }
}
