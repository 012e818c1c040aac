/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.robot;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.time.Duration;

/**
 * Settings of the file finder flow.
 *
 * @param enabled                          whether robots may start the flow at all
 * @param globsAllowed                     whether paths may contain {@code *}, {@code ?} or {@code [}
 * @param interpolationsAllowed            whether paths may contain {@code %%} knowledge-base interpolations
 * @param fileFinderFlowName               flow that actually runs; lets operators substitute a hardened variant
 * @param maxFlowsPerClientDaily           flows per client in a trailing 24h window; 0 = unlimited
 * @param minIntervalBetweenDuplicateFlows spacing of identical flows on one client; zero = unlimited
 * @param maxFileSize                      largest file the flow may fetch, in bytes; 0 = unlimited
 * @param undeclaredFileSize               handling of requests that declare no size while a limit is set
 */
public record FileFinderFlowParams(
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("globs_allowed") boolean globsAllowed,
        @JsonProperty("interpolations_allowed") boolean interpolationsAllowed,
        @JsonProperty("file_finder_flow_name") String fileFinderFlowName,
        @JsonProperty("max_flows_per_client_daily") long maxFlowsPerClientDaily,
        @JsonProperty("min_interval_between_duplicate_flows")
        @JsonDeserialize(using = DurationSecondsDeserializer.class) Duration minIntervalBetweenDuplicateFlows,
        @JsonProperty("max_file_size") long maxFileSize,
        @JsonProperty("undeclared_file_size") UndeclaredFileSizePolicy undeclaredFileSize
) {

    public static final String DEFAULT_FLOW_NAME = "FileFinder";

    public FileFinderFlowParams {
        if (fileFinderFlowName == null || fileFinderFlowName.isBlank()) {
            fileFinderFlowName = DEFAULT_FLOW_NAME;
        }
        if (minIntervalBetweenDuplicateFlows == null) {
            minIntervalBetweenDuplicateFlows = Duration.ZERO;
        }
        if (undeclaredFileSize == null) {
            undeclaredFileSize = UndeclaredFileSizePolicy.CAP;
        }
        if (maxFlowsPerClientDaily < 0) {
            throw new IllegalArgumentException("max_flows_per_client_daily must be >= 0");
        }
        if (maxFileSize < 0) {
            throw new IllegalArgumentException("max_file_size must be >= 0");
        }
        if (minIntervalBetweenDuplicateFlows.isNegative()) {
            throw new IllegalArgumentException("min_interval_between_duplicate_flows must be >= 0");
        }
    }

    public static FileFinderFlowParams enabledWithDefaults() {
        return new FileFinderFlowParams(true, false, false, null, 0, null, 0, null);
    }
}
