/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.plugins.labels;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.intuitivedesigns.routerkernel.core.RouterParams;

import java.util.Set;

/**
 * Parameters of the labels-restricted router.
 *
 * @param labelsWhitelist       label names that make a client accessible
 * @param labelsOwnersWhitelist owners whose labels count; a label set by anyone else is ignored
 * @param allowFlowsAccess      opens the flow actions (still subject to the label check)
 * @param allowVfsAccess        opens the VFS actions (still subject to the label check)
 */
public record LabelsRestrictedRouterParams(
        @JsonProperty("labels_whitelist") Set<String> labelsWhitelist,
        @JsonProperty("labels_owners_whitelist") Set<String> labelsOwnersWhitelist,
        @JsonProperty("allow_flows_access") boolean allowFlowsAccess,
        @JsonProperty("allow_vfs_access") boolean allowVfsAccess
) implements RouterParams {

    public static final LabelsRestrictedRouterParams NONE =
            new LabelsRestrictedRouterParams(Set.of(), Set.of(), false, false);

    public LabelsRestrictedRouterParams {
        labelsWhitelist = labelsWhitelist == null ? Set.of() : Set.copyOf(labelsWhitelist);
        labelsOwnersWhitelist = labelsOwnersWhitelist == null ? Set.of() : Set.copyOf(labelsOwnersWhitelist);
    }
}
