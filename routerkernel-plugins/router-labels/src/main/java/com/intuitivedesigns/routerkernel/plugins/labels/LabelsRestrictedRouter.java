/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.plugins.labels;

import com.intuitivedesigns.routerkernel.core.ApiCall;
import com.intuitivedesigns.routerkernel.core.ClientIds;
import com.intuitivedesigns.routerkernel.core.ClientLabel;
import com.intuitivedesigns.routerkernel.core.Decision;
import com.intuitivedesigns.routerkernel.core.DenyReason;
import com.intuitivedesigns.routerkernel.spi.ApiCallRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Router that confines a principal to clients carrying a whitelisted label.
 *
 * Unrestricted actions are always allowed. Client actions need an accessible client; flow and VFS
 * actions additionally need their access flag. Everything else is disabled.
 */
final class LabelsRestrictedRouter implements ApiCallRouter {

    private static final Logger log = LoggerFactory.getLogger(LabelsRestrictedRouter.class);

    static final Set<String> UNRESTRICTED_ACTIONS = Set.of(
            "search_clients", "list_client_approvals", "get_grr_user", "list_pending_user_notifications");

    static final Set<String> CLIENT_ACTIONS = Set.of(
            "get_client", "get_client_versions", "list_client_crash_infos");

    static final Set<String> FLOW_ACTIONS = Set.of(
            "list_flows", "get_flow", "create_flow", "cancel_flow", "list_flow_results", "list_flow_logs",
            "get_flow_files_archive");

    static final Set<String> VFS_ACTIONS = Set.of(
            "list_files", "get_file_details", "get_file_text", "get_file_blob", "get_vfs_timeline",
            "create_vfs_refresh_operation");

    private final LabelsRestrictedRouterParams params;
    private final CachingClientLabelDirectory labels;

    LabelsRestrictedRouter(LabelsRestrictedRouterParams params, CachingClientLabelDirectory labels) {
        this.params = Objects.requireNonNull(params, "params");
        this.labels = Objects.requireNonNull(labels, "labels");
    }

    @Override
    public Decision authorize(ApiCall call) {
        final String action = call.action();

        if (UNRESTRICTED_ACTIONS.contains(action)) {
            return Decision.allow();
        }
        if (CLIENT_ACTIONS.contains(action)) {
            return checkClientAccess(call);
        }
        if (FLOW_ACTIONS.contains(action)) {
            if (!params.allowFlowsAccess()) {
                return Decision.deny(DenyReason.ACTION_DISABLED, "Flow access is not allowed: " + action);
            }
            return checkClientAccess(call);
        }
        if (VFS_ACTIONS.contains(action)) {
            if (!params.allowVfsAccess()) {
                return Decision.deny(DenyReason.ACTION_DISABLED, "VFS access is not allowed: " + action);
            }
            return checkClientAccess(call);
        }
        return Decision.deny(DenyReason.ACTION_DISABLED, "Action is not available: " + action);
    }

    /**
     * Archives are only produced for flows the principal could already reach, so no path is filtered.
     */
    @Override
    public Predicate<String> archivePathFilter(String flowName) {
        return params.allowFlowsAccess() ? path -> true : path -> false;
    }

    private Decision checkClientAccess(ApiCall call) {
        Optional<String> clientId = call.textArgument("client_id").flatMap(ClientIds::normalize);
        if (clientId.isEmpty()) {
            return Decision.deny(DenyReason.INVALID_ARGUMENTS, "Missing or malformed client_id");
        }
        if (isAccessible(clientId.get())) {
            return Decision.allow();
        }
        log.debug("Client {} is not labeled for {}", clientId.get(), call.principal().user());
        return Decision.deny(DenyReason.CLIENT_NOT_ACCESSIBLE,
                "Client " + clientId.get() + " carries no whitelisted label");
    }

    boolean isAccessible(String clientId) {
        for (ClientLabel label : labels.labelsOf(clientId)) {
            if (params.labelsWhitelist().contains(label.name())
                    && params.labelsOwnersWhitelist().contains(label.owner())) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void close() {
        labels.close();
    }

    @Override
    public String toString() {
        return LabelsRestrictedRouterPlugin.ID + params.labelsWhitelist();
    }
}
