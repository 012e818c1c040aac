/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One entry of the API authorization configuration: which router (and with which parameters)
 * applies to which users and groups.
 *
 * @param router       router plugin name, matched case-insensitively against plugin ids
 * @param routerParams opaque parameter tree; typed by the router plugin at load time (may be null)
 * @param users        usernames bound to this router
 * @param groups       group names bound to this router
 */
public record ApiAuthorization(String router, JsonNode routerParams, Set<String> users, Set<String> groups) {

    @JsonCreator
    public ApiAuthorization(@JsonProperty("router") String router,
                            @JsonProperty("router_params") JsonNode routerParams,
                            @JsonProperty("users") Set<String> users,
                            @JsonProperty("groups") Set<String> groups) {
        this.router = router == null ? "" : router.trim();
        this.routerParams = routerParams;
        this.users = orderedCopy(users);
        this.groups = orderedCopy(groups);
    }

    public static ApiAuthorization forUsers(String router, JsonNode params, String... users) {
        return new ApiAuthorization(router, params, new LinkedHashSet<>(List.of(users)), Set.of());
    }

    public static ApiAuthorization forGroups(String router, JsonNode params, String... groups) {
        return new ApiAuthorization(router, params, Set.of(), new LinkedHashSet<>(List.of(groups)));
    }

    /** A record with no users and no groups can never match anybody. */
    public boolean reachable() {
        return !users.isEmpty() || !groups.isEmpty();
    }

    public boolean matches(Principal principal) {
        return users.contains(principal.user()) || principal.isMemberOfAny(groups);
    }

    private static Set<String> orderedCopy(Set<String> in) {
        if (in == null || in.isEmpty()) return Set.of();
        Set<String> out = new LinkedHashSet<>();
        for (String s : in) {
            if (s != null && !s.isBlank()) out.add(s.trim());
        }
        return Collections.unmodifiableSet(out);
    }
}
