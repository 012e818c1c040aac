/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.engine;

import com.intuitivedesigns.routerkernel.core.ApiAuthorization;
import com.intuitivedesigns.routerkernel.core.Principal;
import com.intuitivedesigns.routerkernel.core.RouterBinding;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Maps a principal to its router: records are scanned in load order and the first one naming the user,
 * or one of the user's groups, wins.
 *
 * Immutable; safe for concurrent use.
 */
public final class AuthorizationResolver {

    /** A record and the router built for it. */
    public record Entry(ApiAuthorization record, RouterBinding binding) {
        public Entry {
            Objects.requireNonNull(record, "record");
            Objects.requireNonNull(binding, "binding");
        }
    }

    private final List<Entry> entries;

    public AuthorizationResolver(List<Entry> entries) {
        this.entries = List.copyOf(entries);
    }

    public Optional<RouterBinding> resolve(Principal principal) {
        Objects.requireNonNull(principal, "principal");
        for (Entry e : entries) {
            if (e.record().matches(principal)) {
                return Optional.of(e.binding());
            }
        }
        return Optional.empty();
    }

    public List<Entry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Positions of records no principal can ever reach: every user and group they name is already named
     * by an earlier record.
     */
    public static List<Integer> shadowedRecords(List<ApiAuthorization> records) {
        final Set<String> seenUsers = new HashSet<>();
        final Set<String> seenGroups = new HashSet<>();
        final List<Integer> shadowed = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            final ApiAuthorization r = records.get(i);
            if (i > 0 && seenUsers.containsAll(r.users()) && seenGroups.containsAll(r.groups())) {
                shadowed.add(i);
            }
            seenUsers.addAll(r.users());
            seenGroups.addAll(r.groups());
        }
        return shadowed;
    }
}
