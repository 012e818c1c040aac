/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.glob;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Blacklist/whitelist path filter.
 *
 * <p>The blacklist is always applied first: a blacklisted path is excluded whatever the whitelist says.
 * A path that survives the blacklist must match at least one whitelist glob, unless the whitelist is
 * empty, in which case the whitelist step is skipped.</p>
 *
 * <p>Instances are immutable and safe to share between threads.</p>
 */
public final class GlobFilter {

    public static final GlobFilter INCLUDE_ALL = new GlobFilter(List.of(), List.of());

    public enum Verdict {
        INCLUDED,
        BLACKLISTED,
        NOT_WHITELISTED;

        public boolean included() {
            return this == INCLUDED;
        }
    }

    private final List<GlobPattern> blacklist;
    private final List<GlobPattern> whitelist;

    private GlobFilter(List<GlobPattern> blacklist, List<GlobPattern> whitelist) {
        this.blacklist = blacklist;
        this.whitelist = whitelist;
    }

    public static GlobFilter compile(List<String> blacklist, List<String> whitelist) {
        return compile(blacklist, whitelist, false);
    }

    /**
     * @throws IllegalArgumentException on the first malformed glob
     */
    public static GlobFilter compile(List<String> blacklist, List<String> whitelist, boolean caseInsensitive) {
        final List<GlobPattern> black = compileAll(blacklist, caseInsensitive);
        final List<GlobPattern> white = compileAll(whitelist, caseInsensitive);
        if (black.isEmpty() && white.isEmpty()) return INCLUDE_ALL;
        return new GlobFilter(black, white);
    }

    /**
     * One-shot form of {@link #includes(String)} for callers that do not keep a compiled filter.
     */
    public static boolean includes(String path, List<String> blacklist, List<String> whitelist) {
        return compile(blacklist, whitelist).includes(path);
    }

    public Verdict evaluate(String path) {
        Objects.requireNonNull(path, "path");
        for (GlobPattern p : blacklist) {
            if (p.matches(path)) return Verdict.BLACKLISTED;
        }
        if (whitelist.isEmpty()) return Verdict.INCLUDED;
        for (GlobPattern p : whitelist) {
            if (p.matches(path)) return Verdict.INCLUDED;
        }
        return Verdict.NOT_WHITELISTED;
    }

    public boolean includes(String path) {
        return evaluate(path).included();
    }

    /** The blacklist glob that excludes {@code path}, if any. */
    public Optional<GlobPattern> blacklistMatch(String path) {
        for (GlobPattern p : blacklist) {
            if (p.matches(path)) return Optional.of(p);
        }
        return Optional.empty();
    }

    public List<GlobPattern> blacklist() {
        return blacklist;
    }

    public List<GlobPattern> whitelist() {
        return whitelist;
    }

    @Override
    public String toString() {
        return "GlobFilter{blacklist=" + blacklist + ", whitelist=" + whitelist + '}';
    }

    private static List<GlobPattern> compileAll(List<String> globs, boolean caseInsensitive) {
        if (globs == null || globs.isEmpty()) return List.of();
        final List<GlobPattern> out = new ArrayList<>(globs.size());
        for (String g : globs) {
            if (g == null || g.isBlank()) continue;
            out.add(GlobPattern.compile(g, caseInsensitive));
        }
        return Collections.unmodifiableList(out);
    }
}
