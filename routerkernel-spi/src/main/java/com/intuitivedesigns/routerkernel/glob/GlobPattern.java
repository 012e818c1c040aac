/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.glob;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A path glob compiled to a regular expression.
 *
 * <p>Dialect:</p>
 * <ul>
 *   <li>{@code *} any run of characters inside one path segment</li>
 *   <li>{@code ?} exactly one character inside one path segment</li>
 *   <li>{@code **} any run of characters across segments; {@code **}{@code /} also matches no directory at all</li>
 *   <li>{@code [abc]}, {@code [a-z]}, {@code [!abc]} character classes (never matching {@code /})</li>
 *   <li>{@code {a,b}} alternation, nestable</li>
 * </ul>
 * Backslashes are treated as path separators, so Windows paths match forward-slash globs.
 * The whole path must match.
 */
public final class GlobPattern {

    private static final String REGEX_META = "\\.[]{}()<>*+-=!?^$|";
    private static final String GLOB_META = "*?[{";

    private final String glob;
    private final Pattern regex;

    private GlobPattern(String glob, Pattern regex) {
        this.glob = glob;
        this.regex = regex;
    }

    public static GlobPattern compile(String glob) {
        return compile(glob, false);
    }

    /**
     * @throws IllegalArgumentException if the glob is blank or has an unbalanced class or alternation
     */
    public static GlobPattern compile(String glob, boolean caseInsensitive) {
        Objects.requireNonNull(glob, "glob");
        final String normalized = normalizeSeparators(glob.trim());
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Glob expression must not be blank");
        }
        final String body = translate(normalized, 0, normalized.length(), glob);
        final int flags = caseInsensitive ? Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE : 0;
        return new GlobPattern(glob, Pattern.compile(body, flags));
    }

    public boolean matches(String path) {
        if (path == null) return false;
        return regex.matcher(normalizeSeparators(path)).matches();
    }

    /**
     * True when {@code path} uses any wildcard, class or alternation of this dialect.
     */
    public static boolean hasMetasyntax(String path) {
        if (path == null) return false;
        for (int i = 0; i < path.length(); i++) {
            if (GLOB_META.indexOf(path.charAt(i)) >= 0) return true;
        }
        return false;
    }

    public String glob() {
        return glob;
    }

    String regex() {
        return regex.pattern();
    }

    @Override
    public String toString() {
        return glob;
    }

    static String normalizeSeparators(String s) {
        return s.indexOf('\\') < 0 ? s : s.replace('\\', '/');
    }

    private static String translate(String g, int from, int to, String original) {
        final StringBuilder out = new StringBuilder((to - from) * 2);
        int i = from;
        while (i < to) {
            final char c = g.charAt(i);
            switch (c) {
                case '*': {
                    int j = i;
                    while (j < to && g.charAt(j) == '*') j++;
                    if (j - i >= 2) {
                        if (j < to && g.charAt(j) == '/') {
                            out.append("(?:.*/)?");
                            j++;
                        } else {
                            out.append(".*");
                        }
                    } else {
                        out.append("[^/]*");
                    }
                    i = j;
                    break;
                }
                case '?':
                    out.append("[^/]");
                    i++;
                    break;
                case '[': {
                    final int close = findClassEnd(g, i, to);
                    if (close < 0) {
                        throw new IllegalArgumentException("Unclosed character class in glob: " + original);
                    }
                    appendClass(out, g, i + 1, close);
                    i = close + 1;
                    break;
                }
                case '{': {
                    final int close = findBraceEnd(g, i, to);
                    if (close < 0) {
                        throw new IllegalArgumentException("Unclosed alternation in glob: " + original);
                    }
                    out.append("(?:");
                    final List<int[]> parts = splitAlternatives(g, i + 1, close);
                    for (int k = 0; k < parts.size(); k++) {
                        if (k > 0) out.append('|');
                        final int[] p = parts.get(k);
                        out.append(translate(g, p[0], p[1], original));
                    }
                    out.append(')');
                    i = close + 1;
                    break;
                }
                case '}':
                    throw new IllegalArgumentException("Unbalanced '}' in glob: " + original);
                default:
                    if (REGEX_META.indexOf(c) >= 0) out.append('\\');
                    out.append(c);
                    i++;
            }
        }
        return out.toString();
    }

    private static int findClassEnd(String g, int open, int to) {
        int j = open + 1;
        if (j < to && (g.charAt(j) == '!' || g.charAt(j) == '^')) j++;
        // A ']' right after the opening bracket is a literal member
        if (j < to && g.charAt(j) == ']') j++;
        while (j < to) {
            if (g.charAt(j) == ']') return j;
            j++;
        }
        return -1;
    }

    private static void appendClass(StringBuilder out, String g, int from, int to) {
        int i = from;
        boolean negated = false;
        if (i < to && (g.charAt(i) == '!' || g.charAt(i) == '^')) {
            negated = true;
            i++;
        }
        final int first = i;
        out.append(negated ? "[^/" : "[");
        for (; i < to; i++) {
            final char c = g.charAt(i);
            if (c == '-' && i > first && i < to - 1) {
                out.append('-');
            } else if (c == '\\' || c == '[' || c == ']' || c == '^' || c == '&' || c == '-') {
                out.append('\\').append(c);
            } else {
                out.append(c);
            }
        }
        // Classes never match a separator
        out.append(negated ? "]" : "&&[^/]]");
    }

    private static int findBraceEnd(String g, int open, int to) {
        int depth = 0;
        for (int j = open; j < to; j++) {
            final char c = g.charAt(j);
            if (c == '[') {
                final int close = findClassEnd(g, j, to);
                if (close < 0) return -1;
                j = close;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) return j;
            }
        }
        return -1;
    }

    private static List<int[]> splitAlternatives(String g, int from, int to) {
        final List<int[]> parts = new ArrayList<>();
        int depth = 0;
        int start = from;
        for (int j = from; j < to; j++) {
            final char c = g.charAt(j);
            if (c == '[') {
                j = findClassEnd(g, j, to);
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
            } else if (c == ',' && depth == 0) {
                parts.add(new int[]{start, j});
                start = j + 1;
            }
        }
        parts.add(new int[]{start, to});
        return parts;
    }
}
