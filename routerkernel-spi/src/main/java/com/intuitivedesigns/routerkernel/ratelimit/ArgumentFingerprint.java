/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.ratelimit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Deterministic digest of call arguments, used to recognise duplicate requests.
 *
 * <p>Normalization: object members are sorted by name, null members are dropped, numbers are compared
 * by value ({@code 5} equals {@code 5.0}), array order is significant.</p>
 */
public final class ArgumentFingerprint {

    private static final HexFormat HEX = HexFormat.of();

    private ArgumentFingerprint() {}

    public static String of(JsonNode arguments) {
        return of(arguments, Set.of());
    }

    /**
     * @param excludedFields top-level members left out of the digest (fields already part of the key,
     *                       or rewritten by the router)
     */
    public static String of(JsonNode arguments, Set<String> excludedFields) {
        final StringBuilder canonical = new StringBuilder(128);
        if (arguments != null) {
            write(canonical, arguments, excludedFields);
        }
        return HEX.formatHex(sha256().digest(canonical.toString().getBytes(StandardCharsets.UTF_8)));
    }

    /** Canonical text the digest is computed over. Exposed for diagnostics. */
    public static String canonicalForm(JsonNode arguments) {
        final StringBuilder sb = new StringBuilder(128);
        if (arguments != null) write(sb, arguments, Set.of());
        return sb.toString();
    }

    private static void write(StringBuilder sb, JsonNode node, Set<String> excluded) {
        if (node.isObject()) {
            final List<String> names = new ArrayList<>();
            for (Iterator<String> it = node.fieldNames(); it.hasNext(); ) {
                final String name = it.next();
                final JsonNode v = node.get(name);
                if (v == null || v.isNull() || v.isMissingNode() || excluded.contains(name)) continue;
                names.add(name);
            }
            Collections.sort(names);
            sb.append('{');
            for (int i = 0; i < names.size(); i++) {
                if (i > 0) sb.append(',');
                sb.append(TextNode.valueOf(names.get(i)).toString()).append(':');
                write(sb, node.get(names.get(i)), Set.of());
            }
            sb.append('}');
        } else if (node.isArray()) {
            sb.append('[');
            for (int i = 0; i < node.size(); i++) {
                if (i > 0) sb.append(',');
                write(sb, node.get(i), Set.of());
            }
            sb.append(']');
        } else if (node.isNumber()) {
            sb.append(node.decimalValue().stripTrailingZeros().toPlainString());
        } else if (node.isNull() || node.isMissingNode()) {
            sb.append("null");
        } else {
            // Text, booleans, binary: Jackson's JSON rendering is already canonical
            sb.append(node.toString());
        }
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available in this JVM", e);
        }
    }
}
