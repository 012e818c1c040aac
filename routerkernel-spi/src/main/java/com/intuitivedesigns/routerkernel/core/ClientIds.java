/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.core;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Client id syntax: {@code C.} followed by 16 hex digits, optionally prefixed with {@code aff4:/}.
 */
public final class ClientIds {

    private static final Pattern CLIENT_ID = Pattern.compile("^(aff4:/)?C\\.[0-9a-fA-F]{16}$");
    private static final String URN_PREFIX = "aff4:/";

    private ClientIds() {}

    public static boolean isValid(String value) {
        return value != null && CLIENT_ID.matcher(value).matches();
    }

    /**
     * Canonical form used for quota and label lookups: URN prefix stripped, hex digits lower-cased.
     */
    public static Optional<String> normalize(String value) {
        if (!isValid(value)) return Optional.empty();
        final String bare = value.startsWith(URN_PREFIX) ? value.substring(URN_PREFIX.length()) : value;
        return Optional.of("C." + bare.substring(2).toLowerCase(Locale.ROOT));
    }
}
