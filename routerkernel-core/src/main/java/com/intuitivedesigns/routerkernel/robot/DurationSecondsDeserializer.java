/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.robot;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a duration given as plain seconds ({@code 600}, {@code "600"}) or with a unit suffix
 * ({@code "30s"}, {@code "10m"}, {@code "1h"}, {@code "2d"}).
 */
public final class DurationSecondsDeserializer extends StdDeserializer<Duration> {

    private static final long serialVersionUID = 1L;

    private static final Pattern WITH_UNIT = Pattern.compile("^(\\d+)\\s*([smhd])$");

    public DurationSecondsDeserializer() {
        super(Duration.class);
    }

    @Override
    public Duration deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        final JsonToken t = p.currentToken();
        if (t == JsonToken.VALUE_NUMBER_INT) {
            return ofSeconds(p.getLongValue(), ctxt);
        }
        if (t == JsonToken.VALUE_NUMBER_FLOAT) {
            final double secs = p.getDoubleValue();
            if (secs < 0) {
                return (Duration) ctxt.handleWeirdNumberValue(Duration.class, secs, "duration must not be negative");
            }
            return Duration.ofMillis(Math.round(secs * 1000.0));
        }
        if (t == JsonToken.VALUE_STRING) {
            return parse(p.getText(), ctxt);
        }
        return (Duration) ctxt.handleUnexpectedToken(Duration.class, p);
    }

    static Duration parse(String raw, DeserializationContext ctxt) throws IOException {
        final String text = raw.trim().toLowerCase(Locale.ROOT);
        if (text.isEmpty()) return Duration.ZERO;
        final Duration parsed = tryParse(text);
        if (parsed != null) return parsed;
        return (Duration) ctxt.handleWeirdStringValue(Duration.class, raw,
                "expected seconds or a number with unit s, m, h or d");
    }

    private static Duration tryParse(String text) {
        try {
            if (text.chars().allMatch(Character::isDigit)) {
                return Duration.ofSeconds(Long.parseLong(text));
            }
            final Matcher m = WITH_UNIT.matcher(text);
            if (!m.matches()) return null;
            final long n = Long.parseLong(m.group(1));
            switch (m.group(2)) {
                case "s": return Duration.ofSeconds(n);
                case "m": return Duration.ofMinutes(n);
                case "h": return Duration.ofHours(n);
                default: return Duration.ofDays(n);
            }
        } catch (NumberFormatException | ArithmeticException e) {
            // Out of range for a Duration
            return null;
        }
    }

    private static Duration ofSeconds(long secs, DeserializationContext ctxt) throws IOException {
        if (secs < 0) {
            return (Duration) ctxt.handleWeirdNumberValue(Duration.class, secs, "duration must not be negative");
        }
        return Duration.ofSeconds(secs);
    }
}
