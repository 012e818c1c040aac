/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.robot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DurationSecondsDeserializerTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private Duration parse(String json) throws Exception {
        return mapper.readValue("{\"d\":" + json + "}", Holder.class).d;
    }

    static final class Holder {
        @JsonDeserialize(using = DurationSecondsDeserializer.class)
        public Duration d;
    }

    @Test
    void testUnits() throws Exception {
        assertEquals(Duration.ofSeconds(600), parse("600"));
        assertEquals(Duration.ofSeconds(600), parse("\"600\""));
        assertEquals(Duration.ofSeconds(30), parse("\"30s\""));
        assertEquals(Duration.ofMinutes(10), parse("\"10m\""));
        assertEquals(Duration.ofHours(1), parse("\"1H\""));
        assertEquals(Duration.ofDays(2), parse("\"2d\""));
        assertEquals(Duration.ofMillis(1500), parse("1.5"));
    }

    @Test
    void testRejectsGarbage() {
        assertThrows(InvalidFormatException.class, () -> parse("\"ten minutes\""));
        assertThrows(InvalidFormatException.class, () -> parse("-5"));
    }
}
