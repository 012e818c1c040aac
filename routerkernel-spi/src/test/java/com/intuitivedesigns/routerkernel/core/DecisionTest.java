/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.core;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DecisionTest {

    @Test
    void testDenyRequiresReason() {
        assertThrows(NullPointerException.class, () -> new Decision(Decision.Effect.DENY, null, "x", null));
    }

    @Test
    void testAllowCannotCarryReason() {
        assertThrows(IllegalArgumentException.class,
                () -> new Decision(Decision.Effect.ALLOW, DenyReason.ACTION_DISABLED, "x", null));
    }

    @Test
    void testDenyDropsEffectiveArguments() {
        ObjectNode args = JsonNodeFactory.instance.objectNode().put("flow_name", "FileFinder");
        Decision d = new Decision(Decision.Effect.DENY, DenyReason.FILE_TOO_LARGE, "too big", args);

        assertFalse(d.allowed());
        assertTrue(d.rewrittenArguments().isEmpty());
        assertEquals(DenyReason.FILE_TOO_LARGE, d.denyReason().orElseThrow());
    }

    @Test
    void testAllowWithArguments() {
        ObjectNode args = JsonNodeFactory.instance.objectNode().put("flow_name", "FileFinder");

        assertSame(Decision.allow(), Decision.allow(null));
        assertEquals(args, Decision.allow(args).rewrittenArguments().orElseThrow());
        assertEquals("file_too_large", DenyReason.FILE_TOO_LARGE.token());
    }
}
