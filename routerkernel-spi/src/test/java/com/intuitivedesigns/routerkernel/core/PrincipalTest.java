/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.core;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PrincipalTest {

    @Test
    void testBlankUserRejected() {
        assertThrows(IllegalArgumentException.class, () -> Principal.of(" "));
        assertThrows(NullPointerException.class, () -> new Principal(null, Set.of()));
    }

    @Test
    void testGroupsAreCopied() {
        Set<String> groups = new HashSet<>(Set.of("robots"));
        Principal p = new Principal("svc", groups);
        groups.add("admins");

        assertEquals(Set.of("robots"), p.groups());
        assertTrue(p.isMemberOfAny(Set.of("admins", "robots")));
        assertFalse(p.isMemberOfAny(Set.of("admins")));
    }

    @Test
    void testAuthorizationMatching() {
        ApiAuthorization byUser = ApiAuthorization.forUsers("robot", null, "alice");
        ApiAuthorization byGroup = ApiAuthorization.forGroups("robot", null, "robots");
        ApiAuthorization nobody = new ApiAuthorization("robot", null, null, Set.of());

        assertTrue(byUser.matches(Principal.of("alice")));
        assertFalse(byUser.matches(Principal.of("bob", "alice")));
        assertTrue(byGroup.matches(Principal.of("bob", "robots")));
        assertFalse(nobody.reachable());
    }

    @Test
    void testClientIds() {
        assertTrue(ClientIds.isValid("C.1234567890abcdef"));
        assertEquals("C.1234567890abcdef", ClientIds.normalize("aff4:/C.1234567890abcdef").orElseThrow());
        assertFalse(ClientIds.isValid("C.123"));
        assertFalse(ClientIds.isValid("c.1234567890abcdef"));
        assertTrue(ClientIds.normalize(null).isEmpty());
    }

    @Test
    void testClientIdHexCaseFolded() {
        assertEquals("C.00000000000abcde", ClientIds.normalize("C.00000000000ABCDE").orElseThrow());
        assertEquals("C.00000000000abcde", ClientIds.normalize("aff4:/C.00000000000AbCdE").orElseThrow());
        assertEquals(ClientIds.normalize("C.000000000000000a"), ClientIds.normalize("C.000000000000000A"));
    }
}
