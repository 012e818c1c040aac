/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.glob;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GlobFilterTest {

    @Test
    void testBlacklistWinsOverWhitelist() {
        GlobFilter filter = GlobFilter.compile(List.of("/home/*/.ssh/**"), List.of("/home/**"));

        assertEquals(GlobFilter.Verdict.BLACKLISTED, filter.evaluate("/home/alice/.ssh/id_rsa"));
        assertEquals(GlobFilter.Verdict.INCLUDED, filter.evaluate("/home/alice/notes.txt"));
        assertEquals(GlobFilter.Verdict.NOT_WHITELISTED, filter.evaluate("/etc/passwd"));
    }

    @Test
    void testEmptyWhitelistIsNoOp() {
        GlobFilter filter = GlobFilter.compile(List.of("**/*.key"), List.of());

        assertTrue(filter.includes("/anything/at/all"));
        assertFalse(filter.includes("/srv/tls/server.key"));
    }

    @Test
    void testEmptyFilterIncludesEverything() {
        assertTrue(GlobFilter.INCLUDE_ALL.includes("/etc/shadow"));
        assertTrue(GlobFilter.includes("/etc/shadow", List.of(), List.of()));
    }

    @Test
    void testBlacklistMatchNamesTheGlob() {
        GlobFilter filter = GlobFilter.compile(List.of("/etc/shadow", "/root/**"), List.of());

        assertEquals("/root/**", filter.blacklistMatch("/root/.bash_history").orElseThrow().glob());
        assertTrue(filter.blacklistMatch("/tmp/x").isEmpty());
    }

    @Test
    void testCaseInsensitiveFilter() {
        GlobFilter filter = GlobFilter.compile(List.of("C:/Windows/**"), List.of(), true);

        assertFalse(filter.includes("c:\\windows\\system32\\config\\SAM"));
    }
}
