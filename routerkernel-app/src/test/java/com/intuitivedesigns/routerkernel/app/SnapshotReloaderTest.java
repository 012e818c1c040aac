/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.app;

import com.intuitivedesigns.routerkernel.config.ConfigurationException;
import com.intuitivedesigns.routerkernel.config.KernelConfig;
import com.intuitivedesigns.routerkernel.core.DenyReason;
import com.intuitivedesigns.routerkernel.core.Principal;
import com.intuitivedesigns.routerkernel.engine.AuthorizationEngine;
import com.intuitivedesigns.routerkernel.ratelimit.MutableClock;
import com.intuitivedesigns.routerkernel.ratelimit.RateLimiter;
import com.intuitivedesigns.routerkernel.spi.RouterContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotReloaderTest {

    private static final Principal EVE = Principal.of("eve");

    @TempDir
    Path dir;

    private AuthorizationEngine engine;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock();
        engine = new AuthorizationEngine(new RouterContext(clock, new RateLimiter(clock), null, null, null));
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private Path write(String name, String yaml, long modifiedSecond) throws Exception {
        Path p = dir.resolve(name);
        Files.writeString(p, yaml, StandardCharsets.UTF_8);
        Files.setLastModifiedTime(p, FileTime.from(Instant.ofEpochSecond(modifiedSecond)));
        return p;
    }

    @Test
    void testUnchangedFileIsNotReloaded() throws Exception {
        Path authz = write("authz.yaml", "router: WITHOUT_CHECKS\nusers: [eve]\n", 1_000);
        SnapshotReloader reloader = new SnapshotReloader(engine, authz, null);

        reloader.loadNow();

        assertFalse(reloader.reloadIfChanged());
        assertTrue(engine.authorize(EVE, "get_flow", null).allowed());
    }

    @Test
    void testChangedFileReplacesSnapshot() throws Exception {
        Path authz = write("authz.yaml", "router: WITHOUT_CHECKS\nusers: [eve]\n", 1_000);
        SnapshotReloader reloader = new SnapshotReloader(engine, authz, null);
        reloader.loadNow();

        write("authz.yaml", "router: DISABLED\nusers: [eve]\n", 2_000);

        assertTrue(reloader.reloadIfChanged());
        assertEquals(DenyReason.ACTION_DISABLED, engine.authorize(EVE, "get_flow", null).reason());
    }

    @Test
    void testBrokenReloadKeepsPreviousSnapshot() throws Exception {
        // Setup
        Path authz = write("authz.yaml", "router: WITHOUT_CHECKS\nusers: [eve]\n", 1_000);
        SnapshotReloader reloader = new SnapshotReloader(engine, authz, null);
        reloader.loadNow();

        // Act
        write("authz.yaml", "router: NO_SUCH_ROUTER\nusers: [eve]\n", 2_000);
        boolean reloaded = reloader.reloadIfChanged();

        // Assert
        assertFalse(reloaded);
        assertTrue(engine.authorize(EVE, "get_flow", null).allowed());
        // Same broken file is not retried on every tick
        assertFalse(reloader.reloadIfChanged());
    }

    @Test
    void testRobotDefaultsFileChangeTriggersReload() throws Exception {
        Path authz = write("authz.yaml", "router: ROBOT\nusers: [eve]\n", 1_000);
        Path defaults = write("defaults.yaml", "search_clients:\n  enabled: false\n", 1_000);
        SnapshotReloader reloader = new SnapshotReloader(engine, authz, defaults);
        reloader.loadNow();
        assertEquals(DenyReason.ACTION_DISABLED, engine.authorize(EVE, "search_clients", null).reason());

        write("defaults.yaml", "search_clients:\n  enabled: true\n", 2_000);

        assertTrue(reloader.reloadIfChanged());
        assertTrue(engine.authorize(EVE, "search_clients", null).allowed());
    }

    @Test
    void testInvalidStartupFileFails() throws Exception {
        Path authz = write("authz.yaml", "router: ROBOT\nusers: []\n", 1_000);

        assertThrows(ConfigurationException.class, () -> new SnapshotReloader(engine, authz, null).loadNow());
        assertEquals(0, engine.activeRecordCount());
    }

    @Test
    void testMisspelledRobotParamRejectedByEngine() throws Exception {
        // The file itself is well-formed YAML; the robot router refuses the unknown key
        assertEquals(1, AuthorizationFileLoader.load(AuthorizationFileLoaderTest.fixture("bad-authz.yaml")).size());

        SnapshotReloader reloader = new SnapshotReloader(engine, AuthorizationFileLoaderTest.fixture("bad-authz.yaml"), null);
        ConfigurationException e = assertThrows(ConfigurationException.class, reloader::loadNow);
        assertTrue(e.getMessage().contains("max_flows_per_client_dialy"), e.getMessage());
    }

    @Test
    void testOptionalPathHelper() {
        KernelConfig config = KernelConfig.of(Map.of(RouterKernelApp.CFG_AUTHZ_PATH, " /etc/rk/authz.yaml ",
                RouterKernelApp.CFG_ROBOT_DEFAULTS_PATH, " "));

        assertEquals(Path.of("/etc/rk/authz.yaml"), RouterKernelApp.optionalPath(config, RouterKernelApp.CFG_AUTHZ_PATH));
        assertNull(RouterKernelApp.optionalPath(config, RouterKernelApp.CFG_ROBOT_DEFAULTS_PATH));
        assertNull(RouterKernelApp.optionalPath(config, RouterKernelApp.CFG_CLIENT_LABELS_PATH));
    }
}
