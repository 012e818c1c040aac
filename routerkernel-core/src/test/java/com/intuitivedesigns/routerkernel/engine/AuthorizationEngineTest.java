/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.intuitivedesigns.routerkernel.config.ConfigurationException;
import com.intuitivedesigns.routerkernel.config.KernelConfig;
import com.intuitivedesigns.routerkernel.core.ApiAuthorization;
import com.intuitivedesigns.routerkernel.core.ApiCall;
import com.intuitivedesigns.routerkernel.core.Decision;
import com.intuitivedesigns.routerkernel.core.DenyReason;
import com.intuitivedesigns.routerkernel.core.Principal;
import com.intuitivedesigns.routerkernel.core.RouterParams;
import com.intuitivedesigns.routerkernel.metrics.MicrometerMetricsRuntime;
import com.intuitivedesigns.routerkernel.ratelimit.MutableClock;
import com.intuitivedesigns.routerkernel.ratelimit.RateLimiter;
import com.intuitivedesigns.routerkernel.robot.RobotRouterParams;
import com.intuitivedesigns.routerkernel.robot.RobotRouterPlugin;
import com.intuitivedesigns.routerkernel.routers.DisabledRouterPlugin;
import com.intuitivedesigns.routerkernel.routers.WithoutChecksRouterPlugin;
import com.intuitivedesigns.routerkernel.spi.ApiCallRouter;
import com.intuitivedesigns.routerkernel.spi.RouterContext;
import com.intuitivedesigns.routerkernel.spi.RouterPlugin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.intuitivedesigns.routerkernel.robot.RobotFixtures.CLIENT;
import static com.intuitivedesigns.routerkernel.robot.RobotFixtures.json;
import static org.junit.jupiter.api.Assertions.*;

class AuthorizationEngineTest {

    private static final Principal ALICE = Principal.of("alice", "robots");
    private static final Principal MALLORY = Principal.of("mallory", "interns");

    private MutableClock clock;
    private MicrometerMetricsRuntime metrics;
    private AuthorizationEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        metrics = new MicrometerMetricsRuntime();
        engine = newEngine(KernelConfig.empty());
    }

    @AfterEach
    void tearDown() {
        engine.close();
        metrics.close();
    }

    private AuthorizationEngine newEngine(KernelConfig config) {
        return new AuthorizationEngine(new RouterContext(clock, new RateLimiter(clock), metrics, config, null));
    }

    private static ApiAuthorization robotsGroup(String params) {
        return ApiAuthorization.forGroups("robot", params == null ? null : json(params), "robots");
    }

    private static JsonNode fileFinder(String path) {
        return json("{'client_id': '" + CLIENT + "', 'paths': ['" + path + "']}");
    }

    @Test
    void testGlobScenario() throws Exception {
        // Setup
        engine.loadSnapshot(List.of(robotsGroup("{'file_finder_flow': {'enabled': true, 'globs_allowed': false}}")));

        // Act
        Decision globbed = engine.authorize(ALICE, "file_finder_flow", fileFinder("/home/*/.bashrc"));
        Decision literal = engine.authorize(ALICE, "file_finder_flow", fileFinder("/home/alice/.bashrc"));

        // Assert
        assertEquals(DenyReason.GLOBS_NOT_ALLOWED, globbed.reason());
        assertTrue(literal.allowed());
        assertEquals(1.0, metrics.counterValue("authz_allow_total"));
        assertEquals(1.0, metrics.counterValue("authz_deny_globs_not_allowed_total"));
    }

    @Test
    void testUnmatchedPrincipal() throws Exception {
        engine.loadSnapshot(List.of(robotsGroup(null)));

        assertThrows(NoMatchingRouterException.class, () -> engine.resolve(MALLORY));
        assertEquals(DenyReason.NO_MATCHING_ROUTER, engine.authorize(MALLORY, "search_clients", null).reason());
    }

    @Test
    void testEmptyEngineDeniesEveryone() {
        assertEquals(DenyReason.NO_MATCHING_ROUTER, engine.authorize(ALICE, "search_clients", null).reason());
        assertFalse(engine.archivePathFilter(ALICE, "FileFinder").test("/tmp/x"));
    }

    @Test
    void testFirstMatchingRecordWins() throws Exception {
        engine.loadSnapshot(List.of(
                ApiAuthorization.forUsers("disabled", null, "alice"),
                robotsGroup("{'search_clients': {'enabled': true}}")));

        assertEquals("disabled", engine.resolve(ALICE).routerName());
        assertEquals(DenyReason.ACTION_DISABLED, engine.authorize(ALICE, "search_clients", null).reason());
        assertTrue(engine.authorize(Principal.of("bob", "robots"), "search_clients", null).allowed());
    }

    @Test
    void testDefaultRouterCatchesUnmatched() throws Exception {
        try (AuthorizationEngine withDefault = newEngine(KernelConfig.of(Map.of(AuthorizationEngine.KEY_DEFAULT_ROUTER, "without_checks")))) {
            withDefault.loadSnapshot(List.of(robotsGroup(null)));

            assertEquals("without_checks", withDefault.resolve(MALLORY).routerName());
            assertTrue(withDefault.authorize(MALLORY, "delete_client", null).allowed());
        }
    }

    @Test
    void testInvalidReloadKeepsPreviousSnapshot() throws Exception {
        engine.loadSnapshot(List.of(robotsGroup("{'search_clients': {'enabled': true}}")));

        assertThrows(ConfigurationException.class, () -> engine.loadSnapshot(List.of(
                robotsGroup("{'search_clients': {'enabled': false}}"),
                ApiAuthorization.forUsers("no_such_router", null, "bob"))));
        assertThrows(ConfigurationException.class, () -> engine.loadSnapshot(List.of(
                new ApiAuthorization("robot", null, Set.of(), Set.of()))));
        assertThrows(ConfigurationException.class, () -> engine.loadSnapshot(List.of(
                robotsGroup("{'search_clients': {'enabled': true, 'max': 1}}"))));

        assertTrue(engine.authorize(ALICE, "search_clients", null).allowed());
        assertEquals(1, engine.activeRecordCount());
        assertEquals(1.0, metrics.counterValue("authz_snapshot_load_total"));
        assertEquals(3.0, metrics.counterValue("authz_snapshot_reject_total"));
    }

    @Test
    void testReloadReplacesCachedBindings() throws Exception {
        engine.loadSnapshot(List.of(robotsGroup("{'search_clients': {'enabled': true}}")));
        assertTrue(engine.authorize(ALICE, "search_clients", null).allowed());

        engine.loadSnapshot(List.of(ApiAuthorization.forGroups("disabled", null, "robots")));

        assertEquals(DenyReason.ACTION_DISABLED, engine.authorize(ALICE, "search_clients", null).reason());
    }

    @Test
    void testDefaultRobotParamsApplyToRecordsWithoutParams() throws Exception {
        RobotRouterParams defaults = new RobotRouterPlugin().parseParams(json("{'get_flow': {'enabled': true}}"));

        engine.loadSnapshot(List.of(
                ApiAuthorization.forUsers("robot", null, "alice"),
                ApiAuthorization.forUsers("robot", json("{'list_flow_logs': {'enabled': true}}"), "bob")), defaults);

        assertTrue(engine.authorize(ALICE, "get_flow", null).allowed());
        assertEquals(DenyReason.ACTION_DISABLED, engine.authorize(Principal.of("bob"), "get_flow", null).reason());
        assertTrue(engine.authorize(Principal.of("bob"), "list_flow_logs", null).allowed());
    }

    @Test
    void testQuotasSurviveReload() throws Exception {
        String params = "{'file_finder_flow': {'enabled': true, 'max_flows_per_client_daily': 1}}";
        engine.loadSnapshot(List.of(robotsGroup(params)));
        assertTrue(engine.authorize(ALICE, "file_finder_flow", fileFinder("/a")).allowed());

        engine.loadSnapshot(List.of(robotsGroup(params)));

        assertEquals(DenyReason.DAILY_QUOTA_EXCEEDED, engine.authorize(ALICE, "file_finder_flow", fileFinder("/b")).reason());
        clock.advance(Duration.ofHours(25));
        assertTrue(engine.authorize(ALICE, "file_finder_flow", fileFinder("/b")).allowed());
    }

    @Test
    void testArchivePathFilter() throws Exception {
        engine.loadSnapshot(List.of(robotsGroup(
                "{'get_flow_files_archive': {'enabled': true, 'path_globs_blacklist': ['/etc/shadow']}}")));

        assertFalse(engine.archivePathFilter(ALICE, "FileFinder").test("/etc/shadow"));
        assertTrue(engine.archivePathFilter(ALICE, "FileFinder").test("/etc/hosts"));
        assertFalse(engine.archivePathFilter(MALLORY, "FileFinder").test("/etc/hosts"));
    }

    @Test
    void testFailingRouterFailsClosed() throws Exception {
        RouterPlugin<RouterParams> exploding = new RouterPlugin<>() {
            @Override
            public String id() {
                return "EXPLODING";
            }

            @Override
            public Class<RouterParams> paramsType() {
                return RouterParams.class;
            }

            @Override
            public RouterParams parseParams(JsonNode raw) {
                return RouterParams.NONE;
            }

            @Override
            public ApiCallRouter create(RouterParams params, RouterContext context) {
                return call -> {
                    throw new IllegalStateException("boom");
                };
            }
        };
        RouterContext ctx = new RouterContext(clock, new RateLimiter(clock), metrics, KernelConfig.empty(), null);
        try (AuthorizationEngine e = new AuthorizationEngine(ctx, RouterFactory.of(List.of(exploding)))) {
            e.loadSnapshot(List.of(ApiAuthorization.forUsers("exploding", null, "alice")));

            assertEquals(DenyReason.INTERNAL_ERROR, e.authorize(new ApiCall(ALICE, "get_flow", null)).reason());
        }
    }

    @Test
    void testPruneRateLimitsPublishesGauge() throws Exception {
        engine.loadSnapshot(List.of(robotsGroup("{'file_finder_flow': {'enabled': true, 'max_flows_per_client_daily': 5}}")));
        engine.authorize(ALICE, "file_finder_flow", fileFinder("/a"));

        assertEquals(0, engine.pruneRateLimits());
        assertEquals(1.0, metrics.registry().get("ratelimit_tracked_buckets").gauge().value());

        clock.advance(Duration.ofDays(2));
        assertEquals(1, engine.pruneRateLimits());
        assertEquals(0.0, metrics.registry().get("ratelimit_tracked_buckets").gauge().value());
    }

    @Test
    void testShadowedRecordsDetected() {
        List<ApiAuthorization> records = List.of(
                ApiAuthorization.forGroups("robot", null, "robots", "admins"),
                new ApiAuthorization("disabled", null, new LinkedHashSet<>(List.of("alice")), Set.of()),
                ApiAuthorization.forGroups("disabled", null, "admins"));

        assertEquals(List.of(2), AuthorizationResolver.shadowedRecords(records));
    }

    @Test
    void testBuiltInRoutersRegistered() {
        RouterFactory factory = RouterFactory.fromClasspath();

        assertTrue(factory.isKnown(RobotRouterPlugin.ID));
        assertTrue(factory.isKnown(WithoutChecksRouterPlugin.ID.toLowerCase()));
        assertTrue(factory.isKnown(DisabledRouterPlugin.ID));
        assertFalse(factory.isKnown("ApiCallRobotRouter"));
    }
}
