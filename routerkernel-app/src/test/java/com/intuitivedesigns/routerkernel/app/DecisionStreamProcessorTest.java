/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.routerkernel.engine.AuthorizationEngine;
import com.intuitivedesigns.routerkernel.ratelimit.MutableClock;
import com.intuitivedesigns.routerkernel.ratelimit.RateLimiter;
import com.intuitivedesigns.routerkernel.spi.RouterContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

import static com.intuitivedesigns.routerkernel.app.AuthorizationFileLoaderTest.fixture;
import static org.junit.jupiter.api.Assertions.*;

class DecisionStreamProcessorTest {

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final String CLIENT = "C.1000000000000001";

    private AuthorizationEngine engine;
    private DecisionStreamProcessor processor;

    @BeforeEach
    void setUp() throws Exception {
        MutableClock clock = new MutableClock();
        RouterContext ctx = new RouterContext(clock, new RateLimiter(clock), null, null,
                AuthorizationFileLoader.loadClientLabels(fixture("client-labels.yaml")));
        engine = new AuthorizationEngine(ctx);
        new SnapshotReloader(engine, fixture("authz.yaml"), fixture("robot-defaults.yaml")).loadNow();
        processor = new DecisionStreamProcessor(engine);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private List<JsonNode> run(String... lines) throws Exception {
        StringWriter out = new StringWriter();
        long answered = processor.process(new StringReader(String.join("\n", lines)), out);

        List<JsonNode> decisions = new ArrayList<>();
        for (String line : out.toString().split("\n")) {
            if (!line.isBlank()) decisions.add(JSON.readTree(line));
        }
        assertEquals(answered, decisions.size());
        return decisions;
    }

    private static String request(String user, String groups, String action, String args) {
        return "{\"user\":\"" + user + "\",\"groups\":" + groups + ",\"action\":\"" + action + "\",\"args\":" + args + "}";
    }

    @Test
    void testRobotFileFinderIsCappedAndNamed() throws Exception {
        String args = "{\"client_id\":\"" + CLIENT + "\",\"paths\":[\"/etc/passwd\"]}";

        List<JsonNode> out = run(request("triage-bot", "[]", "file_finder_flow", args));

        JsonNode d = out.get(0);
        assertEquals("ALLOW", d.get("effect").asText());
        assertEquals("FileFinder", d.at("/effective_args/flow_name").asText());
        assertEquals(1048576L, d.at("/effective_args/action/max_size").asLong());
    }

    @Test
    void testRobotDenialsAndQuota() throws Exception {
        String glob = "{\"client_id\":\"" + CLIENT + "\",\"paths\":[\"/tmp/*\"]}";
        String a = "{\"client_id\":\"" + CLIENT + "\",\"paths\":[\"/a\"]}";
        String b = "{\"client_id\":\"" + CLIENT + "\",\"paths\":[\"/b\"]}";
        String c = "{\"client_id\":\"" + CLIENT + "\",\"paths\":[\"/c\"]}";

        List<JsonNode> out = run(
                request("triage-bot", "[]", "file_finder_flow", glob),
                request("triage-bot", "[]", "file_finder_flow", a),
                request("triage-bot", "[]", "file_finder_flow", a),
                request("triage-bot", "[]", "file_finder_flow", b),
                request("triage-bot", "[]", "file_finder_flow", c));

        assertEquals("GLOBS_NOT_ALLOWED", out.get(0).get("reason").asText());
        assertEquals("ALLOW", out.get(1).get("effect").asText());
        assertEquals("DUPLICATE_TOO_SOON", out.get(2).get("reason").asText());
        assertEquals("ALLOW", out.get(3).get("effect").asText());
        assertEquals("DAILY_QUOTA_EXCEEDED", out.get(4).get("reason").asText());
    }

    @Test
    void testGroupRecordUsesRobotDefaults() throws Exception {
        String args = "{\"client_id\":\"" + CLIENT + "\",\"artifact_list\":[\"WindowsEventLogs\"]}";

        List<JsonNode> out = run(
                request("collector", "[\"robots\"]", "artifact_collector_flow", args),
                request("collector", "[\"robots\"]", "file_finder_flow", "{}"));

        assertEquals("ALLOW", out.get(0).get("effect").asText());
        assertEquals("ArtifactCollectorFlow", out.get(0).at("/effective_args/flow_name").asText());
        assertEquals("ACTION_DISABLED", out.get(1).get("reason").asText());
    }

    @Test
    void testLabelsRouterFromYaml() throws Exception {
        List<JsonNode> out = run(
                request("ann", "[\"analysts\"]", "get_client", "{\"client_id\":\"C.00000000000000aa\"}"),
                request("ann", "[\"analysts\"]", "get_client", "{\"client_id\":\"C.00000000000000bb\"}"),
                request("ann", "[\"analysts\"]", "list_files", "{\"client_id\":\"C.00000000000000aa\"}"));

        assertEquals("ALLOW", out.get(0).get("effect").asText());
        assertEquals("CLIENT_NOT_ACCESSIBLE", out.get(1).get("reason").asText());
        assertEquals("ACTION_DISABLED", out.get(2).get("reason").asText());
    }

    @Test
    void testUnmatchedAndMalformedRequests() throws Exception {
        List<JsonNode> out = run(
                request("stranger", "[]", "search_clients", "{}"),
                "",
                "this is not json",
                "{\"action\":\"search_clients\"}");

        assertEquals(3, out.size());
        assertEquals("NO_MATCHING_ROUTER", out.get(0).get("reason").asText());
        assertEquals("INVALID_ARGUMENTS", out.get(1).get("reason").asText());
        assertEquals("INVALID_ARGUMENTS", out.get(2).get("reason").asText());
    }

    @Test
    void testPermitAllUser() throws Exception {
        List<JsonNode> out = run(request("admin", "[]", "delete_everything", "{}"));

        assertEquals("ALLOW", out.get(0).get("effect").asText());
        assertFalse(out.get(0).has("reason"));
    }
}
