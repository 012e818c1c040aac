/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.routerkernel.core.Decision;
import com.intuitivedesigns.routerkernel.core.DenyReason;
import com.intuitivedesigns.routerkernel.core.Principal;
import com.intuitivedesigns.routerkernel.engine.AuthorizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Request/decision loop over JSON lines.
 *
 * Input, one object per line: {@code {"user": "...", "groups": [...], "action": "...", "args": {...}}}.
 * Output, one object per input line: {@code {"user", "action", "effect", "reason", "message", "effective_args"}}.
 * Blank lines are skipped. A malformed line is answered with {@code INVALID_ARGUMENTS}; the loop keeps going.
 */
public final class DecisionStreamProcessor {

    private static final Logger log = LoggerFactory.getLogger(DecisionStreamProcessor.class);

    private final AuthorizationEngine engine;
    private final ObjectMapper json;

    public DecisionStreamProcessor(AuthorizationEngine engine) {
        this(engine, new ObjectMapper());
    }

    DecisionStreamProcessor(AuthorizationEngine engine, ObjectMapper json) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.json = Objects.requireNonNull(json, "json");
    }

    /**
     * Answers every request read from {@code in} until end of stream.
     *
     * @return number of requests answered
     */
    public long process(Reader in, Writer out) throws IOException {
        final BufferedReader reader = in instanceof BufferedReader br ? br : new BufferedReader(in);
        long answered = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank()) continue;
            out.write(json.writeValueAsString(answer(line)));
            out.write('\n');
            out.flush();
            answered++;
        }
        log.debug("Decision stream finished after {} requests", answered);
        return answered;
    }

    ObjectNode answer(String line) {
        final JsonNode request;
        try {
            request = json.readTree(line);
        } catch (JsonProcessingException e) {
            return render(null, null, Decision.deny(DenyReason.INVALID_ARGUMENTS,
                    "Malformed request: " + e.getOriginalMessage()));
        }

        final String user = request.path("user").asText("");
        final String action = request.path("action").asText("");
        if (!request.isObject() || user.isBlank() || action.isBlank()) {
            return render(user, action, Decision.deny(DenyReason.INVALID_ARGUMENTS,
                    "Request needs a user and an action"));
        }

        final Set<String> groups = new LinkedHashSet<>();
        for (JsonNode g : request.path("groups")) {
            if (g.isTextual()) groups.add(g.asText());
        }

        final Principal principal = new Principal(user, groups);
        return render(user, action, engine.authorize(principal, action, request.get("args")));
    }

    private ObjectNode render(String user, String action, Decision decision) {
        final ObjectNode out = json.createObjectNode();
        out.put("user", user);
        out.put("action", action);
        out.put("effect", decision.effect().name());
        decision.denyReason().ifPresent(r -> out.put("reason", r.name()));
        out.put("message", decision.message());
        decision.rewrittenArguments().ifPresent(a -> out.set("effective_args", a));
        return out;
    }
}
