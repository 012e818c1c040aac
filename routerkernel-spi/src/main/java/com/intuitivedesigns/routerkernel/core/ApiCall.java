/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * One inbound API invocation as seen by a router.
 *
 * @param principal the authenticated caller
 * @param action    API method name in snake_case, e.g. {@code file_finder_flow}
 * @param arguments raw request arguments; never null (an empty object when absent)
 */
public record ApiCall(Principal principal, String action, JsonNode arguments) {

    public ApiCall {
        Objects.requireNonNull(principal, "principal");
        Objects.requireNonNull(action, "action");
        action = action.trim();
        if (arguments == null || arguments.isNull() || arguments.isMissingNode()) {
            arguments = JsonNodeFactory.instance.objectNode();
        }
    }

    public ApiCall withArguments(JsonNode newArguments) {
        return new ApiCall(principal, action, newArguments);
    }

    /** Text value of a top-level argument, if present and textual. */
    public Optional<String> textArgument(String field) {
        JsonNode n = arguments.get(field);
        return (n != null && n.isTextual()) ? Optional.of(n.asText()) : Optional.empty();
    }
}
