/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.robot;

import java.util.Optional;

/**
 * API actions the robot router knows about. Anything else is refused.
 */
public enum RobotAction {
    SEARCH_CLIENTS("search_clients"),
    FILE_FINDER_FLOW("file_finder_flow"),
    ARTIFACT_COLLECTOR_FLOW("artifact_collector_flow"),
    GET_FLOW("get_flow"),
    LIST_FLOW_RESULTS("list_flow_results"),
    LIST_FLOW_LOGS("list_flow_logs"),
    GET_FLOW_FILES_ARCHIVE("get_flow_files_archive"),
    CREATE_FLOW("create_flow");

    private final String wireName;

    RobotAction(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<RobotAction> fromWireName(String name) {
        for (RobotAction a : values()) {
            if (a.wireName.equals(name)) return Optional.of(a);
        }
        return Optional.empty();
    }
}
