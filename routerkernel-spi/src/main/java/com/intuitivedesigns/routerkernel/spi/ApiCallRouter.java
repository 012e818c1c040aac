/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.spi;

import com.intuitivedesigns.routerkernel.core.ApiCall;
import com.intuitivedesigns.routerkernel.core.Decision;

import java.util.function.Predicate;

/**
 * Runtime contract of a router: decides whether one API call may proceed.
 *
 * <p><b>Performance Note:</b> called once per inbound API request, concurrently from many threads.
 * Implementations must not perform I/O on this path beyond cached lookups.</p>
 */
public interface ApiCallRouter extends AutoCloseable {

    /**
     * @param call the inbound call (principal, action name, raw arguments)
     * @return Allow or Deny(reason); never null, never thrown for an expected denial
     */
    Decision authorize(ApiCall call);

    /**
     * Predicate the archive generator applies to every file path of a flow's results.
     *
     * @param flowName name of the flow whose files are being archived
     */
    default Predicate<String> archivePathFilter(String flowName) {
        return path -> true;
    }

    /**
     * Lifecycle hook to release caches when a snapshot is retired.
     */
    @Override
    default void close() {
        // No-op by default
    }
}
