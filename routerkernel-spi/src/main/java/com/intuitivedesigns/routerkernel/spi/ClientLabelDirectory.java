/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.spi;

import com.intuitivedesigns.routerkernel.core.ClientLabel;

import java.util.Set;

/**
 * Lookup of the labels attached to a client. Backed by the datastore of the hosting service.
 */
@FunctionalInterface
public interface ClientLabelDirectory {

    /** Directory that knows no clients; every client-scoped label check fails against it. */
    ClientLabelDirectory EMPTY = clientId -> Set.of();

    /**
     * @param clientId normalized client id ({@code C.} + 16 hex digits)
     * @return labels of the client; empty when the client is unknown
     */
    Set<ClientLabel> labelsOf(String clientId);
}
