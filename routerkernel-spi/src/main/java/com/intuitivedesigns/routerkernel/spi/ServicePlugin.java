/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.routerkernel.spi;

public interface ServicePlugin {
    /**
     * @return The unique ID of this plugin implementation (e.g., 'ROBOT', 'DISABLED').
     */
    String id();

    /**
     * @return The kind of plugin.
     */
    PluginKind kind();
}
