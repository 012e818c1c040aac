/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.spi;

import java.util.List;

/**
 * The central registry for all loaded plugins.
 */
public final class PluginCatalog {

    private final ServicePluginRegistry<RouterPlugin<?>> routers;

    public PluginCatalog(ClassLoader cl) {
        this.routers = new ServicePluginRegistry<>(RouterPlugin.class.getSimpleName(), loadRouters(cl));
    }

    public PluginCatalog(List<? extends RouterPlugin<?>> routers) {
        this.routers = new ServicePluginRegistry<>(RouterPlugin.class.getSimpleName(), routers);
    }

    public ServicePluginRegistry<RouterPlugin<?>> routers() {
        return routers;
    }

    @SuppressWarnings({"rawtypes", "unchecked"})
    private static Iterable<RouterPlugin<?>> loadRouters(ClassLoader cl) {
        // ServiceLoader cannot be parameterized with a wildcard type
        Iterable loaded = java.util.ServiceLoader.load(RouterPlugin.class, cl);
        return (Iterable<RouterPlugin<?>>) loaded;
    }
}
