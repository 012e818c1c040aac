/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.intuitivedesigns.routerkernel.config.ConfigurationException;
import com.intuitivedesigns.routerkernel.core.ApiAuthorization;
import com.intuitivedesigns.routerkernel.core.RouterBinding;
import com.intuitivedesigns.routerkernel.core.RouterParams;
import com.intuitivedesigns.routerkernel.spi.ApiCallRouter;
import com.intuitivedesigns.routerkernel.spi.PluginCatalog;
import com.intuitivedesigns.routerkernel.spi.RouterContext;
import com.intuitivedesigns.routerkernel.spi.RouterPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Turns authorization records into live routers through the discovered {@link RouterPlugin}s.
 */
public final class RouterFactory {

    private static final Logger log = LoggerFactory.getLogger(RouterFactory.class);

    private final PluginCatalog catalog;

    public RouterFactory(PluginCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    /**
     * Factory over every router plugin registered in {@code META-INF/services}.
     */
    public static RouterFactory fromClasspath() {
        return new RouterFactory(new PluginCatalog(resolveClassLoader()));
    }

    public static RouterFactory of(List<? extends RouterPlugin<?>> plugins) {
        return new RouterFactory(new PluginCatalog(plugins));
    }

    public void logAvailablePlugins() {
        log.info("Router plugins: {}", catalog.routers().availableIds());
    }

    public boolean isKnown(String routerName) {
        return catalog.routers().get(routerName).isPresent();
    }

    /**
     * Builds the router of one record.
     *
     * @param presetParams typed params to use instead of parsing the record's own; ignored unless they
     *                     belong to the record's router kind
     */
    public RouterBinding bind(ApiAuthorization record, RouterParams presetParams, RouterContext context)
            throws ConfigurationException {
        return bind(record.router(), record.routerParams(), presetParams, context);
    }

    public RouterBinding bind(String routerName, JsonNode rawParams, RouterParams presetParams, RouterContext context)
            throws ConfigurationException {
        Objects.requireNonNull(context, "context");
        final RouterPlugin<?> plugin = catalog.routers().get(routerName)
                .orElseThrow(() -> new ConfigurationException("Unknown router '" + routerName + "'. "
                        + "Available options: " + catalog.routers().availableIds()));
        return bindTyped(plugin, routerName, rawParams, presetParams, context);
    }

    private static <P extends RouterParams> RouterBinding bindTyped(RouterPlugin<P> plugin,
                                                                    String routerName,
                                                                    JsonNode rawParams,
                                                                    RouterParams presetParams,
                                                                    RouterContext context) throws ConfigurationException {
        final P params = (presetParams != null && presetParams.getClass() == plugin.paramsType())
                ? plugin.paramsType().cast(presetParams)
                : plugin.parseParams(rawParams);
        return new RouterBinding(routerName, params, createSafe(plugin, params, context));
    }

    private static <P extends RouterParams> ApiCallRouter createSafe(RouterPlugin<P> plugin, P params, RouterContext context)
            throws ConfigurationException {
        final ApiCallRouter router;
        try {
            router = plugin.create(params, context);
        } catch (ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ConfigurationException("Failed creating router [" + plugin.id() + "]", e);
        }
        if (router == null) {
            throw new ConfigurationException("Router plugin [" + plugin.id() + "] returned no router");
        }
        return router;
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader ctx = Thread.currentThread().getContextClassLoader();
        return (ctx != null) ? ctx : RouterFactory.class.getClassLoader();
    }
}
