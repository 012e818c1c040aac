/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.app;

import com.intuitivedesigns.routerkernel.config.ConfigurationException;
import com.intuitivedesigns.routerkernel.config.KernelConfig;
import com.intuitivedesigns.routerkernel.engine.AuthorizationEngine;
import com.intuitivedesigns.routerkernel.engine.RouterFactory;
import com.intuitivedesigns.routerkernel.metrics.MetricsFactory;
import com.intuitivedesigns.routerkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.routerkernel.metrics.MetricsSettings;
import com.intuitivedesigns.routerkernel.ratelimit.RateLimiter;
import com.intuitivedesigns.routerkernel.spi.ClientLabelDirectory;
import com.intuitivedesigns.routerkernel.spi.RouterContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Boots the engine from {@link KernelConfig}, answers JSON-line requests from stdin on stdout,
 * and keeps configuration and quota state fresh in the background.
 */
public final class RouterKernelApp {

    private static final Logger log = LoggerFactory.getLogger(RouterKernelApp.class);

    // --- Config Keys ---
    static final String CFG_AUTHZ_PATH = "authz.config.path";
    static final String CFG_ROBOT_DEFAULTS_PATH = "authz.robot.defaults.path";
    static final String CFG_CLIENT_LABELS_PATH = "authz.client.labels.path";
    static final String CFG_RELOAD_SECONDS = "authz.reload.interval.seconds";
    static final String CFG_PRUNE_SECONDS = "ratelimit.prune.interval.seconds";

    // --- Defaults ---
    private static final int DEFAULT_RELOAD_SECONDS = 30;
    private static final int DEFAULT_PRUNE_SECONDS = 300;

    private RouterKernelApp() {}

    public static void main(String[] args) {
        log.info("=== Booting RouterKernel ===");

        final KernelConfig config = KernelConfig.get();
        final RouterFactory routers = RouterFactory.fromClasspath();
        routers.logAvailablePlugins();

        MetricsRuntime metrics = null;
        AuthorizationEngine engine = null;
        ScheduledExecutorService scheduler = null;
        final AtomicBoolean shutdownStarted = new AtomicBoolean(false);

        try {
            // 1. Initialize Metrics
            metrics = MetricsFactory.init(MetricsSettings.from(config));

            // 2. Collaborators
            final ClientLabelDirectory labels = optionalPath(config, CFG_CLIENT_LABELS_PATH) == null
                    ? ClientLabelDirectory.EMPTY
                    : AuthorizationFileLoader.loadClientLabels(optionalPath(config, CFG_CLIENT_LABELS_PATH));
            final Clock clock = Clock.systemUTC();
            engine = new AuthorizationEngine(
                    new RouterContext(clock, new RateLimiter(clock), metrics, config, labels), routers);

            // 3. Initial snapshot; a broken file is fatal at startup
            final Path authzPath = optionalPath(config, CFG_AUTHZ_PATH);
            if (authzPath == null) {
                throw new ConfigurationException("Missing required setting " + CFG_AUTHZ_PATH);
            }
            final SnapshotReloader reloader =
                    new SnapshotReloader(engine, authzPath, optionalPath(config, CFG_ROBOT_DEFAULTS_PATH));
            reloader.loadNow();

            // 4. Background maintenance
            final int reloadSec = Math.max(0, config.getInt(CFG_RELOAD_SECONDS, DEFAULT_RELOAD_SECONDS));
            final int pruneSec = Math.max(1, config.getInt(CFG_PRUNE_SECONDS, DEFAULT_PRUNE_SECONDS));
            scheduler = Executors.newScheduledThreadPool(1, new NamedDaemonThreadFactory("rk-maintenance"));
            if (reloadSec > 0) {
                scheduler.scheduleWithFixedDelay(reloader, reloadSec, reloadSec, TimeUnit.SECONDS);
            }
            final AuthorizationEngine finalEngine = engine;
            scheduler.scheduleWithFixedDelay(() -> prune(finalEngine), pruneSec, pruneSec, TimeUnit.SECONDS);
            log.info("CONFIG: authz={} | reload={}s | prune={}s | metrics={}",
                    authzPath, reloadSec, pruneSec, metrics.type());

            // 5. Shutdown Hook
            final MetricsRuntime finalMetrics = metrics;
            final ScheduledExecutorService finalScheduler = scheduler;
            Runtime.getRuntime().addShutdownHook(new Thread(
                    () -> shutdown(shutdownStarted, finalScheduler, finalEngine, finalMetrics), "rk-shutdown"));

            // 6. Serve until stdin closes
            final DecisionStreamProcessor processor = new DecisionStreamProcessor(engine);
            final long answered = processor.process(
                    new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                    new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
            log.info("Input closed after {} requests.", answered);

            shutdown(shutdownStarted, scheduler, engine, metrics);
        } catch (Throwable t) {
            log.error("Fatal application error", t);
            shutdown(shutdownStarted, scheduler, engine, metrics);
            System.exit(1);
        }
    }

    private static void prune(AuthorizationEngine engine) {
        try {
            final int removed = engine.pruneRateLimits();
            log.debug("Pruned {} idle rate-limit buckets", removed);
        } catch (RuntimeException e) {
            log.warn("Rate-limit prune failed", e);
        }
    }

    private static void shutdown(AtomicBoolean started, ScheduledExecutorService scheduler,
                                 AuthorizationEngine engine, MetricsRuntime metrics) {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down.");
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
        closeLogged(engine);
        closeLogged(metrics);
    }

    static Path optionalPath(KernelConfig config, String key) {
        final String raw = config.getString(key, null);
        return (raw == null || raw.isBlank()) ? null : Path.of(raw.trim());
    }

    private static void closeLogged(AutoCloseable resource) {
        if (resource == null) return;
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Error closing {}: {}", resource.getClass().getSimpleName(), e.getMessage());
        }
    }

    private static final class NamedDaemonThreadFactory implements ThreadFactory {
        private final String name;

        private NamedDaemonThreadFactory(String name) {
            this.name = name;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        }
    }
}
