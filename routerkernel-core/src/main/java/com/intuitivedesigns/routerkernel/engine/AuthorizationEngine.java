/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.intuitivedesigns.routerkernel.config.ConfigurationException;
import com.intuitivedesigns.routerkernel.config.KernelConfig;
import com.intuitivedesigns.routerkernel.core.ApiAuthorization;
import com.intuitivedesigns.routerkernel.core.ApiCall;
import com.intuitivedesigns.routerkernel.core.Decision;
import com.intuitivedesigns.routerkernel.core.DenyReason;
import com.intuitivedesigns.routerkernel.core.Principal;
import com.intuitivedesigns.routerkernel.core.RouterBinding;
import com.intuitivedesigns.routerkernel.core.RouterParams;
import com.intuitivedesigns.routerkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.routerkernel.ratelimit.RateLimiter;
import com.intuitivedesigns.routerkernel.robot.RobotRouterParams;
import com.intuitivedesigns.routerkernel.robot.RobotRouterPlugin;
import com.intuitivedesigns.routerkernel.spi.ApiCallRouter;
import com.intuitivedesigns.routerkernel.spi.ClientLabelDirectory;
import com.intuitivedesigns.routerkernel.spi.PluginIds;
import com.intuitivedesigns.routerkernel.spi.RouterContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * Entry point for API authorization: resolves the caller's router and lets it decide on the call.
 *
 * <p>Configuration lives in an immutable snapshot swapped atomically by {@link #loadSnapshot}. A load that
 * fails leaves the current snapshot untouched. The rate limiter belongs to the engine, not to a snapshot,
 * so quotas survive reloads.</p>
 *
 * <p>Fail closed: a principal without a router, or a router that throws, gets a denial.</p>
 */
public final class AuthorizationEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationEngine.class);

    public static final String KEY_DEFAULT_ROUTER = "authz.default.router";
    public static final String KEY_BINDING_CACHE_MAX = "authz.binding.cache.max.size";
    private static final long DEFAULT_BINDING_CACHE_MAX = 10_000L;

    static final String METRIC_ALLOW = "authz_allow_total";
    static final String METRIC_DENY = "authz_deny_total";
    static final String METRIC_SNAPSHOT_LOAD = "authz_snapshot_load_total";
    static final String METRIC_SNAPSHOT_REJECT = "authz_snapshot_reject_total";
    static final String METRIC_LATENCY = "authz_decision_latency_ms";
    static final String METRIC_TRACKED_BUCKETS = "ratelimit_tracked_buckets";

    // Log throttling: at most one router failure ERROR per window
    private static final long ERROR_LOG_WINDOW_NANOS = TimeUnit.SECONDS.toNanos(10);

    private final RouterContext context;
    private final RouterFactory routers;
    private final MetricsRuntime metrics;
    private final AtomicReference<AuthorizationSnapshot> current = new AtomicReference<>(AuthorizationSnapshot.EMPTY);
    private final AtomicLong nextErrorLogAtNanos = new AtomicLong(0);

    public AuthorizationEngine(RouterContext context) {
        this(context, RouterFactory.fromClasspath());
    }

    public AuthorizationEngine(RouterContext context, RouterFactory routers) {
        this.context = Objects.requireNonNull(context, "context");
        this.routers = Objects.requireNonNull(routers, "routers");
        this.metrics = context.metrics();
    }

    /**
     * Engine on the system clock with a fresh rate limiter and every router plugin on the classpath.
     */
    public static AuthorizationEngine create(KernelConfig config, MetricsRuntime metrics, ClientLabelDirectory labels) {
        final Clock clock = Clock.systemUTC();
        return new AuthorizationEngine(new RouterContext(clock, new RateLimiter(clock), metrics, config, labels));
    }

    // --- Snapshot management ---

    public void loadSnapshot(List<ApiAuthorization> records) throws ConfigurationException {
        loadSnapshot(records, null);
    }

    /**
     * Validates {@code records}, builds their routers and publishes them as the active configuration.
     *
     * @param robotDefaults params for robot-router records that carry none of their own; may be null
     * @throws ConfigurationException on any invalid record; the previous snapshot stays active
     */
    public synchronized void loadSnapshot(List<ApiAuthorization> records, RobotRouterParams robotDefaults)
            throws ConfigurationException {
        Objects.requireNonNull(records, "records");
        final AuthorizationSnapshot next;
        try {
            next = build(records, robotDefaults);
        } catch (ConfigurationException e) {
            metrics.counter(METRIC_SNAPSHOT_REJECT);
            log.error("Rejected authorization configuration, keeping the previous snapshot ({} records): {}",
                    current.get().recordCount(), e.getMessage());
            throw e;
        }

        final AuthorizationSnapshot previous = current.getAndSet(next);
        metrics.counter(METRIC_SNAPSHOT_LOAD);
        log.info("Authorization snapshot active: {} records, default router {}",
                next.recordCount(), next.defaultBinding().map(RouterBinding::routerName).orElse("<none>"));
        if (previous != AuthorizationSnapshot.EMPTY) {
            previous.close();
        }
    }

    private AuthorizationSnapshot build(List<ApiAuthorization> records, RobotRouterParams robotDefaults)
            throws ConfigurationException {
        final List<AuthorizationResolver.Entry> entries = new ArrayList<>(records.size());
        RouterBinding defaultBinding = null;
        try {
            for (int i = 0; i < records.size(); i++) {
                final ApiAuthorization record = records.get(i);
                if (record == null) {
                    throw new ConfigurationException("Authorization record #" + i + " is empty");
                }
                if (record.router().isEmpty()) {
                    throw new ConfigurationException("Authorization record #" + i + " names no router");
                }
                if (!record.reachable()) {
                    throw new ConfigurationException("Authorization record #" + i + " (router " + record.router()
                            + ") names no users and no groups");
                }
                final RouterParams preset = presetFor(record.router(), record.routerParams(), robotDefaults);
                try {
                    entries.add(new AuthorizationResolver.Entry(record, routers.bind(record, preset, context)));
                } catch (ConfigurationException e) {
                    throw new ConfigurationException("Authorization record #" + i + " (router " + record.router()
                            + "): " + e.getMessage(), e);
                }
            }

            final String defaultRouter = context.config().getString(KEY_DEFAULT_ROUTER, "").trim();
            if (!defaultRouter.isEmpty()) {
                defaultBinding = routers.bind(defaultRouter, null, presetFor(defaultRouter, null, robotDefaults), context);
            }
        } catch (ConfigurationException e) {
            closeAll(entries);
            throw e;
        } catch (RuntimeException e) {
            closeAll(entries);
            throw new ConfigurationException("Invalid authorization configuration: " + e.getMessage(), e);
        }

        for (int idx : AuthorizationResolver.shadowedRecords(records)) {
            log.warn("Authorization record #{} (router {}) is unreachable: earlier records already cover users {} and groups {}",
                    idx, records.get(idx).router(), records.get(idx).users(), records.get(idx).groups());
        }

        final long cacheMax = context.config().getLong(KEY_BINDING_CACHE_MAX, DEFAULT_BINDING_CACHE_MAX);
        return new AuthorizationSnapshot(new AuthorizationResolver(entries), defaultBinding, cacheMax, context.clock().instant());
    }

    private static RouterParams presetFor(String router, JsonNode rawParams, RobotRouterParams robotDefaults) {
        if (robotDefaults == null || !RobotRouterPlugin.ID.equals(PluginIds.normalize(router))) {
            return null;
        }
        final boolean noOwnParams = rawParams == null || rawParams.isNull() || rawParams.isMissingNode()
                || (rawParams.isObject() && rawParams.isEmpty());
        return noOwnParams ? robotDefaults : null;
    }

    private static void closeAll(List<AuthorizationResolver.Entry> built) {
        for (AuthorizationResolver.Entry e : built) {
            e.binding().router().close();
        }
    }

    // --- Decisions ---

    /**
     * @throws NoMatchingRouterException when no record covers the principal and no default router is set
     */
    public RouterBinding resolve(Principal principal) throws NoMatchingRouterException {
        return current.get().bindingFor(principal).orElseThrow(() -> new NoMatchingRouterException(principal));
    }

    public Decision authorize(Principal principal, String action, JsonNode arguments) {
        return authorize(new ApiCall(principal, action, arguments));
    }

    public Decision authorize(ApiCall call) {
        final long startNanos = System.nanoTime();
        final Optional<RouterBinding> binding = current.get().bindingFor(call.principal());

        final Decision decision = binding.isEmpty()
                ? Decision.deny(DenyReason.NO_MATCHING_ROUTER, "no API router configured for " + call.principal().user())
                : invokeSafe(binding.get(), call);

        record(decision, startNanos);
        if (log.isDebugEnabled()) {
            log.debug("user={} action={} router={} -> {}", call.principal().user(), call.action(),
                    binding.map(RouterBinding::routerName).orElse("-"), decision);
        }
        return decision;
    }

    /**
     * Per-file filter for the archive of a flow's results. Denies everything when the principal has no
     * router.
     */
    public Predicate<String> archivePathFilter(Principal principal, String flowName) {
        final Optional<RouterBinding> binding = current.get().bindingFor(principal);
        if (binding.isEmpty()) {
            return path -> false;
        }
        final ApiCallRouter router = binding.get().router();
        try {
            return router.archivePathFilter(flowName);
        } catch (RuntimeException e) {
            throttledError("Router " + binding.get().routerName() + " failed building archive filter", e);
            return path -> false;
        }
    }

    private Decision invokeSafe(RouterBinding binding, ApiCall call) {
        try {
            final Decision d = binding.router().authorize(call);
            if (d != null) {
                return d;
            }
            throttledError("Router " + binding.routerName() + " returned no decision for " + call.action(), null);
        } catch (RuntimeException e) {
            throttledError("Router " + binding.routerName() + " failed on " + call.action(), e);
        }
        return Decision.deny(DenyReason.INTERNAL_ERROR, "authorization failed");
    }

    private void record(Decision decision, long startNanos) {
        metrics.timer(METRIC_LATENCY, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
        if (decision.allowed()) {
            metrics.counter(METRIC_ALLOW);
        } else {
            metrics.counter(METRIC_DENY);
            metrics.counter("authz_deny_" + decision.reason().token() + "_total");
        }
    }

    private void throttledError(String msg, Exception e) {
        final long now = System.nanoTime();
        final long nextAt = nextErrorLogAtNanos.get();
        if (now >= nextAt && nextErrorLogAtNanos.compareAndSet(nextAt, now + ERROR_LOG_WINDOW_NANOS)) {
            log.error(msg, e);
        } else {
            metrics.counter("authz_error_log_suppressed_total");
        }
    }

    // --- Rate limits ---

    public RateLimiter rateLimiter() {
        return context.rateLimiter();
    }

    /**
     * Drops idle quota buckets and publishes the remaining bucket count.
     *
     * @return number of buckets removed
     */
    public int pruneRateLimits() {
        final int removed = context.rateLimiter().pruneExpired();
        metrics.gauge(METRIC_TRACKED_BUCKETS, context.rateLimiter().trackedBuckets());
        return removed;
    }

    // --- Introspection ---

    public int activeRecordCount() {
        return current.get().recordCount();
    }

    public RouterContext context() {
        return context;
    }

    @Override
    public synchronized void close() {
        current.getAndSet(AuthorizationSnapshot.EMPTY).close();
        log.info("Authorization engine closed.");
    }
}
