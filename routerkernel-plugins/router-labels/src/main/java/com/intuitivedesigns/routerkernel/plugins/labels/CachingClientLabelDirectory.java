/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.plugins.labels;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.intuitivedesigns.routerkernel.config.KernelConfig;
import com.intuitivedesigns.routerkernel.core.ClientLabel;
import com.intuitivedesigns.routerkernel.spi.ClientLabelDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Caffeine-backed front of a {@link ClientLabelDirectory}.
 *
 * Label checks sit on the request path, while the backing directory usually hits the datastore.
 * Entries expire after {@code labels.cache.ttl.seconds} so label changes show up without a reload.
 */
public final class CachingClientLabelDirectory implements ClientLabelDirectory, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CachingClientLabelDirectory.class);

    public static final String KEY_TTL_SECONDS = "labels.cache.ttl.seconds";
    public static final String KEY_MAX_SIZE = "labels.cache.max.size";

    private static final long DEFAULT_TTL_SECONDS = 60;
    private static final long DEFAULT_MAX_SIZE = 10_000;

    private final ClientLabelDirectory delegate;
    private final Cache<String, Set<ClientLabel>> cache;

    public CachingClientLabelDirectory(ClientLabelDirectory delegate, Duration ttl, long maxSize, Ticker ticker) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(ttl)
                .ticker(ticker)
                .build();
    }

    /**
     * Reads TTL and size from config; expiry follows {@code clock} so tests can drive it.
     */
    public static CachingClientLabelDirectory from(ClientLabelDirectory delegate, KernelConfig config, Clock clock) {
        long ttlSec = Math.max(0, config.getLong(KEY_TTL_SECONDS, DEFAULT_TTL_SECONDS));
        long maxSize = Math.max(0, config.getLong(KEY_MAX_SIZE, DEFAULT_MAX_SIZE));
        log.debug("Creating label cache (Size={}, TTL={}s)", maxSize, ttlSec);
        return new CachingClientLabelDirectory(delegate, Duration.ofSeconds(ttlSec), maxSize, tickerOf(clock));
    }

    static Ticker tickerOf(Clock clock) {
        Objects.requireNonNull(clock, "clock");
        return () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
    }

    @Override
    public Set<ClientLabel> labelsOf(String clientId) {
        if (clientId == null) return Set.of();
        return cache.get(clientId, this::fetch);
    }

    private Set<ClientLabel> fetch(String clientId) {
        Set<ClientLabel> labels = delegate.labelsOf(clientId);
        return labels == null ? Set.of() : Set.copyOf(labels);
    }

    public void invalidate(String clientId) {
        cache.invalidate(clientId);
    }

    long estimatedSize() {
        return cache.estimatedSize();
    }

    @Override
    public void close() {
        cache.invalidateAll();
        cache.cleanUp();
    }
}
