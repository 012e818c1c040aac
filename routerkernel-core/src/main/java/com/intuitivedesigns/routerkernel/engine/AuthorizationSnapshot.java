/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.engine;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.intuitivedesigns.routerkernel.core.Principal;
import com.intuitivedesigns.routerkernel.core.RouterBinding;
import com.intuitivedesigns.routerkernel.spi.ApiCallRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.Collections;

/**
 * One immutable generation of the authorization configuration, with the routers built from it.
 *
 * <p>Resolutions are memoized per principal in a bounded Caffeine cache that belongs to this generation,
 * so publishing a new snapshot drops every cached binding at once.</p>
 */
final class AuthorizationSnapshot implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationSnapshot.class);

    static final AuthorizationSnapshot EMPTY =
            new AuthorizationSnapshot(new AuthorizationResolver(List.of()), null, 0L, Instant.EPOCH);

    private final AuthorizationResolver resolver;
    private final RouterBinding defaultBinding;
    private final Cache<Principal, Optional<RouterBinding>> bindings;
    private final Instant loadedAt;

    AuthorizationSnapshot(AuthorizationResolver resolver, RouterBinding defaultBinding, long cacheMaxSize, Instant loadedAt) {
        this.resolver = resolver;
        this.defaultBinding = defaultBinding;
        this.loadedAt = loadedAt;
        this.bindings = cacheMaxSize > 0
                ? Caffeine.newBuilder().maximumSize(cacheMaxSize).build()
                : null;
    }

    Optional<RouterBinding> bindingFor(Principal principal) {
        if (bindings == null) {
            return lookup(principal);
        }
        return bindings.get(principal, this::lookup);
    }

    private Optional<RouterBinding> lookup(Principal principal) {
        final Optional<RouterBinding> matched = resolver.resolve(principal);
        return matched.isPresent() ? matched : Optional.ofNullable(defaultBinding);
    }

    AuthorizationResolver resolver() {
        return resolver;
    }

    Optional<RouterBinding> defaultBinding() {
        return Optional.ofNullable(defaultBinding);
    }

    int recordCount() {
        return resolver.size();
    }

    Instant loadedAt() {
        return loadedAt;
    }

    /**
     * Releases the routers of a retired generation. In-flight calls holding one of them still complete:
     * routers only drop caches on close.
     */
    @Override
    public void close() {
        if (bindings != null) {
            bindings.invalidateAll();
            bindings.cleanUp();
        }
        final Set<ApiCallRouter> routers = Collections.newSetFromMap(new IdentityHashMap<>());
        for (AuthorizationResolver.Entry e : resolver.entries()) {
            routers.add(e.binding().router());
        }
        if (defaultBinding != null) {
            routers.add(defaultBinding.router());
        }
        for (ApiCallRouter r : routers) {
            try {
                r.close();
            } catch (RuntimeException e) {
                log.warn("Failed closing router {}", r, e);
            }
        }
    }
}
