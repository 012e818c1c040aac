/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.ratelimit;

import com.intuitivedesigns.routerkernel.core.Decision;
import com.intuitivedesigns.routerkernel.core.DenyReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory quota tracker for rate-limited actions.
 *
 * <p>Two independent constraints, both must pass:</p>
 * <ul>
 *   <li>daily cap: at most {@code maxDaily} admissions per (client, action) in the trailing 24 hours</li>
 *   <li>duplicate interval: the same (client, action, fingerprint) at most once per {@code minInterval}</li>
 * </ul>
 * A limit of 0 means unlimited.
 *
 * <p>Check and record form one atomic step per (client, action) bucket: the whole admission runs inside
 * {@link ConcurrentHashMap#compute}, which locks only that bucket's bin. Distinct clients never contend.</p>
 *
 * <p>State is per process. Several engine instances behind a load balancer each enforce their own quota.</p>
 */
public final class RateLimiter {

    public static final Duration WINDOW = Duration.ofHours(24);

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    // At most one clock-skew warning per window
    private static final long SKEW_LOG_WINDOW_NANOS = TimeUnit.SECONDS.toNanos(30);

    private final Clock clock;
    private final ConcurrentHashMap<RateLimitKey.Scope, Bucket> buckets = new ConcurrentHashMap<>();
    private final AtomicLong nextSkewLogAtNanos = new AtomicLong(0);

    public RateLimiter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Clock clock() {
        return clock;
    }

    public Decision admitAndRecord(RateLimitKey key, long maxDaily, Duration minInterval) {
        return admitAndRecord(key, clock.instant(), maxDaily, minInterval);
    }

    /**
     * Checks both constraints for {@code key} at {@code now} and, if both pass, records the admission.
     *
     * @param maxDaily    admissions allowed per client and action in 24h; 0 = unlimited
     * @param minInterval minimum spacing of identical calls; null or zero = unlimited
     */
    public Decision admitAndRecord(RateLimitKey key, Instant now, long maxDaily, Duration minInterval) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(now, "now");
        final Duration interval = (minInterval == null || minInterval.isNegative()) ? Duration.ZERO : minInterval;

        final Decision[] result = new Decision[1];
        buckets.compute(key.scope(), (scope, existing) -> {
            final Bucket bucket = (existing != null) ? existing : new Bucket();
            // Retention must cover this call's interval before anything is pruned
            bucket.retainAtLeast(interval);
            bucket.prune(now);
            result[0] = bucket.admit(key, now, maxDaily, interval);
            return bucket.isEmpty() ? null : bucket;
        });
        return result[0];
    }

    /**
     * Drops entries past their retention and removes empty buckets.
     *
     * @return number of buckets removed
     */
    public int pruneExpired() {
        return pruneExpired(clock.instant());
    }

    public int pruneExpired(Instant now) {
        int removed = 0;
        for (RateLimitKey.Scope scope : buckets.keySet()) {
            final boolean[] dropped = new boolean[1];
            buckets.computeIfPresent(scope, (s, bucket) -> {
                bucket.prune(now);
                dropped[0] = bucket.isEmpty();
                return dropped[0] ? null : bucket;
            });
            if (dropped[0]) removed++;
        }
        if (removed > 0) {
            log.debug("Pruned {} idle rate-limit buckets ({} remain)", removed, buckets.size());
        }
        return removed;
    }

    public int trackedBuckets() {
        return buckets.size();
    }

    /**
     * Admissions recorded for a client and action within the 24h window ending now.
     */
    public int recordedCount(String clientId, String action) {
        final Instant now = clock.instant();
        final int[] count = new int[1];
        buckets.computeIfPresent(new RateLimitKey.Scope(clientId, action), (s, bucket) -> {
            count[0] = bucket.countSince(now.minus(WINDOW));
            return bucket;
        });
        return count[0];
    }

    private void warnSkew(RateLimitKey key, Duration skew) {
        final long now = System.nanoTime();
        final long nextAt = nextSkewLogAtNanos.get();
        if (now >= nextAt && nextSkewLogAtNanos.compareAndSet(nextAt, now + SKEW_LOG_WINDOW_NANOS)) {
            log.warn("Clock skew detected for client={} action={}: last admission is {}ms in the future. Treating elapsed time as zero.",
                    key.clientId(), key.action(), skew.toMillis());
        }
    }

    private record Entry(Instant at, String fingerprint) {}

    /**
     * Admission history of one (client, action). Only touched inside a map compute call.
     */
    private final class Bucket {
        private final ArrayDeque<Entry> entries = new ArrayDeque<>();
        private Duration retention = WINDOW;

        Decision admit(RateLimitKey key, Instant now, long maxDaily, Duration minInterval) {
            if (maxDaily > 0) {
                final int count = countSince(now.minus(WINDOW));
                if (count >= maxDaily) {
                    return Decision.deny(DenyReason.DAILY_QUOTA_EXCEEDED,
                            "client " + key.clientId() + " already had " + count + " " + key.action()
                                    + " calls in the last 24h (limit " + maxDaily + ")");
                }
            }

            if (!minInterval.isZero()) {
                final Entry last = lastWithFingerprint(key.fingerprint());
                if (last != null) {
                    Duration elapsed = Duration.between(last.at(), now);
                    if (elapsed.isNegative()) {
                        warnSkew(key, elapsed.negated());
                        elapsed = Duration.ZERO;
                    }
                    if (elapsed.compareTo(minInterval) < 0) {
                        return Decision.deny(DenyReason.DUPLICATE_TOO_SOON,
                                "identical " + key.action() + " call for client " + key.clientId() + " was admitted "
                                        + elapsed.toSeconds() + "s ago (minimum interval " + minInterval.toSeconds() + "s)");
                    }
                }
            }

            entries.addLast(new Entry(now, key.fingerprint()));
            return Decision.allow();
        }

        void retainAtLeast(Duration minInterval) {
            if (minInterval.compareTo(retention) > 0) {
                retention = minInterval;
            }
        }

        int countSince(Instant cutoff) {
            int n = 0;
            for (Entry e : entries) {
                if (!e.at().isBefore(cutoff)) n++;
            }
            return n;
        }

        void prune(Instant now) {
            final Instant cutoff = now.minus(retention);
            entries.removeIf(e -> e.at().isBefore(cutoff));
        }

        boolean isEmpty() {
            return entries.isEmpty();
        }

        private Entry lastWithFingerprint(String fingerprint) {
            for (Iterator<Entry> it = entries.descendingIterator(); it.hasNext(); ) {
                final Entry e = it.next();
                if (e.fingerprint().equals(fingerprint)) return e;
            }
            return null;
        }
    }
}
