package com.mercadolibre.ratelimiter.ratelimit.memory;

import com.mercadolibre.ratelimiter.ratelimit.core.BucketKeys;
import com.mercadolibre.ratelimiter.ratelimit.core.CounterStore;
import com.mercadolibre.ratelimiter.ratelimit.core.RateLimiterKey;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single-instance store. Buckets are indexed by {@link RateLimiterKey}, then by bucket start millis,
 * so a read only touches the caller's own buckets. Expired buckets are skipped on read, replaced on
 * write and dropped by {@link #evictExpired()}.
 */
public class InMemoryCounterStore implements CounterStore {

    private final Map<RateLimiterKey, Map<Long, Bucket>> buckets = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryCounterStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Mono<Long> get(RateLimiterKey key) {
        return Mono.fromSupplier(() -> {
            Map<Long, Bucket> own = buckets.get(key);
            if (own == null) return 0L;
            Instant now = clock.instant();
            long sum = 0;
            for (Bucket b : own.values()) {
                if (b.isLive(now)) sum += b.count();
            }
            return sum;
        });
    }

    @Override
    public Mono<Void> increment(RateLimiterKey key, Instant timestamp, Duration windowInterval, Duration ttl) {
        return Mono.fromRunnable(() -> {
            long start = BucketKeys.bucketStart(timestamp, windowInterval).toEpochMilli();
            Instant now = clock.instant();
            // the outer compute holds the key while evictExpired may be dropping its map
            buckets.compute(key, (k, own) -> {
                Map<Long, Bucket> m = own != null ? own : new ConcurrentHashMap<>();
                m.compute(start, (s, b) -> b == null || !b.isLive(now)
                        ? new Bucket(1, now.plus(ttl))
                        : new Bucket(b.count() + 1, b.expiresAt()));
                return m;
            });
        });
    }

    /**
     * Drops expired buckets and keys left without buckets, returns how many buckets were removed.
     */
    public int evictExpired() {
        Instant now = clock.instant();
        AtomicInteger removed = new AtomicInteger();
        for (RateLimiterKey key : buckets.keySet()) {
            buckets.computeIfPresent(key, (k, own) -> {
                int before = own.size();
                own.values().removeIf(b -> !b.isLive(now));
                removed.addAndGet(before - own.size());
                return own.isEmpty() ? null : own;
            });
        }
        return removed.get();
    }

    int size() {
        return buckets.values().stream().mapToInt(Map::size).sum();
    }

    int keyCount() {
        return buckets.size();
    }

    private record Bucket(long count, Instant expiresAt) {
        boolean isLive(Instant now) {
            return now.isBefore(expiresAt);
        }
    }
}
