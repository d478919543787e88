package com.mercadolibre.ratelimiter.ratelimit.redis;

import com.mercadolibre.ratelimiter.ratelimit.core.BucketKeys;
import com.mercadolibre.ratelimiter.ratelimit.core.CounterStore;
import com.mercadolibre.ratelimiter.ratelimit.core.RateLimiterKey;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Buckets are plain Redis string counters.
 * <ul>
 *   <li>read: {@code SCAN MATCH <pattern> COUNT <batch>}, deduplicated, values fetched with one {@code MGET} per batch;</li>
 *   <li>write: {@code INCR} and, for a new bucket, {@code PEXPIRE} inside one Lua script, so a bucket never lives without a TTL.</li>
 * </ul>
 */
public class RedisCounterStore implements CounterStore {

    static final String INCREMENT_SCRIPT = "local c = redis.call('INCR', KEYS[1]); "
            + "if c == 1 then redis.call('PEXPIRE', KEYS[1], ARGV[1]); end; "
            + "return c";

    private final RedisScript<Long> script = new DefaultRedisScript<>(INCREMENT_SCRIPT, Long.class);

    private final ReactiveStringRedisTemplate redis;
    private final String keyPrefix;
    private final int scanBatchSize;

    public RedisCounterStore(ReactiveStringRedisTemplate redis, String keyPrefix, int scanBatchSize) {
        if (scanBatchSize < 1) throw new IllegalArgumentException("scanBatchSize must be positive");
        this.redis = redis;
        this.keyPrefix = keyPrefix;
        this.scanBatchSize = scanBatchSize;
    }

    @Override
    public Mono<Long> get(RateLimiterKey key) {
        var options = ScanOptions.scanOptions()
                .match(BucketKeys.matchPattern(keyPrefix, key))
                .count(scanBatchSize)
                .build();
        // SCAN may return a key more than once while the keyspace changes
        return redis.scan(options)
                .distinct()
                .buffer(scanBatchSize)
                .concatMap(keys -> redis.opsForValue().multiGet(keys))
                .map(RedisCounterStore::sum)
                .reduce(0L, Long::sum);
    }

    // MGET answers null for buckets that expired after the scan saw them
    private static long sum(List<String> values) {
        return values.stream()
                .filter(Objects::nonNull)
                .mapToLong(Long::parseLong)
                .sum();
    }

    @Override
    public Mono<Void> increment(RateLimiterKey key, Instant timestamp, Duration windowInterval, Duration ttl) {
        String k = BucketKeys.bucketKey(keyPrefix, key, BucketKeys.bucketStart(timestamp, windowInterval));
        String ttlMs = String.valueOf(Math.max(1L, ttl.toMillis()));
        return redis.execute(script, List.of(k), List.of(ttlMs))
                .then();
    }
}
