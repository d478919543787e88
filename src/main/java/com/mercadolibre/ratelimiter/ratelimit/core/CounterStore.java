package com.mercadolibre.ratelimiter.ratelimit.core;

import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

/**
 * Time-bucketed request counters. Buckets are keyed by user, endpoint and the bucket start,
 * expire on their own and are never deleted by the limiter.
 */
public interface CounterStore {

    /**
     * Sum of every live bucket of {@code key}; {@code 0} when there is none.
     */
    Mono<Long> get(RateLimiterKey key);

    /**
     * Adds one to the bucket {@code timestamp} falls into, {@code windowInterval} being the bucket
     * width. A bucket created by this call expires {@code ttl} after creation.
     */
    Mono<Void> increment(RateLimiterKey key, Instant timestamp, Duration windowInterval, Duration ttl);
}
