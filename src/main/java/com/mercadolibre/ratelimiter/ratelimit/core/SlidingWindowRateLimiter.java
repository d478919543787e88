package com.mercadolibre.ratelimiter.ratelimit.core;

import com.mercadolibre.ratelimiter.metrics.RateLimiterMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

/**
 * Sliding-window-counter admission: a request is admitted while the sum of the caller's live
 * buckets for the endpoint is below the endpoint limit, and only admitted requests are counted.
 * <p>
 * The read and the increment are two store calls, so concurrent requests of one caller may
 * overshoot the limit by the number of requests in flight.
 */
public class SlidingWindowRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    /**
     * Requests are admitted whenever the store cannot be read or written, timeouts included.
     * Flipping this turns every store outage into an outage of the protected service.
     */
    public static final boolean ADMIT_ON_STORE_FAILURE = true;

    private final RateLimiterConfig config;
    private final CounterStore store;
    private final Clock clock;
    private final RateLimiterMetrics metrics;

    public SlidingWindowRateLimiter(RateLimiterConfig config, CounterStore store, Clock clock, RateLimiterMetrics metrics) {
        this.config = config;
        this.store = store;
        this.clock = clock;
        this.metrics = metrics;
    }

    public Mono<Boolean> allowRequest(String endpoint, String userId) {
        return decide(endpoint, userId).map(Decision::allowed);
    }

    public Mono<Decision> decide(String endpoint, String userId) {
        var conf = config.forEndpoint(endpoint).orElse(null);
        if (conf == null) {
            return Mono.just(Decision.unlimited(endpoint)).doOnNext(metrics::recordDecision);
        }
        var key = new RateLimiterKey(userId, endpoint);
        return Mono.defer(() -> {
                    Instant now = clock.instant();
                    return store.get(key)
                            .defaultIfEmpty(0L)
                            .flatMap(count -> count < conf.maxRequests()
                                    ? admit(key, now, conf)
                                    : Mono.just(Decision.rejected(endpoint)));
                })
                .onErrorResume(e -> Mono.just(onStoreFailure("get", key, e)))
                .doOnNext(dec -> {
                    if (!dec.allowed()) log.debug("rejected user={} endpoint={}", userId, dec.endpoint());
                    metrics.recordDecision(dec);
                });
    }

    private Mono<Decision> admit(RateLimiterKey key, Instant now, EndpointConfig conf) {
        return store.increment(key, now, conf.slidingWindowInterval(), conf.timeWindow())
                .thenReturn(Decision.admitted(key.endpoint()))
                .onErrorResume(e -> {
                    // the read succeeded, a lost increment only undercounts
                    onStoreFailure("increment", key, e);
                    return Mono.just(Decision.admitted(key.endpoint()));
                });
    }

    private Decision onStoreFailure(String operation, RateLimiterKey key, Throwable e) {
        metrics.recordStoreFailure(operation);
        log.warn("counter store {} failed for user={} endpoint={}, admitting: {}",
                operation, key.userId(), key.endpoint(), e.toString());
        return ADMIT_ON_STORE_FAILURE ? Decision.failOpen(key.endpoint()) : Decision.rejected(key.endpoint());
    }
}
