package com.mercadolibre.ratelimiter.ratelimit.resilience;

import com.mercadolibre.ratelimiter.ratelimit.core.CounterStore;
import com.mercadolibre.ratelimiter.ratelimit.core.RateLimiterKey;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.github.resilience4j.reactor.timelimiter.TimeLimiterOperator;
import io.github.resilience4j.timelimiter.TimeLimiter;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

/**
 * Puts a deadline and a circuit breaker around every store call. A call past the deadline is
 * cancelled and signals {@link java.util.concurrent.TimeoutException}; an open circuit signals
 * {@link io.github.resilience4j.circuitbreaker.CallNotPermittedException} without touching the store.
 */
public class ResilientCounterStore implements CounterStore {

    private final CounterStore delegate;
    private final CircuitBreaker cb;
    private final TimeLimiter tl;

    public ResilientCounterStore(CounterStore delegate, CircuitBreaker cb, TimeLimiter tl) {
        this.delegate = delegate;
        this.cb = cb;
        this.tl = tl;
    }

    @Override
    public Mono<Long> get(RateLimiterKey key) {
        return delegate.get(key)
                .transformDeferred(TimeLimiterOperator.of(tl))
                .transformDeferred(CircuitBreakerOperator.of(cb));
    }

    @Override
    public Mono<Void> increment(RateLimiterKey key, Instant timestamp, Duration windowInterval, Duration ttl) {
        return delegate.increment(key, timestamp, windowInterval, ttl)
                .transformDeferred(TimeLimiterOperator.of(tl))
                .transformDeferred(CircuitBreakerOperator.of(cb));
    }
}
