package com.mercadolibre.ratelimiter.config;

import com.mercadolibre.ratelimiter.metrics.RateLimiterMetrics;
import com.mercadolibre.ratelimiter.ratelimit.core.CounterStore;
import com.mercadolibre.ratelimiter.ratelimit.core.RateLimiterConfig;
import com.mercadolibre.ratelimiter.ratelimit.core.SlidingWindowRateLimiter;
import com.mercadolibre.ratelimiter.ratelimit.memory.ExpiredBucketSweeper;
import com.mercadolibre.ratelimiter.ratelimit.memory.InMemoryCounterStore;
import com.mercadolibre.ratelimiter.ratelimit.redis.RedisCounterStore;
import com.mercadolibre.ratelimiter.ratelimit.resilience.ResilientCounterStore;
import com.mercadolibre.ratelimiter.web.filter.ClientIdentityResolver;
import com.mercadolibre.ratelimiter.web.filter.EndpointResolver;
import com.mercadolibre.ratelimiter.web.filter.FirstSegmentEndpointResolver;
import com.mercadolibre.ratelimiter.web.filter.RateLimitWebFilter;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.*;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

@Configuration
@EnableScheduling
public class RateLimitConfig {

    private static final Logger log = LoggerFactory.getLogger(RateLimitConfig.class);

    public static final String STORE_INSTANCE = "counterStore";

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RateLimiterConfig rateLimiterConfig(RateLimiterProperties props) {
        RateLimiterConfig config = props.toRateLimiterConfig();
        log.info("rate limits configured for endpoints {}", config.endpoints());
        return config;
    }

    @Bean
    @ConditionalOnProperty(name = "ratelimiter.backend", havingValue = "memory", matchIfMissing = true)
    public InMemoryCounterStore memoryCounterStore(Clock clock) {
        log.info("using in-memory counter store");
        return new InMemoryCounterStore(clock);
    }

    @Bean
    @ConditionalOnProperty(name = "ratelimiter.backend", havingValue = "memory", matchIfMissing = true)
    public ExpiredBucketSweeper expiredBucketSweeper(InMemoryCounterStore store) {
        return new ExpiredBucketSweeper(store);
    }

    @Bean
    @ConditionalOnProperty(name = "ratelimiter.backend", havingValue = "redis")
    public RedisCounterStore redisCounterStore(ReactiveStringRedisTemplate tpl, RateLimiterProperties props) {
        log.info("using redis counter store, scan batch size {}", props.scanBatchSize());
        return new RedisCounterStore(tpl, props.keyPrefix(), props.scanBatchSize());
    }

    @Bean
    public SlidingWindowRateLimiter slidingWindowRateLimiter(
            RateLimiterConfig config,
            CounterStore store,
            Clock clock,
            RateLimiterMetrics metrics,
            CircuitBreakerRegistry cbRegistry,
            TimeLimiterRegistry tlRegistry
    ) {
        var resilient = new ResilientCounterStore(
                store,
                cbRegistry.circuitBreaker(STORE_INSTANCE),
                tlRegistry.timeLimiter(STORE_INSTANCE)
        );
        return new SlidingWindowRateLimiter(config, resilient, clock, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public EndpointResolver endpointResolver() {
        return new FirstSegmentEndpointResolver();
    }

    @Bean
    @ConditionalOnMissingBean
    public ClientIdentityResolver clientIdentityResolver() {
        return ClientIdentityResolver.forwardedFor();
    }

    @Bean
    public RateLimitWebFilter rateLimitWebFilter(SlidingWindowRateLimiter limiter,
                                                 EndpointResolver endpoints,
                                                 ClientIdentityResolver identities) {
        return new RateLimitWebFilter(limiter, endpoints, identities);
    }
}
