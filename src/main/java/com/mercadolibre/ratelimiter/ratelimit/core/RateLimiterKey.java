package com.mercadolibre.ratelimiter.ratelimit.core;

import java.util.Objects;

/**
 * Subject of a limit: one caller on one normalized endpoint.
 */
public record RateLimiterKey(String userId, String endpoint) {
    public RateLimiterKey {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(endpoint, "endpoint");
    }
}
