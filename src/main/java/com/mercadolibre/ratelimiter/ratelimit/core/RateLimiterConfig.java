package com.mercadolibre.ratelimiter.ratelimit.core;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Endpoint to limit mapping. Endpoints without an entry are not limited.
 */
public final class RateLimiterConfig {

    private final Map<String, EndpointConfig> endpoints;

    private RateLimiterConfig(Map<String, EndpointConfig> endpoints) {
        this.endpoints = Map.copyOf(endpoints);
    }

    public static RateLimiterConfig of(Map<String, EndpointConfig> endpoints) {
        return new RateLimiterConfig(endpoints);
    }

    public static RateLimiterConfig empty() {
        return new RateLimiterConfig(Map.of());
    }

    public Optional<EndpointConfig> forEndpoint(String endpoint) {
        return Optional.ofNullable(endpoints.get(endpoint));
    }

    public Set<String> endpoints() {
        return endpoints.keySet();
    }

    public Map<String, EndpointConfig> asMap() {
        return endpoints;
    }
}
