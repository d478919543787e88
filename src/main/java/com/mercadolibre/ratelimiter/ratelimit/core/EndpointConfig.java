package com.mercadolibre.ratelimiter.ratelimit.core;

import java.time.Duration;

/**
 * Limit attached to one endpoint: at most {@code maxRequests} admitted requests inside the
 * trailing {@code timeWindow}, counted in buckets {@code slidingWindowInterval} wide.
 * <p>
 * A {@code null} duration falls back to its default on its own, so an interval larger than the
 * window is accepted; it only makes the window coarser.
 */
public record EndpointConfig(int maxRequests, Duration timeWindow, Duration slidingWindowInterval) {

    public static final int DEFAULT_MAX_REQUESTS = 100;
    public static final Duration DEFAULT_TIME_WINDOW = Duration.ofHours(24);
    public static final Duration DEFAULT_SLIDING_WINDOW_INTERVAL = Duration.ofMinutes(1);

    public EndpointConfig {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be positive, got " + maxRequests);
        }
        timeWindow = positiveOrDefault("timeWindow", timeWindow, DEFAULT_TIME_WINDOW);
        slidingWindowInterval = positiveOrDefault("slidingWindowInterval", slidingWindowInterval,
                DEFAULT_SLIDING_WINDOW_INTERVAL);
    }

    public static EndpointConfig defaults() {
        return new EndpointConfig(DEFAULT_MAX_REQUESTS, DEFAULT_TIME_WINDOW, DEFAULT_SLIDING_WINDOW_INTERVAL);
    }

    public static EndpointConfig of(int maxRequests) {
        return new EndpointConfig(maxRequests, null, null);
    }

    private static Duration positiveOrDefault(String name, Duration value, Duration fallback) {
        if (value == null) return fallback;
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
        return value;
    }
}
