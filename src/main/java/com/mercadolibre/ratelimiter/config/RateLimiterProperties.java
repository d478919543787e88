package com.mercadolibre.ratelimiter.config;

import com.mercadolibre.ratelimiter.ratelimit.core.EndpointConfig;
import com.mercadolibre.ratelimiter.ratelimit.core.RateLimiterConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Validated
@ConfigurationProperties(prefix = "ratelimiter")
public record RateLimiterProperties(
        @NotBlank String backend,                                  // "memory" | "redis"
        @NotBlank @Pattern(regexp = "[A-Za-z0-9_.-]+") String keyPrefix,
        @Min(1) int scanBatchSize,                                 // keys per SCAN / MGET round trip
        Map<String, @Valid Endpoint> endpoints
) {

    /**
     * Omitted durations take the {@link EndpointConfig} defaults.
     */
    public record Endpoint(
            @Min(1) int maxRequests,
            Duration timeWindow,
            Duration slidingWindowInterval
    ) {
    }

    public RateLimiterConfig toRateLimiterConfig() {
        Map<String, EndpointConfig> out = new LinkedHashMap<>();
        if (endpoints != null) {
            endpoints.forEach((endpoint, e) -> {
                try {
                    out.put(endpoint, new EndpointConfig(e.maxRequests(), e.timeWindow(), e.slidingWindowInterval()));
                } catch (IllegalArgumentException ex) {
                    throw new IllegalArgumentException("invalid rate limit for endpoint '" + endpoint + "': " + ex.getMessage(), ex);
                }
            });
        }
        return RateLimiterConfig.of(out);
    }
}
