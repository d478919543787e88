package com.mercadolibre.ratelimiter.management;

import com.mercadolibre.ratelimiter.metrics.RateLimiterMetrics;
import com.mercadolibre.ratelimiter.ratelimit.core.Decision;
import com.mercadolibre.ratelimiter.ratelimit.core.RateLimiterConfig;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.endpoint.annotation.*;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

@Component
@Endpoint(id = "ratelimiterstats")
public class RateLimiterStatsEndpoint {

    private final MeterRegistry registry;
    private final RateLimiterMetrics metrics;
    private final RateLimiterConfig config;

    public RateLimiterStatsEndpoint(MeterRegistry registry, RateLimiterMetrics metrics, RateLimiterConfig config) {
        this.registry = registry;
        this.metrics = metrics;
        this.config = config;
    }

    @ReadOperation
    public Map<String, Object> stats() {
        Map<String, Object> out = new LinkedHashMap<>();

        Map<String, Double> decisions = new LinkedHashMap<>();
        for (Decision.Outcome o : Decision.Outcome.values()) {
            decisions.put(o.name().toLowerCase(), metrics.decisionCount(o));
        }
        out.put("decisions_total", decisions);

        Map<String, Double> failures = new TreeMap<>();
        registry.find(RateLimiterMetrics.STORE_FAILURES).counters().forEach(c -> {
            String op = c.getId().getTag("operation");
            failures.merge(op != null ? op : "unknown", c.count(), Double::sum);
        });
        out.put("store_failures_total", failures);

        Map<String, Object> endpoints = new TreeMap<>();
        config.asMap().forEach((endpoint, conf) -> endpoints.put(endpoint, Map.of(
                "max_requests", conf.maxRequests(),
                "time_window", conf.timeWindow().toString(),
                "sliding_window_interval", conf.slidingWindowInterval().toString())));
        out.put("endpoints", endpoints);

        return out;
    }
}
