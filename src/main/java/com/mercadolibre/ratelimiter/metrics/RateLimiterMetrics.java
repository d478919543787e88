package com.mercadolibre.ratelimiter.metrics;

import com.mercadolibre.ratelimiter.ratelimit.core.Decision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

@Component
public class RateLimiterMetrics {

    public static final String DECISIONS = "ratelimiter_decisions_total";
    public static final String STORE_FAILURES = "ratelimiter_store_failures_total";

    private final MeterRegistry registry;
    private final Map<Decision.Outcome, Counter> decisions = new EnumMap<>(Decision.Outcome.class);

    public RateLimiterMetrics(MeterRegistry registry) {
        this.registry = registry;
        for (Decision.Outcome outcome : Decision.Outcome.values()) {
            decisions.put(outcome, Counter.builder(DECISIONS)
                    .description("Rate limiter decisions by outcome")
                    .tag("outcome", outcome.name().toLowerCase())
                    .register(registry));
        }
    }

    public void recordDecision(Decision decision) {
        decisions.get(decision.outcome()).increment();
    }

    public void recordStoreFailure(String operation) {
        Counter.builder(STORE_FAILURES)
                .description("Counter store calls that failed and were resolved fail-open")
                .tags("operation", safe(operation))
                .register(registry)
                .increment();
    }

    public double decisionCount(Decision.Outcome outcome) {
        return decisions.get(outcome).count();
    }

    private static String safe(String s) {
        return s == null ? "unknown" : s;
    }
}
