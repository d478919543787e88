package com.mercadolibre.ratelimiter.ratelimit.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

public class ExpiredBucketSweeper {

    private static final Logger log = LoggerFactory.getLogger(ExpiredBucketSweeper.class);

    private final InMemoryCounterStore store;

    public ExpiredBucketSweeper(InMemoryCounterStore store) {
        this.store = store;
    }

    @Scheduled(fixedDelayString = "${ratelimiter.memory.sweep-interval:PT1M}",
            initialDelayString = "${ratelimiter.memory.sweep-interval:PT1M}")
    public void sweep() {
        int removed = store.evictExpired();
        if (removed > 0) log.debug("evicted {} expired buckets", removed);
    }
}
