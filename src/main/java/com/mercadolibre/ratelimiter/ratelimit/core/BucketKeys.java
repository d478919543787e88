package com.mercadolibre.ratelimiter.ratelimit.core;

import java.time.Duration;
import java.time.Instant;

/**
 * Bucket key layout shared by every store: {@code <prefix>:<userId>:<endpoint>:<bucketStartMillis>}.
 * <p>
 * User id and endpoint are percent-escaped for the delimiter, the escape character and the glob
 * metacharacters, so {@link #matchPattern} only ever matches buckets of exactly one key.
 */
public final class BucketKeys {

    public static final char DELIMITER = ':';

    private static final String ESCAPED = "%:*?[]\\";

    private BucketKeys() {}

    /**
     * Start of the bucket {@code timestamp} falls into (floor, never rounded up).
     */
    public static Instant bucketStart(Instant timestamp, Duration windowInterval) {
        long intervalMs = Math.max(1L, windowInterval.toMillis()); // sub-millisecond intervals degrade to 1ms
        long ts = timestamp.toEpochMilli();
        return Instant.ofEpochMilli(ts - Math.floorMod(ts, intervalMs));
    }

    public static String bucketKey(String prefix, RateLimiterKey key, Instant bucketStart) {
        return keyPrefix(prefix, key) + bucketStart.toEpochMilli();
    }

    /**
     * Literal prefix shared by all buckets of {@code key}, delimiter included.
     */
    public static String keyPrefix(String prefix, RateLimiterKey key) {
        return prefix + DELIMITER + escape(key.userId()) + DELIMITER + escape(key.endpoint()) + DELIMITER;
    }

    /**
     * Glob pattern (Redis {@code SCAN MATCH} syntax) selecting all buckets of {@code key}.
     */
    public static String matchPattern(String prefix, RateLimiterKey key) {
        return keyPrefix(prefix, key) + "*";
    }

    static String escape(String value) {
        StringBuilder sb = null;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (ESCAPED.indexOf(c) >= 0) {
                if (sb == null) sb = new StringBuilder(value.length() + 8).append(value, 0, i);
                sb.append('%').append(String.format("%02X", (int) c));
            } else if (sb != null) {
                sb.append(c);
            }
        }
        return sb == null ? value : sb.toString();
    }
}
