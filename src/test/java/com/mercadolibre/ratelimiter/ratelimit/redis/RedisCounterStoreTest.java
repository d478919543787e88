package com.mercadolibre.ratelimiter.ratelimit.redis;

import com.mercadolibre.ratelimiter.ratelimit.core.RateLimiterKey;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ReactiveValueOperations;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisCounterStoreTest {

    private final RateLimiterKey key = new RateLimiterKey("10.0.0.1", "/ping");

    @Mock
    ReactiveStringRedisTemplate redis;

    @Mock
    ReactiveValueOperations<String, String> values;

    // every bucket holds 2, keys ending in ":gone" expired after the scan
    private void stubValues() {
        when(redis.opsForValue()).thenReturn(values);
        when(values.multiGet(anyCollection())).thenAnswer(inv -> {
            Collection<String> keys = inv.getArgument(0);
            List<String> out = new ArrayList<>();
            for (String k : keys) out.add(k.endsWith(":gone") ? null : "2");
            return Mono.just(out);
        });
    }

    @Test
    void get_sums_scanned_buckets_with_the_key_pattern() {
        stubValues();
        when(redis.scan(any(ScanOptions.class))).thenReturn(Flux.just("rl:10.0.0.1:/ping:0", "rl:10.0.0.1:/ping:5000"));
        var store = new RedisCounterStore(redis, "rl", 100);

        StepVerifier.create(store.get(key)).expectNext(4L).verifyComplete();

        ArgumentCaptor<ScanOptions> options = ArgumentCaptor.forClass(ScanOptions.class);
        verify(redis).scan(options.capture());
        assertThat(options.getValue().getPattern()).isEqualTo("rl:10.0.0.1:/ping:*");
        assertThat(options.getValue().getCount()).isEqualTo(100L);
    }

    @Test
    void get_counts_a_key_seen_twice_once() {
        stubValues();
        when(redis.scan(any(ScanOptions.class))).thenReturn(Flux.just("rl:a:/ping:0", "rl:a:/ping:5000", "rl:a:/ping:0"));
        var store = new RedisCounterStore(redis, "rl", 100);

        StepVerifier.create(store.get(key)).expectNext(4L).verifyComplete();
    }

    @Test
    void get_reads_values_in_batches_without_changing_the_sum() {
        stubValues();
        List<String> keys = new ArrayList<>();
        for (int i = 0; i < 7; i++) keys.add("rl:10.0.0.1:/ping:" + (i * 5000));
        when(redis.scan(any(ScanOptions.class))).thenReturn(Flux.fromIterable(keys));
        var store = new RedisCounterStore(redis, "rl", 3);

        StepVerifier.create(store.get(key)).expectNext(14L).verifyComplete();
        verify(values, times(3)).multiGet(anyCollection());
    }

    @Test
    void get_ignores_buckets_expired_between_scan_and_read() {
        stubValues();
        when(redis.scan(any(ScanOptions.class))).thenReturn(Flux.just("rl:10.0.0.1:/ping:0", "rl:10.0.0.1:/ping:gone"));
        var store = new RedisCounterStore(redis, "rl", 10);

        StepVerifier.create(store.get(key)).expectNext(2L).verifyComplete();
    }

    @Test
    void get_without_buckets_is_zero_and_skips_mget() {
        when(redis.scan(any(ScanOptions.class))).thenReturn(Flux.empty());
        var store = new RedisCounterStore(redis, "rl", 10);

        StepVerifier.create(store.get(key)).expectNext(0L).verifyComplete();
        verify(values, never()).multiGet(anyCollection());
    }

    @Test
    void get_propagates_backend_errors() {
        when(redis.scan(any(ScanOptions.class))).thenReturn(Flux.error(new RedisConnectionFailureException("down")));
        var store = new RedisCounterStore(redis, "rl", 10);

        StepVerifier.create(store.get(key)).expectError(RedisConnectionFailureException.class).verify();
    }

    @Test
    void increment_runs_script_on_floored_bucket_with_ttl_in_millis() {
        when(redis.execute(ArgumentMatchers.<RedisScript<Long>>any(), anyList(), anyList())).thenReturn(Flux.just(1L));
        var store = new RedisCounterStore(redis, "rl", 10);

        StepVerifier.create(store.increment(key, Instant.ofEpochMilli(12_345), Duration.ofSeconds(5), Duration.ofMinutes(1)))
                .verifyComplete();

        verify(redis).execute(ArgumentMatchers.<RedisScript<Long>>any(),
                eq(List.of("rl:10.0.0.1:/ping:10000")),
                eq(List.of("60000")));
    }

    @Test
    void script_expires_only_new_buckets() {
        assertThat(RedisCounterStore.INCREMENT_SCRIPT)
                .contains("redis.call('INCR', KEYS[1])")
                .contains("if c == 1 then redis.call('PEXPIRE', KEYS[1], ARGV[1])");
    }

    @Test
    void rejects_non_positive_batch_size() {
        assertThatThrownBy(() -> new RedisCounterStore(redis, "rl", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
