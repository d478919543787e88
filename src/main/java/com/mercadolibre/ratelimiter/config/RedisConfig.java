package com.mercadolibre.ratelimiter.config;

import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;

import java.time.Duration;

/**
 * Lettuce client for the counter store. Commands time out with the store deadline and are
 * rejected while disconnected, so an unreachable Redis resolves fail-open instead of queueing.
 */
@Configuration
@ConditionalOnProperty(name = "ratelimiter.backend", havingValue = "redis")
@EnableConfigurationProperties(RedisProperties.class)
public class RedisConfig {

    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(2);

    @Bean
    public LettuceConnectionFactory counterStoreConnectionFactory(RedisProperties props, TimeLimiterRegistry tlRegistry) {
        RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(props.getHost(), props.getPort());
        standalone.setDatabase(props.getDatabase());
        if (props.getPassword() != null && !props.getPassword().isEmpty()) {
            standalone.setPassword(RedisPassword.of(props.getPassword()));
        }

        Duration deadline = storeDeadline(tlRegistry);
        Duration connectTimeout = props.getConnectTimeout() != null ? props.getConnectTimeout() : DEFAULT_CONNECT_TIMEOUT;

        ClientOptions options = ClientOptions.builder()
                .autoReconnect(true)
                .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
                .socketOptions(SocketOptions.builder().connectTimeout(connectTimeout).build())
                .timeoutOptions(TimeoutOptions.enabled(deadline))
                .build();

        LettuceClientConfiguration clientCfg = LettuceClientConfiguration.builder()
                .clientOptions(options)
                .commandTimeout(deadline)
                .shutdownTimeout(Duration.ofMillis(100))
                .build();

        return new LettuceConnectionFactory(standalone, clientCfg);
    }

    @Bean
    public ReactiveStringRedisTemplate reactiveStringRedisTemplate(ReactiveRedisConnectionFactory cf) {
        return new ReactiveStringRedisTemplate(cf);
    }

    static Duration storeDeadline(TimeLimiterRegistry tlRegistry) {
        return tlRegistry.timeLimiter(RateLimitConfig.STORE_INSTANCE)
                .getTimeLimiterConfig()
                .getTimeoutDuration();
    }
}
