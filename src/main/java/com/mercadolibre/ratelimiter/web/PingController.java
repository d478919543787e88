package com.mercadolibre.ratelimiter.web;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Sample routes guarded by the limiter.
 */
@RestController
public class PingController {

    @GetMapping(path = "/ping", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, String>> ping() {
        return Mono.just(Map.of("message", "pong"));
    }

    @GetMapping(path = "/", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, String>> welcome() {
        return Mono.just(Map.of("message", "Welcome to the rate limiter example!"));
    }
}
