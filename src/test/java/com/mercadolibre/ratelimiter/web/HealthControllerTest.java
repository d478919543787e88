package com.mercadolibre.ratelimiter.web;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.test.web.reactive.server.WebTestClient;

@WebFluxTest(controllers = {HealthController.class, PingController.class})
class HealthControllerTest {

    @Autowired
    WebTestClient client;

    @Test
    void healthz_returns_ok() {
        client.get().uri("/healthz")
                .exchange()
                .expectStatus().isOk()
                .expectBody(String.class).isEqualTo("ok");
    }

    @Test
    void ping_returns_pong() {
        client.get().uri("/ping")
                .exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.message").isEqualTo("pong");
    }

    @Test
    void root_returns_welcome() {
        client.get().uri("/")
                .exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.message").isEqualTo("Welcome to the rate limiter example!");
    }
}
