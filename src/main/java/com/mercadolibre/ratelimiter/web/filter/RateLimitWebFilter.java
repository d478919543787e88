package com.mercadolibre.ratelimiter.web.filter;

import com.mercadolibre.ratelimiter.ratelimit.core.SlidingWindowRateLimiter;
import org.springframework.core.Ordered;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

public class RateLimitWebFilter implements WebFilter, Ordered {

    static final byte[] REJECTION_BODY = "{\"error\":\"Rate limit exceeded\"}".getBytes(StandardCharsets.UTF_8);

    private final SlidingWindowRateLimiter limiter;
    private final EndpointResolver endpoints;
    private final ClientIdentityResolver identities;

    public RateLimitWebFilter(SlidingWindowRateLimiter limiter, EndpointResolver endpoints, ClientIdentityResolver identities) {
        this.limiter = limiter;
        this.endpoints = endpoints;
        this.identities = identities;
    }

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE + 10;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().pathWithinApplication().value();
        if (HttpMethod.OPTIONS.equals(exchange.getRequest().getMethod()) || path.startsWith("/actuator")) {
            return chain.filter(exchange);
        }

        String endpoint = endpoints.resolve(path);
        String userId = identities.resolve(exchange);

        return limiter.decide(endpoint, userId)
                .flatMap(dec -> dec.allowed() ? chain.filter(exchange) : reject(exchange));
    }

    private Mono<Void> reject(ServerWebExchange exchange) {
        var resp = exchange.getResponse();
        if (resp.isCommitted()) return Mono.empty();
        resp.setStatusCode(HttpStatus.TOO_MANY_REQUESTS);
        resp.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        return resp.writeWith(Mono.just(resp.bufferFactory().wrap(REJECTION_BODY)));
    }
}
