package com.mercadolibre.ratelimiter.web.filter;

import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;

import java.net.InetSocketAddress;

@FunctionalInterface
public interface ClientIdentityResolver {

    String UNKNOWN = "unknown";

    String resolve(ServerWebExchange exchange);

    /**
     * First address of {@code X-Forwarded-For}, else the peer address.
     */
    static ClientIdentityResolver forwardedFor() {
        return ex -> {
            String xff = ex.getRequest().getHeaders().getFirst("X-Forwarded-For");
            if (StringUtils.hasText(xff)) {
                String first = xff.split(",")[0].trim();
                if (StringUtils.hasText(first)) return first;
            }
            InetSocketAddress remote = ex.getRequest().getRemoteAddress();
            if (remote != null && remote.getAddress() != null) {
                return remote.getAddress().getHostAddress();
            }
            return UNKNOWN;
        };
    }
}
