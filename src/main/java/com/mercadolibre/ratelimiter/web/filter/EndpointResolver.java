package com.mercadolibre.ratelimiter.web.filter;

/**
 * Collapses a request path into the endpoint key the limits are configured under.
 */
@FunctionalInterface
public interface EndpointResolver {
    String resolve(String path);
}
