package com.mercadolibre.ratelimiter.web.filter;

/**
 * {@code /ping/1?x=y} becomes {@code /ping}, the root and empty paths become {@code /}.
 */
public class FirstSegmentEndpointResolver implements EndpointResolver {

    @Override
    public String resolve(String path) {
        if (path == null) return "/";
        String p = path.trim();
        int q = p.indexOf('?');
        if (q >= 0) p = p.substring(0, q);

        int start = 0;
        while (start < p.length() && p.charAt(start) == '/') start++;
        int end = p.indexOf('/', start);
        return "/" + (end < 0 ? p.substring(start) : p.substring(start, end));
    }
}
