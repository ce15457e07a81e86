/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.metrics;

import java.io.IOException;

import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpExchange;

/**
 * Rejects every request to the metrics server that is not a GET with
 * <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/405">405 Method Not Allowed</a>.
 */
class UnsupportedHttpMethodFilter extends Filter {

    static final Filter INSTANCE = new UnsupportedHttpMethodFilter();

    private UnsupportedHttpMethodFilter() {
    }

    @Override
    public void doFilter(HttpExchange exchange, Chain chain) throws IOException {
        if ("GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            chain.doFilter(exchange);
        }
        else {
            try (exchange) {
                // nothing but GET is expected, so the request body is deliberately left unread
                exchange.getResponseHeaders().add("Allow", "GET");
                exchange.sendResponseHeaders(405, -1);
            }
        }
    }

    @Override
    public String description() {
        return "Rejects methods other than GET";
    }
}
