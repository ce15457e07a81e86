/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.client;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.util.Objects;

import io.threescale.adapter.tls.TlsHttpClientConfigurator;

/**
 * The HTTP client the authorizer uses to talk to 3scale, together with the configuration it was built from.
 */
public final class BackendHttpClient {

    private final HttpClient httpClient;
    private final ClientConfig config;

    private BackendHttpClient(HttpClient httpClient, ClientConfig config) {
        this.httpClient = httpClient;
        this.config = config;
    }

    /**
     * Builds a client.  The platform's default SSL context is left in place unless the config carries TLS material.
     * @param config client configuration
     * @return client
     */
    public static BackendHttpClient create(ClientConfig config) {
        Objects.requireNonNull(config);
        HttpClient.Builder builder = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL);
        if (config.hasTimeout()) {
            builder.connectTimeout(config.timeout());
        }
        config.tls()
                .map(TlsHttpClientConfigurator::new)
                .ifPresent(configurator -> configurator.apply(builder));
        return new BackendHttpClient(builder.build(), config);
    }

    /**
     * Starts a request carrying the client's timeout.
     * @param uri target
     * @return request builder
     */
    public HttpRequest.Builder newRequest(URI uri) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri);
        if (config.hasTimeout()) {
            builder.timeout(config.timeout());
        }
        return builder;
    }

    public HttpClient httpClient() {
        return httpClient;
    }

    public ClientConfig config() {
        return config;
    }
}
