/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.authorizer;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.threescale.adapter.backend.BackendConfig;
import io.threescale.adapter.cache.SystemCache;
import io.threescale.adapter.client.BackendHttpClient;
import io.threescale.adapter.metrics.MetricsReporter;

/**
 * <p>The {@link Authorizer} assembled from the resolved startup configuration.</p>
 *
 * <p>It owns the system cache: the cache's refresh task is started on construction and
 * stopped by {@link #shutdown()}. Metrics are reported only when a {@link MetricsReporter}
 * was supplied.</p>
 */
public class AuthorizerManager implements Authorizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(AuthorizerManager.class);

    static final String SYSTEM_ENDPOINT = "proxy_config";

    private final BackendHttpClient client;
    private final SystemCache systemCache;
    private final BackendConfig backendConfig;
    private final Optional<MetricsReporter> metricsReporter;

    public AuthorizerManager(BackendHttpClient client,
                             SystemCache systemCache,
                             BackendConfig backendConfig,
                             Optional<MetricsReporter> metricsReporter) {
        this.client = Objects.requireNonNull(client);
        this.systemCache = Objects.requireNonNull(systemCache);
        this.backendConfig = Objects.requireNonNull(backendConfig);
        this.metricsReporter = Objects.requireNonNull(metricsReporter);
        systemCache.start();
        LOGGER.atDebug()
                .setMessage("Authorizer created: backend caching {}, metrics {}")
                .addArgument(backendConfig.enableCaching() ? "enabled" : "disabled")
                .addArgument(metricsReporter.isPresent() ? "enabled" : "disabled")
                .log();
    }

    /**
     * Returns the system configuration of a service, from the system cache when possible.
     * @param serviceId 3scale service
     * @param configUri location of the service's configuration in the 3scale system
     * @return configuration document
     * @throws IOException if 3scale cannot be reached or answers with something other than 200
     * @throws InterruptedException if interrupted while waiting for 3scale
     */
    public String systemConfiguration(String serviceId, URI configUri) throws IOException, InterruptedException {
        String key = configUri.toString();
        Optional<String> cached = systemCache.getIfPresent(key);
        if (cached.isPresent()) {
            metricsReporter.ifPresent(reporter -> reporter.cacheHitCallback().onCacheHit());
            return cached.get();
        }
        SystemCache.Fetcher fetcher = ignored -> fetch(serviceId, configUri);
        String value = fetcher.fetch(key);
        systemCache.put(key, value, fetcher);
        return value;
    }

    private String fetch(String serviceId, URI configUri) throws IOException, InterruptedException {
        long start = System.nanoTime();
        HttpResponse<String> response = client.httpClient().send(client.newRequest(configUri).GET().build(), HttpResponse.BodyHandlers.ofString());
        reportResponse(SYSTEM_ENDPOINT, serviceId, response.statusCode(), Duration.ofNanos(System.nanoTime() - start));
        if (response.statusCode() != 200) {
            throw new IOException("unexpected status " + response.statusCode() + " fetching " + configUri);
        }
        return response.body();
    }

    /**
     * Passes a 3scale response on to the metrics reporter, if there is one.
     */
    public void reportResponse(String endpoint, String serviceId, int status, Duration latency) {
        metricsReporter.ifPresent(reporter -> reporter.responseCallback().onResponse(endpoint, serviceId, status, latency));
    }

    @Override
    public void shutdown() {
        LOGGER.debug("Authorizer shutting down");
        systemCache.stop();
    }

    public BackendHttpClient client() {
        return client;
    }

    public SystemCache systemCache() {
        return systemCache;
    }

    public BackendConfig backendConfig() {
        return backendConfig;
    }

    public Optional<MetricsReporter> metricsReporter() {
        return metricsReporter;
    }
}
