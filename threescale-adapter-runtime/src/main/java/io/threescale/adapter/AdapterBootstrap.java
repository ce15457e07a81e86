/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter;

import java.util.Objects;
import java.util.Optional;

import io.threescale.adapter.backend.BackendConfig;
import io.threescale.adapter.backend.BackendPolicyResolver;
import io.threescale.adapter.cache.SystemCache;
import io.threescale.adapter.cache.SystemCacheResolver;
import io.threescale.adapter.client.BackendHttpClient;
import io.threescale.adapter.client.TlsClientBuilder;
import io.threescale.adapter.config.Settings;
import io.threescale.adapter.metrics.MetricsReporter;
import io.threescale.adapter.metrics.MetricsSideband;

/**
 * Runs the startup resolvers, in order, against one set of settings: HTTP client, system cache,
 * backend policy, then metrics.  The first resolver to fail aborts startup.
 */
public class AdapterBootstrap {

    /**
     * Resolves the metrics sideband; starting it is a side effect of resolution.
     */
    @FunctionalInterface
    public interface MetricsResolver {
        Optional<MetricsReporter> resolve(Settings settings);
    }

    private final TlsClientBuilder clientBuilder;
    private final MetricsResolver metricsResolver;

    public AdapterBootstrap(VersionInfo versionInfo) {
        this(new TlsClientBuilder(), settings -> MetricsSideband.parseMetricsConfig(settings, versionInfo));
    }

    public AdapterBootstrap(TlsClientBuilder clientBuilder, MetricsResolver metricsResolver) {
        this.clientBuilder = Objects.requireNonNull(clientBuilder);
        this.metricsResolver = Objects.requireNonNull(metricsResolver);
    }

    public ResolvedConfig resolve(Settings settings) {
        BackendHttpClient client = clientBuilder.build(settings);
        SystemCache systemCache = SystemCacheResolver.createSystemCache(settings);
        BackendConfig backendConfig = BackendPolicyResolver.createBackendConfig(settings);
        Optional<MetricsReporter> metricsReporter = metricsResolver.resolve(settings);
        return new ResolvedConfig(client, systemCache, backendConfig, metricsReporter);
    }
}
