/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter;

import java.util.Objects;
import java.util.Optional;

import io.threescale.adapter.backend.BackendConfig;
import io.threescale.adapter.cache.SystemCache;
import io.threescale.adapter.client.BackendHttpClient;
import io.threescale.adapter.metrics.MetricsReporter;

/**
 * Everything the authorizer is built from, resolved from settings at startup.
 *
 * @param client HTTP client for calls to 3scale
 * @param systemCache unstarted system cache
 * @param backendConfig backend caching configuration
 * @param metricsReporter metrics callbacks, empty when metrics reporting is disabled
 */
public record ResolvedConfig(BackendHttpClient client,
                             SystemCache systemCache,
                             BackendConfig backendConfig,
                             Optional<MetricsReporter> metricsReporter) {

    public ResolvedConfig {
        Objects.requireNonNull(client);
        Objects.requireNonNull(systemCache);
        Objects.requireNonNull(backendConfig);
        Objects.requireNonNull(metricsReporter);
    }
}
