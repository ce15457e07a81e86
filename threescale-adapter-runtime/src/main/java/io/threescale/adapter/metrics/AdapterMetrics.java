/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.metrics;

import java.time.Duration;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;

import io.threescale.adapter.VersionInfo;

import static io.micrometer.core.instrument.Metrics.globalRegistry;

/**
 * Meters published by the adapter.  All are registered with the global registry.
 */
public final class AdapterMetrics {

    // Common Labels
    public static final String ENDPOINT_LABEL = "endpoint";
    public static final String SERVICE_ID_LABEL = "service_id";
    public static final String STATUS_LABEL = "status";

    public static final String BACKEND_REQUESTS_METER_NAME = "threescale_backend_requests";
    public static final String SYSTEM_CACHE_HITS_METER_NAME = "threescale_system_cache_hits";

    /**
     * Name of the build_info metric.  The {@code .info} suffix tells Micrometer this is an 'info'
     * metric; Prometheus exposes it as {@code threescale_adapter_build_info}.
     */
    public static final String INFO_METRIC_NAME = "threescale_adapter_build.info";

    private AdapterMetrics() {
        // unused
    }

    public static void recordBackendResponse(String endpoint, String serviceId, int status, Duration latency) {
        Timer.builder(BACKEND_REQUESTS_METER_NAME)
                .description("Latency of requests made to 3scale.")
                .tag(ENDPOINT_LABEL, endpoint)
                .tag(SERVICE_ID_LABEL, serviceId)
                .tag(STATUS_LABEL, Integer.toString(status))
                .register(globalRegistry)
                .record(latency);
    }

    public static void incrementSystemCacheHits() {
        Counter.builder(SYSTEM_CACHE_HITS_METER_NAME)
                .description("Count of lookups served from the system cache.")
                .register(globalRegistry)
                .increment();
    }

    public static void versionInfoMetric(VersionInfo versionInfo) {
        Gauge.builder(INFO_METRIC_NAME, () -> 1.0)
                .description("Reports threescale adapter version information")
                .tag("version", versionInfo.version())
                .strongReference(true)
                .register(globalRegistry);
    }

    /**
     * Callbacks recording into the meters above.
     * @return reporter
     */
    public static MetricsReporter reporter() {
        return new MetricsReporter(AdapterMetrics::recordBackendResponse, AdapterMetrics::incrementSystemCacheHits);
    }
}
