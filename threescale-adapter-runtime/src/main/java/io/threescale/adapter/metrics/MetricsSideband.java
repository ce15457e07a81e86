/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.metrics;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import io.micrometer.core.instrument.Metrics;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.prometheus.metrics.exporter.httpserver.MetricsHandler;

import io.threescale.adapter.VersionInfo;
import io.threescale.adapter.config.Settings;
import io.threescale.adapter.tag.VisibleForTesting;

import static io.threescale.adapter.config.SettingNames.METRICS_PORT;
import static io.threescale.adapter.config.SettingNames.REPORT_METRICS;

/**
 * <p>HTTP listener, separate from the adapter's own port, exposing the adapter's meters in the
 * Prometheus text format at {@value #METRICS_PATH}.</p>
 *
 * <p>Once started the listener runs on a daemon thread until the process exits.</p>
 */
public final class MetricsSideband implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(MetricsSideband.class);

    public static final int DEFAULT_METRICS_PORT = 8080;
    public static final String METRICS_PATH = "/metrics";

    private final HttpServer server;
    private final ExecutorService executor;
    private final PrometheusMeterRegistry prometheusMeterRegistry;

    private MetricsSideband(HttpServer server, ExecutorService executor, PrometheusMeterRegistry prometheusMeterRegistry) {
        this.server = server;
        this.executor = executor;
        this.prometheusMeterRegistry = prometheusMeterRegistry;
    }

    /**
     * Starts the metrics listener if reporting is enabled.
     * @param settings settings
     * @param versionInfo build information published as an info metric
     * @return callbacks feeding the metrics, empty if reporting is disabled
     * @throws MetricsServerException if the listener cannot bind its port
     */
    public static Optional<MetricsReporter> parseMetricsConfig(Settings settings, VersionInfo versionInfo) {
        return startIfEnabled(settings, versionInfo).map(sideband -> AdapterMetrics.reporter());
    }

    @VisibleForTesting
    static Optional<MetricsSideband> startIfEnabled(Settings settings, VersionInfo versionInfo) {
        if (!settings.isSet(REPORT_METRICS) || !settings.getBool(REPORT_METRICS)) {
            return Optional.empty();
        }
        int port = DEFAULT_METRICS_PORT;
        if (settings.isSet(METRICS_PORT)) {
            port = settings.getInt(METRICS_PORT);
        }
        return Optional.of(start(port, versionInfo));
    }

    /**
     * Binds all interfaces on the given port and starts serving.
     * @param port port, 0 for an ephemeral one
     * @param versionInfo build information
     * @return the running sideband
     */
    @VisibleForTesting
    static MetricsSideband start(int port, VersionInfo versionInfo) {
        HttpServer server;
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        }
        catch (IOException | IllegalArgumentException e) {
            // IllegalArgumentException: port outside 0-65535
            throw new MetricsServerException("failed to start metrics server on port " + port, e);
        }

        var prometheusMeterRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        var metricsHandler = new MetricsHandler(prometheusMeterRegistry.getPrometheusRegistry());
        server.createContext("/", exchange -> {
            if (METRICS_PATH.equals(exchange.getRequestURI().getPath())) {
                metricsHandler.handle(exchange);
            }
            else {
                notFound(exchange);
            }
        }).getFilters().add(UnsupportedHttpMethodFilter.INSTANCE);
        Metrics.globalRegistry.add(prometheusMeterRegistry);
        AdapterMetrics.versionInfoMetric(versionInfo);

        ExecutorService executor = Executors.newSingleThreadExecutor(new DefaultThreadFactory("metrics-sideband", true));
        server.setExecutor(executor);
        server.start();
        LOGGER.info("Serving metrics on port {}", server.getAddress().getPort());
        return new MetricsSideband(server, executor, prometheusMeterRegistry);
    }

    private static void notFound(HttpExchange exchange) throws IOException {
        try (exchange) {
            exchange.sendResponseHeaders(404, -1);
        }
    }

    public int port() {
        return server.getAddress().getPort();
    }

    @VisibleForTesting
    PrometheusMeterRegistry prometheusMeterRegistry() {
        return prometheusMeterRegistry;
    }

    /**
     * Stops listening and withdraws this sideband's registry from the global one.
     */
    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
        var copy = List.copyOf(prometheusMeterRegistry.getMeters());
        copy.forEach(Metrics.globalRegistry::remove);
        Metrics.removeRegistry(prometheusMeterRegistry);
    }
}
