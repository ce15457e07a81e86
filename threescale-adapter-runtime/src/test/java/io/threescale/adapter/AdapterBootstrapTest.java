/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter;

import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import io.threescale.adapter.cache.SystemCacheConfig;
import io.threescale.adapter.client.ClientConfig;
import io.threescale.adapter.client.TlsClientBuilder;
import io.threescale.adapter.config.IllegalConfigurationException;
import io.threescale.adapter.config.Settings;
import io.threescale.adapter.metrics.MetricsReporter;
import io.threescale.adapter.tls.TlsMaterial;

import static io.threescale.adapter.config.SettingNames.ALLOW_INSECURE_CONN;
import static io.threescale.adapter.config.SettingNames.CACHE_TTL_SECONDS;
import static io.threescale.adapter.config.SettingNames.ROOT_CA;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AdapterBootstrapTest {

    private final List<Settings> metricsResolutions = new ArrayList<>();
    private final AdapterBootstrap bootstrap = new AdapterBootstrap(new TlsClientBuilder(() -> new X509Certificate[0]), settings -> {
        metricsResolutions.add(settings);
        return Optional.empty();
    });

    @Test
    void nothingSet() {
        ResolvedConfig resolved = bootstrap.resolve(Settings.empty());

        assertThat(resolved.client().config()).isEqualTo(new ClientConfig(Duration.ofSeconds(10), Optional.empty()));
        assertThat(resolved.systemCache().config()).isEqualTo(
                new SystemCacheConfig(1000, Duration.ofSeconds(300), Duration.ofSeconds(180), 1));
        assertThat(resolved.systemCache().stopSignal()).isNotDone();
        assertThat(resolved.backendConfig().enableCaching()).isFalse();
        assertThat(resolved.metricsReporter()).isEmpty();
        assertThat(metricsResolutions).hasSize(1);
    }

    @Test
    void insecureWithEmptyRootCa() {
        ResolvedConfig resolved = bootstrap.resolve(Settings.of(Map.of(ALLOW_INSECURE_CONN, "true", ROOT_CA, "")));

        Optional<TlsMaterial> tls = resolved.client().config().tls();
        assertThat(tls).hasValueSatisfying(material -> {
            assertThat(material.insecureSkipVerify()).isTrue();
            assertThat(material.trustPool()).isNull();
            assertThat(material.clientCertificate()).isNull();
        });
    }

    @Test
    void metricsReporterPassedThrough() {
        var reporter = new MetricsReporter((endpoint, serviceId, status, latency) -> {
        }, () -> {
        });
        ResolvedConfig resolved = new AdapterBootstrap(new TlsClientBuilder(() -> new X509Certificate[0]), settings -> Optional.of(reporter))
                .resolve(Settings.empty());

        assertThat(resolved.metricsReporter()).containsSame(reporter);
    }

    @Test
    void failedResolutionStopsBeforeMetrics() {
        Settings settings = Settings.of(Map.of(CACHE_TTL_SECONDS, "-5"));

        assertThatThrownBy(() -> bootstrap.resolve(settings)).isInstanceOf(IllegalConfigurationException.class);
        assertThat(metricsResolutions).isEmpty();
    }
}
