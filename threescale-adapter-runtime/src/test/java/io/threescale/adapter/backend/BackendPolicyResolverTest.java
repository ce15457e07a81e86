/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.backend;

import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import io.threescale.adapter.config.Settings;

import static io.threescale.adapter.config.SettingNames.BACKEND_CACHE_FLUSH_INTERVAL_SECONDS;
import static io.threescale.adapter.config.SettingNames.BACKEND_CACHE_POLICY_FAIL_CLOSED;
import static io.threescale.adapter.config.SettingNames.USE_CACHED_BACKEND;
import static org.assertj.core.api.Assertions.assertThat;

class BackendPolicyResolverTest {

    @Test
    void disabledByDefault() {
        BackendConfig config = BackendPolicyResolver.createBackendConfig(Settings.empty());

        assertThat(config.enableCaching()).isFalse();
        assertThat(config.cacheFlushInterval()).isNull();
        assertThat(config.policy()).isNull();
        assertThat(config.logger().getName()).isEqualTo("io.threescale.adapter.backend.CachedBackend");
    }

    @Test
    void disabledIgnoresOtherBackendSettings() {
        BackendConfig config = BackendPolicyResolver.createBackendConfig(Settings.of(Map.of(
                USE_CACHED_BACKEND, "false",
                BACKEND_CACHE_FLUSH_INTERVAL_SECONDS, "30",
                BACKEND_CACHE_POLICY_FAIL_CLOSED, "false")));

        assertThat(config.enableCaching()).isFalse();
        assertThat(config.cacheFlushInterval()).isNull();
        assertThat(config.policy()).isNull();
    }

    @ParameterizedTest
    @ValueSource(strings = { "0", "" })
    void enabledWithoutIntervalUsesDefault(String interval) {
        BackendConfig config = BackendPolicyResolver.createBackendConfig(Settings.of(Map.of(
                USE_CACHED_BACKEND, "true",
                BACKEND_CACHE_FLUSH_INTERVAL_SECONDS, interval)));

        assertThat(config.enableCaching()).isTrue();
        assertThat(config.cacheFlushInterval()).isEqualTo(Duration.ofSeconds(15));
    }

    @Test
    void enabledWithInterval() {
        BackendConfig config = BackendPolicyResolver.createBackendConfig(Settings.of(Map.of(
                USE_CACHED_BACKEND, "true",
                BACKEND_CACHE_FLUSH_INTERVAL_SECONDS, "45")));

        assertThat(config.cacheFlushInterval()).isEqualTo(Duration.ofSeconds(45));
        assertThat(config.policy()).isEqualTo(FailurePolicy.FAIL_CLOSED);
    }

    @Test
    void failClosedWhenPolicyUnset() {
        assertThat(BackendPolicyResolver.failurePolicy(Settings.empty())).isEqualTo(FailurePolicy.FAIL_CLOSED);
    }

    @Test
    void failClosedWhenPolicyTrue() {
        assertThat(BackendPolicyResolver.failurePolicy(Settings.of(Map.of(BACKEND_CACHE_POLICY_FAIL_CLOSED, "true"))))
                .isEqualTo(FailurePolicy.FAIL_CLOSED);
    }

    @Test
    void failOpenOnlyWhenExplicitlyFalse() {
        BackendConfig config = BackendPolicyResolver.createBackendConfig(Settings.of(Map.of(
                USE_CACHED_BACKEND, "true",
                BACKEND_CACHE_POLICY_FAIL_CLOSED, "false")));

        assertThat(config.policy()).isEqualTo(FailurePolicy.FAIL_OPEN);
    }
}
