/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.config;

import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junitpioneer.jupiter.ClearEnvironmentVariable;
import org.junitpioneer.jupiter.SetEnvironmentVariable;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SettingsTest {

    @Test
    void unsetSettingsReadAsZeroValues() {
        var settings = Settings.empty();

        assertThat(settings.isSet(SettingNames.LISTEN_ADDR)).isFalse();
        assertThat(settings.getString(SettingNames.LISTEN_ADDR)).isEmpty();
        assertThat(settings.getInt(SettingNames.METRICS_PORT)).isZero();
        assertThat(settings.getBool(SettingNames.REPORT_METRICS)).isFalse();
        assertThat(settings.getSeconds(SettingNames.CACHE_TTL_SECONDS)).isEqualTo(Duration.ZERO);
    }

    @Test
    void emptyValueIsSet() {
        var settings = Settings.of(Map.of(SettingNames.ROOT_CA, "", SettingNames.METRICS_PORT, ""));

        assertThat(settings.isSet(SettingNames.ROOT_CA)).isTrue();
        assertThat(settings.getString(SettingNames.ROOT_CA)).isEmpty();
        assertThat(settings.getInt(SettingNames.METRICS_PORT)).isZero();
    }

    @Test
    void explicitFalseIsDistinctFromUnset() {
        var settings = Settings.of(Map.of(SettingNames.BACKEND_CACHE_POLICY_FAIL_CLOSED, "false"));

        assertThat(settings.isSet(SettingNames.BACKEND_CACHE_POLICY_FAIL_CLOSED)).isTrue();
        assertThat(settings.getBool(SettingNames.BACKEND_CACHE_POLICY_FAIL_CLOSED)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = { "1", "t", "T", "TRUE", "true", "True", " true " })
    void trueValues(String value) {
        assertThat(Settings.of(Map.of(SettingNames.LOG_JSON, value)).getBool(SettingNames.LOG_JSON)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = { "0", "f", "F", "FALSE", "false", "False" })
    void falseValues(String value) {
        assertThat(Settings.of(Map.of(SettingNames.LOG_JSON, value)).getBool(SettingNames.LOG_JSON)).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = { "yes", "no", "on", "2", "tRuE" })
    void malformedBoolean(String value) {
        var settings = Settings.of(Map.of(SettingNames.LOG_JSON, value));

        assertThatThrownBy(() -> settings.getBool(SettingNames.LOG_JSON))
                .isInstanceOf(IllegalConfigurationException.class)
                .hasMessageContaining(SettingNames.LOG_JSON);
    }

    @Test
    void parsesInteger() {
        var settings = Settings.of(Map.of(SettingNames.METRICS_PORT, " 9090 "));

        assertThat(settings.getInt(SettingNames.METRICS_PORT)).isEqualTo(9090);
    }

    @Test
    void malformedInteger() {
        var settings = Settings.of(Map.of(SettingNames.METRICS_PORT, "80a"));

        assertThatThrownBy(() -> settings.getInt(SettingNames.METRICS_PORT))
                .isInstanceOf(IllegalConfigurationException.class)
                .hasMessage("setting metrics_port must be an integer, but was '80a'");
    }

    @Test
    void environmentVariableName() {
        assertThat(Settings.environmentVariableName(SettingNames.CACHE_ENTRIES_MAX)).isEqualTo("THREESCALE_CACHE_ENTRIES_MAX");
    }

    @Test
    void bindsOnlyKnownPrefixedVariables() {
        var settings = Settings.fromEnvironment(Map.of(
                "THREESCALE_LISTEN_ADDR", "4444",
                "LISTEN_ADDR", "5555",
                "THREESCALE_UNKNOWN", "x"));

        assertThat(settings.getString(SettingNames.LISTEN_ADDR)).isEqualTo("4444");
        assertThat(settings.isSet("unknown")).isFalse();
        assertThat(settings).hasToString("Settings[listen_addr]");
    }

    @Test
    @SetEnvironmentVariable(key = "THREESCALE_USE_CACHED_BACKEND", value = "true")
    @SetEnvironmentVariable(key = "THREESCALE_ROOT_CA", value = "")
    @ClearEnvironmentVariable(key = "THREESCALE_CLIENT_CERT")
    void bindsProcessEnvironment() {
        // Given environment set by annotations

        // When
        var settings = Settings.fromEnvironment();

        // Then
        assertThat(settings.getBool(SettingNames.USE_CACHED_BACKEND)).isTrue();
        assertThat(settings.isSet(SettingNames.ROOT_CA)).isTrue();
        assertThat(settings.isSet(SettingNames.CLIENT_CERT)).isFalse();
    }
}
