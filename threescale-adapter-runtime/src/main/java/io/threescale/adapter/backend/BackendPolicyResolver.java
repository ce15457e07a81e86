/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.backend;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.threescale.adapter.config.Settings;

import static io.threescale.adapter.config.SettingNames.BACKEND_CACHE_FLUSH_INTERVAL_SECONDS;
import static io.threescale.adapter.config.SettingNames.BACKEND_CACHE_POLICY_FAIL_CLOSED;
import static io.threescale.adapter.config.SettingNames.USE_CACHED_BACKEND;

/**
 * Resolves whether the backend is cached and, if so, how.
 */
public final class BackendPolicyResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(BackendPolicyResolver.class);

    private static final Logger BACKEND_LOGGER = LoggerFactory.getLogger("io.threescale.adapter.backend.CachedBackend");

    private BackendPolicyResolver() {
    }

    public static BackendConfig createBackendConfig(Settings settings) {
        if (!settings.getBool(USE_CACHED_BACKEND)) {
            return BackendConfig.disabled(BACKEND_LOGGER);
        }
        Duration interval = settings.getSeconds(BACKEND_CACHE_FLUSH_INTERVAL_SECONDS);
        if (interval.isZero()) {
            interval = BackendConfig.DEFAULT_FLUSH_INTERVAL;
        }
        LOGGER.info("backend cache set to flush at {} intervals", interval);
        return new BackendConfig(true, interval, BACKEND_LOGGER, failurePolicy(settings));
    }

    /**
     * Fail closed unless explicitly told otherwise.
     */
    static FailurePolicy failurePolicy(Settings settings) {
        if (settings.isSet(BACKEND_CACHE_POLICY_FAIL_CLOSED) && !settings.getBool(BACKEND_CACHE_POLICY_FAIL_CLOSED)) {
            LOGGER.info("backend cache fail policy set to open");
            return FailurePolicy.FAIL_OPEN;
        }
        LOGGER.info("backend cache fail policy set to closed");
        return FailurePolicy.FAIL_CLOSED;
    }
}
