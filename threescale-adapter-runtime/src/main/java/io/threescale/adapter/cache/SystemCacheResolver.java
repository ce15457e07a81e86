/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.cache;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import io.threescale.adapter.config.IllegalConfigurationException;
import io.threescale.adapter.config.Settings;

import static io.threescale.adapter.config.SettingNames.CACHE_ENTRIES_MAX;
import static io.threescale.adapter.config.SettingNames.CACHE_REFRESH_RETRIES;
import static io.threescale.adapter.config.SettingNames.CACHE_REFRESH_SECONDS;
import static io.threescale.adapter.config.SettingNames.CACHE_TTL_SECONDS;

/**
 * Resolves the system cache settings. Each setting falls back to its default on its own.
 */
public final class SystemCacheResolver {

    private SystemCacheResolver() {
    }

    /**
     * Creates the system cache, handing it a stop signal of its own.
     * @param settings settings
     * @return an unstarted cache
     */
    public static SystemCache createSystemCache(Settings settings) {
        return new SystemCache(resolveConfig(settings), new CompletableFuture<>());
    }

    public static SystemCacheConfig resolveConfig(Settings settings) {
        Duration ttl = SystemCacheConfig.DEFAULT_TTL;
        Duration refreshInterval = SystemCacheConfig.DEFAULT_REFRESH_INTERVAL;
        int maxSize = SystemCacheConfig.DEFAULT_MAX_SIZE;
        int refreshRetries = SystemCacheConfig.DEFAULT_REFRESH_RETRIES;

        if (settings.isSet(CACHE_TTL_SECONDS)) {
            ttl = Duration.ofSeconds(nonNegative(settings, CACHE_TTL_SECONDS));
        }
        if (settings.isSet(CACHE_REFRESH_SECONDS)) {
            refreshInterval = Duration.ofSeconds(nonNegative(settings, CACHE_REFRESH_SECONDS));
        }
        if (settings.isSet(CACHE_ENTRIES_MAX)) {
            maxSize = nonNegative(settings, CACHE_ENTRIES_MAX);
        }
        if (settings.isSet(CACHE_REFRESH_RETRIES)) {
            refreshRetries = nonNegative(settings, CACHE_REFRESH_RETRIES);
        }
        return new SystemCacheConfig(maxSize, ttl, refreshInterval, refreshRetries);
    }

    private static int nonNegative(Settings settings, String name) {
        int value = settings.getInt(name);
        if (value < 0) {
            throw new IllegalConfigurationException("setting " + name + " must not be negative, but was " + value);
        }
        return value;
    }
}
