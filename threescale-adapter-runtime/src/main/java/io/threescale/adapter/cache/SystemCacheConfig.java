/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Sizing and refresh behaviour of the {@link SystemCache}.
 *
 * @param maxSize the maximum number of entries the cache may contain
 * @param ttl entries are removed once this duration has elapsed after they were last written
 * @param refreshInterval period of the background refresh, zero disables it
 * @param refreshRetries extra attempts made for an entry whose refresh failed
 */
public record SystemCacheConfig(int maxSize, Duration ttl, Duration refreshInterval, int refreshRetries) {

    public static final int DEFAULT_MAX_SIZE = 1000;
    public static final Duration DEFAULT_TTL = Duration.ofSeconds(300);
    public static final Duration DEFAULT_REFRESH_INTERVAL = Duration.ofSeconds(180);
    public static final int DEFAULT_REFRESH_RETRIES = 1;

    public static final SystemCacheConfig DEFAULT = new SystemCacheConfig(DEFAULT_MAX_SIZE, DEFAULT_TTL, DEFAULT_REFRESH_INTERVAL, DEFAULT_REFRESH_RETRIES);

    public SystemCacheConfig {
        Objects.requireNonNull(ttl);
        Objects.requireNonNull(refreshInterval);
        if (maxSize < 0) {
            throw new IllegalArgumentException("maxSize must not be negative");
        }
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be negative");
        }
        if (refreshInterval.isNegative()) {
            throw new IllegalArgumentException("refreshInterval must not be negative");
        }
        if (refreshRetries < 0) {
            throw new IllegalArgumentException("refreshRetries must not be negative");
        }
    }
}
