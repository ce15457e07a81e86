/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.backend;

import java.time.Duration;
import java.util.Objects;

import org.slf4j.Logger;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Configuration of the caching layer in front of the 3scale backend.
 *
 * @param enableCaching whether reports and authorizations are cached
 * @param cacheFlushInterval how often the cache is flushed to 3scale, null when caching is disabled
 * @param logger logger used by the caching layer
 * @param policy behaviour when 3scale cannot be reached, null when caching is disabled
 */
public record BackendConfig(boolean enableCaching,
                            @Nullable Duration cacheFlushInterval,
                            Logger logger,
                            @Nullable FailurePolicy policy) {

    public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofSeconds(15);

    public BackendConfig {
        Objects.requireNonNull(logger);
        if (enableCaching) {
            Objects.requireNonNull(cacheFlushInterval, "cacheFlushInterval is required when caching is enabled");
            Objects.requireNonNull(policy, "policy is required when caching is enabled");
        }
    }

    public static BackendConfig disabled(Logger logger) {
        return new BackendConfig(false, null, logger, null);
    }
}
