/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.metrics;

/**
 * Invoked by the authorizer when a lookup is served from the system cache.
 */
@FunctionalInterface
public interface CacheHitObserver {
    void onCacheHit();
}
