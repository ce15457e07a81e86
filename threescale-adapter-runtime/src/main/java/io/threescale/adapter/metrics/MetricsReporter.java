/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.metrics;

import java.util.Objects;

/**
 * Callbacks the authorizer invokes to feed the metrics sideband.  Only exists when metrics
 * reporting is enabled.
 *
 * @param responseCallback records responses from 3scale
 * @param cacheHitCallback records system cache hits
 */
public record MetricsReporter(ResponseObserver responseCallback, CacheHitObserver cacheHitCallback) {

    public MetricsReporter {
        Objects.requireNonNull(responseCallback);
        Objects.requireNonNull(cacheHitCallback);
    }
}
