/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.metrics;

import java.time.Duration;

/**
 * Invoked by the authorizer each time 3scale answers one of its requests.
 */
@FunctionalInterface
public interface ResponseObserver {

    /**
     * @param endpoint 3scale endpoint called, e.g. {@code authorize}
     * @param serviceId 3scale service the request was made for
     * @param status HTTP status of the response
     * @param latency time taken for the response to arrive
     */
    void onResponse(String endpoint, String serviceId, int status, Duration latency);
}
