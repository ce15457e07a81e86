/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.metrics;

/**
 * The metrics sideband could not be started.
 */
public class MetricsServerException extends RuntimeException {
    public MetricsServerException(String message, Throwable cause) {
        super(message, cause);
    }
}
