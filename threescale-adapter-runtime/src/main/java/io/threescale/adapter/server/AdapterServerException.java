/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.server;

/**
 * The adapter server failed to start, or stopped serving unexpectedly.
 */
public class AdapterServerException extends RuntimeException {
    public AdapterServerException(String message) {
        super(message);
    }

    public AdapterServerException(String message, Throwable cause) {
        super(message, cause);
    }
}
