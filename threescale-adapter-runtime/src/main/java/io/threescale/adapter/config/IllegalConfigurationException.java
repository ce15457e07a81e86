/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.config;

/**
 * Signals that a setting is present but cannot be turned into a usable runtime policy,
 * for example an unparseable number or an incomplete client certificate/key pairing.
 * Startup does not continue past one of these.
 */
public class IllegalConfigurationException extends RuntimeException {
    public IllegalConfigurationException(String message) {
        super(message);
    }

    public IllegalConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
