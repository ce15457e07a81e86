/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.tls;

/**
 * Signals that TLS material could not be read, parsed or turned into an {@link javax.net.ssl.SSLContext}.
 */
public class SslConfigurationException extends RuntimeException {
    public SslConfigurationException(Exception cause) {
        super(cause);
    }

    public SslConfigurationException(String message) {
        super(message);
    }

    public SslConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
