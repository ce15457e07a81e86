/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.client;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

import io.threescale.adapter.tls.TlsMaterial;

/**
 * Resolved settings of the outbound HTTP client.
 *
 * @param timeout time allowed for connecting and for each request; zero or negative means no timeout
 * @param tls TLS material, present only if at least one TLS setting was supplied
 */
public record ClientConfig(Duration timeout, Optional<TlsMaterial> tls) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    public ClientConfig {
        Objects.requireNonNull(timeout);
        Objects.requireNonNull(tls);
    }

    public boolean hasTimeout() {
        return !timeout.isZero() && !timeout.isNegative();
    }
}
