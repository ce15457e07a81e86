/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.server;

import java.time.Duration;
import java.util.Objects;

import io.threescale.adapter.authorizer.Authorizer;

/**
 * What the adapter server is built from.
 *
 * @param authorizer authorizer answering the server's requests
 * @param keepAliveMaxAge connections are closed once they have been open this long; zero means never
 */
public record AdapterConfig(Authorizer authorizer, Duration keepAliveMaxAge) {

    public static final Duration DEFAULT_KEEP_ALIVE_MAX_AGE = Duration.ofMinutes(1);

    public AdapterConfig {
        Objects.requireNonNull(authorizer);
        Objects.requireNonNull(keepAliveMaxAge);
    }
}
