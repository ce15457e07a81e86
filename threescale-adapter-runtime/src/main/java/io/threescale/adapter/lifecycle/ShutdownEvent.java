/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.lifecycle;

import java.util.Objects;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Something that may end the adapter's run.
 */
public sealed interface ShutdownEvent {

    /**
     * The process received a termination or interrupt signal.
     *
     * @param name signal name, e.g. {@code TERM}
     */
    record OsSignal(String name) implements ShutdownEvent {
        public OsSignal {
            Objects.requireNonNull(name);
        }
    }

    /**
     * The server stopped serving.
     *
     * @param error why serving ended, null for a clean stop
     */
    record ServerTerminated(@Nullable Throwable error) implements ShutdownEvent {}
}
