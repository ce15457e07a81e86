/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.lifecycle;

import java.util.function.Consumer;

/**
 * Delivers the process signals that request a graceful shutdown.
 */
public interface SignalSource extends AutoCloseable {

    /**
     * Starts delivering signals.
     * @param listener receives the name of each signal as it arrives, on an arbitrary thread
     */
    void register(Consumer<String> listener);

    /**
     * Stops delivering signals.
     */
    @Override
    void close();
}
