/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.server;

import java.util.concurrent.CompletionStage;

/**
 * Serves the adapter's API.
 */
public interface AdapterServer extends AutoCloseable {

    /**
     * Starts serving.
     * @return stage that completes exactly once, when serving has ended: normally after a clean
     * stop, exceptionally if serving ended abnormally
     */
    CompletionStage<Void> run();

    /**
     * Stops serving gracefully.  The stage returned by {@link #run()} completes once the stop is done.
     * @throws Exception if the server could not be stopped cleanly
     */
    @Override
    void close() throws Exception;
}
