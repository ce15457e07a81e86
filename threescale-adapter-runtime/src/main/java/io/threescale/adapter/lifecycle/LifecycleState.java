/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.lifecycle;

/**
 * States of the {@link LifecycleController}.
 */
public enum LifecycleState {
    /** Building the authorizer and the server. */
    STARTING,
    /** Serving, waiting for a signal or for the server to stop by itself. */
    RUNNING,
    /** A signal arrived and the server is being stopped. */
    SHUTTING_DOWN,
    /** The server stopped cleanly. */
    STOPPED,
    /** Startup or shutdown failed; terminal. */
    FATAL
}
