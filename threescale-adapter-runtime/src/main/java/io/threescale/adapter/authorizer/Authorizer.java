/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.authorizer;

/**
 * Makes authorization decisions against 3scale on behalf of the adapter server.
 */
public interface Authorizer {

    /**
     * Releases the background resources the authorizer owns.  May be invoked more than once.
     */
    void shutdown();
}
