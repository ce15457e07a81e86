/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.backend;

/**
 * What the cached backend does with a request when it cannot reach 3scale.
 */
public enum FailurePolicy {
    /** Let the request through. */
    FAIL_OPEN,
    /** Deny the request. */
    FAIL_CLOSED
}
