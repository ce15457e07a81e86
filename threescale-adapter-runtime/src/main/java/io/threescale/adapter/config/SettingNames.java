/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.config;

import java.util.List;

/**
 * Names of the settings the adapter binds at startup.
 */
public final class SettingNames {

    // logging
    public static final String LOG_LEVEL = "log_level";
    public static final String LOG_JSON = "log_json";
    public static final String LOG_GRPC = "log_grpc";

    // serving
    public static final String LISTEN_ADDR = "listen_addr";
    public static final String GRPC_CONN_MAX_SECONDS = "grpc_conn_max_seconds";

    // metrics
    public static final String REPORT_METRICS = "report_metrics";
    public static final String METRICS_PORT = "metrics_port";

    // system cache
    public static final String CACHE_TTL_SECONDS = "cache_ttl_seconds";
    public static final String CACHE_REFRESH_SECONDS = "cache_refresh_seconds";
    public static final String CACHE_ENTRIES_MAX = "cache_entries_max";
    public static final String CACHE_REFRESH_RETRIES = "cache_refresh_retries";

    // outbound client
    public static final String CLIENT_TIMEOUT_SECONDS = "client_timeout_seconds";
    public static final String ALLOW_INSECURE_CONN = "allow_insecure_conn";
    public static final String ROOT_CA = "root_ca";
    public static final String CLIENT_CERT = "client_cert";
    public static final String CLIENT_KEY = "client_key";

    // backend
    public static final String USE_CACHED_BACKEND = "use_cached_backend";
    public static final String BACKEND_CACHE_FLUSH_INTERVAL_SECONDS = "backend_cache_flush_interval_seconds";
    public static final String BACKEND_CACHE_POLICY_FAIL_CLOSED = "backend_cache_policy_fail_closed";

    static final List<String> ALL = List.of(
            LOG_LEVEL, LOG_JSON, LOG_GRPC,
            LISTEN_ADDR, GRPC_CONN_MAX_SECONDS,
            REPORT_METRICS, METRICS_PORT,
            CACHE_TTL_SECONDS, CACHE_REFRESH_SECONDS, CACHE_ENTRIES_MAX, CACHE_REFRESH_RETRIES,
            CLIENT_TIMEOUT_SECONDS, ALLOW_INSECURE_CONN, ROOT_CA, CLIENT_CERT, CLIENT_KEY,
            USE_CACHED_BACKEND, BACKEND_CACHE_FLUSH_INTERVAL_SECONDS, BACKEND_CACHE_POLICY_FAIL_CLOSED);

    private SettingNames() {
        // unused
    }
}
