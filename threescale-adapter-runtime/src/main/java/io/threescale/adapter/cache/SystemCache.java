/*
 * Copyright Threescale Adapter Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.threescale.adapter.cache;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import io.netty.util.concurrent.DefaultThreadFactory;

import io.threescale.adapter.tag.VisibleForTesting;

/**
 * <p>Bounded cache of system configuration documents fetched from 3scale, keyed by service.</p>
 *
 * <p>Every entry remembers the {@link Fetcher} that produced it. Once {@link #start() started},
 * a background task re-fetches all entries each refresh interval, retrying a failing fetch
 * {@link SystemCacheConfig#refreshRetries()} extra times before leaving the stale entry to expire.
 * The task runs until the stop signal completes.</p>
 */
public class SystemCache {

    private static final Logger LOGGER = LoggerFactory.getLogger(SystemCache.class);

    /**
     * Fetches the current value for a key from its origin.
     */
    @FunctionalInterface
    public interface Fetcher {
        String fetch(String key) throws IOException, InterruptedException;
    }

    private record Entry(String value, Fetcher fetcher) {}

    private final SystemCacheConfig config;
    private final CompletableFuture<Void> stopSignal;
    private final Cache<String, Entry> entries;
    private final AtomicBoolean started = new AtomicBoolean(false);

    public SystemCache(SystemCacheConfig config, CompletableFuture<Void> stopSignal) {
        this.config = Objects.requireNonNull(config);
        this.stopSignal = Objects.requireNonNull(stopSignal);
        this.entries = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(config.ttl())
                .recordStats()
                .build();
        new CaffeineCacheMetrics<>(this.entries, "systemCache", List.of()).bindTo(Metrics.globalRegistry);
    }

    public SystemCacheConfig config() {
        return config;
    }

    /**
     * Signal that, once completed, ends the background refresh.
     * @return stop signal
     */
    public CompletableFuture<Void> stopSignal() {
        return stopSignal;
    }

    public Optional<String> getIfPresent(String key) {
        return Optional.ofNullable(entries.getIfPresent(key)).map(Entry::value);
    }

    public void put(String key, String value, Fetcher fetcher) {
        entries.put(key, new Entry(value, fetcher));
    }

    public void invalidate(String key) {
        entries.invalidate(key);
    }

    public long size() {
        entries.cleanUp();
        return entries.estimatedSize();
    }

    /**
     * Starts the background refresh. Calling it more than once, or after the stop signal has
     * completed, has no effect.
     */
    public void start() {
        if (stopSignal.isDone() || !started.compareAndSet(false, true)) {
            return;
        }
        if (config.refreshInterval().isZero()) {
            LOGGER.info("System cache refresh disabled");
            return;
        }
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(new DefaultThreadFactory("system-cache-refresh", true));
        long periodMillis = config.refreshInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::refresh, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        stopSignal.whenComplete((v, t) -> {
            LOGGER.debug("System cache refresh stopping");
            scheduler.shutdownNow();
        });
        LOGGER.atInfo()
                .setMessage("System cache refreshing every {} with {} retries")
                .addArgument(config.refreshInterval())
                .addArgument(config.refreshRetries())
                .log();
    }

    /**
     * Completes the stop signal.
     */
    public void stop() {
        stopSignal.complete(null);
    }

    /**
     * Re-fetches every entry currently held.
     */
    @VisibleForTesting
    void refresh() {
        for (Map.Entry<String, Entry> mapping : Map.copyOf(entries.asMap()).entrySet()) {
            if (stopSignal.isDone()) {
                return;
            }
            refreshEntry(mapping.getKey(), mapping.getValue());
        }
    }

    private void refreshEntry(String key, Entry entry) {
        Exception lastFailure = null;
        for (int attempt = 0; attempt <= config.refreshRetries(); attempt++) {
            try {
                entries.put(key, new Entry(entry.fetcher().fetch(key), entry.fetcher()));
                return;
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            catch (IOException | RuntimeException e) {
                lastFailure = e;
                LOGGER.debug("Refresh attempt {} for {} failed: {}", attempt + 1, key, e.getMessage());
            }
        }
        LOGGER.atWarn()
                .setMessage("Failed to refresh system cache entry {}, keeping stale value: {}")
                .addArgument(key)
                .addArgument(lastFailure.getMessage())
                .setCause(LOGGER.isDebugEnabled() ? lastFailure : null)
                .log();
    }
}
