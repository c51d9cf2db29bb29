/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.opensearch.jwtgate.keybyoidc;

import java.io.Closeable;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Loads the keys of all configured issuers independently of request traffic.
 * <p>
 * Unless prefetching is skipped, keys are fetched once after the prefetch delay. With a non-zero refresh interval,
 * keys are fetched again each time the interval has passed since the previous fetch completed. Without either nothing
 * is scheduled and no thread is started.
 */
public class KeyRefresher implements Closeable {
    private static final Logger log = LogManager.getLogger(KeyRefresher.class);

    private final IssuerKeyCache keyCache;
    private final ScheduledExecutorService executor;

    private KeyRefresher(IssuerKeyCache keyCache, ScheduledExecutorService executor) {
        this.keyCache = keyCache;
        this.executor = executor;
    }

    /**
     * @param prefetchDelay delay of the initial fetch, null to skip prefetching
     * @param refreshInterval pause between periodic fetches, zero to disable them
     */
    public static KeyRefresher start(IssuerKeyCache keyCache, Duration prefetchDelay, Duration refreshInterval, String name) {
        boolean prefetch = prefetchDelay != null;
        boolean periodic = refreshInterval != null && !refreshInterval.isZero() && !refreshInterval.isNegative();

        if (!prefetch && !periodic) {
            return new KeyRefresher(keyCache, null);
        }

        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(
            new ThreadFactoryBuilder().setNameFormat("jwt-key-refresher[" + name + "]-%d").setDaemon(true).build()
        );
        KeyRefresher refresher = new KeyRefresher(keyCache, executor);

        long initialDelayNanos = prefetch ? Math.max(0, prefetchDelay.toNanos()) : 0;
        if (prefetch) {
            executor.schedule(refresher::refresh, initialDelayNanos, TimeUnit.NANOSECONDS);
        }
        if (periodic) {
            long intervalNanos = refreshInterval.toNanos();
            executor.scheduleWithFixedDelay(refresher::refresh, initialDelayNanos + intervalNanos, intervalNanos, TimeUnit.NANOSECONDS);
        }
        log.debug("Started key refresher for {} (prefetch delay: {}, refresh interval: {})", name, prefetchDelay, refreshInterval);
        return refresher;
    }

    void refresh() {
        try {
            keyCache.refreshAll();
        } catch (RuntimeException e) {
            // an exception escaping a periodic task would cancel all further runs
            log.error("Key refresh failed", e);
        }
    }

    public boolean isRunning() {
        return executor != null && !executor.isShutdown();
    }

    @Override
    public void close() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }
}
