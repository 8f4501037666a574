package com.baas.auth.keys;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import lombok.extern.slf4j.Slf4j;

/**
 * Refreshes the verification key cache in the background so that it never runs out between ticks.
 */
@Slf4j
public class KeyCacheRefresher implements AutoCloseable {

    private final ScheduledExecutorService ses = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "verification-key-refresher");
        t.setDaemon(true);
        return t;
    });

    public KeyCacheRefresher(CachingKeyStore keyStore, Duration interval) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }
        long millis = interval.toMillis();
        ses.scheduleWithFixedDelay(() -> refresh(keyStore, interval), 0, millis, TimeUnit.MILLISECONDS);
    }

    static void refresh(CachingKeyStore keyStore, Duration window) {
        try {
            keyStore.refreshIfExpiringWithin(window);
        } catch (Exception e) {
            log.warn("Failed to refresh verification keys", e);
        }
    }

    @Override
    public void close() {
        ses.shutdownNow();
    }
}
