package com.baas.auth.keys;

import java.io.IOException;
import java.net.URI;
import java.security.PublicKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

import com.baas.auth.AuthErrorCode;
import com.baas.auth.AuthException;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps the provider's verification keys in memory until the fetch response's cache lifetime runs out.
 *
 * <p>Only one fetch is in flight at a time: the first caller that finds the cache stale performs it,
 * concurrent callers wait for that fetch and share its result. A successful fetch replaces the whole
 * key set. A failed fetch keeps a cache that has not expired yet and otherwise surfaces
 * {@code KEY_SOURCE_UNAVAILABLE}.
 */
@Slf4j
public final class CachingKeyStore implements VerificationKeyStore {

    /** Longest time a fetched key set is trusted, whatever lifetime the key source announces. */
    static final Duration MAX_TTL = Duration.ofDays(1);

    private final KeyFetchTransport transport;
    private final URI url;
    private final Clock clock;
    private final Duration defaultTtl;

    private final AtomicReference<KeyCache> cache = new AtomicReference<>(KeyCache.EMPTY);
    private final AtomicReference<CompletableFuture<KeyCache>> inFlight = new AtomicReference<>();

    public CachingKeyStore(KeyFetchTransport transport, URI url, Clock clock, Duration defaultTtl) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.url = Objects.requireNonNull(url, "url");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.defaultTtl = Objects.requireNonNull(defaultTtl, "defaultTtl");
    }

    @Override
    public Optional<PublicKey> getKey(String keyId) {
        KeyCache current = cache.get();
        if (!current.isUsable(clock.instant())) {
            current = load(false);
        } else {
            log.debug("Using cached verification keys valid until {}", current.validUntil());
        }
        return Optional.ofNullable(current.keys().get(keyId));
    }

    /**
     * Fetches the key set even if the cache is still valid.
     *
     * @return key ids of the key set in use afterwards
     */
    public Set<String> refresh() {
        return load(true).keys().keySet();
    }

    /**
     * Fetches the key set when the cache has expired or will expire within {@code window}.
     */
    public void refreshIfExpiringWithin(Duration window) {
        KeyCache current = cache.get();
        if (!current.isUsable(clock.instant().plus(window))) {
            load(true);
        }
    }

    public Optional<Instant> validUntil() {
        KeyCache current = cache.get();
        return current.keys().isEmpty() ? Optional.empty() : Optional.of(current.validUntil());
    }

    private KeyCache load(boolean force) {
        CompletableFuture<KeyCache> pending = new CompletableFuture<>();
        CompletableFuture<KeyCache> existing = inFlight.compareAndExchange(null, pending);
        if (existing != null) {
            return await(existing);
        }

        try {
            KeyCache current = cache.get();
            // another caller may have finished a fetch between our staleness check and winning the slot
            if (!force && current.isUsable(clock.instant())) {
                pending.complete(current);
                return current;
            }
            KeyCache result = fetchOrFallback(current);
            pending.complete(result);
            return result;
        } catch (RuntimeException e) {
            pending.completeExceptionally(e);
            throw e;
        } finally {
            if (!pending.isDone()) {
                pending.completeExceptionally(new IllegalStateException("Verification key fetch aborted"));
            }
            inFlight.compareAndSet(pending, null);
        }
    }

    private KeyCache fetchOrFallback(KeyCache current) {
        log.info("Fetching verification keys from {}", url);
        try {
            KeyFetchResponse response = transport.fetch(url);
            Map<String, PublicKey> keys = X509Certificates.publicKeys(response.certificates());
            if (keys.isEmpty()) {
                throw new IOException("Key set from " + url + " contains no keys");
            }

            Duration ttl = response.maxAge() != null ? response.maxAge() : defaultTtl;
            if (ttl.compareTo(MAX_TTL) > 0) {
                log.debug("Capping verification key lifetime {} to {}", ttl, MAX_TTL);
                ttl = MAX_TTL;
            }
            KeyCache fresh = new KeyCache(Map.copyOf(keys), clock.instant().plus(ttl));
            cache.set(fresh);
            log.info("Cached {} verification keys from {} for {}s", keys.size(), url, ttl.toSeconds());
            return fresh;
        } catch (IOException | RuntimeException e) {
            if (current.isUsable(clock.instant())) {
                log.warn("Failed to refresh verification keys from {}, keeping keys valid until {}",
                    url, current.validUntil(), e);
                return current;
            }
            throw new AuthException(AuthErrorCode.KEY_SOURCE_UNAVAILABLE,
                "Failed to fetch verification keys from " + url + ": " + e.getMessage(), e);
        }
    }

    private static KeyCache await(CompletableFuture<KeyCache> fetch) {
        try {
            return fetch.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof AuthException ae) {
                throw new AuthException(ae.getError(), ae);
            }
            throw new AuthException(AuthErrorCode.KEY_SOURCE_UNAVAILABLE,
                "Failed to fetch verification keys", e.getCause());
        }
    }

    private record KeyCache(Map<String, PublicKey> keys, Instant validUntil) {
        static final KeyCache EMPTY = new KeyCache(Map.of(), Instant.EPOCH);

        boolean isUsable(Instant at) {
            return !keys.isEmpty() && at.isBefore(validUntil);
        }
    }
}
