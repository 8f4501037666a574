package com.baas.auth.keys;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Transport that plays back queued responses and failures, counts fetches, and can hold a fetch open
 * until the test releases it.
 */
final class ScriptedTransport implements KeyFetchTransport {

    final AtomicInteger fetches = new AtomicInteger();
    private final Queue<Object> script = new ConcurrentLinkedQueue<>();
    private volatile CountDownLatch entered;
    private volatile CountDownLatch release;

    ScriptedTransport respond(Map<String, String> certificates, Duration maxAge) {
        script.add(new KeyFetchResponse(certificates, maxAge));
        return this;
    }

    ScriptedTransport fail(IOException failure) {
        script.add(failure);
        return this;
    }

    /** Makes the next fetches block until {@link #release()} is called. */
    CountDownLatch hold() {
        entered = new CountDownLatch(1);
        release = new CountDownLatch(1);
        return entered;
    }

    void release() {
        release.countDown();
    }

    @Override
    public KeyFetchResponse fetch(URI url) throws IOException {
        fetches.incrementAndGet();
        CountDownLatch e = entered;
        CountDownLatch r = release;
        if (e != null) {
            e.countDown();
            try {
                if (!r.await(10, TimeUnit.SECONDS)) {
                    throw new IOException("test never released the fetch");
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("interrupted");
            }
        }

        Object next = script.poll();
        if (next == null) {
            throw new IllegalStateException("unexpected fetch #" + fetches.get());
        }
        if (next instanceof IOException failure) {
            throw failure;
        }
        return (KeyFetchResponse) next;
    }
}
