package com.baas.auth.keys;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

/**
 * Fetches a {@code {"kid": "-----BEGIN CERTIFICATE-----..."}} document and reads its cache lifetime
 * from the {@code Cache-Control: max-age} response header.
 */
@Slf4j
public final class HttpKeyFetchTransport implements KeyFetchTransport {

    private static final TypeReference<Map<String, String>> CERTIFICATES = new TypeReference<>() {};

    private final HttpClient http;
    private final Duration timeout;
    private final ObjectMapper mapper;

    public HttpKeyFetchTransport(HttpClient http, Duration timeout) {
        this(http, timeout, new ObjectMapper());
    }

    public HttpKeyFetchTransport(HttpClient http, Duration timeout, ObjectMapper mapper) {
        this.http = Objects.requireNonNull(http, "http");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public KeyFetchResponse fetch(URI url) throws IOException {
        HttpRequest req = HttpRequest.newBuilder(url)
            .timeout(timeout)
            .header("Accept", "application/json")
            .GET()
            .build();

        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while fetching verification keys from " + url);
        }

        int sc = resp.statusCode();
        if (sc < 200 || sc >= 300) {
            throw new IOException("Failed to fetch verification keys: HTTP " + sc + " from " + url);
        }

        Map<String, String> certificates = mapper.readValue(resp.body(), CERTIFICATES);
        if (certificates == null) {
            throw new IOException("Empty verification key document from " + url);
        }
        Duration maxAge = resp.headers()
            .firstValue("Cache-Control")
            .map(HttpKeyFetchTransport::parseMaxAge)
            .orElse(null);

        log.debug("Fetched {} certificates from {} (max-age {})", certificates.size(), url, maxAge);
        return new KeyFetchResponse(certificates, maxAge);
    }

    /**
     * @return the {@code max-age} directive of a Cache-Control value, or null when absent or unparsable
     */
    static Duration parseMaxAge(String cacheControl) {
        if (cacheControl == null) return null;
        for (String directive : cacheControl.split(",")) {
            String d = directive.trim().toLowerCase(Locale.ROOT);
            if (!d.startsWith("max-age=")) continue;

            String value = d.substring("max-age=".length()).replace("\"", "").trim();
            try {
                long seconds = Long.parseLong(value);
                return seconds < 0 ? null : Duration.ofSeconds(seconds);
            } catch (NumberFormatException e) {
                log.debug("Ignoring unparsable Cache-Control max-age '{}'", value);
                return null;
            }
        }
        return null;
    }
}
