package com.baas.auth.keys;

import java.io.IOException;
import java.net.URI;

/**
 * Fetches the identity provider's current certificate set.
 * Implement this over HTTP, a local file, a test fixture, etc.
 */
public interface KeyFetchTransport {

    KeyFetchResponse fetch(URI url) throws IOException;
}
