package com.baas.auth.keys;

import java.security.PublicKey;
import java.util.Optional;

/**
 * Source of the public keys that sign ID tokens, indexed by key id.
 */
public interface VerificationKeyStore {

    /**
     * @return the key, or empty when the current key set has no such id
     * @throws com.baas.auth.AuthException with {@code KEY_SOURCE_UNAVAILABLE} when no usable key set can be obtained
     */
    Optional<PublicKey> getKey(String keyId);
}
