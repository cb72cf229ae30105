/*
 * Copyright 2022 Neil Madden.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 *
 */

package io.envelopes;

import static java.util.Objects.requireNonNull;

import java.security.MessageDigest;
import java.util.Objects;

import javax.crypto.SecretKey;

/**
 * A secret key held as an in-memory byte array whose {@link #destroy()} method really scrubs the key material, unlike
 * {@link javax.crypto.spec.SecretKeySpec}. Keys are {@link AutoCloseable} so that the data-encryption and
 * key-encryption keys of an envelope can be scoped to a try-with-resources block and are wiped on every exit path:
 * <pre>{@code
 * try (var kek = ConcatKDF.derive(sharedSecret, 32, context)) {
 *     ...
 * }
 * }</pre>
 * Once destroyed, the key material can no longer be read and the key is only equal to itself.
 */
final class DestroyableSecretKey implements SecretKey, AutoCloseable {

    private final String algorithm;
    private final byte[] keyMaterial;
    private volatile boolean destroyed;

    /**
     * Creates a key from a copy of the given key material. The caller remains responsible for wiping its array.
     */
    DestroyableSecretKey(String algorithm, byte[] keyMaterial) {
        this.algorithm = requireNonNull(algorithm, "algorithm");
        this.keyMaterial = requireNonNull(keyMaterial, "keyMaterial").clone();
    }

    /**
     * Creates a key that takes over the given key material, wiping the caller's array.
     */
    static DestroyableSecretKey takeOwnership(String algorithm, byte[] keyMaterial) {
        try {
            return new DestroyableSecretKey(algorithm, keyMaterial);
        } finally {
            Utils.wipe(keyMaterial);
        }
    }

    @Override
    public String getAlgorithm() {
        return algorithm;
    }

    @Override
    public String getFormat() {
        return "RAW";
    }

    @Override
    public byte[] getEncoded() {
        if (destroyed) {
            throw new IllegalStateException("Key material has been destroyed");
        }
        return keyMaterial.clone();
    }

    /**
     * The length of the key material in bytes. This doesn't copy the key, and still works after it is destroyed.
     */
    int length() {
        return keyMaterial.length;
    }

    @Override
    public void destroy() {
        if (!destroyed) {
            destroyed = true;
            Utils.wipe(keyMaterial);
        }
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public void close() {
        destroy();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) { return true; }
        if (!(other instanceof DestroyableSecretKey)) { return false; }
        var that = (DestroyableSecretKey) other;
        if (this.destroyed || that.destroyed) { return false; }
        return algorithm.equals(that.algorithm) && MessageDigest.isEqual(keyMaterial, that.keyMaterial);
    }

    // Never derived from the key material itself
    @Override
    public int hashCode() {
        return Objects.hash(algorithm, keyMaterial.length);
    }

    @Override
    public String toString() {
        var state = destroyed ? "destroyed" : (keyMaterial.length * 8) + " bits";
        return "DestroyableSecretKey[" + algorithm + ", " + state + "]";
    }
}
