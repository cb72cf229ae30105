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

import java.security.PrivateKey;
import java.security.PublicKey;

import javax.crypto.SecretKey;

/**
 * Interface to be implemented by Key Encapsulation Mechanisms (KEMs). A KEM protects the random data-encryption key
 * (DEK) of a single envelope so that only the holder of the recipient's private key can recover it. Envelope KEMs
 * must satisfy the following properties:
 * <ul>
 *     <li>Every call to {@link #wrap(SecretKey, PublicKey)} uses fresh ephemeral key material, so that two wrappings
 *     of the same DEK for the same recipient are unlinkable and compromise of one wrapping reveals nothing about
 *     another.</li>
 *     <li>The wrapped key is authenticated. If {@link #unwrap(byte[], PrivateKey)} returns then the recovered DEK
 *     is exactly the one that was wrapped; any modification of the wrapped key, or use of the wrong private key, is
 *     reported as an {@link EnvelopeAuthenticationException} without further detail.</li>
 *     <li>The wrapped key has a fixed length for a given KEM, so that it can be framed with a short length
 *     prefix.</li>
 * </ul>
 */
interface KEM {

    /**
     * A unique identifier for this KEM algorithm.
     */
    String getIdentifier();

    /**
     * The length in bytes of every wrapped key produced by this KEM.
     */
    int wrappedKeyLength();

    /**
     * Wraps the given data-encryption key for the given recipient.
     *
     * @param dek the data-encryption key. Must be in RAW format.
     * @param recipient the recipient's public key.
     * @return the wrapped key blob.
     * @throws UnsupportedCurveException if the recipient key is not supported by this KEM.
     */
    byte[] wrap(SecretKey dek, PublicKey recipient);

    /**
     * Recovers a data-encryption key that was previously wrapped for the given recipient.
     *
     * @param wrappedKey the wrapped key blob.
     * @param recipient the recipient's private key.
     * @return the unwrapped data-encryption key. The caller is responsible for destroying it.
     * @throws MalformedEnvelopeException if the wrapped key is structurally invalid.
     * @throws EnvelopeAuthenticationException if the wrapped key cannot be authenticated with the given key.
     * @throws UnsupportedCurveException if the recipient key is not supported by this KEM.
     */
    DestroyableSecretKey unwrap(byte[] wrappedKey, PrivateKey recipient) throws EnvelopeException;
}
