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

import static io.envelopes.Utils.require;
import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.util.Objects.requireNonNull;

import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.ECPublicKey;
import java.util.Arrays;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;

import io.envelopes.EnvelopeException.Reason;

/**
 * A KEM using ephemeral-static ECDH over P-256. A fresh ephemeral key pair is generated for every wrapping, the
 * shared secret is passed through {@link ConcatKDF} to derive a 256-bit key-encryption key (KEK), and the
 * data-encryption key is then encrypted under the KEK with AES-256-GCM and a random nonce. The wrapped key is
 * <pre>{@code
 * ephemeralPublicKey (65 bytes, uncompressed) || nonce (12) || encryptedDek (32) || tag (16)
 * }</pre>
 * for a total of 125 bytes.
 */
final class EcdhP256Kem implements KEM {
    private static final RedactingLogger logger = RedactingLogger.getLogger(EcdhP256Kem.class);

    static final byte[] KDF_CONTEXT = "AES-256-GCM".getBytes(US_ASCII);
    static final int DEK_SIZE_BYTES = Crypto.AES_KEY_SIZE_BYTES;
    static final int WRAPPED_KEY_LENGTH = P256.ENCODED_POINT_LENGTH + Crypto.GCM_NONCE_SIZE_BYTES
            + DEK_SIZE_BYTES + Crypto.GCM_TAG_SIZE_BYTES;

    @Override
    public String getIdentifier() {
        return "ECDH-P256-ConcatKDF-SHA256-A256GCM";
    }

    @Override
    public int wrappedKeyLength() {
        return WRAPPED_KEY_LENGTH;
    }

    @Override
    public byte[] wrap(SecretKey dek, PublicKey recipient) {
        requireNonNull(dek, "dek");
        P256.requireP256(recipient);
        if (dek.isDestroyed()) {
            throw new IllegalStateException("Key has been destroyed");
        }
        require("RAW".equalsIgnoreCase(dek.getFormat()), "DEK is not RAW format");

        var ephemeral = P256.generateKeyPair();
        byte[] sharedSecret = null;
        byte[] encodedDek = null;
        try {
            sharedSecret = Crypto.ecdh(ephemeral.getPrivate(), recipient);
            try (var kek = ConcatKDF.derive(sharedSecret, Crypto.AES_KEY_SIZE_BYTES, KDF_CONTEXT)) {
                Utils.wipe(sharedSecret);

                encodedDek = dek.getEncoded();
                require(encodedDek.length == DEK_SIZE_BYTES, "DEK must be " + DEK_SIZE_BYTES + " bytes");
                var nonce = Crypto.randomBytes(Crypto.GCM_NONCE_SIZE_BYTES);
                var sealed = Crypto.aesGcm(Cipher.ENCRYPT_MODE, kek, nonce).doFinal(encodedDek);

                var wrapped = Utils.concat(P256.encode((ECPublicKey) ephemeral.getPublic()), nonce, sealed);
                assert wrapped.length == WRAPPED_KEY_LENGTH;
                logger.trace("Wrapped DEK: epk={}, nonce={}",
                        Arrays.copyOf(wrapped, P256.ENCODED_POINT_LENGTH), nonce);
                return wrapped;
            }
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        } finally {
            Utils.wipe(sharedSecret, encodedDek);
            Utils.destroy(ephemeral.getPrivate());
        }
    }

    @Override
    public DestroyableSecretKey unwrap(byte[] wrappedKey, PrivateKey recipient) throws EnvelopeException {
        requireNonNull(wrappedKey, "wrappedKey");
        P256.requireP256(recipient);
        if (wrappedKey.length < WRAPPED_KEY_LENGTH) {
            throw new MalformedEnvelopeException(Reason.MALFORMED_WRAP,
                    "Wrapped key too short: " + wrappedKey.length + " < " + WRAPPED_KEY_LENGTH);
        }

        int nonceOffset = P256.ENCODED_POINT_LENGTH;
        int ciphertextOffset = nonceOffset + Crypto.GCM_NONCE_SIZE_BYTES;
        var nonce = Arrays.copyOfRange(wrappedKey, nonceOffset, ciphertextOffset);

        byte[] sharedSecret = null;
        byte[] encodedDek = null;
        try {
            var ephemeralPublicKey = P256.decode(wrappedKey, 0);
            sharedSecret = Crypto.ecdh(recipient, ephemeralPublicKey);
            try (var kek = ConcatKDF.derive(sharedSecret, Crypto.AES_KEY_SIZE_BYTES, KDF_CONTEXT)) {
                Utils.wipe(sharedSecret);
                // Everything after the nonce is ciphertext and tag, so every byte of the blob is authenticated
                encodedDek = Crypto.aesGcm(Cipher.DECRYPT_MODE, kek, nonce)
                        .doFinal(wrappedKey, ciphertextOffset, wrappedKey.length - ciphertextOffset);
            }
            if (encodedDek.length != DEK_SIZE_BYTES) {
                throw new MalformedEnvelopeException(Reason.MALFORMED_WRAP,
                        "Unwrapped key has wrong length: " + encodedDek.length);
            }
            return Crypto.aesKey(encodedDek);

        } catch (AEADBadTagException | IllegalArgumentException e) {
            logger.debug("Unable to unwrap DEK", e);
            throw new EnvelopeAuthenticationException(Reason.DEK_UNWRAP_FAILED);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        } finally {
            Utils.wipe(sharedSecret, encodedDek);
        }
    }
}
