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

import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.Key;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;

import javax.crypto.Cipher;
import javax.crypto.KeyAgreement;
import javax.crypto.NoSuchPaddingException;
import javax.crypto.spec.GCMParameterSpec;

final class Crypto {
    private static final SecureRandom SECURE_RANDOM;
    static final String HASH_ALGORITHM = "SHA-256";
    static final String CIPHER_ALGORITHM = "AES/GCM/NoPadding";
    static final String KEY_AGREEMENT_ALGORITHM = "ECDH";
    static final int AES_KEY_SIZE_BYTES = 32;
    static final int GCM_NONCE_SIZE_BYTES = 12;
    static final int GCM_TAG_SIZE_BYTES = 16;

    static {
        SecureRandom random;
        try {
            random = SecureRandom.getInstance("NativePRNGNonBlocking");
        } catch (NoSuchAlgorithmException e) {
            random = new SecureRandom();
        }
        SECURE_RANDOM = random;
    }

    static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance(HASH_ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("JVM doesn't support SHA-256", e);
        }
    }

    static byte[] randomBytes(int numBytes) {
        byte[] bytes = new byte[numBytes];
        SECURE_RANDOM.nextBytes(bytes);
        return bytes;
    }

    static SecureRandom secureRandom() {
        return SECURE_RANDOM;
    }

    /**
     * Wraps the given key material as an AES key. The input array is wiped before this method returns.
     */
    static DestroyableSecretKey aesKey(byte[] keyData) {
        return DestroyableSecretKey.takeOwnership("AES", keyData);
    }

    static DestroyableSecretKey generateAesKey() {
        return aesKey(randomBytes(AES_KEY_SIZE_BYTES));
    }

    /**
     * Performs raw ECDH key agreement, returning the x-coordinate of the shared point. The caller is responsible
     * for wiping the result.
     *
     * @throws IllegalArgumentException if either key is unsuitable, for example a public key that is not on the
     * same curve as the private key.
     */
    static byte[] ecdh(PrivateKey privateKey, PublicKey publicKey) {
        try {
            var keyAgreement = KeyAgreement.getInstance(KEY_AGREEMENT_ALGORITHM);
            keyAgreement.init(privateKey);
            keyAgreement.doPhase(publicKey, true);
            return keyAgreement.generateSecret();
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError("JVM doesn't support ECDH", e);
        } catch (InvalidKeyException | IllegalStateException e) {
            throw new IllegalArgumentException(e);
        }
    }

    static Cipher newAesGcmCipher() {
        try {
            return Cipher.getInstance(CIPHER_ALGORITHM);
        } catch (NoSuchAlgorithmException | NoSuchPaddingException e) {
            throw new AssertionError("JVM doesn't support AES/GCM encryption", e);
        }
    }

    static void initAesGcm(Cipher cipher, int mode, Key key, byte[] nonce) {
        try {
            cipher.init(mode, key, new GCMParameterSpec(GCM_TAG_SIZE_BYTES * 8, nonce));
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException(e);
        }
    }

    static Cipher aesGcm(int mode, Key key, byte[] nonce) {
        var cipher = newAesGcmCipher();
        initAesGcm(cipher, mode, key, nonce);
        return cipher;
    }

    private Crypto() {}
}
