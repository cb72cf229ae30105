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

import static java.util.Objects.checkFromIndexSize;
import static java.util.Objects.requireNonNull;

import java.security.GeneralSecurityException;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;

import io.envelopes.EnvelopeException.Reason;

/**
 * The data encapsulation mechanism (DEM) for envelope streams: AES-256-GCM applied to a sequence of frames under a
 * single data-encryption key. The nonce for frame {@code i} is
 * <pre>{@code
 * baseNonce[0:4] || LE64(i)
 * }</pre>
 * where the frame counter {@code i} is an unsigned 64-bit value starting at zero. Only the first frame has
 * associated data, which is the {@linkplain Header#associatedData() header binding}.
 * <p>
 * A plaintext frame is at most {@value #MAX_FRAME_SIZE} bytes so that the ciphertext plus tag always fits in an
 * unsigned 16-bit length prefix. Every frame except the last is exactly this size; a shorter frame marks the end of
 * the stream.
 * <p>
 * Instances are stateful and must process the frames of one stream in order. They are not thread-safe.
 */
final class FrameCipher {
    private static final RedactingLogger logger = RedactingLogger.getLogger(FrameCipher.class);

    static final int MAX_FRAME_SIZE = 65519;
    static final int TAG_SIZE = Crypto.GCM_TAG_SIZE_BYTES;
    static final int MAX_CHUNK_SIZE = MAX_FRAME_SIZE + TAG_SIZE;
    static final int NONCE_SIZE = Crypto.GCM_NONCE_SIZE_BYTES;
    static final int NONCE_PREFIX_SIZE = 4;

    private final int mode;
    private final Cipher cipher;
    private final SecretKey dek;
    private final byte[] baseNonce;
    private final byte[] headerAd;
    private final byte[] nonce = new byte[NONCE_SIZE];

    private long counter;
    private boolean counterExhausted;
    private boolean finalFrameSeen;

    private FrameCipher(int mode, SecretKey dek, Header header) {
        this.mode = mode;
        this.dek = requireNonNull(dek, "dek");
        this.baseNonce = requireNonNull(header, "header").baseNonce();
        this.headerAd = header.associatedData();
        this.cipher = Crypto.newAesGcmCipher();
    }

    static FrameCipher forEncryption(SecretKey dek, Header header) {
        return new FrameCipher(Cipher.ENCRYPT_MODE, dek, header);
    }

    static FrameCipher forDecryption(SecretKey dek, Header header) {
        return new FrameCipher(Cipher.DECRYPT_MODE, dek, header);
    }

    /**
     * Builds the nonce for the given frame.
     */
    static byte[] frameNonce(byte[] baseNonce, long counter) {
        var nonce = new byte[NONCE_SIZE];
        writeNonce(baseNonce, counter, nonce);
        return nonce;
    }

    private static void writeNonce(byte[] baseNonce, long counter, byte[] nonce) {
        System.arraycopy(baseNonce, 0, nonce, 0, NONCE_PREFIX_SIZE);
        Utils.putLongLittleEndian(counter, nonce, NONCE_PREFIX_SIZE);
    }

    /**
     * Encrypts the next frame.
     *
     * @param plaintext the buffer holding the plaintext frame.
     * @param length the length of the frame, at most {@value #MAX_FRAME_SIZE}. A frame shorter than this is the final
     *               frame, after which no further frames can be encrypted.
     * @param output the buffer to write the ciphertext and tag to. Must have room for {@code length + TAG_SIZE}
     *               bytes.
     * @return the number of bytes written to the output.
     */
    int encryptFrame(byte[] plaintext, int length, byte[] output) {
        Utils.require(mode == Cipher.ENCRYPT_MODE, "Not initialised for encryption");
        checkFromIndexSize(0, length, plaintext.length);
        Utils.require(length <= MAX_FRAME_SIZE, "Frame too large: " + length);
        if (finalFrameSeen) {
            throw new IllegalStateException("Final frame has already been encrypted");
        }
        initFrame();
        try {
            int written = cipher.doFinal(plaintext, 0, length, output, 0);
            nextFrame(length);
            return written;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * Decrypts and verifies the next frame. If verification fails then nothing is released into the output.
     *
     * @param chunk the buffer holding the ciphertext and tag.
     * @param length the length of the ciphertext and tag.
     * @param output the buffer to write the plaintext to. Must have room for {@code length - TAG_SIZE} bytes.
     * @return the number of plaintext bytes written to the output.
     * @throws MalformedEnvelopeException if the chunk has an invalid length, or follows the final frame.
     * @throws EnvelopeAuthenticationException if the frame fails authentication.
     */
    int decryptFrame(byte[] chunk, int length, byte[] output) throws EnvelopeException {
        Utils.require(mode == Cipher.DECRYPT_MODE, "Not initialised for decryption");
        checkFromIndexSize(0, length, chunk.length);
        if (finalFrameSeen) {
            throw new MalformedEnvelopeException(Reason.FRAME_AFTER_FINAL, "Frame found after the final frame");
        }
        if (length < TAG_SIZE) {
            throw new MalformedEnvelopeException(Reason.CHUNK_TOO_SHORT, "Chunk too short for tag: " + length);
        }
        if (length > MAX_CHUNK_SIZE) {
            throw new MalformedEnvelopeException(Reason.CHUNK_TOO_LARGE, "Chunk too large: " + length);
        }
        initFrame();
        try {
            int written = cipher.doFinal(chunk, 0, length, output, 0);
            nextFrame(written);
            return written;
        } catch (AEADBadTagException e) {
            Utils.wipe(output);
            logger.debug("Frame {} failed authentication", Long.toUnsignedString(counter), e);
            throw new EnvelopeAuthenticationException(Reason.FRAME_AUTH_FAILED);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * The number of frames processed so far, as an unsigned value.
     */
    long framesProcessed() {
        return counter;
    }

    /**
     * Whether a final (short) frame has been processed.
     */
    boolean isFinished() {
        return finalFrameSeen;
    }

    private void initFrame() {
        if (counterExhausted) {
            throw new IllegalStateException("Frame counter exhausted");
        }
        writeNonce(baseNonce, counter, nonce);
        Crypto.initAesGcm(cipher, mode, dek, nonce);
        if (counter == 0) {
            cipher.updateAAD(headerAd);
        }
    }

    private void nextFrame(int plaintextLength) {
        logger.trace("Processed frame {} ({} bytes)", Long.toUnsignedString(counter), plaintextLength);
        counter++;
        if (counter == 0) {
            counterExhausted = true;
        }
        if (plaintextLength < MAX_FRAME_SIZE) {
            finalFrameSeen = true;
        }
    }
}
