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

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.PrivateKey;
import java.security.PublicKey;

import io.envelopes.io.FrameReader;
import io.envelopes.io.FrameWriter;

/**
 * Streaming envelope encryption for arbitrarily large data using ECDH P-256 and AES-256-GCM. A fresh random
 * data-encryption key (DEK) is generated for every envelope and wrapped for the recipient's public key with an
 * ephemeral ECDH key agreement. The data is then encrypted with AES-256-GCM in frames of at most
 * {@value FrameCipher#MAX_FRAME_SIZE} bytes, so that encryption and decryption run in constant memory regardless of
 * the size of the input. The wire format is:
 * <pre>{@code
 * u16 wrappedLength || wrappedKey || baseNonce[12]        (header)
 * ( u16 chunkLength || ciphertext || tag[16] )*           (frames)
 * }</pre>
 * The first frame authenticates the header length and base nonce as associated data.
 * <p>
 * All methods are safe to call concurrently: each call owns its own key material and buffers. The source and sink
 * streams are never closed by {@link #encrypt(PublicKey, InputStream, OutputStream)} or
 * {@link #decrypt(PrivateKey, InputStream, OutputStream)}.
 * <p>
 * Any failure is terminal and nothing already written to the sink is rolled back. Callers must discard all output
 * of a failed operation.
 */
public final class Envelopes {
    private static final RedactingLogger logger = RedactingLogger.getLogger(Envelopes.class);
    private static final KEM KEM = new EcdhP256Kem();

    /**
     * Encrypts everything read from the source to the sink for the given recipient.
     *
     * @param recipient the recipient's P-256 public key.
     * @param source the plaintext source. Read until end-of-stream.
     * @param sink the sink to write the envelope to.
     * @return the number of plaintext bytes encrypted.
     * @throws UnsupportedCurveException if the key is not a P-256 key. Nothing is read or written in this case.
     * @throws IOException if reading the source or writing the sink fails.
     */
    public static long encrypt(PublicKey recipient, InputStream source, OutputStream sink) throws IOException {
        P256.requireP256(recipient);
        requireNonNull(source, "source");
        requireNonNull(sink, "sink");

        var writer = new FrameWriter(sink);
        var plaintext = new byte[FrameCipher.MAX_FRAME_SIZE];
        var ciphertext = new byte[FrameCipher.MAX_CHUNK_SIZE];
        long total = 0;

        try (var dek = Crypto.generateAesKey()) {
            var header = Header.create(KEM, dek, recipient);
            header.writeTo(writer);
            long written = header.length();
            var frameCipher = FrameCipher.forEncryption(dek, header);

            while (true) {
                int read = source.readNBytes(plaintext, 0, plaintext.length);
                if (read == 0) {
                    break;
                }
                int length = frameCipher.encryptFrame(plaintext, read, ciphertext);
                writer.writeChunk(ciphertext, 0, length);
                written += 2 + length;
                total += read;
                // readNBytes only returns short at end-of-stream, so a short frame is always the last
                if (read < plaintext.length) {
                    break;
                }
            }

            logger.debug("Encrypted {} bytes in {} frames with {} ({} bytes written)", total,
                    frameCipher.framesProcessed(), KEM.getIdentifier(), written);
            return total;
        } finally {
            Utils.wipe(plaintext, ciphertext);
        }
    }

    /**
     * Decrypts an envelope read from the source, writing the plaintext to the sink. Each frame is authenticated
     * before any of its plaintext is written.
     *
     * @param recipient the recipient's P-256 private key.
     * @param source the envelope source. Read until end-of-stream.
     * @param sink the sink to write the plaintext to.
     * @return the number of plaintext bytes written to the sink.
     * @throws UnsupportedCurveException if the key is not a P-256 key. Nothing is read or written in this case.
     * @throws MalformedEnvelopeException if the envelope is truncated or structurally invalid.
     * @throws EnvelopeAuthenticationException if the key is wrong or the envelope has been tampered with.
     * @throws IOException if reading the source or writing the sink fails.
     */
    public static long decrypt(PrivateKey recipient, InputStream source, OutputStream sink) throws IOException {
        P256.requireP256(recipient);
        requireNonNull(source, "source");
        requireNonNull(sink, "sink");

        var reader = new FrameReader(source);
        var header = Header.readFrom(reader);
        var ciphertext = new byte[FrameCipher.MAX_CHUNK_SIZE];
        var plaintext = new byte[FrameCipher.MAX_FRAME_SIZE];
        long total = 0;

        try (var dek = KEM.unwrap(header.wrappedKey(), recipient)) {
            var frameCipher = FrameCipher.forDecryption(dek, header);

            int chunkLength;
            while ((chunkLength = reader.readChunk(ciphertext, FrameCipher.MAX_CHUNK_SIZE)) >= 0) {
                int length = frameCipher.decryptFrame(ciphertext, chunkLength, plaintext);
                sink.write(plaintext, 0, length);
                total += length;
            }

            logger.debug("Decrypted {} bytes in {} frames", total, frameCipher.framesProcessed());
            if (!frameCipher.isFinished()) {
                logger.debug("Envelope ended at a frame boundary without a short final frame");
            }
            return total;
        } finally {
            Utils.wipe(plaintext, ciphertext);
        }
    }

    /**
     * Encrypts the source file into the target file, replacing any existing target. A partially written target is
     * left in place if encryption fails.
     */
    public static long encrypt(PublicKey recipient, Path source, Path target) throws IOException {
        P256.requireP256(recipient);
        try (var in = Files.newInputStream(source);
             var out = Files.newOutputStream(target)) {
            return encrypt(recipient, in, out);
        }
    }

    /**
     * Decrypts the source file into the target file, replacing any existing target. A partially written target is
     * left in place if decryption fails, and must not be trusted.
     */
    public static long decrypt(PrivateKey recipient, Path source, Path target) throws IOException {
        P256.requireP256(recipient);
        try (var in = Files.newInputStream(source);
             var out = Files.newOutputStream(target)) {
            return decrypt(recipient, in, out);
        }
    }

    /**
     * Returns an output stream that encrypts everything written to it for the given recipient. The header is
     * written to the sink immediately. The envelope is only complete once the returned stream has been closed,
     * which also closes the sink.
     */
    public static EncryptingOutputStream newEncryptingStream(PublicKey recipient, OutputStream sink)
            throws IOException {
        return new EncryptingOutputStream(KEM, recipient, sink);
    }

    /**
     * Returns an input stream that decrypts an envelope read from the source. The header is read and the key
     * unwrapped before this method returns. Closing the returned stream closes the source.
     */
    public static DecryptingInputStream newDecryptingStream(PrivateKey recipient, InputStream source)
            throws IOException {
        return new DecryptingInputStream(KEM, recipient, source);
    }

    private Envelopes() {}
}
