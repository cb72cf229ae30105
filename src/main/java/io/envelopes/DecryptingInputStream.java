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

import java.io.IOException;
import java.io.InputStream;
import java.security.PrivateKey;

import io.envelopes.io.FrameReader;

/**
 * An input stream that decrypts an envelope read from an underlying source, one frame at a time. The header is read
 * and the data-encryption key unwrapped when the stream is created. Each frame is only released to the caller after
 * it has been authenticated, so a read never returns unverified plaintext. Any {@link EnvelopeException} is terminal
 * and destroys the key material; as with {@link Envelopes#decrypt(PrivateKey, InputStream, java.io.OutputStream)}
 * the caller must discard everything read so far if the stream fails.
 * <p>
 * Instances are not thread-safe.
 */
public final class DecryptingInputStream extends InputStream {
    private static final RedactingLogger logger = RedactingLogger.getLogger(DecryptingInputStream.class);

    private final InputStream source;
    private final FrameReader reader;
    private final DestroyableSecretKey dek;
    private final FrameCipher frameCipher;
    private final byte[] chunkBuffer = new byte[FrameCipher.MAX_CHUNK_SIZE];
    private final byte[] frameBuffer = new byte[FrameCipher.MAX_FRAME_SIZE];
    private int position;
    private int limit;
    private long bytesProcessed;
    private boolean endOfStream;
    private boolean failed;
    private boolean closed;

    DecryptingInputStream(KEM kem, PrivateKey recipient, InputStream source) throws IOException {
        P256.requireP256(recipient);
        this.source = requireNonNull(source, "source");
        this.reader = new FrameReader(source);
        var header = Header.readFrom(reader);
        this.dek = kem.unwrap(header.wrappedKey(), recipient);
        this.frameCipher = FrameCipher.forDecryption(dek, header);
    }

    @Override
    public int read() throws IOException {
        if (!fill()) {
            return -1;
        }
        return frameBuffer[position++] & 0xFF;
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
        checkFromIndexSize(offset, length, buffer.length);
        if (length == 0) {
            return 0;
        }
        if (!fill()) {
            return -1;
        }
        int toCopy = Math.min(length, limit - position);
        System.arraycopy(frameBuffer, position, buffer, offset, toCopy);
        position += toCopy;
        return toCopy;
    }

    @Override
    public int available() throws IOException {
        ensureOpen();
        return limit - position;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try (source) {
            position = limit = 0;
            release();
        }
    }

    /**
     * The number of plaintext bytes decrypted so far.
     */
    public long bytesProcessed() {
        return bytesProcessed;
    }

    /**
     * Ensures that there is authenticated plaintext available in the frame buffer.
     *
     * @return false if the end of the envelope has been reached.
     */
    private boolean fill() throws IOException {
        ensureOpen();
        while (position == limit) {
            if (endOfStream) {
                return false;
            }
            try {
                int chunkLength = reader.readChunk(chunkBuffer, FrameCipher.MAX_CHUNK_SIZE);
                if (chunkLength < 0) {
                    endOfStream = true;
                    logger.debug("Decrypted {} bytes in {} frames", bytesProcessed, frameCipher.framesProcessed());
                    if (!frameCipher.isFinished()) {
                        logger.debug("Envelope ended at a frame boundary without a short final frame");
                    }
                    release();
                    return false;
                }
                limit = frameCipher.decryptFrame(chunkBuffer, chunkLength, frameBuffer);
                position = 0;
                bytesProcessed += limit;
            } catch (IOException | RuntimeException e) {
                position = limit = 0;
                failed = true;
                release();
                throw e;
            }
        }
        return true;
    }

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("Stream closed");
        }
        if (failed) {
            throw new IOException("Envelope decryption has already failed");
        }
    }

    private void release() {
        dek.destroy();
        Utils.wipe(chunkBuffer);
        if (position == limit) {
            Utils.wipe(frameBuffer);
        }
    }
}
