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
import java.io.OutputStream;
import java.security.PublicKey;

import io.envelopes.io.FrameWriter;

/**
 * An output stream that encrypts everything written to it into an envelope on the underlying sink. The header is
 * written when the stream is created. Data is collected into a single frame buffer and each full frame is encrypted
 * and written as soon as it is complete; {@link #close()} writes the final partial frame (if any) and closes the
 * sink. The output is identical in format to {@link Envelopes#encrypt(PublicKey, java.io.InputStream, OutputStream)}.
 * <p>
 * {@link #flush()} flushes the sink but cannot force out a partial frame, as a short frame always ends the stream.
 * If any write to the sink fails then the stream is unusable and its key material is destroyed. Instances are not
 * thread-safe.
 */
public final class EncryptingOutputStream extends OutputStream {
    private static final RedactingLogger logger = RedactingLogger.getLogger(EncryptingOutputStream.class);

    private final OutputStream sink;
    private final FrameWriter writer;
    private final DestroyableSecretKey dek;
    private final FrameCipher frameCipher;
    private final byte[] frameBuffer = new byte[FrameCipher.MAX_FRAME_SIZE];
    private final byte[] chunkBuffer = new byte[FrameCipher.MAX_CHUNK_SIZE];
    private int buffered;
    private long bytesProcessed;
    private boolean closed;
    private boolean released;

    EncryptingOutputStream(KEM kem, PublicKey recipient, OutputStream sink) throws IOException {
        P256.requireP256(recipient);
        this.sink = requireNonNull(sink, "sink");
        this.writer = new FrameWriter(sink);
        this.dek = Crypto.generateAesKey();
        try {
            var header = Header.create(kem, dek, recipient);
            header.writeTo(writer);
            this.frameCipher = FrameCipher.forEncryption(dek, header);
        } catch (IOException | RuntimeException e) {
            dek.destroy();
            throw e;
        }
    }

    @Override
    public void write(int b) throws IOException {
        ensureOpen();
        frameBuffer[buffered++] = (byte) b;
        if (buffered == frameBuffer.length) {
            writeFrame();
        }
    }

    @Override
    public void write(byte[] data, int offset, int length) throws IOException {
        checkFromIndexSize(offset, length, data.length);
        ensureOpen();
        while (length > 0) {
            int toCopy = Math.min(length, frameBuffer.length - buffered);
            System.arraycopy(data, offset, frameBuffer, buffered, toCopy);
            buffered += toCopy;
            offset += toCopy;
            length -= toCopy;
            if (buffered == frameBuffer.length) {
                writeFrame();
            }
        }
    }

    @Override
    public void flush() throws IOException {
        ensureOpen();
        writer.flush();
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try (sink) {
            if (!released && buffered > 0) {
                writeFrame();
            }
            logger.debug("Encrypted {} bytes in {} frames", bytesProcessed, frameCipher.framesProcessed());
        } finally {
            release();
        }
    }

    /**
     * The number of plaintext bytes encrypted and written to the sink so far.
     */
    public long bytesProcessed() {
        return bytesProcessed;
    }

    private void writeFrame() throws IOException {
        try {
            int length = frameCipher.encryptFrame(frameBuffer, buffered, chunkBuffer);
            writer.writeChunk(chunkBuffer, 0, length);
            bytesProcessed += buffered;
            buffered = 0;
        } catch (IOException | RuntimeException e) {
            release();
            throw e;
        }
    }

    private void ensureOpen() throws IOException {
        if (closed || released) {
            throw new IOException("Stream closed");
        }
    }

    private void release() {
        released = true;
        dek.destroy();
        Utils.wipe(frameBuffer, chunkBuffer);
    }
}
