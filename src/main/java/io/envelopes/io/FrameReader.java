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

package io.envelopes.io;

import static java.util.Objects.checkFromIndexSize;
import static java.util.Objects.requireNonNull;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;

import io.envelopes.EnvelopeException.Reason;
import io.envelopes.MalformedEnvelopeException;

/**
 * Reads the primitive fields of the envelope wire format: big-endian unsigned 16-bit lengths, fixed-length byte
 * strings, and length-prefixed chunks. All reads are <em>full</em> reads: a read only returns fewer bytes than
 * requested when the underlying stream has reached end-of-stream, regardless of how the stream fragments its data.
 */
public final class FrameReader implements Closeable {
    private static final int MAX_LENGTH = 0xFFFF;

    private final InputStream inputStream;
    private final byte[] lengthBuffer = new byte[2];

    public FrameReader(InputStream inputStream) {
        this.inputStream = requireNonNull(inputStream);
    }

    /**
     * Reads an unsigned 16-bit big-endian length.
     *
     * @throws MalformedEnvelopeException if the stream ends before both bytes have been read.
     */
    public int readLength() throws IOException {
        int length = readOptionalLength();
        if (length < 0) {
            throw new MalformedEnvelopeException(Reason.UNEXPECTED_EOF, "Unexpected end of stream reading length");
        }
        return length;
    }

    /**
     * Reads an unsigned 16-bit big-endian length, or returns -1 if the stream is already at end-of-stream.
     *
     * @throws MalformedEnvelopeException if the stream ends after only one byte of the length.
     */
    public int readOptionalLength() throws IOException {
        int read = inputStream.readNBytes(lengthBuffer, 0, 2);
        if (read == 0) {
            return -1;
        }
        if (read < 2) {
            throw new MalformedEnvelopeException(Reason.UNEXPECTED_EOF, "Unexpected end of stream reading length");
        }
        return ((lengthBuffer[0] & 0xFF) << 8) | (lengthBuffer[1] & 0xFF);
    }

    public byte[] readFixedLengthBytes(int length) throws IOException {
        var bytes = new byte[length];
        readFully(bytes, 0, length);
        return bytes;
    }

    public void readFully(byte[] buffer, int offset, int length) throws IOException {
        checkFromIndexSize(offset, length, buffer.length);
        int read = inputStream.readNBytes(buffer, offset, length);
        if (read < length) {
            throw new MalformedEnvelopeException(Reason.UNEXPECTED_EOF,
                    "Unexpected end of stream: expected " + length + " bytes, got " + read);
        }
    }

    /**
     * Reads a length-prefixed chunk into the start of the given buffer.
     *
     * @param buffer the buffer to read into.
     * @param maxLength the maximum permitted chunk length, at most the size of the buffer.
     * @return the length of the chunk, or -1 if the stream was cleanly at end-of-stream before the length prefix.
     * @throws MalformedEnvelopeException if the chunk is longer than {@code maxLength} or is truncated.
     */
    public int readChunk(byte[] buffer, int maxLength) throws IOException {
        checkFromIndexSize(0, maxLength, Math.min(buffer.length, MAX_LENGTH));
        int length = readOptionalLength();
        if (length < 0) {
            return -1;
        }
        if (length > maxLength) {
            throw new MalformedEnvelopeException(Reason.CHUNK_TOO_LARGE,
                    "Chunk length " + length + " exceeds maximum of " + maxLength);
        }
        readFully(buffer, 0, length);
        return length;
    }

    @Override
    public void close() throws IOException {
        inputStream.close();
    }
}
