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
import java.io.Flushable;
import java.io.IOException;
import java.io.OutputStream;

/**
 * Writes the primitive fields of the envelope wire format. Lengths are written as unsigned 16-bit big-endian
 * values.
 */
public final class FrameWriter implements Closeable, Flushable {
    private static final int MAX_LENGTH = 0xFFFF;

    private final OutputStream outputStream;
    private final byte[] lengthBuffer = new byte[2];

    public FrameWriter(OutputStream outputStream) {
        this.outputStream = requireNonNull(outputStream);
    }

    public void writeLength(int length) throws IOException {
        if (length < 0 || length > MAX_LENGTH) {
            throw new IllegalArgumentException("Length must fit in an unsigned short");
        }
        lengthBuffer[0] = (byte) (length >>> 8);
        lengthBuffer[1] = (byte) length;
        outputStream.write(lengthBuffer);
    }

    public void writeFixedLengthBytes(byte[] data) throws IOException {
        outputStream.write(data);
    }

    /**
     * Writes a chunk preceded by its length.
     */
    public void writeChunk(byte[] data, int offset, int length) throws IOException {
        checkFromIndexSize(offset, length, data.length);
        writeLength(length);
        outputStream.write(data, offset, length);
    }

    public void writeChunk(byte[] data) throws IOException {
        writeChunk(data, 0, data.length);
    }

    @Override
    public void close() throws IOException {
        outputStream.close();
    }

    @Override
    public void flush() throws IOException {
        outputStream.flush();
    }
}
