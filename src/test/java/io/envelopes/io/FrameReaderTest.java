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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;

import org.testng.annotations.Test;

import io.envelopes.EnvelopeException.Reason;
import io.envelopes.MalformedEnvelopeException;

public class FrameReaderTest {

    /**
     * Returns at most one byte per read call, like a slow network stream.
     */
    static final class TrickleInputStream extends FilterInputStream {
        TrickleInputStream(InputStream in) {
            super(in);
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            return super.read(b, off, Math.min(len, 1));
        }
    }

    private static FrameReader readerOf(int... data) {
        var bytes = new byte[data.length];
        for (int i = 0; i < data.length; i++) {
            bytes[i] = (byte) data[i];
        }
        return new FrameReader(new ByteArrayInputStream(bytes));
    }

    @Test
    public void shouldReadBigEndianLengths() throws Exception {
        var reader = readerOf(0xff, 0xef, 0, 1);

        assertThat(reader.readLength()).isEqualTo(65519);
        assertThat(reader.readLength()).isEqualTo(1);
        assertThat(reader.readOptionalLength()).isEqualTo(-1);
    }

    @Test
    public void shouldReportCleanEndOfStream() throws Exception {
        assertThat(readerOf().readOptionalLength()).isEqualTo(-1);
        assertThat(readerOf().readChunk(new byte[10], 10)).isEqualTo(-1);
    }

    @Test
    public void shouldRejectPartialLength() {
        assertThatThrownBy(() -> readerOf(1).readOptionalLength())
                .isInstanceOfSatisfying(MalformedEnvelopeException.class,
                        e -> assertThat(e.reason()).isEqualTo(Reason.UNEXPECTED_EOF));
        assertThatThrownBy(() -> readerOf().readLength())
                .isInstanceOfSatisfying(MalformedEnvelopeException.class,
                        e -> assertThat(e.reason()).isEqualTo(Reason.UNEXPECTED_EOF));
    }

    @Test
    public void shouldReadChunks() throws Exception {
        var reader = readerOf(0, 3, 1, 2, 3, 0, 0);
        var buffer = new byte[10];

        assertThat(reader.readChunk(buffer, 10)).isEqualTo(3);
        assertThat(buffer).startsWith(1, 2, 3);
        assertThat(reader.readChunk(buffer, 10)).isZero();
        assertThat(reader.readChunk(buffer, 10)).isEqualTo(-1);
    }

    @Test
    public void shouldRejectOversizedChunk() {
        assertThatThrownBy(() -> readerOf(0, 11).readChunk(new byte[10], 10))
                .isInstanceOfSatisfying(MalformedEnvelopeException.class,
                        e -> assertThat(e.reason()).isEqualTo(Reason.CHUNK_TOO_LARGE));
    }

    @Test
    public void shouldRejectTruncatedChunk() {
        assertThatThrownBy(() -> readerOf(0, 5, 1, 2).readChunk(new byte[10], 10))
                .isInstanceOfSatisfying(MalformedEnvelopeException.class,
                        e -> assertThat(e.reason()).isEqualTo(Reason.UNEXPECTED_EOF))
                .hasMessageContaining("expected 5 bytes, got 2");
    }

    @Test
    public void shouldNotTreatShortReadsAsEndOfStream() throws Exception {
        var data = new byte[2 + 1000];
        data[0] = 0x03;
        data[1] = (byte) 0xe8;
        for (int i = 2; i < data.length; i++) {
            data[i] = (byte) i;
        }
        var reader = new FrameReader(new TrickleInputStream(new ByteArrayInputStream(data)));
        var buffer = new byte[1000];

        assertThat(reader.readChunk(buffer, 1000)).isEqualTo(1000);
        assertThat(buffer[999]).isEqualTo((byte) 1001);
        assertThat(reader.readChunk(buffer, 1000)).isEqualTo(-1);
    }

    @Test
    public void shouldReadFixedLengthFields() throws Exception {
        var reader = readerOf(1, 2, 3, 4);

        assertThat(reader.readFixedLengthBytes(3)).containsExactly(1, 2, 3);
        assertThatThrownBy(() -> reader.readFixedLengthBytes(2))
                .isInstanceOf(MalformedEnvelopeException.class);
    }

    @Test
    public void shouldRejectMaxLengthLargerThanBuffer() {
        assertThatThrownBy(() -> readerOf(0, 1, 1).readChunk(new byte[5], 10))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }
}
