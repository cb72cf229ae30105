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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.security.KeyPair;
import java.util.concurrent.ThreadLocalRandom;

import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

public class EncryptingOutputStreamTest {
    private static final int M = FrameCipher.MAX_FRAME_SIZE;
    private static final int HEADER_LENGTH = 139;

    private KeyPair recipient;

    @BeforeClass
    public void generateKeys() {
        recipient = P256.generateKeyPair();
    }

    private byte[] decrypt(byte[] envelope) throws IOException {
        var out = new ByteArrayOutputStream();
        Envelopes.decrypt(recipient.getPrivate(), new ByteArrayInputStream(envelope), out);
        return out.toByteArray();
    }

    private static byte[] randomBytes(int length) {
        var data = new byte[length];
        ThreadLocalRandom.current().nextBytes(data);
        return data;
    }

    @Test
    public void shouldWriteHeaderOnCreation() throws Exception {
        var sink = new ByteArrayOutputStream();

        try (var ignored = Envelopes.newEncryptingStream(recipient.getPublic(), sink)) {
            assertThat(sink.size()).isEqualTo(HEADER_LENGTH);
        }

        assertThat(decrypt(sink.toByteArray())).isEmpty();
    }

    @Test
    public void shouldEncryptByteByByte() throws Exception {
        var plaintext = randomBytes(M + 5);
        var sink = new ByteArrayOutputStream();

        try (var out = Envelopes.newEncryptingStream(recipient.getPublic(), sink)) {
            for (byte b : plaintext) {
                out.write(b);
            }
            assertThat(out.bytesProcessed()).isEqualTo(M);
        }

        assertThat(sink.size()).isEqualTo(HEADER_LENGTH + (2 + M + 16) + (2 + 5 + 16));
        assertThat(decrypt(sink.toByteArray())).isEqualTo(plaintext);
    }

    @Test
    public void shouldMatchFramingOfEncrypt() throws Exception {
        var plaintext = randomBytes(3 * M + 17);
        var streamed = new ByteArrayOutputStream();
        try (var out = Envelopes.newEncryptingStream(recipient.getPublic(), streamed)) {
            int offset = 0;
            int step = 1;
            while (offset < plaintext.length) {
                int length = Math.min(step, plaintext.length - offset);
                out.write(plaintext, offset, length);
                offset += length;
                step = step * 3 + 1;
            }
        }
        var direct = new ByteArrayOutputStream();
        Envelopes.encrypt(recipient.getPublic(), new ByteArrayInputStream(plaintext), direct);

        assertThat(streamed.size()).isEqualTo(direct.size());
        assertThat(decrypt(streamed.toByteArray())).isEqualTo(plaintext);
    }

    @Test
    public void shouldEmitFullFramesImmediately() throws Exception {
        var sink = new ByteArrayOutputStream();
        var out = Envelopes.newEncryptingStream(recipient.getPublic(), sink);

        out.write(new byte[M - 1]);
        assertThat(sink.size()).isEqualTo(HEADER_LENGTH);
        out.write(0);
        assertThat(sink.size()).isEqualTo(HEADER_LENGTH + 2 + M + 16);

        out.close();
        assertThat(sink.size()).isEqualTo(HEADER_LENGTH + 2 + M + 16);
        assertThat(out.bytesProcessed()).isEqualTo(M);
    }

    @Test
    public void shouldCloseSinkOnce() throws Exception {
        var sink = spy(new ByteArrayOutputStream());
        var out = Envelopes.newEncryptingStream(recipient.getPublic(), sink);
        out.write(new byte[10]);
        out.flush();

        out.close();
        out.close();

        verify(sink).flush();
        verify(sink, times(1)).close();
        assertThatThrownBy(() -> out.write(1)).isInstanceOf(IOException.class).hasMessage("Stream closed");
        assertThatThrownBy(out::flush).isInstanceOf(IOException.class);
    }

    @Test
    public void shouldBecomeUnusableAfterSinkFailure() throws Exception {
        var sink = new OutputStream() {
            private boolean headerWritten;

            @Override
            public void write(int b) {
            }

            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                if (headerWritten && len > 2) {
                    throw new IOException("connection reset");
                }
                if (len == 12) {
                    headerWritten = true;
                }
            }
        };
        var out = Envelopes.newEncryptingStream(recipient.getPublic(), sink);

        assertThatThrownBy(() -> out.write(new byte[M])).isInstanceOf(IOException.class)
                .hasMessage("connection reset");
        assertThatThrownBy(() -> out.write(new byte[1])).isInstanceOf(IOException.class)
                .hasMessage("Stream closed");
        out.close();
    }

    @Test
    public void shouldValidateArguments() throws Exception {
        try (var out = Envelopes.newEncryptingStream(recipient.getPublic(), new ByteArrayOutputStream())) {
            assertThatThrownBy(() -> out.write(new byte[4], 3, 2)).isInstanceOf(IndexOutOfBoundsException.class);
        }
        assertThatThrownBy(() -> Envelopes.newEncryptingStream(recipient.getPublic(), null))
                .isInstanceOf(NullPointerException.class);
    }
}
