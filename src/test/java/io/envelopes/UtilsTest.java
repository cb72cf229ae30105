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
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.math.BigInteger;
import java.util.Iterator;
import java.util.concurrent.ThreadLocalRandom;

import javax.security.auth.DestroyFailedException;
import javax.security.auth.Destroyable;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class UtilsTest {

    @DataProvider
    public Iterator<BigInteger> randomInts() {
        return ThreadLocalRandom.current().longs(100, 0, Long.MAX_VALUE).mapToObj(BigInteger::valueOf).iterator();
    }

    @Test(dataProvider = "randomInts")
    public void shouldRecreateSameBigInteger(BigInteger value) {
        byte[] be = Utils.toUnsignedBigEndian(value, 32);
        assertThat(be).hasSize(32);
        assertThat(new BigInteger(1, be)).isEqualTo(value);
    }

    @Test
    public void shouldStripSignByte() {
        var value = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);
        assertThat(value.toByteArray()).hasSize(33);

        assertThat(Utils.toUnsignedBigEndian(value, 32)).hasSize(32).containsOnly(0xff);
    }

    @Test
    public void shouldRejectValuesTooLargeForLength() {
        assertThatThrownBy(() -> Utils.toUnsignedBigEndian(BigInteger.ONE.shiftLeft(256), 32))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @DataProvider
    public Object[][] concatTestCases() {
        return new Object[][] {
                { new byte[0], new byte[0] },
                { new byte[0], new byte[0], new byte[0] },
                { new byte[] { 42 }, new byte[] { 42 }, new byte[0], new byte[0] },
                { new byte[] { 42 }, new byte[0], new byte[0], new byte[] { 42 } },
                { new byte[] { 1, 2, 3 }, new byte[] { 1 }, new byte[] { 2 }, new byte[] { 3 } },
                { new byte[] { 1, 2, 3 }, new byte[0], new byte[] { 1, 2 }, new byte[] { 3 } },
        };
    }

    @Test(dataProvider = "concatTestCases")
    public void testConcat(byte[] concatenation, byte[]... components) {
        assertThat(Utils.concat(components)).isEqualTo(concatenation);
    }

    @Test
    public void shouldEncodeBigEndianIntegers() {
        assertThat(Utils.uint16(0)).containsExactly(0, 0);
        assertThat(Utils.uint16(125)).containsExactly(0, 125);
        assertThat(Utils.uint16(0xFFEF)).containsExactly(0xff, 0xef);
        assertThat(Utils.uint32(256)).containsExactly(0, 0, 1, 0);
        assertThatThrownBy(() -> Utils.uint16(0x10000)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Utils.uint16(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void shouldWriteLittleEndianLongAtOffset() {
        var output = new byte[10];
        Utils.putLongLittleEndian(0x0807060504030201L, output, 1);
        assertThat(output).containsExactly(0, 1, 2, 3, 4, 5, 6, 7, 8, 0);
    }

    @Test
    public void shouldWipeArraysAndIgnoreNulls() {
        var a = new byte[] { 1, 2, 3 };
        var b = new byte[] { 4 };

        Utils.wipe(a, null, b);

        assertThat(a).containsOnly(0);
        assertThat(b).containsOnly(0);
    }

    @Test
    public void shouldFormatHex() {
        assertThat(Utils.hex(new byte[] { 0, 1, (byte) 0xab })).isEqualTo("0001ab");
    }

    @Test
    public void testDestroyIgnoresExceptions() throws Exception {
        var key1 = mock(Destroyable.class);
        var key2 = mock(Destroyable.class);
        doThrow(DestroyFailedException.class).when(key1).destroy();

        Utils.destroy(key1, null, key2);

        verify(key2).destroy();
    }

    @Test
    public void testDestroySkipsDestroyedKeys() throws Exception {
        var key = mock(Destroyable.class);
        when(key.isDestroyed()).thenReturn(true);

        Utils.destroy(key);

        verify(key, never()).destroy();
    }
}
