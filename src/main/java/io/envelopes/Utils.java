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

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

import javax.security.auth.DestroyFailedException;
import javax.security.auth.Destroyable;

final class Utils {
    private static final RedactingLogger logger = RedactingLogger.getLogger(Utils.class);

    static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }

    static byte[] toUnsignedBigEndian(BigInteger value, int length) {
        var bytes = value.toByteArray();
        if (bytes.length > length && bytes[0] == 0) {
            // Remove sign byte
            bytes = Arrays.copyOfRange(bytes, 1, bytes.length);
        }
        require(bytes.length <= length, "Value too large for " + length + " bytes");
        var padded = new byte[length];
        System.arraycopy(bytes, 0, padded, length - bytes.length, bytes.length);
        return padded;
    }

    static byte[] uint16(int value) {
        require(value >= 0 && value <= 0xFFFF, "Value must fit in an unsigned short");
        return new byte[] { (byte) (value >>> 8), (byte) value };
    }

    static byte[] uint32(int value) {
        return ByteBuffer.allocate(Integer.BYTES).putInt(value).array();
    }

    static void putLongLittleEndian(long value, byte[] output, int offset) {
        ByteBuffer.wrap(output, offset, Long.BYTES).order(ByteOrder.LITTLE_ENDIAN).putLong(value);
    }

    static byte[] concat(byte[]... elements) {
        int totalSize = Arrays.stream(elements).mapToInt(b -> b.length).reduce(0, Math::addExact);
        byte[] result = new byte[totalSize];
        int offset = 0;
        for (var element : elements) {
            System.arraycopy(element, 0, result, offset, element.length);
            offset += element.length;
        }
        return result;
    }

    static String hex(byte[] data) {
        var i = new BigInteger(1, data);
        return String.format("%0" + (data.length << 1) + "x", i);
    }

    /**
     * Attempts to wipe any sensitive data from memory by writing zero bytes over the array contents. This is a
     * best-effort attempt to remove data from memory, because Java's garbage collector may already have copied the
     * data in the heap.
     *
     * @param sensitiveData the sensitive data to wipe. Each non-null byte array argument is overwritten with zero
     *                      bytes. Null arguments are ignored.
     */
    static void wipe(byte[]... sensitiveData) {
        for (var data : sensitiveData) {
            if (data != null) {
                Arrays.fill(data, (byte) 0);
            }
        }
    }

    static void destroy(Destroyable... toDestroy) {
        for (var it : toDestroy) {
            if (it != null && !it.isDestroyed()) {
                try {
                    it.destroy();
                } catch (DestroyFailedException e) {
                    // Default behaviour of JCA keys is to not be destroyable unfortunately
                    logger.trace("Unable to destroy {}", it.getClass().getName());
                }
            }
        }
    }

    private Utils() {}
}
