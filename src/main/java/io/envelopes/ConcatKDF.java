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

import static io.envelopes.Utils.require;
import static java.util.Objects.requireNonNull;

/**
 * The single-step key derivation function from NIST SP 800-56A (section 5.8.2.1) instantiated with SHA-256. Each
 * block of output is computed as
 * <pre>{@code
 * SHA-256(BE32(counter) || Z || otherInfo || BE32(keyLengthBits))
 * }</pre>
 * with the counter starting at 1. The key length is appended as the SuppPubInfo field, in bits.
 */
final class ConcatKDF {
    static final int HASH_SIZE_BYTES = 32;
    static final int MAX_OUTPUT_SIZE_BYTES = 255 * HASH_SIZE_BYTES;

    static DestroyableSecretKey derive(byte[] sharedSecret, int keyLengthBytes, byte[] otherInfo) {
        requireNonNull(sharedSecret, "sharedSecret");
        requireNonNull(otherInfo, "otherInfo");
        require(keyLengthBytes > 0 && keyLengthBytes <= MAX_OUTPUT_SIZE_BYTES,
                "Output size must be >= 1 and <= " + MAX_OUTPUT_SIZE_BYTES);

        var digest = Crypto.sha256();
        var keyLengthBits = Utils.uint32(keyLengthBytes * 8);
        var output = new byte[keyLengthBytes];
        try {
            for (int i = 0, counter = 1; i < keyLengthBytes; i += HASH_SIZE_BYTES, counter++) {
                digest.update(Utils.uint32(counter));
                digest.update(sharedSecret);
                digest.update(otherInfo);
                digest.update(keyLengthBits);
                var block = digest.digest();
                System.arraycopy(block, 0, output, i, Math.min(keyLengthBytes - i, HASH_SIZE_BYTES));
                Utils.wipe(block);
            }
            return new DestroyableSecretKey("AES", output);
        } finally {
            Utils.wipe(output);
        }
    }

    private ConcatKDF() {}
}
