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
import java.security.PublicKey;
import java.util.Arrays;
import java.util.Objects;

import javax.crypto.SecretKey;

import io.envelopes.EnvelopeException.Reason;
import io.envelopes.io.FrameReader;
import io.envelopes.io.FrameWriter;

/**
 * The envelope header: the wrapped data-encryption key followed by the base nonce for the frame cipher. On the wire
 * this is
 * <pre>{@code
 * u16 wrappedLength || wrappedKey[wrappedLength] || baseNonce[12]
 * }</pre>
 * The header is not authenticated on its own. Instead {@link #associatedData()} is included as associated data in
 * the first frame, so tampering with the length or base nonce invalidates that frame, while tampering with the
 * wrapped key causes key unwrapping to fail.
 */
final class Header {
    static final int BASE_NONCE_SIZE = Crypto.GCM_NONCE_SIZE_BYTES;
    /**
     * Upper bound on the wrapped key length accepted when reading a header. This is a sanity limit to reject corrupt
     * headers early rather than a cryptographic one.
     */
    static final int MAX_WRAPPED_KEY_LENGTH = 200;

    private final byte[] wrappedKey;
    private final byte[] baseNonce;

    Header(byte[] wrappedKey, byte[] baseNonce) {
        requireNonNull(wrappedKey, "wrappedKey");
        requireNonNull(baseNonce, "baseNonce");
        Utils.require(wrappedKey.length > 0 && wrappedKey.length <= MAX_WRAPPED_KEY_LENGTH,
                "Invalid wrapped key length");
        Utils.require(baseNonce.length == BASE_NONCE_SIZE, "Base nonce must be " + BASE_NONCE_SIZE + " bytes");
        this.wrappedKey = wrappedKey.clone();
        this.baseNonce = baseNonce.clone();
    }

    /**
     * Creates a header for a new envelope with a fresh random base nonce.
     */
    static Header create(byte[] wrappedKey) {
        return new Header(wrappedKey, Crypto.randomBytes(BASE_NONCE_SIZE));
    }

    /**
     * Wraps the DEK for the recipient with the given KEM and creates a header for it.
     *
     * @throws IllegalStateException if the KEM produced a wrapped key of the wrong length.
     */
    static Header create(KEM kem, SecretKey dek, PublicKey recipient) {
        var wrappedKey = kem.wrap(dek, recipient);
        if (wrappedKey.length != kem.wrappedKeyLength()) {
            throw new IllegalStateException(kem.getIdentifier() + " produced a wrapped key of " + wrappedKey.length
                    + " bytes, expected " + kem.wrappedKeyLength());
        }
        return create(wrappedKey);
    }

    static Header readFrom(FrameReader in) throws IOException {
        int wrappedLength = in.readLength();
        if (wrappedLength == 0 || wrappedLength > MAX_WRAPPED_KEY_LENGTH) {
            throw new MalformedEnvelopeException(Reason.INVALID_WRAPPED_LENGTH,
                    "Invalid wrapped key length: " + wrappedLength);
        }
        var wrappedKey = in.readFixedLengthBytes(wrappedLength);
        var baseNonce = in.readFixedLengthBytes(BASE_NONCE_SIZE);
        return new Header(wrappedKey, baseNonce);
    }

    void writeTo(FrameWriter out) throws IOException {
        out.writeChunk(wrappedKey);
        out.writeFixedLengthBytes(baseNonce);
    }

    byte[] wrappedKey() {
        return wrappedKey.clone();
    }

    byte[] baseNonce() {
        return baseNonce.clone();
    }

    /**
     * The associated data bound to the first frame: {@code BE16(wrappedLength) || baseNonce}.
     */
    byte[] associatedData() {
        return Utils.concat(Utils.uint16(wrappedKey.length), baseNonce);
    }

    /**
     * The encoded length of this header in bytes.
     */
    int length() {
        return 2 + wrappedKey.length + baseNonce.length;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) { return true; }
        if (!(other instanceof Header)) { return false; }
        Header that = (Header) other;
        return Arrays.equals(this.wrappedKey, that.wrappedKey) && Arrays.equals(this.baseNonce, that.baseNonce);
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(wrappedKey), Arrays.hashCode(baseNonce));
    }

    @Override
    public String toString() {
        return "Header{" +
                "wrappedKeyLength=" + wrappedKey.length +
                ", baseNonce=" + Utils.hex(baseNonce) +
                '}';
    }
}
