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

/**
 * Base class of all failures to process an encrypted envelope stream. Every such failure is terminal: the stream
 * operation is aborted, nothing is retried, and any output already written to the sink must be discarded by the
 * caller. Failures of the underlying source or sink are not wrapped and propagate as plain {@link IOException}s.
 */
public abstract class EnvelopeException extends IOException {
    private final Reason reason;

    EnvelopeException(Reason reason, String message) {
        super(message);
        this.reason = requireNonNull(reason, "reason");
    }

    /**
     * The reason that processing failed.
     */
    public Reason reason() {
        return reason;
    }

    public enum Reason {
        /** The input ended part way through a header, length prefix or frame. */
        UNEXPECTED_EOF,
        /** The wrapped key length in the header is zero or implausibly large. */
        INVALID_WRAPPED_LENGTH,
        /** A frame length prefix exceeds the largest frame that can be produced. */
        CHUNK_TOO_LARGE,
        /** A frame is too short to hold an authentication tag. */
        CHUNK_TOO_SHORT,
        /** The wrapped data-encryption key is structurally invalid. */
        MALFORMED_WRAP,
        /** Another frame follows a short frame, which must be the last one. */
        FRAME_AFTER_FINAL,
        /** The data-encryption key could not be unwrapped: wrong private key or a tampered header. */
        DEK_UNWRAP_FAILED,
        /** A frame failed authentication: corrupted or tampered ciphertext. */
        FRAME_AUTH_FAILED
    }
}
