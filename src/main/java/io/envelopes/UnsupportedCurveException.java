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

/**
 * Thrown when a key is supplied that is not an elliptic curve key on the NIST P-256 curve. This is always detected
 * before any data is read from or written to a stream.
 */
public final class UnsupportedCurveException extends IllegalArgumentException {

    UnsupportedCurveException(String message) {
        super(message);
    }
}
