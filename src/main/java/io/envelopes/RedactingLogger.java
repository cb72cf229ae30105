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

import java.security.Key;
import java.util.Arrays;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A thin wrapper around an slf4j {@link Logger} that redacts certain types of arguments to prevent them being leaked
 * in log files. Byte arrays are reduced to a short fingerprint of their first and last few bytes (short arrays are
 * replaced entirely) and {@link Key} objects are never rendered at all.
 */
final class RedactingLogger {
    private final Logger realLogger;

    private RedactingLogger(Logger realLogger) {
        this.realLogger = Objects.requireNonNull(realLogger);
    }

    static RedactingLogger getLogger(Class<?> forClass) {
        return new RedactingLogger(LoggerFactory.getLogger(forClass));
    }

    boolean isTraceEnabled() {
        return realLogger.isTraceEnabled();
    }

    void trace(String format, Object... args) {
        if (isTraceEnabled()) {
            realLogger.trace(format, redactAll(args));
        }
    }

    boolean isDebugEnabled() {
        return realLogger.isDebugEnabled();
    }

    void debug(String format, Object... args) {
        if (isDebugEnabled()) {
            realLogger.debug(format, redactAll(args));
        }
    }

    static Object redact(Object arg) {
        if (arg instanceof byte[]) {
            return maskForLog((byte[]) arg);
        } else if (arg instanceof Key) {
            return "<redacted " + ((Key) arg).getAlgorithm() + " key>";
        } else {
            return arg;
        }
    }

    private static Object[] redactAll(Object[] args) {
        return Arrays.stream(args).map(RedactingLogger::redact).toArray();
    }

    static String maskForLog(byte[] secret) {
        return secret == null
                ? "null"
                : secret.length < 16
                ? "<redacted>"
                : Utils.hex(Arrays.copyOf(secret, 3)) + "..." +
                Utils.hex(Arrays.copyOfRange(secret, secret.length-3, secret.length));
    }
}
