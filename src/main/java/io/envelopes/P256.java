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

import java.math.BigInteger;
import java.security.AlgorithmParameters;
import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.interfaces.ECKey;
import java.security.interfaces.ECPublicKey;
import java.security.spec.ECFieldFp;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.ECParameterSpec;
import java.security.spec.ECPoint;
import java.security.spec.ECPublicKeySpec;
import java.util.Arrays;

/**
 * Curve policy and point encoding for NIST P-256 (secp256r1), the only curve supported for key wrapping.
 */
final class P256 {
    static final String CURVE_NAME = "secp256r1";
    static final int FIELD_SIZE_BYTES = 32;
    static final int ENCODED_POINT_LENGTH = 1 + 2 * FIELD_SIZE_BYTES;
    private static final byte UNCOMPRESSED_POINT = 0x04;

    private static final ECParameterSpec PARAMS;
    private static final BigInteger FIELD_PRIME;

    static {
        try {
            var parameters = AlgorithmParameters.getInstance("EC");
            parameters.init(new ECGenParameterSpec(CURVE_NAME));
            PARAMS = parameters.getParameterSpec(ECParameterSpec.class);
            FIELD_PRIME = ((ECFieldFp) PARAMS.getCurve().getField()).getP();
        } catch (GeneralSecurityException e) {
            throw new AssertionError("JVM doesn't support " + CURVE_NAME, e);
        }
    }

    static boolean isP256(Key key) {
        if (!(key instanceof ECKey)) {
            return false;
        }
        var params = ((ECKey) key).getParams();
        return params != null
                && PARAMS.getCurve().equals(params.getCurve())
                && PARAMS.getGenerator().equals(params.getGenerator())
                && PARAMS.getOrder().equals(params.getOrder())
                && PARAMS.getCofactor() == params.getCofactor();
    }

    /**
     * Checks that the given key is a P-256 key.
     *
     * @throws UnsupportedCurveException if the key is not an EC key on the P-256 curve.
     */
    static void requireP256(Key key) {
        requireNonNull(key, "key");
        if (!isP256(key)) {
            throw new UnsupportedCurveException("Only P-256 keys are supported, got " + describe(key));
        }
    }

    static KeyPair generateKeyPair() {
        try {
            var generator = KeyPairGenerator.getInstance("EC");
            generator.initialize(PARAMS, Crypto.secureRandom());
            return generator.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new AssertionError("JVM doesn't support " + CURVE_NAME + " key generation", e);
        }
    }

    /**
     * Encodes the public key as an uncompressed SEC 1 point: {@code 0x04 || X || Y}.
     */
    static byte[] encode(ECPublicKey publicKey) {
        var point = publicKey.getW();
        var encoded = new byte[ENCODED_POINT_LENGTH];
        encoded[0] = UNCOMPRESSED_POINT;
        System.arraycopy(Utils.toUnsignedBigEndian(point.getAffineX(), FIELD_SIZE_BYTES), 0,
                encoded, 1, FIELD_SIZE_BYTES);
        System.arraycopy(Utils.toUnsignedBigEndian(point.getAffineY(), FIELD_SIZE_BYTES), 0,
                encoded, 1 + FIELD_SIZE_BYTES, FIELD_SIZE_BYTES);
        return encoded;
    }

    /**
     * Decodes an uncompressed SEC 1 point, checking that it lies on the curve.
     *
     * @throws IllegalArgumentException if the encoding is invalid or the point is not on the curve.
     */
    static ECPublicKey decode(byte[] encoded, int offset) {
        Utils.require(offset >= 0 && encoded.length - offset >= ENCODED_POINT_LENGTH, "Encoded point too short");
        Utils.require(encoded[offset] == UNCOMPRESSED_POINT, "Not an uncompressed point");
        var x = new BigInteger(1, Arrays.copyOfRange(encoded, offset + 1, offset + 1 + FIELD_SIZE_BYTES));
        var y = new BigInteger(1, Arrays.copyOfRange(encoded, offset + 1 + FIELD_SIZE_BYTES,
                offset + ENCODED_POINT_LENGTH));
        Utils.require(isOnCurve(x, y), "Point is not on the P-256 curve");
        try {
            var keyFactory = KeyFactory.getInstance("EC");
            return (ECPublicKey) keyFactory.generatePublic(new ECPublicKeySpec(new ECPoint(x, y), PARAMS));
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException("Invalid public key", e);
        }
    }

    // y^2 = x^3 + ax + b (mod p)
    private static boolean isOnCurve(BigInteger x, BigInteger y) {
        if (x.compareTo(FIELD_PRIME) >= 0 || y.compareTo(FIELD_PRIME) >= 0) {
            return false;
        }
        var curve = PARAMS.getCurve();
        var lhs = y.multiply(y).mod(FIELD_PRIME);
        var rhs = x.pow(3).add(curve.getA().multiply(x)).add(curve.getB()).mod(FIELD_PRIME);
        return lhs.equals(rhs);
    }

    private static String describe(Key key) {
        if (key instanceof ECKey && ((ECKey) key).getParams() != null) {
            return "EC key with field size " + ((ECKey) key).getParams().getCurve().getField().getFieldSize();
        }
        return key.getAlgorithm() + " key";
    }

    private P256() {}
}
